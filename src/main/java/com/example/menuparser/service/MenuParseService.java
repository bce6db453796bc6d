package com.example.menuparser.service;

import com.example.menuparser.util.menu.MenuParseException;
import com.example.menuparser.util.menu.MenuParseResult;
import com.example.menuparser.util.menu.MenuParsingPipeline;
import com.example.menuparser.util.menu.ParseSession;
import com.example.menuparser.util.menu.dto.AssemblyMode;
import com.example.menuparser.util.menu.dto.DetectionMode;
import com.example.menuparser.util.menu.dto.FailureKind;
import com.example.menuparser.util.menu.dto.PageTokens;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.pdf.PdfBoxPageRasterizer;
import com.example.menuparser.util.pdf.PdfTokenExtractor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * 菜单解析服务
 *
 * 打开 PDF，提取文本片段，挂上页面渲染器，跑一次解析会话。
 * 每次调用独立的会话，页面缓存随会话关闭释放。
 */
@Slf4j
@Service
public class MenuParseService {

    @Autowired
    private PipelineConfig pipelineConfig;

    private final MenuParsingPipeline pipeline = new MenuParsingPipeline();

    /**
     * 解析 PDF 菜单
     *
     * @param pdfBytes      PDF 文件内容
     * @param filename      原始文件名（仅用于日志）
     * @param detectionMode 区域检测模式，null 使用配置值
     * @param assemblyMode  组装模式，null 使用配置值
     * @throws MenuParseException PDF 无法读取、没有页面或没有文本
     */
    public MenuParseResult parse(byte[] pdfBytes, String filename, DetectionMode detectionMode,
                                 AssemblyMode assemblyMode) throws MenuParseException {
        PipelineConfig config = pipelineConfig.withModes(detectionMode, assemblyMode);

        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            List<PageTokens> pages = PdfTokenExtractor.extract(document);
            log.info("开始解析菜单: {}, {} 页, detectionMode={}, assemblyMode={}", filename, pages.size(),
                    config.getDetectionMode(), config.getAssemblyMode());

            try (ParseSession session = new ParseSession(config, pages, new PdfBoxPageRasterizer(document),
                    snapshot -> log.debug("[{}] {}% {}", snapshot.getPhase(), snapshot.getPercent(),
                            snapshot.getMessage()))) {
                MenuParseResult result = pipeline.run(session);
                log.info("菜单解析完成: {}, 会话={}, {} 道菜, 耗时={}ms", filename, result.getSessionId(),
                        result.getItems().size(), result.getElapsedMillis());
                return result;
            }
        } catch (IOException e) {
            log.warn("无法读取 PDF {}: {}", filename, e.getMessage());
            throw new MenuParseException(FailureKind.INPUT, "无法读取 PDF: " + e.getMessage(), e);
        }
    }

    public PipelineConfig getPipelineConfig() {
        return pipelineConfig;
    }
}
