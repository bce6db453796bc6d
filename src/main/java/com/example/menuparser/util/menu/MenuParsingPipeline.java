package com.example.menuparser.util.menu;

import com.example.menuparser.util.menu.assembler.AssemblyOutcome;
import com.example.menuparser.util.menu.assembler.ItemAssembler;
import com.example.menuparser.util.menu.box.BoxDetector;
import com.example.menuparser.util.menu.classifier.ClassificationResult;
import com.example.menuparser.util.menu.classifier.TokenClassifier;
import com.example.menuparser.util.menu.dto.DetectionMode;
import com.example.menuparser.util.menu.dto.FailureKind;
import com.example.menuparser.util.menu.dto.NumberType;
import com.example.menuparser.util.menu.dto.PageTokens;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.ProcessingPhase;
import com.example.menuparser.util.menu.dto.Region;
import com.example.menuparser.util.menu.region.RegionDetector;
import com.example.menuparser.util.menu.validation.RegionValidator;
import org.slf4j.event.Level;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 菜单解析流水线
 *
 * Phase 0 数字分类 → Phase 1 区域检测 → Phase 2 区域校验 → Phase 3 组装与自举
 *
 * 本类无状态，全部中间产物都挂在 {@link ParseSession} 上，可被多个会话并发使用。
 * 只有结构上无效的输入（零页、零 token）会抛出 {@link MenuParseException}；
 * 单页、单区域的失败都在本地恢复并记入会话日志。
 */
public class MenuParsingPipeline {

    /** Phase 1 在总进度中的区间 */
    private static final int DETECTION_START = 15;
    private static final int DETECTION_END = 40;

    public MenuParseResult run(ParseSession session) throws MenuParseException {
        long start = System.currentTimeMillis();
        PipelineConfig config = session.getConfig();

        int tokenCount = validateInput(session);
        session.progress(ProcessingPhase.INPUT, 0,
                String.format("开始解析: %d 页, %d 个 token", session.getPages().size(), tokenCount));

        // Phase 0
        session.checkCancelled(ProcessingPhase.CLASSIFICATION);
        TokenClassifier classifier = session.getClassifier();
        ClassificationResult classification = classifier.classify(session.getPages());
        session.updateClassification(classifier, classification);
        session.log(ProcessingPhase.CLASSIFICATION, Level.INFO, "识别 {} 个数字, 其中价格 {} 个, 字体指纹 {} 组",
                classification.getClassifications().size(), classification.countOf(NumberType.PRICE),
                classification.getFingerprints().size());
        session.progress(ProcessingPhase.CLASSIFICATION, DETECTION_START, "数字分类完成");

        // Phase 1
        List<Region> regions = detectRegions(session);
        session.progress(ProcessingPhase.REGION_DETECTION, DETECTION_END,
                "区域检测完成: " + regions.size() + " 个候选区域");

        // Phase 2
        session.checkCancelled(ProcessingPhase.REGION_VALIDATION);
        List<Region> accepted = new RegionValidator(config).validate(session, regions);
        session.log(ProcessingPhase.REGION_VALIDATION, Level.INFO, "{} 个候选区域中 {} 个通过校验",
                regions.size(), accepted.size());
        session.progress(ProcessingPhase.REGION_VALIDATION, 60, "区域校验完成: " + accepted.size() + " 个区域");

        // Phase 3
        AssemblyOutcome outcome = new ItemAssembler(config).assemble(session, accepted);
        session.checkCancelled(ProcessingPhase.DONE);
        session.progress(ProcessingPhase.DONE, 100, "解析完成: " + outcome.getItems().size() + " 道菜");

        return MenuParseResult.builder()
                .sessionId(session.getSessionId())
                .items(outcome.getItems())
                .bootstrap(outcome.getSummary())
                .log(session.getLogEntries())
                .progress(session.getProgressHistory())
                .pageCount(session.getPages().size())
                .tokenCount(tokenCount)
                .regionCount(regions.size())
                .acceptedRegionCount(accepted.size())
                .elapsedMillis(System.currentTimeMillis() - start)
                .build();
    }

    /**
     * @return token 总数
     * @throws MenuParseException 零页或零 token
     */
    private int validateInput(ParseSession session) throws MenuParseException {
        if (session.getPages().isEmpty()) {
            session.failure(ProcessingPhase.INPUT, Level.ERROR, FailureKind.INPUT, "文档没有页面");
            throw new MenuParseException(FailureKind.INPUT, "document has no pages");
        }
        int tokenCount = 0;
        for (PageTokens page : session.getPages()) {
            tokenCount += page.getTokens() == null ? 0 : page.getTokens().size();
        }
        if (tokenCount == 0) {
            session.failure(ProcessingPhase.INPUT, Level.ERROR, FailureKind.INPUT, "文档没有任何文本");
            throw new MenuParseException(FailureKind.INPUT, "document has no text tokens");
        }
        return tokenCount;
    }

    /**
     * Phase 1：逐页检测，页与页之间检查取消
     */
    private List<Region> detectRegions(ParseSession session) {
        PipelineConfig config = session.getConfig();
        RegionDetector proximity = new RegionDetector(config);
        BoxDetector boxes = new BoxDetector(config);
        DetectionMode mode = config.getDetectionMode();

        if (mode == DetectionMode.BOX && !session.hasRasterizer()) {
            session.log(ProcessingPhase.REGION_DETECTION, Level.WARN, "未提供页面渲染器，边框模式退化为邻近度模式");
        }

        List<Region> regions = new ArrayList<>();
        List<PageTokens> pages = session.getPages();
        for (int i = 0; i < pages.size(); i++) {
            session.checkCancelled(ProcessingPhase.REGION_DETECTION);
            PageTokens page = pages.get(i);

            List<Region> pageRegions = null;
            if (mode != DetectionMode.PROXIMITY && session.hasRasterizer()) {
                pageRegions = detectBoxes(session, boxes, page);
                if (pageRegions != null && mode == DetectionMode.AUTO && pageRegions.size() < 2) {
                    // 不像格子版式
                    pageRegions = null;
                }
            }
            if (pageRegions == null) {
                pageRegions = proximity.detect(page);
                session.log(ProcessingPhase.REGION_DETECTION, Level.DEBUG, "第 {} 页邻近度检测: {} 个区域",
                        page.getPageIndex(), pageRegions.size());
            } else {
                session.log(ProcessingPhase.REGION_DETECTION, Level.DEBUG, "第 {} 页边框检测: {} 个区域",
                        page.getPageIndex(), pageRegions.size());
            }
            regions.addAll(pageRegions);

            int percent = DETECTION_START + (DETECTION_END - DETECTION_START) * (i + 1) / pages.size();
            session.progress(ProcessingPhase.REGION_DETECTION, percent,
                    "第 " + (i + 1) + "/" + pages.size() + " 页区域检测完成");
        }
        return regions;
    }

    /**
     * @return 渲染或检测失败时返回 null（该页退化为邻近度模式）
     */
    private List<Region> detectBoxes(ParseSession session, BoxDetector boxes, PageTokens page) {
        double scale = session.getConfig().getBoxRenderScale();
        try {
            BufferedImage image = session.getRasterizer().rasterize(page.getPageIndex(), scale);
            return boxes.detect(image, scale, page);
        } catch (IOException | RuntimeException e) {
            session.failure(ProcessingPhase.REGION_DETECTION, Level.WARN, FailureKind.REGION_EXTRACTION,
                    "第 {} 页边框检测失败，退化为邻近度模式: {}", page.getPageIndex(), e.getMessage());
            return null;
        }
    }
}
