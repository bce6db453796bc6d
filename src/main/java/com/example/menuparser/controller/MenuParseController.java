package com.example.menuparser.controller;

import com.example.menuparser.service.MenuParseService;
import com.example.menuparser.util.menu.MenuParseException;
import com.example.menuparser.util.menu.MenuParseResult;
import com.example.menuparser.util.menu.dto.AssemblyMode;
import com.example.menuparser.util.menu.dto.DetectionMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * PDF 菜单解析控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/menu")
public class MenuParseController {

    @Autowired
    private MenuParseService menuParseService;

    /**
     * 上传 PDF 菜单并解析出菜品列表
     *
     * @param file          PDF 文件
     * @param detectionMode 区域检测模式 PROXIMITY / BOX / AUTO（可选）
     * @param assemblyMode  组装模式 TRIPLE / PAIR / AUTO（可选）
     * @return 菜品列表、结构化日志、进度历史、自举摘要
     */
    @PostMapping("/parse")
    public ResponseEntity<Map<String, Object>> parse(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "detectionMode", required = false) String detectionMode,
            @RequestParam(value = "assemblyMode", required = false) String assemblyMode) {

        Map<String, Object> result = new HashMap<>();

        // 验证文件
        if (file.isEmpty()) {
            result.put("success", false);
            result.put("message", "文件不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            result.put("success", false);
            result.put("message", "只支持.pdf文件");
            return ResponseEntity.badRequest().body(result);
        }

        DetectionMode detection;
        AssemblyMode assembly;
        try {
            detection = parseEnum(DetectionMode.class, detectionMode);
            assembly = parseEnum(AssemblyMode.class, assemblyMode);
        } catch (IllegalArgumentException e) {
            result.put("success", false);
            result.put("message", "参数错误: " + e.getMessage());
            return ResponseEntity.badRequest().body(result);
        }

        try {
            log.info("接收菜单: {}, {} bytes", originalFilename, file.getSize());
            MenuParseResult parsed = menuParseService.parse(file.getBytes(), originalFilename, detection, assembly);

            result.put("success", true);
            result.put("message", "解析完成");
            result.put("sessionId", parsed.getSessionId());
            result.put("items", parsed.getItems());
            result.put("bootstrap", parsed.getBootstrap());
            result.put("log", parsed.getLog());
            result.put("progress", parsed.getProgress());
            result.put("pageCount", parsed.getPageCount());
            result.put("tokenCount", parsed.getTokenCount());
            result.put("regionCount", parsed.getRegionCount());
            result.put("acceptedRegionCount", parsed.getAcceptedRegionCount());
            result.put("elapsedMillis", parsed.getElapsedMillis());
            return ResponseEntity.ok(result);

        } catch (MenuParseException e) {
            log.warn("菜单解析失败: {} ({})", e.getMessage(), e.getKind());
            result.put("success", false);
            result.put("message", e.getMessage());
            result.put("failureKind", e.getKind());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);

        } catch (IOException e) {
            log.error("读取上传文件失败: {}", e.getMessage(), e);
            result.put("success", false);
            result.put("message", "读取上传文件失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);

        } catch (Exception e) {
            log.error("菜单解析异常: {}", e.getMessage(), e);
            result.put("success", false);
            result.put("message", "解析失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 当前生效的流水线配置
     */
    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> config() {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("config", menuParseService.getPipelineConfig().toJson());
        return ResponseEntity.ok(result);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(type.getSimpleName() + " 不支持 '" + value + "'", e);
        }
    }
}
