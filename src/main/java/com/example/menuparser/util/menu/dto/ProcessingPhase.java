package com.example.menuparser.util.menu.dto;

/**
 * 流水线阶段，同时用于日志、进度和菜品来源标记
 */
public enum ProcessingPhase {
    INPUT("输入校验"),
    CLASSIFICATION("Phase 0 数字分类与字体指纹"),
    REGION_DETECTION("Phase 1 区域检测"),
    REGION_VALIDATION("Phase 2 区域校验"),
    ASSEMBLY("Phase 3 菜品组装"),
    FALLBACK("Phase 3 文本兜底解析"),
    REFINEMENT("Phase 3 模式回灌"),
    DOCUMENT_VALIDATION("Phase 3 全文校验"),
    DONE("完成");

    private final String label;

    ProcessingPhase(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
