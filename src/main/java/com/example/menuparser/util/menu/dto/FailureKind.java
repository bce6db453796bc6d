package com.example.menuparser.util.menu.dto;

/**
 * 失败分类
 *
 * 只有 INPUT 会中止解析；其余在会话日志中记录后就地恢复。
 */
public enum FailureKind {
    /** 无页面或无 token，致命 */
    INPUT,
    /** 缩略图渲染失败：保留区域，置信度惩罚 */
    REGION_EXTRACTION,
    /** 产出不足：触发文本兜底 */
    LOW_YIELD,
    /** 区域或菜品未通过质量门槛：丢弃 */
    VALIDATION,
    /** 迭代上限内未收敛：返回最佳快照 */
    CONVERGENCE
}
