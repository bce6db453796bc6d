package com.example.menuparser.util.menu.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Phase 3 自举循环的运行摘要
 */
@Value
@Builder
public class BootstrapSummary {

    /** 是否触发了文本兜底 */
    boolean fallbackTriggered;

    /** 兜底轮数（不超过 maxBootstrapIterations） */
    int iterations;

    /** 每轮结束时的质量分，第 0 项是首轮组装的结果 */
    List<Double> qualityHistory;

    boolean converged;

    /** 质量回退，已恢复到最佳快照 */
    boolean reverted;

    /** 是否把学到的价格区间回灌给 Phase 0 */
    boolean patternsReinjected;

    double finalQuality;

    int regionItemCount;

    int fallbackItemCount;

    String stopReason;
}
