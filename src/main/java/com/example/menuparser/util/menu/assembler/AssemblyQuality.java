package com.example.menuparser.util.menu.assembler;

import com.example.menuparser.util.menu.dto.MenuItem;
import com.example.menuparser.util.menu.dto.PipelineConfig;

import java.util.List;

/**
 * 一轮组装结果的质量指标
 *
 * score = 0.4 × min(数量 / minItemCount, 1) + 0.4 × 平均置信度 + 0.2 × 覆盖率
 * 覆盖率 = 带价格的记录数 / 被分类为价格的 token 数（上限 1）
 */
public class AssemblyQuality {

    private static final double COUNT_WEIGHT = 0.4;
    private static final double CONFIDENCE_WEIGHT = 0.4;
    private static final double COVERAGE_WEIGHT = 0.2;

    private final int count;
    private final double meanConfidence;
    private final double coverage;
    private final double score;

    private AssemblyQuality(int count, double meanConfidence, double coverage, double score) {
        this.count = count;
        this.meanConfidence = meanConfidence;
        this.coverage = coverage;
        this.score = score;
    }

    public static AssemblyQuality measure(List<MenuItem> items, int priceTokenCount, PipelineConfig config) {
        int count = items.size();
        double confidenceSum = 0;
        int priced = 0;
        for (MenuItem item : items) {
            confidenceSum += item.getConfidence();
            if (item.hasPrice()) {
                priced++;
            }
        }
        double mean = count == 0 ? 0 : confidenceSum / count;

        double coverage;
        if (priceTokenCount > 0) {
            coverage = Math.min(1.0, (double) priced / priceTokenCount);
        } else {
            coverage = count == 0 ? 0 : 1.0;
        }

        double countRatio = Math.min(1.0, (double) count / Math.max(1, config.getMinItemCount()));
        double score = COUNT_WEIGHT * countRatio + CONFIDENCE_WEIGHT * mean + COVERAGE_WEIGHT * coverage;
        return new AssemblyQuality(count, mean, coverage, score);
    }

    /**
     * 数量、平均置信度、覆盖率均达标
     */
    public boolean isSufficient(PipelineConfig config) {
        return count >= config.getMinItemCount()
                && meanConfidence >= config.getBootstrapQualityThreshold()
                && coverage >= config.getMinCoverageRatio();
    }

    public int getCount() {
        return count;
    }

    public double getMeanConfidence() {
        return meanConfidence;
    }

    public double getCoverage() {
        return coverage;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return String.format("count=%d, meanConf=%.2f, coverage=%.2f, score=%.3f", count, meanConfidence, coverage, score);
    }
}
