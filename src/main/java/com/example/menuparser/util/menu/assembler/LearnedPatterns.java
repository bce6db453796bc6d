package com.example.menuparser.util.menu.assembler;

import com.example.menuparser.util.menu.dto.MenuItem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从兜底结果中学到的简单统计模式：名称长度区间、价格区间、分类分布
 */
public class LearnedPatterns {

    /** 少于该数量的样本不学习 */
    public static final int MIN_SAMPLES = 2;

    private static final double NAME_BONUS = 0.05;
    private static final double PRICE_BONUS = 0.05;
    private static final double CATEGORY_BONUS = 0.02;

    private final int minNameLength;
    private final int maxNameLength;
    private final double minPrice;
    private final double maxPrice;
    private final Map<String, Integer> categoryCounts;
    private final String dominantCategory;

    private LearnedPatterns(int minNameLength, int maxNameLength, double minPrice, double maxPrice,
                            Map<String, Integer> categoryCounts, String dominantCategory) {
        this.minNameLength = minNameLength;
        this.maxNameLength = maxNameLength;
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
        this.categoryCounts = Collections.unmodifiableMap(categoryCounts);
        this.dominantCategory = dominantCategory;
    }

    /**
     * @return 样本不足或没有带价格的样本时返回 null
     */
    public static LearnedPatterns learn(List<MenuItem> samples) {
        if (samples == null || samples.size() < MIN_SAMPLES) {
            return null;
        }
        int minName = Integer.MAX_VALUE;
        int maxName = 0;
        double lowPrice = Double.MAX_VALUE;
        double highPrice = 0;
        int priced = 0;
        Map<String, Integer> categories = new LinkedHashMap<>();

        for (MenuItem item : samples) {
            int length = item.getName().length();
            minName = Math.min(minName, length);
            maxName = Math.max(maxName, length);
            if (item.hasPrice()) {
                lowPrice = Math.min(lowPrice, item.getPrice());
                highPrice = Math.max(highPrice, item.getPrice());
                priced++;
            }
            categories.merge(item.getCategory(), 1, Integer::sum);
        }
        if (priced == 0) {
            return null;
        }

        // 占一半以上才算主导分类
        String dominant = null;
        for (Map.Entry<String, Integer> entry : categories.entrySet()) {
            if (entry.getValue() * 2 > samples.size()) {
                dominant = entry.getKey();
            }
        }
        return new LearnedPatterns(minName, maxName, lowPrice, highPrice, categories, dominant);
    }

    /**
     * 按学到的模式重新打分，返回新的置信度（未截断）
     */
    public double rescore(MenuItem item, double baseConfidence) {
        double confidence = baseConfidence;
        int length = item.getName().length();
        confidence += length >= minNameLength && length <= maxNameLength ? NAME_BONUS : -NAME_BONUS;
        if (item.hasPrice()) {
            confidence += matchesPrice(item.getPrice()) ? PRICE_BONUS : -PRICE_BONUS;
        }
        if (dominantCategory != null && dominantCategory.equals(item.getCategory())) {
            confidence += CATEGORY_BONUS;
        }
        return confidence;
    }

    public boolean matchesPrice(double price) {
        return price >= minPrice && price <= maxPrice;
    }

    public int getMinNameLength() {
        return minNameLength;
    }

    public int getMaxNameLength() {
        return maxNameLength;
    }

    public double getMinPrice() {
        return minPrice;
    }

    public double getMaxPrice() {
        return maxPrice;
    }

    public Map<String, Integer> getCategoryCounts() {
        return categoryCounts;
    }

    public String getDominantCategory() {
        return dominantCategory;
    }

    @Override
    public String toString() {
        return String.format("LearnedPatterns{name=[%d, %d], price=[%.2f, %.2f], categories=%s}",
                minNameLength, maxNameLength, minPrice, maxPrice, categoryCounts);
    }
}
