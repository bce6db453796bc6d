package com.example.menuparser.util.menu.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * 菜品记录
 *
 * 在 Phase 3 创建；去重时可能被置信度更高的同名记录替换；返回后不再变化。
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MenuItem {

    private final String id;
    private final String name;
    private final String description;
    private final double price;
    private final boolean priceless;
    private final String category;
    private final int servingSize;
    private final double confidence;
    private final int pageIndex;

    /** 产出该记录的阶段 */
    private final ProcessingPhase phase;

    /** 区域缩略图（data URL），来自文本兜底的记录为 null */
    private final String regionImage;

    @JsonIgnore
    private final Region sourceRegion;

    @Builder(toBuilder = true)
    public MenuItem(String id, String name, String description, double price, boolean priceless,
                    String category, int servingSize, double confidence, int pageIndex,
                    ProcessingPhase phase, String regionImage, Region sourceRegion) {
        this.id = id;
        this.name = name;
        this.description = description == null || description.trim().isEmpty() ? null : description.trim();
        this.price = price;
        this.priceless = priceless;
        this.category = category;
        this.servingSize = servingSize;
        this.confidence = Confidence.clamp(confidence);
        this.pageIndex = pageIndex;
        this.phase = phase;
        this.regionImage = regionImage;
        this.sourceRegion = sourceRegion;
    }

    public boolean hasPrice() {
        return !priceless && price > 0;
    }

    public MenuItem withConfidence(double newConfidence) {
        return toBuilder().confidence(newConfidence).build();
    }

    @Override
    public String toString() {
        return String.format("MenuItem{name='%s', price=%.2f, conf=%.2f, phase=%s}", name, price, confidence, phase);
    }
}
