package com.example.menuparser.util.menu.dto;

import lombok.Value;

/**
 * 单个数字子串的分类结果
 */
@Value
public class NumberClassification {

    double value;

    NumberType type;

    /** [0, 1] */
    double confidence;

    /** 命中的规则说明，便于追溯 */
    String reasoning;

    /** 原始匹配文本，如 "$12.95" */
    String matchedText;

    public NumberClassification(double value, NumberType type, double confidence, String reasoning, String matchedText) {
        this.value = value;
        this.type = type;
        this.confidence = Confidence.clamp(confidence);
        this.reasoning = reasoning;
        this.matchedText = matchedText;
    }

    public boolean isPrice(double threshold) {
        return type == NumberType.PRICE && confidence > threshold;
    }
}
