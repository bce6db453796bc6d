package com.example.menuparser.util.menu.dto;

import lombok.Value;

import java.util.Set;

/**
 * 字体指纹：同一 (family, size, weight) 组的统计摘要
 */
@Value
public class TypographyFingerprint {

    FontKey key;

    int sampleCount;

    double averageTextLength;

    Set<ContentPattern> patterns;

    double confidence;

    public boolean hasPattern(ContentPattern pattern) {
        return patterns.contains(pattern);
    }
}
