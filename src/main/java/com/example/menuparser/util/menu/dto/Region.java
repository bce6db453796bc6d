package com.example.menuparser.util.menu.dto;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 候选区域：一组几何上聚在一起、疑似构成一条菜品记录的 token
 *
 * 不变量：
 * - 至少 2 个 token
 * - 边界框是包含全部 token 的最小矩形，宽高均大于 0
 * - 置信度在 [0, 1]
 *
 * Phase 2/3 只做标注（缩略图、置信度惩罚），通过 with* 方法返回新实例。
 */
@Getter
public class Region {

    private final List<Token> tokens;
    private final BoundingBox boundingBox;
    private final double confidence;
    private final int pageIndex;
    private final float pageHeight;
    private final DetectionSource source;

    /** data:image/png;base64,... 渲染失败或未渲染时为 null */
    private final String thumbnail;

    public Region(List<Token> tokens, double confidence, int pageIndex, float pageHeight, DetectionSource source) {
        this(tokens, BoundingBox.enclosing(tokens), confidence, pageIndex, pageHeight, source, null);
    }

    private Region(List<Token> tokens, BoundingBox boundingBox, double confidence, int pageIndex,
                   float pageHeight, DetectionSource source, String thumbnail) {
        if (tokens.size() < 2) {
            throw new IllegalArgumentException("a region needs at least 2 tokens, got " + tokens.size());
        }
        if (boundingBox.getWidth() <= 0 || boundingBox.getHeight() <= 0) {
            throw new IllegalArgumentException("degenerate region bounding box " + boundingBox);
        }
        this.tokens = Collections.unmodifiableList(tokens);
        this.boundingBox = boundingBox;
        this.confidence = Confidence.clamp(confidence);
        this.pageIndex = pageIndex;
        this.pageHeight = pageHeight;
        this.source = source;
        this.thumbnail = thumbnail;
    }

    public Region withConfidence(double newConfidence) {
        return new Region(tokens, boundingBox, newConfidence, pageIndex, pageHeight, source, thumbnail);
    }

    public Region withThumbnail(String newThumbnail) {
        return new Region(tokens, boundingBox, confidence, pageIndex, pageHeight, source, newThumbnail);
    }

    public String joinedText() {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(token.trimmedText());
        }
        return sb.toString().trim();
    }

    public double averageFontSize() {
        double sum = 0;
        for (Token token : tokens) {
            sum += token.getFontSize();
        }
        return sum / tokens.size();
    }

    @Override
    public String toString() {
        return String.format("Region{page=%d, bbox=%s, tokens=%d, conf=%.2f, source=%s}",
                pageIndex, boundingBox, tokens.size(), confidence, source);
    }
}
