package com.example.menuparser.util.menu.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 文本片段（Token）
 *
 * 由外部文本提取器产出，不可变。坐标采用文档自身的坐标系：
 * 原点在页面左下角，Y 轴向上，y 为文本框底边。
 */
@Value
@Builder(toBuilder = true)
public class Token {

    String text;

    /** 左边界 */
    float x;

    /** 底边（Y 轴向上） */
    float y;

    float width;

    float height;

    float fontSize;

    @Builder.Default
    String fontFamily = "unknown";

    /** CSS 风格字重：400 常规，700 粗体 */
    @Builder.Default
    int fontWeight = 400;

    @Builder.Default
    String fontStyle = "normal";

    int pageIndex;

    public static Token of(String text, float x, float y, float width, float height, float fontSize, int pageIndex) {
        return Token.builder()
                .text(text)
                .x(x)
                .y(y)
                .width(width)
                .height(height)
                .fontSize(fontSize)
                .pageIndex(pageIndex)
                .build();
    }

    public float getRight() {
        return x + width;
    }

    public float getTop() {
        return y + height;
    }

    public float getCenterX() {
        return x + width / 2f;
    }

    public float getCenterY() {
        return y + height / 2f;
    }

    public boolean isBold() {
        if (fontWeight >= 600) {
            return true;
        }
        String family = fontFamily == null ? "" : fontFamily.toLowerCase();
        return family.contains("bold") || family.contains("black") || family.contains("heavy");
    }

    public String trimmedText() {
        return text == null ? "" : text.trim();
    }

    /**
     * 平移到另一页的坐标空间（跨页续接时使用）
     */
    public Token translate(float dx, float dy, int targetPageIndex) {
        return toBuilder().x(x + dx).y(y + dy).pageIndex(targetPageIndex).build();
    }
}
