package com.example.menuparser.util.menu.dto;

import lombok.Value;

/**
 * 字体分组键 (family, size, weight)
 */
@Value
public class FontKey {

    String fontFamily;

    /** 字号保留一位小数，避免浮点抖动把同一字体拆成多组 */
    float fontSize;

    int fontWeight;

    public static FontKey of(Token token) {
        float size = Math.round(token.getFontSize() * 10f) / 10f;
        return new FontKey(token.getFontFamily(), size, token.getFontWeight());
    }
}
