package com.example.menuparser.util.menu.classifier;

/**
 * 从 token 中抽出的一个数字子串及其上下文
 */
public class NumberCandidate {

    public final double value;
    public final String matchedText;
    public final boolean currencyMarker;
    public final boolean twoDecimal;
    public final boolean integer;

    /** 紧跟的单位（同 token 后缀或下一个 token），没有时为 null */
    public final String unit;

    /** 形如 "#12"、"No. 12" 或整个 token 只有数字 */
    public final boolean itemNumberShape;

    /** 在 token 文本中的起止位置 */
    public final int start;
    public final int end;

    public NumberCandidate(double value, String matchedText, boolean currencyMarker, boolean twoDecimal,
                           boolean integer, String unit, boolean itemNumberShape, int start, int end) {
        this.value = value;
        this.matchedText = matchedText;
        this.currencyMarker = currencyMarker;
        this.twoDecimal = twoDecimal;
        this.integer = integer;
        this.unit = unit;
        this.itemNumberShape = itemNumberShape;
        this.start = start;
        this.end = end;
    }

    public boolean hasUnit() {
        return unit != null;
    }

    public boolean isCurrencyFormat() {
        return currencyMarker || twoDecimal;
    }

    @Override
    public String toString() {
        return String.format("NumberCandidate{'%s', value=%s, currency=%s, unit=%s}",
                matchedText, value, currencyMarker, unit);
    }
}
