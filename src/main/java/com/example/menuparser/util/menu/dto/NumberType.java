package com.example.menuparser.util.menu.dto;

/**
 * 数字分类类型
 */
public enum NumberType {
    PRICE,
    CALORIE,
    MEASUREMENT,
    COUNT,
    ITEM_NUMBER,
    UNKNOWN
}
