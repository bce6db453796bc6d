package com.example.menuparser.util.menu.dto;

/**
 * 字体组内反复出现的内容形态
 */
public enum ContentPattern {
    /** 烹饪动词：grilled、roasted ... */
    PREPARATION_VERB,
    /** 货币形态：$12.95 */
    CURRENCY_SHAPE,
    /** 计量单位形态：12 oz */
    UNIT_SHAPE,
    /** 分类词：Appetizers、Desserts ... */
    CATEGORY_WORD
}
