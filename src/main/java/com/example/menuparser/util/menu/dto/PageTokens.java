package com.example.menuparser.util.menu.dto;

import lombok.Value;

import java.util.List;

/**
 * 单页 token 集合及页面尺寸（由文本提取器给出）
 */
@Value
public class PageTokens {

    int pageIndex;

    float pageWidth;

    float pageHeight;

    List<Token> tokens;
}
