package com.example.menuparser.util.menu.dto;

/**
 * 区域来源
 */
public enum DetectionSource {
    PROXIMITY,
    BOX,
    CROSS_PAGE
}
