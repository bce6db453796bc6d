package com.example.menuparser.util.menu.dto;

/**
 * Phase 1 区域检测模式
 */
public enum DetectionMode {
    /** 按 token 邻近度聚类 */
    PROXIMITY,
    /** 按栅格化页面上的边框线检测 */
    BOX,
    /** 有渲染器时先试边框，页面上检测不到再退回邻近度 */
    AUTO
}
