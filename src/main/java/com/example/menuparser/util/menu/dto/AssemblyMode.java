package com.example.menuparser.util.menu.dto;

/**
 * Phase 3 组装模式
 */
public enum AssemblyMode {
    /** 名称 + 描述 + 价格 */
    TRIPLE,
    /** 名称 + 价格（无描述的菜单） */
    PAIR,
    /** 按区域 token 数自动判断 */
    AUTO
}
