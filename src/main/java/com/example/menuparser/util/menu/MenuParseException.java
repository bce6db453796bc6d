package com.example.menuparser.util.menu;

import com.example.menuparser.util.menu.dto.FailureKind;

/**
 * 解析中止异常（只用于结构上无效的输入）
 */
public class MenuParseException extends Exception {

    private final FailureKind kind;

    public MenuParseException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MenuParseException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
