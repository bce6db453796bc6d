package com.example.menuparser.util.menu.dto;

/**
 * 置信度工具：所有置信度统一截断到 [0, 1]
 */
public final class Confidence {

    private Confidence() {
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
