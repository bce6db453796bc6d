package com.example.menuparser.util.menu.dto;

import lombok.Value;

import java.util.Collection;

/**
 * 轴对齐边界框（文档坐标系，y 为底边）
 */
@Value
public class BoundingBox {

    double x;

    double y;

    double width;

    double height;

    public double getRight() {
        return x + width;
    }

    public double getTop() {
        return y + height;
    }

    public double area() {
        return width * height;
    }

    public boolean contains(Token token, double tolerance) {
        return token.getX() >= x - tolerance
                && token.getRight() <= getRight() + tolerance
                && token.getY() >= y - tolerance
                && token.getTop() <= getTop() + tolerance;
    }

    /**
     * 包含所有 token 的最小外接矩形
     */
    public static BoundingBox enclosing(Collection<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("cannot enclose an empty token set");
        }
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (Token token : tokens) {
            minX = Math.min(minX, token.getX());
            minY = Math.min(minY, token.getY());
            maxX = Math.max(maxX, token.getRight());
            maxY = Math.max(maxY, token.getTop());
        }
        return new BoundingBox(minX, minY, maxX - minX, maxY - minY);
    }

    @Override
    public String toString() {
        return String.format("[%.1f, %.1f, %.1f, %.1f]", x, y, getRight(), getTop());
    }
}
