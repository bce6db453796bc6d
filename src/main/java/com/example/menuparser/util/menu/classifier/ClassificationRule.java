package com.example.menuparser.util.menu.classifier;

import com.example.menuparser.util.menu.dto.NumberType;

import java.util.function.Predicate;

/**
 * 分类规则 (predicate, type, confidence)，按顺序首个命中生效
 */
public class ClassificationRule {

    private final String name;
    private final Predicate<NumberCandidate> predicate;
    private final NumberType type;
    private final double confidence;

    public ClassificationRule(String name, Predicate<NumberCandidate> predicate, NumberType type, double confidence) {
        this.name = name;
        this.predicate = predicate;
        this.type = type;
        this.confidence = confidence;
    }

    public boolean matches(NumberCandidate candidate) {
        return predicate.test(candidate);
    }

    public String getName() {
        return name;
    }

    public NumberType getType() {
        return type;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return name + " -> " + type + " (" + confidence + ")";
    }
}
