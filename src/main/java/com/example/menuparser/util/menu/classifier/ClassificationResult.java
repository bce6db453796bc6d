package com.example.menuparser.util.menu.classifier;

import com.example.menuparser.util.menu.dto.FontKey;
import com.example.menuparser.util.menu.dto.NumberClassification;
import com.example.menuparser.util.menu.dto.NumberType;
import com.example.menuparser.util.menu.dto.Token;
import com.example.menuparser.util.menu.dto.TypographyFingerprint;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Phase 0 产物：数字分类列表 + 字体指纹表
 */
public class ClassificationResult {

    private final Map<Token, List<NumberClassification>> byToken;
    private final List<NumberClassification> classifications;
    private final Map<FontKey, TypographyFingerprint> fingerprints;

    public ClassificationResult(Map<Token, List<NumberClassification>> byToken,
                                List<NumberClassification> classifications,
                                Map<FontKey, TypographyFingerprint> fingerprints) {
        this.byToken = Collections.unmodifiableMap(byToken);
        this.classifications = Collections.unmodifiableList(classifications);
        this.fingerprints = Collections.unmodifiableMap(fingerprints);
    }

    public List<NumberClassification> classificationsOf(Token token) {
        return byToken.getOrDefault(token, Collections.emptyList());
    }

    /**
     * token 中置信度最高的价格分类（必须严格高于阈值），没有返回 null
     */
    public NumberClassification bestPrice(Token token, double threshold) {
        NumberClassification best = null;
        for (NumberClassification c : classificationsOf(token)) {
            if (c.isPrice(threshold) && (best == null || c.getConfidence() > best.getConfidence())) {
                best = c;
            }
        }
        return best;
    }

    public boolean hasPrice(Token token, double threshold) {
        return bestPrice(token, threshold) != null;
    }

    public int countOf(NumberType type) {
        int count = 0;
        for (NumberClassification c : classifications) {
            if (c.getType() == type) {
                count++;
            }
        }
        return count;
    }

    public Map<Token, List<NumberClassification>> getByToken() {
        return byToken;
    }

    public List<NumberClassification> getClassifications() {
        return classifications;
    }

    public Map<FontKey, TypographyFingerprint> getFingerprints() {
        return fingerprints;
    }

    public TypographyFingerprint fingerprintOf(Token token) {
        return fingerprints.get(FontKey.of(token));
    }
}
