package com.example.menuparser.util.menu.classifier;

import com.example.menuparser.util.menu.dto.ContentPattern;
import com.example.menuparser.util.menu.dto.FontKey;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.Token;
import com.example.menuparser.util.menu.dto.TypographyFingerprint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 字体指纹生成
 *
 * 按 (fontFamily, fontSize, fontWeight) 分组，少于 fingerprintMinGroupSize 个 token 的组丢弃；
 * 对保留的组统计平均文本长度，并提取出现比例不低于 patternExtractionMinSupport 的内容形态。
 * 置信度 = min(组大小 / fingerprintSampleCap, 1.0)
 */
public class TypographyFingerprinter {

    private final PipelineConfig config;

    public TypographyFingerprinter(PipelineConfig config) {
        this.config = config;
    }

    public Map<FontKey, TypographyFingerprint> fingerprint(List<Token> tokens) {
        Map<FontKey, List<Token>> groups = new LinkedHashMap<>();
        for (Token token : tokens) {
            groups.computeIfAbsent(FontKey.of(token), k -> new ArrayList<>()).add(token);
        }

        Map<FontKey, TypographyFingerprint> fingerprints = new LinkedHashMap<>();
        for (Map.Entry<FontKey, List<Token>> entry : groups.entrySet()) {
            List<Token> group = entry.getValue();
            if (group.size() < config.getFingerprintMinGroupSize()) {
                continue;
            }

            double totalLength = 0;
            Map<ContentPattern, Integer> patternCounts = new EnumMap<>(ContentPattern.class);
            for (Token token : group) {
                String text = token.trimmedText();
                totalLength += text.length();
                for (ContentPattern pattern : patternsOf(text)) {
                    patternCounts.merge(pattern, 1, Integer::sum);
                }
            }

            Set<ContentPattern> recurring = EnumSet.noneOf(ContentPattern.class);
            for (Map.Entry<ContentPattern, Integer> pc : patternCounts.entrySet()) {
                if ((double) pc.getValue() / group.size() >= config.getPatternExtractionMinSupport()) {
                    recurring.add(pc.getKey());
                }
            }

            double confidence = Math.min((double) group.size() / config.getFingerprintSampleCap(), 1.0);
            fingerprints.put(entry.getKey(), new TypographyFingerprint(entry.getKey(), group.size(),
                    totalLength / group.size(), Collections.unmodifiableSet(recurring), confidence));
        }
        return fingerprints;
    }

    /**
     * 单个文本命中的内容形态
     */
    static Set<ContentPattern> patternsOf(String text) {
        Set<ContentPattern> patterns = EnumSet.noneOf(ContentPattern.class);
        if (MenuTextPatterns.PREPARATION_VERB.matcher(text).find()) {
            patterns.add(ContentPattern.PREPARATION_VERB);
        }
        if (MenuTextPatterns.hasCurrency(text)) {
            patterns.add(ContentPattern.CURRENCY_SHAPE);
        }
        if (MenuTextPatterns.SUFFIXED_UNIT.matcher(text).find()) {
            patterns.add(ContentPattern.UNIT_SHAPE);
        }
        if (MenuTextPatterns.CATEGORY_WORD.matcher(text).find()) {
            patterns.add(ContentPattern.CATEGORY_WORD);
        }
        return patterns;
    }
}
