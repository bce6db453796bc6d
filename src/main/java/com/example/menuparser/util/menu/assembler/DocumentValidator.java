package com.example.menuparser.util.menu.assembler;

import com.example.menuparser.util.menu.ParseSession;
import com.example.menuparser.util.menu.dto.FailureKind;
import com.example.menuparser.util.menu.dto.MenuItem;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.ProcessingPhase;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Phase 3 全文校验与去重
 *
 * - 名称唯一：规范化名称相同时保留置信度高的（位置沿用先出现的那条）
 * - 价格分布：带价格的记录不少于 3 条时，价格高于 均值 + outlierSigma × 标准差 的视为异常值剔除，无价格记录不参与
 * - 去重：按 (规范化名称, 价格分) 做最后一道去重
 */
public class DocumentValidator {

    /** 参与价格分布统计的最少记录数 */
    public static final int MIN_PRICED_FOR_OUTLIERS = 3;

    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{P}\\p{S}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final PipelineConfig config;

    public DocumentValidator(PipelineConfig config) {
        this.config = config;
    }

    public List<MenuItem> validate(ParseSession session, List<MenuItem> items) {
        return removePriceOutliers(session, enforceUniqueness(session, items));
    }

    public List<MenuItem> enforceUniqueness(ParseSession session, List<MenuItem> items) {
        Map<String, MenuItem> byName = new LinkedHashMap<>();
        for (MenuItem item : items) {
            String key = normalizeName(item.getName());
            MenuItem existing = byName.get(key);
            if (existing == null) {
                byName.put(key, item);
            } else if (item.getConfidence() > existing.getConfidence()) {
                byName.put(key, item);
                logDrop(session, existing, "与 '" + item.getName() + "' 重名且置信度更低");
            } else {
                logDrop(session, item, "与 '" + existing.getName() + "' 重名且置信度更低");
            }
        }
        return new ArrayList<>(byName.values());
    }

    public List<MenuItem> removePriceOutliers(ParseSession session, List<MenuItem> items) {
        int priced = 0;
        double sum = 0;
        for (MenuItem item : items) {
            if (item.hasPrice()) {
                priced++;
                sum += item.getPrice();
            }
        }
        if (priced < MIN_PRICED_FOR_OUTLIERS) {
            return items;
        }

        double mean = sum / priced;
        double squares = 0;
        for (MenuItem item : items) {
            if (item.hasPrice()) {
                squares += (item.getPrice() - mean) * (item.getPrice() - mean);
            }
        }
        double stdev = Math.sqrt(squares / priced);
        double ceiling = mean + config.getOutlierSigma() * stdev;

        List<MenuItem> kept = new ArrayList<>();
        for (MenuItem item : items) {
            if (item.hasPrice() && item.getPrice() > ceiling) {
                logDrop(session, item, String.format("价格 %.2f 超过 均值 %.2f + %.1fσ (σ=%.2f)",
                        item.getPrice(), mean, config.getOutlierSigma(), stdev));
                continue;
            }
            kept.add(item);
        }
        return kept;
    }

    public List<MenuItem> deduplicate(ParseSession session, List<MenuItem> items) {
        Map<String, MenuItem> seen = new LinkedHashMap<>();
        for (MenuItem item : items) {
            String key = normalizeName(item.getName()) + "|" + Math.round(item.getPrice() * 100);
            MenuItem existing = seen.get(key);
            if (existing == null) {
                seen.put(key, item);
            } else if (item.getConfidence() > existing.getConfidence()) {
                seen.put(key, item);
                logDrop(session, existing, "重复记录");
            } else {
                logDrop(session, item, "重复记录");
            }
        }
        return new ArrayList<>(seen.values());
    }

    /**
     * 小写、去标点符号、合并空白
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        String lower = PUNCTUATION.matcher(name.toLowerCase()).replaceAll(" ");
        return WHITESPACE.matcher(lower).replaceAll(" ").trim();
    }

    private static void logDrop(ParseSession session, MenuItem item, String reason) {
        session.failure(ProcessingPhase.DOCUMENT_VALIDATION, Level.INFO, FailureKind.VALIDATION,
                "剔除 '{}' (第 {} 页, {}): {}", item.getName(), item.getPageIndex(), item.getPhase(), reason);
    }
}
