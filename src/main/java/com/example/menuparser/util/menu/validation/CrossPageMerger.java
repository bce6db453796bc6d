package com.example.menuparser.util.menu.validation;

import com.example.menuparser.util.menu.ParseSession;
import com.example.menuparser.util.menu.classifier.MenuTextPatterns;
import com.example.menuparser.util.menu.dto.DetectionSource;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.ProcessingPhase;
import com.example.menuparser.util.menu.dto.Region;
import com.example.menuparser.util.menu.dto.Token;
import com.example.menuparser.util.menu.region.RegionDetector;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 跨页续接
 *
 * 第 N 页底部边距内的区域缺价格（或缺名称），第 N+1 页顶部边距内有水平对齐、且恰好补上缺失部分的区域，
 * 则把后者的 token 平移到第 N 页坐标空间（dy = -第 N+1 页高度，即紧贴在第 N 页底边之下），合并成一个区域并重新打分。
 */
public class CrossPageMerger {

    private final PipelineConfig config;
    private final RegionDetector scorer;

    public CrossPageMerger(PipelineConfig config) {
        this.config = config;
        this.scorer = new RegionDetector(config);
    }

    public List<Region> merge(List<Region> regions, ParseSession session) {
        Map<Region, Region> merged = new IdentityHashMap<>();
        Map<Region, Boolean> consumed = new IdentityHashMap<>();

        for (Region tail : regions) {
            if (consumed.containsKey(tail) || !atBottomMargin(tail)) {
                continue;
            }
            boolean hasPrice = hasPrice(tail, session);
            boolean hasName = hasName(tail, session);
            if (hasPrice == hasName) {
                // 完整或两者皆无，都不续接
                continue;
            }
            for (Region head : regions) {
                if (head == tail || consumed.containsKey(head) || merged.containsKey(head)
                        || head.getPageIndex() != tail.getPageIndex() + 1 || !atTopMargin(head)) {
                    continue;
                }
                if (Math.abs(head.getBoundingBox().getX() - tail.getBoundingBox().getX())
                        > config.getCrossPageAlignTolerance()) {
                    continue;
                }
                boolean supplies = hasPrice ? hasName(head, session) : hasPrice(head, session);
                if (!supplies) {
                    continue;
                }
                Region joined = join(tail, head);
                merged.put(tail, joined);
                consumed.put(head, Boolean.TRUE);
                session.log(ProcessingPhase.REGION_VALIDATION, Level.INFO,
                        "跨页续接: 第 {} 页区域 {} + 第 {} 页区域 {} -> {}",
                        tail.getPageIndex(), tail.getBoundingBox(), head.getPageIndex(), head.getBoundingBox(),
                        joined.getBoundingBox());
                break;
            }
        }

        if (merged.isEmpty()) {
            return regions;
        }
        List<Region> result = new ArrayList<>();
        for (Region region : regions) {
            if (consumed.containsKey(region)) {
                continue;
            }
            result.add(merged.getOrDefault(region, region));
        }
        return result;
    }

    private Region join(Region tail, Region head) {
        float dy = -head.getPageHeight();
        List<Token> tokens = new ArrayList<>(tail.getTokens());
        for (Token token : head.getTokens()) {
            tokens.add(token.translate(0f, dy, tail.getPageIndex()));
        }
        tokens.sort(RegionDetector.READING_ORDER);
        return new Region(tokens, scorer.scoreConfidence(tokens), tail.getPageIndex(), tail.getPageHeight(),
                DetectionSource.CROSS_PAGE);
    }

    boolean atBottomMargin(Region region) {
        return region.getBoundingBox().getY() <= region.getPageHeight() * config.getCrossPageMarginRatio();
    }

    boolean atTopMargin(Region region) {
        return region.getBoundingBox().getTop() >= region.getPageHeight() * (1 - config.getCrossPageMarginRatio());
    }

    private static boolean hasPrice(Region region, ParseSession session) {
        for (Token token : region.getTokens()) {
            if (session.priceOf(token) != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * 存在不含价格、带文字的 token
     */
    private static boolean hasName(Region region, ParseSession session) {
        for (Token token : region.getTokens()) {
            String text = token.trimmedText();
            boolean wordy = MenuTextPatterns.hasLatin(text) || MenuTextPatterns.hasCjk(text);
            if (wordy && session.priceOf(token) == null) {
                return true;
            }
        }
        return false;
    }
}
