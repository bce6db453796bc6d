package com.example.menuparser.util.menu.region;

import com.example.menuparser.util.menu.classifier.MenuTextPatterns;
import com.example.menuparser.util.menu.dto.Confidence;
import com.example.menuparser.util.menu.dto.DetectionSource;
import com.example.menuparser.util.menu.dto.PageTokens;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.Region;
import com.example.menuparser.util.menu.dto.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Phase 1：基于邻近度的区域检测
 *
 * 算法：
 * 1. 过滤空白/零尺寸 token，按阅读顺序排序（自上而下，即 y 递减；同高按 x 递增）
 * 2. 行带：顺序扫描，与当前行带最后一个 token 的垂直距离 ≤ yProximityEm × 平均字号则并入，否则新开行带
 * 3. 行带内按 x 排序，与前一个 token 右边界的水平间隙 ≤ xDistanceEm × 平均字号则并入当前区域，
 *    否则结束当前区域（≥2 个 token 才输出）
 * 4. 区域置信度：基础分 + 长度差异 + 货币 + 成员数 + 字体一致性，最终截断到 [0, 1]
 */
public class RegionDetector {

    private static final Logger log = LoggerFactory.getLogger(RegionDetector.class);

    /** 阅读顺序：y 大的在上 */
    public static final Comparator<Token> READING_ORDER =
            Comparator.comparingDouble((Token t) -> -t.getY()).thenComparingDouble(Token::getX);

    private final PipelineConfig config;

    public RegionDetector(PipelineConfig config) {
        this.config = config;
    }

    /**
     * 检测单页的候选区域
     */
    public List<Region> detect(PageTokens page) {
        List<Token> valid = usableTokens(page.getTokens());
        List<Region> regions = new ArrayList<>();
        if (valid.size() < 2) {
            return regions;
        }

        double avgFontSize = averageFontSize(valid);
        List<List<Token>> bands = formBands(valid, avgFontSize);

        for (List<Token> band : bands) {
            regions.addAll(clusterBand(band, avgFontSize, page.getPageIndex(), page.getPageHeight()));
        }

        log.debug("Page {}: {} 个有效 token, {} 个行带, {} 个候选区域 (avgFont={})",
                page.getPageIndex(), valid.size(), bands.size(), regions.size(), String.format("%.1f", avgFontSize));
        return regions;
    }

    /**
     * 行带划分
     *
     * 阈值越大行带越少（单调）：行带数 = 1 + 相邻 token 间距超过阈值的次数。
     */
    public List<List<Token>> formBands(List<Token> tokens, double avgFontSize) {
        List<Token> sorted = new ArrayList<>(tokens);
        sorted.sort(READING_ORDER);

        double threshold = config.getYProximityEm() * avgFontSize;
        List<List<Token>> bands = new ArrayList<>();
        List<Token> current = null;

        for (Token token : sorted) {
            if (current != null) {
                Token last = current.get(current.size() - 1);
                if (Math.abs(last.getY() - token.getY()) <= threshold) {
                    current.add(token);
                    continue;
                }
            }
            current = new ArrayList<>();
            current.add(token);
            bands.add(current);
        }
        return bands;
    }

    /**
     * 行带内按水平间距聚类
     */
    public List<Region> clusterBand(List<Token> band, double avgFontSize, int pageIndex, float pageHeight) {
        List<Region> regions = new ArrayList<>();
        if (band.isEmpty()) {
            return regions;
        }

        List<Token> sorted = new ArrayList<>(band);
        sorted.sort(Comparator.comparingDouble(Token::getX));

        double threshold = config.getXDistanceEm() * avgFontSize;
        List<Token> current = new ArrayList<>();
        current.add(sorted.get(0));

        for (int i = 1; i < sorted.size(); i++) {
            Token token = sorted.get(i);
            Token previous = current.get(current.size() - 1);
            double gap = token.getX() - previous.getRight();
            if (gap <= threshold) {
                current.add(token);
            } else {
                emit(current, pageIndex, pageHeight, regions);
                current = new ArrayList<>();
                current.add(token);
            }
        }
        emit(current, pageIndex, pageHeight, regions);
        return regions;
    }

    private void emit(List<Token> tokens, int pageIndex, float pageHeight, List<Region> out) {
        if (tokens.size() < 2) {
            return;
        }
        List<Token> ordered = new ArrayList<>(tokens);
        ordered.sort(READING_ORDER);
        out.add(new Region(ordered, scoreConfidence(ordered), pageIndex, pageHeight, DetectionSource.PROXIMITY));
    }

    /**
     * 区域置信度
     *
     * 各项加权和可能超过 1.0，按原样截断，不做归一化。
     */
    public double scoreConfidence(List<Token> tokens) {
        double confidence = config.getBaseRegionConfidence();

        int minLength = Integer.MAX_VALUE;
        int maxLength = 0;
        boolean hasCurrency = false;
        Set<String> fonts = new HashSet<>();
        for (Token token : tokens) {
            int length = token.trimmedText().length();
            minLength = Math.min(minLength, length);
            maxLength = Math.max(maxLength, length);
            hasCurrency |= MenuTextPatterns.hasCurrency(token.getText());
            fonts.add(token.getFontFamily());
        }

        // 名称与描述的长度差异
        if (maxLength > 1.5 * minLength) {
            confidence += config.getLengthVarietyWeight();
        }
        if (hasCurrency) {
            confidence += config.getPricePatternWeight();
        }
        if (tokens.size() >= 2 && tokens.size() <= 5) {
            confidence += config.getItemCountWeight();
        }
        if (fonts.size() <= 3) {
            confidence += config.getTypographyWeight();
        }
        return Confidence.clamp(confidence);
    }

    /**
     * 可用 token：非空白且宽高为正
     */
    public static List<Token> usableTokens(List<Token> tokens) {
        List<Token> valid = new ArrayList<>();
        for (Token token : tokens) {
            if (!token.trimmedText().isEmpty() && token.getWidth() > 0 && token.getHeight() > 0) {
                valid.add(token);
            }
        }
        return valid;
    }

    public static double averageFontSize(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (Token token : tokens) {
            sum += token.getFontSize() > 0 ? token.getFontSize() : token.getHeight();
        }
        return sum / tokens.size();
    }
}
