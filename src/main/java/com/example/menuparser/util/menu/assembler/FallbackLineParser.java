package com.example.menuparser.util.menu.assembler;

import com.example.menuparser.util.menu.classifier.MenuTextPatterns;
import com.example.menuparser.util.menu.dto.MenuItem;
import com.example.menuparser.util.menu.dto.PageTokens;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.ProcessingPhase;
import com.example.menuparser.util.menu.dto.Token;
import com.example.menuparser.util.menu.region.RegionDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Phase 3 文本兜底：不依赖区域，直接按行做正则解析
 *
 * 行模式（按顺序尝试，首个产出合法记录的生效）：
 * 1. 名称 - 描述 价格      "Caesar Salad - romaine, parmesan 9.50"
 * 2. 名称 价格（行尾）     "Grilled Salmon ...... $24.95"
 * 3. 名称 价格 描述（行中）"Pad Thai $12.95 rice noodles, peanuts"
 * 4. 价格 名称（行首）     "$12.99 Fish Tacos"
 * 5. 名称独占一行（≥10 字符），下一行只有价格
 */
public class FallbackLineParser {

    private static final Logger log = LoggerFactory.getLogger(FallbackLineParser.class);

    private static final String AMOUNT = "(" + MenuTextPatterns.AMOUNT + ")";
    private static final String MARKER = "[$€£¥￥]";

    private static final Pattern NAME_DASH_DESC_PRICE = Pattern.compile(
            "^(.+?)\\s+[-–—]\\s+(.+?)\\s+" + MARKER + "?\\s*" + AMOUNT + "\\s*$");
    private static final Pattern NAME_PRICE = Pattern.compile(
            "^(.+?)\\s+" + MARKER + "?\\s*" + AMOUNT + "\\s*$");
    // 行中价格必须带货币符号或两位小数，避免把 "2 pieces" 当成价格
    private static final Pattern NAME_PRICE_DESC = Pattern.compile(
            "^(.+?)\\s+(?:" + MARKER + "\\s*" + AMOUNT + "|(\\d{1,4}\\.\\d{2}))\\s+(\\D.{2,})$");
    private static final Pattern PRICE_NAME = Pattern.compile(
            "^(?:" + MARKER + "\\s*" + AMOUNT + "|(\\d{1,4}\\.\\d{2}))\\s+(.+)$");
    private static final Pattern NAME_ONLY = Pattern.compile("^(.{10,})$");
    private static final Pattern PRICE_ONLY = Pattern.compile("^" + MARKER + "?\\s*" + AMOUNT + "\\s*$");

    /**
     * 一行文字
     */
    public static class TextLine {
        public final int pageIndex;
        public final String text;

        public TextLine(int pageIndex, String text) {
            this.pageIndex = pageIndex;
            this.text = text;
        }

        @Override
        public String toString() {
            return pageIndex + ": " + text;
        }
    }

    private final PipelineConfig config;

    public FallbackLineParser(PipelineConfig config) {
        this.config = config;
    }

    /**
     * 解析全部页面
     *
     * @return 兜底记录，id 为 item-1、item-2 ...（行顺序）
     */
    public List<MenuItem> parse(List<PageTokens> pages) {
        List<TextLine> lines = new ArrayList<>();
        for (PageTokens page : pages) {
            lines.addAll(linesOf(page));
        }
        return parseLines(lines);
    }

    public List<MenuItem> parseLines(List<TextLine> lines) {
        List<MenuItem> items = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            TextLine line = lines.get(i);
            String text = line.text.trim();
            if (text.isEmpty()) {
                continue;
            }

            MenuItem item = matchSingleLine(text, line.pageIndex, items.size() + 1);
            if (item == null && i + 1 < lines.size() && NAME_ONLY.matcher(text).matches()) {
                TextLine next = lines.get(i + 1);
                Matcher priceOnly = PRICE_ONLY.matcher(next.text.trim());
                if (next.pageIndex == line.pageIndex && priceOnly.matches()) {
                    item = build(text, null, priceOnly.group(1), line.pageIndex, items.size() + 1);
                    if (item != null) {
                        // 下一行已被消费
                        i++;
                    }
                }
            }
            if (item != null) {
                items.add(item);
            }
        }
        log.debug("文本兜底: {} 行, {} 条记录", lines.size(), items.size());
        return items;
    }

    private MenuItem matchSingleLine(String text, int pageIndex, int sequence) {
        Matcher m = NAME_DASH_DESC_PRICE.matcher(text);
        if (m.matches()) {
            MenuItem item = build(m.group(1), m.group(2), m.group(3), pageIndex, sequence);
            if (item != null) {
                return item;
            }
        }
        m = NAME_PRICE.matcher(text);
        if (m.matches()) {
            MenuItem item = build(m.group(1), null, m.group(2), pageIndex, sequence);
            if (item != null) {
                return item;
            }
        }
        m = NAME_PRICE_DESC.matcher(text);
        if (m.matches()) {
            String amount = m.group(2) != null ? m.group(2) : m.group(3);
            MenuItem item = build(m.group(1), m.group(4), amount, pageIndex, sequence);
            if (item != null) {
                return item;
            }
        }
        m = PRICE_NAME.matcher(text);
        if (m.matches()) {
            String amount = m.group(1) != null ? m.group(1) : m.group(2);
            return build(m.group(3), null, amount, pageIndex, sequence);
        }
        return null;
    }

    /**
     * 组装兜底记录，名称或价格不合法返回 null
     */
    private MenuItem build(String rawName, String description, String amount, int pageIndex, int sequence) {
        String name = MenuItemClassifier.cleanName(rawName);
        if (name.length() < config.getMinNameLength() || name.length() > config.getMaxNameLength()) {
            return null;
        }
        if (!MenuTextPatterns.hasLatin(name) && !MenuTextPatterns.hasCjk(name)) {
            return null;
        }
        double price = MenuTextPatterns.parseAmount(amount);
        if (price <= 0 || price < config.getMinPrice() || price > config.getMaxPrice()) {
            return null;
        }
        String desc = description == null ? null : description.trim();
        return MenuItem.builder()
                .id("item-" + sequence)
                .name(name)
                .description(desc)
                .price(price)
                .category(MenuItemClassifier.categorize(name, desc))
                .servingSize(MenuItemClassifier.estimateServingSize(name, desc))
                .confidence(config.getFallbackItemConfidence())
                .pageIndex(pageIndex)
                .phase(ProcessingPhase.FALLBACK)
                .build();
    }

    /**
     * 把一页 token 拼成文本行：阅读顺序扫描，与行首 token 的 y 差不超过半个字号视为同一行，行内按 x 排序
     */
    public static List<TextLine> linesOf(PageTokens page) {
        List<Token> tokens = RegionDetector.usableTokens(page.getTokens());
        tokens.sort(RegionDetector.READING_ORDER);

        List<TextLine> lines = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        for (Token token : tokens) {
            if (!current.isEmpty()) {
                Token first = current.get(0);
                double tolerance = 0.5 * Math.max(fontOf(first), fontOf(token));
                if (Math.abs(first.getY() - token.getY()) > tolerance) {
                    lines.add(join(current, page.getPageIndex()));
                    current = new ArrayList<>();
                }
            }
            current.add(token);
        }
        if (!current.isEmpty()) {
            lines.add(join(current, page.getPageIndex()));
        }
        return lines;
    }

    private static float fontOf(Token token) {
        return token.getFontSize() > 0 ? token.getFontSize() : token.getHeight();
    }

    private static TextLine join(List<Token> tokens, int pageIndex) {
        List<Token> sorted = new ArrayList<>(tokens);
        sorted.sort(Comparator.comparingDouble(Token::getX));
        StringBuilder sb = new StringBuilder();
        for (Token token : sorted) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(token.trimmedText());
        }
        return new TextLine(pageIndex, sb.toString());
    }
}
