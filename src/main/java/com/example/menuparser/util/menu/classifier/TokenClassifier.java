package com.example.menuparser.util.menu.classifier;

import com.example.menuparser.util.menu.dto.NumberClassification;
import com.example.menuparser.util.menu.dto.NumberType;
import com.example.menuparser.util.menu.dto.PageTokens;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Phase 0：数字分类器
 *
 * 对每个 token 中的每个数字子串独立分类（价格/热量/计量/数量/编号/未知），
 * 同时委托 {@link TypographyFingerprinter} 生成字体指纹。
 *
 * 数字抽取按优先级分层：
 * 1. 货币前缀/后缀
 * 2. 单位后缀（热量、计量）
 * 3. 裸整数/小数
 * 先命中的层会占用对应字符区间，后面的层不再重复抽取。
 *
 * 分类规则是有序表，首个命中的规则生效；纯函数，同一输入同一配置结果恒定。
 */
public class TokenClassifier {

    private static final Logger log = LoggerFactory.getLogger(TokenClassifier.class);

    private final PipelineConfig config;
    private final List<ClassificationRule> rules;
    private final TypographyFingerprinter fingerprinter;

    public TokenClassifier(PipelineConfig config) {
        this(config, defaultRules(config));
    }

    private TokenClassifier(PipelineConfig config, List<ClassificationRule> rules) {
        this.config = config;
        this.rules = Collections.unmodifiableList(rules);
        this.fingerprinter = new TypographyFingerprinter(config);
    }

    /**
     * 默认规则表
     */
    public static List<ClassificationRule> defaultRules(PipelineConfig config) {
        List<ClassificationRule> rules = new ArrayList<>();
        rules.add(new ClassificationRule("currency format within price range",
                c -> c.isCurrencyFormat() && c.value >= config.getMinPrice() && c.value <= config.getMaxPrice(),
                NumberType.PRICE, 0.9));
        rules.add(new ClassificationRule("integer 100-2000 with calorie suffix",
                c -> c.integer && c.value >= 100 && c.value <= 2000
                        && c.hasUnit() && MenuTextPatterns.CALORIE_UNIT.matcher(c.unit).matches(),
                NumberType.CALORIE, 0.85));
        rules.add(new ClassificationRule("number adjacent to measurement unit",
                c -> c.hasUnit() && MenuTextPatterns.MEASUREMENT_UNIT.matcher(c.unit).matches(),
                NumberType.MEASUREMENT, 0.8));
        rules.add(new ClassificationRule("small integer without currency marker",
                c -> c.integer && c.value <= 20 && !c.currencyMarker,
                NumberType.COUNT, 0.6));
        rules.add(new ClassificationRule("item number shape",
                c -> c.itemNumberShape,
                NumberType.ITEM_NUMBER, 0.7));
        rules.add(new ClassificationRule("no rule matched",
                c -> true,
                NumberType.UNKNOWN, 0.3));
        return rules;
    }

    /**
     * 回灌学习到的价格区间：在货币规则之后插入一条规则，
     * 把落在区间内、无单位的裸数字也判为价格
     *
     * @return 新的分类器，原分类器不变
     */
    public TokenClassifier withLearnedPriceRange(double minPrice, double maxPrice) {
        List<ClassificationRule> enhanced = new ArrayList<>(rules);
        String name = String.format("bare number within learned price range [%.2f, %.2f]", minPrice, maxPrice);
        enhanced.add(1, new ClassificationRule(name,
                c -> !c.hasUnit() && !c.itemNumberShape && c.value >= minPrice && c.value <= maxPrice,
                NumberType.PRICE, config.getLearnedPriceConfidence()));
        log.debug("回灌价格区间规则: {}", name);
        return new TokenClassifier(config, enhanced);
    }

    public List<ClassificationRule> getRules() {
        return rules;
    }

    /**
     * Phase 0 入口：对全文所有 token 分类并生成字体指纹
     */
    public ClassificationResult classify(List<PageTokens> pages) {
        Map<Token, List<NumberClassification>> byToken = new LinkedHashMap<>();
        List<NumberClassification> all = new ArrayList<>();
        List<Token> allTokens = new ArrayList<>();

        for (PageTokens page : pages) {
            List<Token> tokens = page.getTokens();
            for (int i = 0; i < tokens.size(); i++) {
                Token token = tokens.get(i);
                Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
                List<NumberClassification> classifications = classifyToken(token, next);
                if (!classifications.isEmpty()) {
                    byToken.put(token, classifications);
                    all.addAll(classifications);
                }
                allTokens.add(token);
            }
        }

        ClassificationResult result = new ClassificationResult(byToken, all, fingerprinter.fingerprint(allTokens));
        log.debug("Phase 0 完成: {} 个 token, {} 个数字, {} 个价格, {} 个字体指纹",
                allTokens.size(), all.size(), result.countOf(NumberType.PRICE), result.getFingerprints().size());
        return result;
    }

    /**
     * 对单个 token 中的每个数字分类
     *
     * @param token 当前 token
     * @param next  同页下一个 token（用于识别独立的单位 token），可为 null
     */
    public List<NumberClassification> classifyToken(Token token, Token next) {
        List<NumberClassification> result = new ArrayList<>();
        for (NumberCandidate candidate : extractNumbers(token.getText(), next == null ? null : next.getText())) {
            result.add(classify(candidate));
        }
        return result;
    }

    /**
     * 按规则表给单个候选数字分类
     */
    public NumberClassification classify(NumberCandidate candidate) {
        for (ClassificationRule rule : rules) {
            if (rule.matches(candidate)) {
                return new NumberClassification(candidate.value, rule.getType(), rule.getConfidence(),
                        rule.getName(), candidate.matchedText);
            }
        }
        // 规则表最后一条恒真，这里不可达
        throw new IllegalStateException("classification rule table has no catch-all rule");
    }

    /**
     * 分层抽取数字子串
     */
    public static List<NumberCandidate> extractNumbers(String text, String nextText) {
        List<NumberCandidate> candidates = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return candidates;
        }
        boolean[] taken = new boolean[text.length()];
        String trimmed = text.trim();
        boolean wholeTokenIsNumber = MenuTextPatterns.ITEM_NUMBER_TOKEN.matcher(trimmed).matches();

        // 1. 货币前缀
        Matcher m = MenuTextPatterns.CURRENCY_PREFIXED.matcher(text);
        while (m.find()) {
            if (overlaps(taken, m.start(), m.end())) {
                continue;
            }
            String digits = m.group(2);
            candidates.add(new NumberCandidate(MenuTextPatterns.parseAmount(digits), m.group(), true,
                    isTwoDecimal(digits), isInteger(digits), null, false, m.start(), m.end()));
            mark(taken, m.start(), m.end());
        }

        // 1b. 货币后缀
        m = MenuTextPatterns.CURRENCY_SUFFIXED.matcher(text);
        while (m.find()) {
            if (overlaps(taken, m.start(), m.end())) {
                continue;
            }
            String digits = m.group(1);
            candidates.add(new NumberCandidate(MenuTextPatterns.parseAmount(digits), m.group(), true,
                    isTwoDecimal(digits), isInteger(digits), null, false, m.start(), m.end()));
            mark(taken, m.start(), m.end());
        }

        // 2. 单位后缀
        m = MenuTextPatterns.SUFFIXED_UNIT.matcher(text);
        while (m.find()) {
            if (overlaps(taken, m.start(), m.end())) {
                continue;
            }
            String digits = m.group(1);
            candidates.add(new NumberCandidate(Double.parseDouble(digits), m.group(), false,
                    isTwoDecimal(digits), isInteger(digits), m.group(2), false, m.start(), m.end()));
            mark(taken, m.start(), m.end());
        }

        // 3. 裸数字
        m = MenuTextPatterns.BARE_NUMBER.matcher(text);
        while (m.find()) {
            if (overlaps(taken, m.start(), m.end())) {
                continue;
            }
            String digits = m.group(2);
            boolean prefixed = m.group(1) != null;
            boolean atEnd = text.substring(m.end()).trim().isEmpty();
            String unit = atEnd ? leadingUnit(nextText) : null;
            boolean itemShape = prefixed || wholeTokenIsNumber
                    || MenuTextPatterns.ITEM_NUMBER_PREFIX.matcher(m.group()).matches();
            candidates.add(new NumberCandidate(Double.parseDouble(digits), m.group(), false,
                    isTwoDecimal(digits), isInteger(digits), unit, itemShape, m.start(), m.end()));
            mark(taken, m.start(), m.end());
        }

        candidates.sort((a, b) -> Integer.compare(a.start, b.start));
        return candidates;
    }

    private static String leadingUnit(String nextText) {
        if (nextText == null) {
            return null;
        }
        Matcher m = MenuTextPatterns.LEADING_UNIT_WORD.matcher(nextText.trim());
        return m.find() ? m.group(1) : null;
    }

    private static boolean isInteger(String digits) {
        return MenuTextPatterns.normalizeAmount(digits).indexOf('.') < 0;
    }

    private static boolean isTwoDecimal(String digits) {
        String normalized = MenuTextPatterns.normalizeAmount(digits);
        int dot = normalized.indexOf('.');
        return dot >= 0 && normalized.length() - dot - 1 == 2;
    }

    private static boolean overlaps(boolean[] taken, int start, int end) {
        for (int i = start; i < end; i++) {
            if (taken[i]) {
                return true;
            }
        }
        return false;
    }

    private static void mark(boolean[] taken, int start, int end) {
        for (int i = start; i < end; i++) {
            taken[i] = true;
        }
    }
}
