package com.example.menuparser.util.menu.assembler;

import com.example.menuparser.util.menu.ParseSession;
import com.example.menuparser.util.menu.classifier.MenuTextPatterns;
import com.example.menuparser.util.menu.dto.AssemblyMode;
import com.example.menuparser.util.menu.dto.ContentPattern;
import com.example.menuparser.util.menu.dto.FailureKind;
import com.example.menuparser.util.menu.dto.MenuItem;
import com.example.menuparser.util.menu.dto.NumberClassification;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.ProcessingPhase;
import com.example.menuparser.util.menu.dto.Region;
import com.example.menuparser.util.menu.dto.Token;
import com.example.menuparser.util.menu.dto.TypographyFingerprint;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从单个区域中抽取 名称 / 描述 / 价格
 *
 * 锚点策略：先找价格 token（置信度最高的价格分类），其余 token 按阅读顺序分配，
 * 第一个是名称，后面的拼成描述。没有价格 token 时退化为纯位置分配，末尾的纯数字 token 视为价格。
 * 字体引导：若其余 token 中有加粗或字号明显更大、且长度合规的，用它替换名称，原名称并入描述。
 * 字号字重相当时参考字体指纹：所在字体组的常见内容是烹饪动词或分类词的更像名称，
 * 是价格或计量形态的更不像，按指纹置信度加权。
 *
 * 对子模式（无描述菜单）：描述恒为空，名称优先选同时含 CJK 与拉丁字母的双语 token。
 */
public class RegionItemExtractor {

    /** 字号超过名称字号该比例才算"更醒目" */
    private static final double PROMINENT_FONT_RATIO = 1.1;

    /** 指纹名称倾向需要超过当前名称该幅度才替换 */
    private static final double FINGERPRINT_AFFINITY_MARGIN = 0.1;

    private static final Pattern PRICE_ONLY = Pattern.compile(
            "^[$€£¥￥]?\\s*(" + MenuTextPatterns.AMOUNT + ")$");

    /**
     * 区域中的一段文字（价格 token 去掉价格后剩下的部分也算一段）
     */
    static class Part {
        final Token token;
        final String text;

        Part(Token token, String text) {
            this.token = token;
            this.text = text;
        }
    }

    private final PipelineConfig config;

    public RegionItemExtractor(PipelineConfig config) {
        this.config = config;
    }

    /**
     * AUTO 模式：超过半数的区域恰好 2 个 token 时按对子模式组装
     */
    public AssemblyMode resolveMode(List<Region> regions) {
        if (config.getAssemblyMode() != AssemblyMode.AUTO) {
            return config.getAssemblyMode();
        }
        int pairs = 0;
        for (Region region : regions) {
            if (region.getTokens().size() == 2) {
                pairs++;
            }
        }
        return !regions.isEmpty() && pairs * 2 > regions.size() ? AssemblyMode.PAIR : AssemblyMode.TRIPLE;
    }

    public List<MenuItem> extractAll(ParseSession session, List<Region> regions, AssemblyMode mode) {
        List<MenuItem> items = new ArrayList<>();
        for (Region region : regions) {
            MenuItem item = extract(session, region, mode);
            if (item != null) {
                items.add(item);
            }
        }
        return items;
    }

    /**
     * @return 名称或价格不合法时返回 null（记 VALIDATION 日志）
     */
    public MenuItem extract(ParseSession session, Region region, AssemblyMode mode) {
        Token priceToken = null;
        NumberClassification price = null;
        for (Token token : region.getTokens()) {
            NumberClassification c = session.priceOf(token);
            if (c != null && (price == null || c.getConfidence() > price.getConfidence())) {
                priceToken = token;
                price = c;
            }
        }

        List<Part> parts = new ArrayList<>();
        for (Token token : region.getTokens()) {
            String text = token.trimmedText();
            if (token == priceToken) {
                // 名称和价格挤在同一个 token 里时，保留名称部分
                String rest = text.replace(price.getMatchedText(), " ").trim();
                if (MenuTextPatterns.hasLatin(rest) || MenuTextPatterns.hasCjk(rest)) {
                    parts.add(new Part(token, rest));
                }
                continue;
            }
            parts.add(new Part(token, text));
        }

        double priceValue = price == null ? 0 : price.getValue();
        if (price == null && parts.size() >= 2) {
            // 纯位置分配：末尾的纯数字 token 视为价格
            Matcher m = PRICE_ONLY.matcher(parts.get(parts.size() - 1).text);
            if (m.matches()) {
                double value = MenuTextPatterns.parseAmount(m.group(1));
                if (value >= config.getMinPrice() && value <= config.getMaxPrice()) {
                    priceValue = value;
                    parts.remove(parts.size() - 1);
                }
            }
        }

        if (parts.isEmpty()) {
            return reject(session, region, "区域内只有价格");
        }

        String name;
        String description;
        if (mode == AssemblyMode.PAIR) {
            name = pickPairName(parts).text;
            description = null;
        } else {
            Part namePart = pickTripleName(session, parts);
            name = namePart.text;
            StringBuilder sb = new StringBuilder();
            for (Part part : parts) {
                if (part != namePart) {
                    sb.append(part.text).append(' ');
                }
            }
            description = sb.toString().trim();
        }

        name = MenuItemClassifier.cleanName(name);
        if (!nameFits(name)) {
            return reject(session, region, "名称长度不合规: '" + name + "'");
        }
        boolean priceless = priceValue <= 0;
        if (priceless && !config.isAllowPricelessItems()) {
            return reject(session, region, "缺少价格: '" + name + "'");
        }

        double confidence = itemConfidence(region, name, description, !priceless);
        return MenuItem.builder()
                .id(String.format("region-%d-%d-%d", region.getPageIndex(),
                        Math.round(region.getBoundingBox().getX()), Math.round(region.getBoundingBox().getY())))
                .name(name)
                .description(description)
                .price(priceless ? 0 : priceValue)
                .priceless(priceless)
                .category(MenuItemClassifier.categorize(name, description))
                .servingSize(MenuItemClassifier.estimateServingSize(name, description))
                .confidence(confidence)
                .pageIndex(region.getPageIndex())
                .phase(ProcessingPhase.ASSEMBLY)
                .regionImage(region.getThumbnail())
                .sourceRegion(region)
                .build();
    }

    /**
     * 区域置信度与三项检查得分按 regionConfidenceShare 混合
     */
    public double itemConfidence(Region region, String name, String description, boolean hasPrice) {
        double triple = 0;
        if (nameFits(name)) {
            triple += config.getNameValidationWeight();
        }
        if (description == null || description.isEmpty() || description.length() >= name.length()) {
            triple += config.getDescriptionValidationWeight();
        }
        if (hasPrice) {
            triple += config.getTripleParsingPriceWeight();
        }
        double share = config.getRegionConfidenceShare();
        return share * region.getConfidence() + (1 - share) * triple;
    }

    private Part pickTripleName(ParseSession session, List<Part> parts) {
        Part name = parts.get(0);
        Part preferred = null;
        for (int i = 1; i < parts.size(); i++) {
            Part part = parts.get(i);
            if (outranks(session, part.token, name.token) && nameFits(MenuItemClassifier.cleanName(part.text))
                    && (preferred == null || outranks(session, part.token, preferred.token))) {
                preferred = part;
            }
        }
        return preferred != null ? preferred : name;
    }

    private static boolean outranks(ParseSession session, Token candidate, Token current) {
        if (moreProminent(candidate, current)) {
            return true;
        }
        if (moreProminent(current, candidate)) {
            return false;
        }
        return nameAffinity(session, candidate) > nameAffinity(session, current) + FINGERPRINT_AFFINITY_MARGIN;
    }

    /**
     * token 所在字体组像"菜名字体"的程度，没有指纹（组太小）时为 0
     */
    static double nameAffinity(ParseSession session, Token token) {
        TypographyFingerprint fingerprint = session.getClassification().fingerprintOf(token);
        if (fingerprint == null) {
            return 0;
        }
        double score = 0;
        if (fingerprint.hasPattern(ContentPattern.PREPARATION_VERB) || fingerprint.hasPattern(ContentPattern.CATEGORY_WORD)) {
            score += 1;
        }
        if (fingerprint.hasPattern(ContentPattern.CURRENCY_SHAPE) || fingerprint.hasPattern(ContentPattern.UNIT_SHAPE)) {
            score -= 1;
        }
        return score * fingerprint.getConfidence();
    }

    private static Part pickPairName(List<Part> parts) {
        for (Part part : parts) {
            if (MenuTextPatterns.hasCjk(part.text) && MenuTextPatterns.hasLatin(part.text)) {
                return part;
            }
        }
        return parts.get(0);
    }

    private static boolean moreProminent(Token candidate, Token current) {
        if (candidate.isBold() && !current.isBold()) {
            return candidate.getFontSize() >= current.getFontSize();
        }
        return candidate.getFontSize() > current.getFontSize() * PROMINENT_FONT_RATIO;
    }

    private boolean nameFits(String name) {
        return name != null && name.length() >= config.getMinNameLength() && name.length() <= config.getMaxNameLength();
    }

    private static MenuItem reject(ParseSession session, Region region, String reason) {
        session.failure(ProcessingPhase.ASSEMBLY, Level.DEBUG, FailureKind.VALIDATION,
                "第 {} 页区域 {} 未能组装: {}", region.getPageIndex(), region.getBoundingBox(), reason);
        return null;
    }
}
