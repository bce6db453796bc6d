package com.example.menuparser.util.menu.classifier;

import java.util.regex.Pattern;

/**
 * 菜单文本常用正则
 *
 * 各阶段共用：货币、计量单位、热量、烹饪动词、分类词、CJK 字符。
 */
public final class MenuTextPatterns {

    private MenuTextPatterns() {
    }

    /**
     * 金额数字：先匹配千分位写法 1,250.00，再匹配普通写法；
     * 逗号后恰好 1 到 2 位数字才算小数逗号（12,50）
     */
    public static final String AMOUNT =
            "(?:\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?(?!\\d)|\\d{1,4}(?:\\.\\d{1,2}|,\\d{1,2}(?!\\d))?)";

    private static final Pattern GROUPED_AMOUNT = Pattern.compile("\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?");

    /** 货币符号前缀：$12.95、¥ 38、$1,250.00 */
    public static final Pattern CURRENCY_PREFIXED = Pattern.compile("([$€£¥￥])\\s*(" + AMOUNT + ")");

    /** 货币代码/汉字后缀：12.95 USD、38元 */
    public static final Pattern CURRENCY_SUFFIXED = Pattern.compile(
            "(" + AMOUNT + ")\\s*(USD|EUR|GBP|RMB|CNY|元|€)(?![A-Za-z])");

    /** 数字 + 单位后缀（热量或计量） */
    public static final Pattern SUFFIXED_UNIT = Pattern.compile(
            "(\\d+(?:\\.\\d+)?)\\s*(kcal|calories|calorie|cals|cal|ounces|ounce|oz|lbs|lb|pounds|pound|inches|inch|in\\.|feet|foot|ft|liters|liter|litres|litre|ml|l|\"|'|″|′)(?![A-Za-z])",
            Pattern.CASE_INSENSITIVE);

    /** 裸数字（可带 # 或 No. 前缀） */
    public static final Pattern BARE_NUMBER = Pattern.compile(
            "(No\\.\\s*|#)?(?<![\\d.])(\\d+(?:\\.\\d+)?)(?![\\d])");

    public static final Pattern ITEM_NUMBER_TOKEN = Pattern.compile("^#?\\d+$");

    public static final Pattern ITEM_NUMBER_PREFIX = Pattern.compile("No\\.\\s*\\d+");

    public static final Pattern CALORIE_UNIT = Pattern.compile("^(kcal|calories|calorie|cals|cal)$", Pattern.CASE_INSENSITIVE);

    public static final Pattern MEASUREMENT_UNIT = Pattern.compile(
            "^(ounces|ounce|oz|lbs|lb|pounds|pound|inches|inch|in\\.|feet|foot|ft|liters|liter|litres|litre|ml|l|\"|'|″|′)$",
            Pattern.CASE_INSENSITIVE);

    /** 紧随其后的独立单位 token，如 "12" "oz" */
    public static final Pattern LEADING_UNIT_WORD = Pattern.compile(
            "^(kcal|calories|calorie|cals|cal|ounces|ounce|oz|lbs|lb|pounds|pound|inches|inch|feet|foot|ft|liters|liter|litres|litre|ml|\"|'|″|′)(?![A-Za-z])",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern PREPARATION_VERB = Pattern.compile(
            "\\b(grilled|fried|roasted|baked|steamed|saut[eé]ed|braised|smoked|seared|poached|blackened|crispy|glazed|marinated|stuffed|tossed|charred|slow-cooked|stir-fried|pan-fried)\\b",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern CATEGORY_WORD = Pattern.compile(
            "\\b(appetizers?|starters?|salads?|soups?|entr[eé]es?|mains?|sides?|desserts?|beverages?|drinks?|specials?|sandwiches|pizzas?|burgers?)\\b",
            Pattern.CASE_INSENSITIVE);

    /** 行尾价格：任意文本中出现的货币格式 */
    public static final Pattern ANY_CURRENCY = Pattern.compile(
            "[$€£¥￥]\\s*\\d|\\d\\s*(USD|EUR|GBP|RMB|CNY|元)(?![A-Za-z])|(?<![\\d.])\\d{1,4}\\.\\d{2}(?![\\d.])");

    public static final Pattern CJK = Pattern.compile("[\\u4e00-\\u9fff\\u3400-\\u4dbf\\u3040-\\u30ff\\uac00-\\ud7af]");

    public static final Pattern LATIN = Pattern.compile("[A-Za-z]");

    /**
     * 文本中是否含货币格式的金额
     */
    public static boolean hasCurrency(String text) {
        return text != null && ANY_CURRENCY.matcher(text).find();
    }

    public static boolean hasCjk(String text) {
        return text != null && CJK.matcher(text).find();
    }

    public static boolean hasLatin(String text) {
        return text != null && LATIN.matcher(text).find();
    }

    /**
     * 规范化金额文本：去掉千分位逗号，小数逗号换成小数点
     */
    public static String normalizeAmount(String digits) {
        if (GROUPED_AMOUNT.matcher(digits).matches()) {
            return digits.replace(",", "");
        }
        return digits.replace(',', '.');
    }

    public static double parseAmount(String digits) {
        return Double.parseDouble(normalizeAmount(digits));
    }
}
