package com.example.menuparser.util.menu.assembler;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 菜品分类、份量估计、名称清洗
 */
public final class MenuItemClassifier {

    public static final String OTHER = "Other";

    /** 按顺序匹配，先命中者生效 */
    private static final Map<String, List<String>> CATEGORY_KEYWORDS = new LinkedHashMap<>();

    static {
        CATEGORY_KEYWORDS.put("Appetizers",
                Arrays.asList("appetizer", "starter", "wings", "nachos", "dip", "bread", "bruschetta", "calamari"));
        CATEGORY_KEYWORDS.put("Salads", Arrays.asList("salad", "caesar", "greens", "lettuce"));
        CATEGORY_KEYWORDS.put("Soups", Arrays.asList("soup", "bisque", "chowder", "broth"));
        CATEGORY_KEYWORDS.put("Mains", Arrays.asList("entree", "main", "chicken", "beef", "pork", "fish", "salmon",
                "steak", "pasta", "pizza", "burger", "sandwich"));
        CATEGORY_KEYWORDS.put("Sides", Arrays.asList("side", "fries", "rice", "potato", "vegetable", "beans"));
        CATEGORY_KEYWORDS.put("Desserts",
                Arrays.asList("dessert", "cake", "pie", "ice cream", "chocolate", "cookie", "tiramisu"));
        CATEGORY_KEYWORDS.put("Beverages",
                Arrays.asList("drink", "coffee", "tea", "soda", "juice", "beer", "wine", "cocktail", "water"));
    }

    private static final Pattern LEADING_NUMBERING = Pattern.compile("^\\d+\\.\\s*");
    private static final Pattern TRAILING_DOTS = Pattern.compile("\\s*\\.\\.+\\s*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private MenuItemClassifier() {
    }

    public static String categorize(String name, String description) {
        String text = combined(name, description);
        for (Map.Entry<String, List<String>> entry : CATEGORY_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (text.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return OTHER;
    }

    /**
     * 份量（人数）估计：先看名称/描述中的份量词，再按分类给默认值
     */
    public static int estimateServingSize(String name, String description) {
        String text = combined(name, description);
        if (text.contains("family") || text.contains("large")) {
            return 4;
        }
        if (text.contains("sharing") || text.contains("platter")) {
            return 6;
        }
        if (text.contains("individual") || text.contains("personal")) {
            return 1;
        }
        if (text.contains("pizza") && text.contains("medium")) {
            return 3;
        }
        if (text.contains("pizza") && text.contains("small")) {
            return 2;
        }
        String category = categorize(name, description);
        if ("Appetizers".equals(category) || "Sides".equals(category)) {
            return 2;
        }
        return 1;
    }

    /**
     * 去掉行首编号（"12. "）、行尾引导点，合并空白
     */
    public static String cleanName(String name) {
        if (name == null) {
            return "";
        }
        String cleaned = LEADING_NUMBERING.matcher(name.trim()).replaceFirst("");
        cleaned = TRAILING_DOTS.matcher(cleaned).replaceFirst("");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    private static String combined(String name, String description) {
        return ((name == null ? "" : name) + " " + (description == null ? "" : description)).toLowerCase();
    }
}
