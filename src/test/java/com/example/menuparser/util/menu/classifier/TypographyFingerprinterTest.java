package com.example.menuparser.util.menu.classifier;

import com.example.menuparser.util.menu.dto.ContentPattern;
import com.example.menuparser.util.menu.dto.FontKey;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.Token;
import com.example.menuparser.util.menu.dto.TypographyFingerprint;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.example.menuparser.MenuFixtures.token;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TypographyFingerprinterTest {

    private final TypographyFingerprinter fingerprinter = new TypographyFingerprinter(PipelineConfig.loadDefault());

    @Test
    public void testGroupsByFontAndDropsSmallGroups() {
        List<Token> tokens = new ArrayList<>();
        tokens.add(bold("Grilled Salmon"));
        tokens.add(bold("Roasted Chicken"));
        tokens.add(bold("Fried Calamari"));
        tokens.add(bold("Caesar Salad"));
        tokens.add(token("$24.95", 300, 700, 10, 0));
        tokens.add(token("$18.50", 300, 660, 10, 0));

        Map<FontKey, TypographyFingerprint> fingerprints = fingerprinter.fingerprint(tokens);

        assertEquals(1, fingerprints.size(), "少于 3 个 token 的字体组应丢弃");
        TypographyFingerprint fp = fingerprints.get(FontKey.of(tokens.get(0)));
        assertNotNull(fp);
        assertEquals(4, fp.getSampleCount());
        assertEquals(0.4, fp.getConfidence(), 1e-9);
        assertEquals((14 + 15 + 14 + 12) / 4.0, fp.getAverageTextLength(), 1e-9);
        assertTrue(fp.hasPattern(ContentPattern.PREPARATION_VERB), "3/4 的名称含烹饪动词");
        assertFalse(fp.hasPattern(ContentPattern.CURRENCY_SHAPE));
        assertNull(fingerprints.get(FontKey.of(tokens.get(4))));
    }

    @Test
    public void testConfidenceCapsAtOne() {
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            tokens.add(token("$" + (10 + i) + ".00", 300, 700 - i * 20, 10, 0));
        }
        TypographyFingerprint fp = fingerprinter.fingerprint(tokens).get(FontKey.of(tokens.get(0)));
        assertEquals(1.0, fp.getConfidence(), 1e-9);
        assertTrue(fp.hasPattern(ContentPattern.CURRENCY_SHAPE));
    }

    @Test
    public void testPatternsOf() {
        assertTrue(TypographyFingerprinter.patternsOf("Smoked Brisket").contains(ContentPattern.PREPARATION_VERB));
        assertTrue(TypographyFingerprinter.patternsOf("Desserts").contains(ContentPattern.CATEGORY_WORD));
        assertTrue(TypographyFingerprinter.patternsOf("16 oz").contains(ContentPattern.UNIT_SHAPE));
        assertTrue(TypographyFingerprinter.patternsOf("Chef's choice").isEmpty());
    }

    private static Token bold(String text) {
        return token(text, 50, 700, 12, 0).toBuilder().fontFamily("Helvetica-Bold").fontWeight(700).build();
    }
}
