package com.example.menuparser.util.menu.assembler;

import com.example.menuparser.util.menu.assembler.FallbackLineParser.TextLine;
import com.example.menuparser.util.menu.dto.MenuItem;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.ProcessingPhase;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.example.menuparser.MenuFixtures.page;
import static com.example.menuparser.MenuFixtures.token;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 文本兜底逐行解析测试
 */
public class FallbackLineParserTest {

    private final FallbackLineParser parser = new FallbackLineParser(PipelineConfig.loadDefault());

    private List<MenuItem> parse(String... lines) {
        List<TextLine> textLines = new ArrayList<>();
        for (String line : lines) {
            textLines.add(new TextLine(0, line));
        }
        return parser.parseLines(textLines);
    }

    private MenuItem single(String line) {
        List<MenuItem> items = parse(line);
        assertEquals(1, items.size(), "应解析出一条记录: " + line);
        return items.get(0);
    }

    @Test
    public void testNamePriceWithLeaderDots() {
        MenuItem item = single("Grilled Salmon ...... $24.95");
        assertEquals("Grilled Salmon", item.getName());
        assertEquals(24.95, item.getPrice(), 1e-9);
        assertNull(item.getDescription());
    }

    @Test
    public void testNameDashDescriptionPrice() {
        MenuItem item = single("Caesar Salad - romaine, parmesan, croutons 9.50");
        assertEquals("Caesar Salad", item.getName());
        assertEquals("romaine, parmesan, croutons", item.getDescription());
        assertEquals(9.50, item.getPrice(), 1e-9);
    }

    @Test
    public void testNamePriceDescription() {
        MenuItem item = single("Pad Thai $12.95 rice noodles with peanuts");
        assertEquals("Pad Thai", item.getName());
        assertEquals("rice noodles with peanuts", item.getDescription());
        assertEquals(12.95, item.getPrice(), 1e-9);
    }

    @Test
    public void testPriceFirst() {
        MenuItem item = single("$8.50 Fish Tacos");
        assertEquals("Fish Tacos", item.getName());
        assertEquals(8.50, item.getPrice(), 1e-9);
    }

    @Test
    public void testPriceOnFollowingLine() {
        List<MenuItem> items = parse("Slow Braised Short Rib", "$28.00", "Tomato Soup 7.25");

        assertEquals(2, items.size(), "价格行被上一行消费");
        assertEquals("Slow Braised Short Rib", items.get(0).getName());
        assertEquals(28.0, items.get(0).getPrice(), 1e-9);
        assertEquals("Tomato Soup", items.get(1).getName());
    }

    @Test
    public void testRejectsOutOfRangeAndNamelessLines() {
        assertTrue(parse("Wagyu Tasting 450.00").isEmpty(), "价格超出上限");
        assertTrue(parse("Call for reservations").isEmpty());
        assertTrue(parse("12 / 24.50").isEmpty(), "名称没有字母");
        assertTrue(parse("Party Platter $1,250.00").isEmpty(), "千分位金额超出上限");
        assertTrue(parse("", "   ").isEmpty());
    }

    @Test
    public void testSequentialIdsAndFallbackMetadata() {
        List<MenuItem> items = parse("Caesar Salad 9.50", "Welcome to our restaurant", "Tomato Soup 7.25");

        assertEquals(2, items.size());
        assertEquals("item-1", items.get(0).getId());
        assertEquals("item-2", items.get(1).getId());
        for (MenuItem item : items) {
            assertEquals(ProcessingPhase.FALLBACK, item.getPhase());
            assertEquals(0.6, item.getConfidence(), 1e-9);
            assertNull(item.getRegionImage());
        }
        assertEquals("Salads", items.get(0).getCategory());
        assertEquals("Soups", items.get(1).getCategory());
    }

    @Test
    public void testLinesOfJoinsTokensOnSameBaseline() {
        List<TextLine> lines = FallbackLineParser.linesOf(page(
                token("$24.95", 300, 700),
                token("Grilled Salmon Fillet", 50, 702),
                token("Fresh Atlantic salmon", 50, 686)));

        assertEquals(2, lines.size());
        assertEquals("Grilled Salmon Fillet $24.95", lines.get(0).text);
        assertEquals("Fresh Atlantic salmon", lines.get(1).text);
    }

    @Test
    public void testParsePages() {
        List<MenuItem> items = parser.parse(Arrays.asList(page(
                token("Grilled Salmon Fillet", 50, 700),
                token("$24.95", 300, 700))));

        assertEquals(1, items.size());
        assertEquals("Grilled Salmon Fillet", items.get(0).getName());
    }
}
