package com.example.menuparser;

import com.example.menuparser.util.menu.PageRasterizer;
import com.example.menuparser.util.menu.ParseSession;
import com.example.menuparser.util.menu.dto.PageTokens;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.Token;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 测试用 token、页面、会话与 PDF 构造工具
 */
public final class MenuFixtures {

    public static final float PAGE_WIDTH = 612f;
    public static final float PAGE_HEIGHT = 792f;

    /** 名称 / 描述 / 价格，名称和价格同一行，描述在下一行 */
    public static final String[][] SAMPLE_ITEMS = {
            {"Grilled Salmon Fillet", "Fresh Atlantic salmon with lemon butter sauce", "$24.95"},
            {"Caesar Salad", "Romaine hearts with parmesan and garlic croutons", "$9.50"},
            {"Tomato Basil Soup", "Slow simmered tomatoes with fresh garden basil", "$7.25"},
            {"Ribeye Steak", "Twelve ounce ribeye with roasted fingerlings", "$32.00"},
            {"Chocolate Lava Cake", "Warm chocolate cake with vanilla bean ice cream", "$8.75"},
            {"Mushroom Risotto", "Arborio rice with wild mushrooms and truffle oil", "$18.50"},
    };

    public static final float SAMPLE_TOP = 700f;
    public static final float SAMPLE_ITEM_SPACING = 40f;
    public static final float SAMPLE_DESCRIPTION_OFFSET = 14f;
    public static final float SAMPLE_NAME_X = 50f;
    public static final float SAMPLE_PRICE_X = 280f;

    private MenuFixtures() {
    }

    /**
     * 宽度按每字符半个字号估算，高度等于字号
     */
    public static Token token(String text, float x, float y, float fontSize, int pageIndex) {
        return Token.of(text, x, y, text.length() * fontSize * 0.5f, fontSize, fontSize, pageIndex);
    }

    public static Token token(String text, float x, float y) {
        return token(text, x, y, 10f, 0);
    }

    public static PageTokens page(int pageIndex, List<Token> tokens) {
        return new PageTokens(pageIndex, PAGE_WIDTH, PAGE_HEIGHT, tokens);
    }

    public static PageTokens page(Token... tokens) {
        return page(0, Arrays.asList(tokens));
    }

    public static List<Token> sampleMenuTokens(int pageIndex) {
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < SAMPLE_ITEMS.length; i++) {
            float y = SAMPLE_TOP - i * SAMPLE_ITEM_SPACING;
            tokens.add(token(SAMPLE_ITEMS[i][0], SAMPLE_NAME_X, y, 10f, pageIndex));
            tokens.add(token(SAMPLE_ITEMS[i][2], SAMPLE_PRICE_X, y, 10f, pageIndex));
            tokens.add(token(SAMPLE_ITEMS[i][1], SAMPLE_NAME_X, y - SAMPLE_DESCRIPTION_OFFSET, 10f, pageIndex));
        }
        return tokens;
    }

    public static PageTokens sampleMenuPage() {
        return page(0, sampleMenuTokens(0));
    }

    /**
     * 已跑完 Phase 0 的会话
     */
    public static ParseSession classifiedSession(PipelineConfig config, PageRasterizer rasterizer, PageTokens... pages) {
        ParseSession session = new ParseSession(config, Arrays.asList(pages), rasterizer, null);
        session.updateClassification(session.getClassifier(), session.getClassifier().classify(session.getPages()));
        return session;
    }

    public static ParseSession classifiedSession(PipelineConfig config, PageTokens... pages) {
        return classifiedSession(config, null, pages);
    }

    /**
     * 白底整页图像
     */
    public static BufferedImage blankPage(double scale) {
        BufferedImage image = new BufferedImage((int) Math.ceil(PAGE_WIDTH * scale),
                (int) Math.ceil(PAGE_HEIGHT * scale), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
        } finally {
            graphics.dispose();
        }
        return image;
    }

    /**
     * 用 PDFBox 生成与 {@link #sampleMenuPage()} 同版式的单页 PDF
     */
    public static byte[] sampleMenuPdf() throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                for (int i = 0; i < SAMPLE_ITEMS.length; i++) {
                    float y = SAMPLE_TOP - i * SAMPLE_ITEM_SPACING;
                    showText(content, regular, 10, SAMPLE_NAME_X, y, SAMPLE_ITEMS[i][0]);
                    showText(content, regular, 10, SAMPLE_PRICE_X, y, SAMPLE_ITEMS[i][2]);
                    showText(content, regular, 10, SAMPLE_NAME_X, y - SAMPLE_DESCRIPTION_OFFSET, SAMPLE_ITEMS[i][1]);
                }
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    public static void showText(PDPageContentStream content, PDType1Font font, float size, float x, float y,
                                String text) throws IOException {
        content.beginText();
        content.setFont(font, size);
        content.newLineAtOffset(x, y);
        content.showText(text);
        content.endText();
    }
}
