package com.example.menuparser.util.pdf;

import com.example.menuparser.MenuFixtures;
import com.example.menuparser.util.menu.dto.PageTokens;
import com.example.menuparser.util.menu.dto.Token;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * PDF 文本片段提取与页面渲染测试（PDF 由 PDFBox 现场生成）
 */
public class PdfTokenExtractorTest {

    private static byte[] menuPdf() throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
            PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                MenuFixtures.showText(content, bold, 12, 50, 700, "Grilled Salmon");
                MenuFixtures.showText(content, regular, 12, 400, 700, "$24.95");
                MenuFixtures.showText(content, regular, 10, 50, 685, "Fresh Atlantic salmon");
            }
            document.addPage(new PDPage(PDRectangle.LETTER));

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    private static Token find(List<Token> tokens, String text) {
        for (Token token : tokens) {
            if (token.getText().equals(text)) {
                return token;
            }
        }
        fail("未找到片段 '" + text + "'，实际: " + tokens);
        return null;
    }

    @Test
    public void testExtractsMergedRunsInDocumentCoordinates() throws IOException {
        try (PDDocument document = Loader.loadPDF(menuPdf())) {
            List<PageTokens> pages = PdfTokenExtractor.extract(document);

            assertEquals(2, pages.size());
            PageTokens first = pages.get(0);
            assertEquals(0, first.getPageIndex());
            assertEquals(612f, first.getPageWidth(), 0.01f);
            assertEquals(792f, first.getPageHeight(), 0.01f);
            assertTrue(pages.get(1).getTokens().isEmpty());

            List<Token> tokens = first.getTokens();
            assertEquals(3, tokens.size(), "同一行同字体的单词合并，价格列单独成片段: " + tokens);

            Token name = find(tokens, "Grilled Salmon");
            assertEquals(50f, name.getX(), 1f);
            assertEquals(700f, name.getY(), 1f, "y 为基线位置（左下原点）");
            assertTrue(name.getTop() > 700f);
            assertEquals(12f, name.getFontSize(), 0.01f);
            assertEquals("Helvetica-Bold", name.getFontFamily());
            assertTrue(name.isBold());

            Token price = find(tokens, "$24.95");
            assertEquals(400f, price.getX(), 1f);
            assertFalse(price.isBold());

            Token description = find(tokens, "Fresh Atlantic salmon");
            assertEquals(685f, description.getY(), 1f);
            assertEquals(10f, description.getFontSize(), 0.01f);
            for (Token token : tokens) {
                assertTrue(token.getWidth() > 0 && token.getHeight() > 0);
                assertFalse(token.getText().trim().isEmpty());
            }
        }
    }

    @Test
    public void testStripSubsetPrefix() {
        assertEquals("SimHei", PdfTokenExtractor.stripSubsetPrefix("ABCDEF+SimHei"));
        assertEquals("Helvetica", PdfTokenExtractor.stripSubsetPrefix("Helvetica"));
        assertEquals(700, PdfTokenExtractor.fontWeight(null, "Arial-BoldMT"));
        assertEquals(400, PdfTokenExtractor.fontWeight(null, "ArialMT"));
        assertTrue(PdfTokenExtractor.isItalic(null, "Times-Italic"));
    }

    @Test
    public void testRasterizerRendersPagesAtScale() throws IOException {
        try (PDDocument document = Loader.loadPDF(menuPdf())) {
            PdfBoxPageRasterizer rasterizer = new PdfBoxPageRasterizer(document);

            BufferedImage image = rasterizer.rasterize(0, 1.0);
            assertNotNull(image);
            assertEquals(612, image.getWidth());
            assertEquals(792, image.getHeight());

            assertThrows(IOException.class, () -> rasterizer.rasterize(5, 1.0));
        }
    }
}
