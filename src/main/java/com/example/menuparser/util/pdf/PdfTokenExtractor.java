package com.example.menuparser.util.pdf;

import com.example.menuparser.util.menu.dto.BoundingBox;
import com.example.menuparser.util.menu.dto.PageTokens;
import com.example.menuparser.util.menu.dto.Token;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF 文本片段提取器
 *
 * PDFTextStripper 按单词回调 writeString，这里把同一基线、同一字体、间距不超过
 * {@link #WORD_GAP_EM} 个字号的相邻单词合并成一个 Token（一段连续文字），
 * 列之间的大间距（如右对齐的价格）会切开。
 *
 * 坐标转换为文档坐标系（左下角原点，y 为底边），见 {@link PdfCoordinateUtils}。
 * 空白片段与零尺寸片段丢弃。
 */
public class PdfTokenExtractor extends PDFTextStripper {

    private static final Logger log = LoggerFactory.getLogger(PdfTokenExtractor.class);

    /** 单词间距上限（字号倍数），超过则切分为两个 Token */
    static final float WORD_GAP_EM = 0.8f;

    /** 同一基线的容差（字号倍数） */
    static final float BASELINE_TOLERANCE_EM = 0.3f;

    private final List<PageTokens> pages = new ArrayList<>();

    private int pageIndex;
    private float pageWidth;
    private float pageHeight;
    private List<Token> pageTokens;

    /** 正在合并的一段文字 */
    private final List<TextPosition> run = new ArrayList<>();
    private final StringBuilder runText = new StringBuilder();

    public PdfTokenExtractor() {
        super();
        setSortByPosition(true);
    }

    /**
     * 提取整个文档
     */
    public static List<PageTokens> extract(PDDocument document) throws IOException {
        long startTime = System.currentTimeMillis();
        PdfTokenExtractor extractor = new PdfTokenExtractor();
        extractor.getText(document);
        extractor.addMissingPages(document);

        int tokenCount = 0;
        for (PageTokens page : extractor.pages) {
            tokenCount += page.getTokens().size();
        }
        log.info("文本提取完成: {} 页, {} 个片段, 耗时={}ms", extractor.pages.size(), tokenCount,
                System.currentTimeMillis() - startTime);
        return extractor.getPages();
    }

    /**
     * 没有内容流的页面不会触发 startPage/endPage，这里补成空页，保证页号连续
     */
    private void addMissingPages(PDDocument document) {
        List<PageTokens> complete = new ArrayList<>();
        int next = 0;
        for (int i = 0; i < document.getNumberOfPages(); i++) {
            if (next < pages.size() && pages.get(next).getPageIndex() == i) {
                complete.add(pages.get(next++));
            } else {
                PDRectangle box = document.getPage(i).getCropBox();
                complete.add(new PageTokens(i, box.getWidth(), box.getHeight(), new ArrayList<>()));
            }
        }
        pages.clear();
        pages.addAll(complete);
    }

    @Override
    protected void startPage(PDPage page) throws IOException {
        PDRectangle box = page.getCropBox();
        pageIndex = getCurrentPageNo() - 1;
        pageWidth = box.getWidth();
        pageHeight = box.getHeight();
        pageTokens = new ArrayList<>();
        super.startPage(page);
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
        flushRun();
        pages.add(new PageTokens(pageIndex, pageWidth, pageHeight, pageTokens));
        super.endPage(page);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (textPositions == null || textPositions.isEmpty() || text == null || text.trim().isEmpty()) {
            return;
        }
        if (!run.isEmpty() && !continuesRun(textPositions.get(0))) {
            flushRun();
        }
        if (!run.isEmpty()) {
            runText.append(' ');
        }
        runText.append(text);
        run.addAll(textPositions);
    }

    /**
     * 同一基线、同一字体字号、水平间距足够小
     */
    private boolean continuesRun(TextPosition next) {
        TextPosition last = run.get(run.size() - 1);
        float size = Math.max(last.getFontSizeInPt(), 1f);
        if (Math.abs(last.getYDirAdj() - next.getYDirAdj()) > BASELINE_TOLERANCE_EM * size) {
            return false;
        }
        if (last.getFont() != next.getFont() || Math.abs(last.getFontSizeInPt() - next.getFontSizeInPt()) > 0.01f) {
            return false;
        }
        float gap = next.getXDirAdj() - (last.getXDirAdj() + last.getWidthDirAdj());
        return gap <= WORD_GAP_EM * size;
    }

    private void flushRun() {
        if (run.isEmpty()) {
            return;
        }
        String text = runText.toString().trim();
        BoundingBox box = PdfCoordinateUtils.computeBoundingBox(run, pageHeight);
        TextPosition first = run.get(0);
        run.clear();
        runText.setLength(0);

        if (text.isEmpty() || box == null || box.getWidth() <= 0 || box.getHeight() <= 0) {
            return;
        }

        PDFont font = first.getFont();
        String fontName = font == null || font.getName() == null ? "unknown" : stripSubsetPrefix(font.getName());
        pageTokens.add(Token.builder()
                .text(text)
                .x((float) box.getX())
                .y((float) box.getY())
                .width((float) box.getWidth())
                .height((float) box.getHeight())
                .fontSize(first.getFontSizeInPt())
                .fontFamily(fontName)
                .fontWeight(fontWeight(font, fontName))
                .fontStyle(isItalic(font, fontName) ? "italic" : "normal")
                .pageIndex(pageIndex)
                .build());
    }

    /**
     * 粗体判断：字体名（Helvetica-Bold、ABCDEF+SimHei-Black）或字体描述符
     */
    static int fontWeight(PDFont font, String fontName) {
        String lower = fontName.toLowerCase();
        if (lower.contains("bold") || lower.contains("black") || lower.contains("heavy")) {
            return 700;
        }
        PDFontDescriptor descriptor = font == null ? null : font.getFontDescriptor();
        if (descriptor != null) {
            if (descriptor.isForceBold()) {
                return 700;
            }
            float weight = descriptor.getFontWeight();
            if (weight > 0) {
                return Math.round(weight);
            }
        }
        return 400;
    }

    static boolean isItalic(PDFont font, String fontName) {
        String lower = fontName.toLowerCase();
        if (lower.contains("italic") || lower.contains("oblique")) {
            return true;
        }
        PDFontDescriptor descriptor = font == null ? null : font.getFontDescriptor();
        return descriptor != null && descriptor.isItalic();
    }

    /**
     * 去掉子集字体前缀 "ABCDEF+"
     */
    static String stripSubsetPrefix(String fontName) {
        int plus = fontName.indexOf('+');
        return plus == 6 ? fontName.substring(plus + 1) : fontName;
    }

    public List<PageTokens> getPages() {
        return pages;
    }
}
