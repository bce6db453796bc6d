package com.example.menuparser.util.pdf;

import com.example.menuparser.util.menu.PageRasterizer;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * 基于 PDFBox 的页面渲染器
 *
 * 注意：PDFRenderer 不是线程安全的，同一文档的渲染串行执行。
 * 文档的生命周期由调用方管理。
 */
public class PdfBoxPageRasterizer implements PageRasterizer {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxPageRasterizer.class);

    private final PDFRenderer renderer;
    private final int pageCount;

    public PdfBoxPageRasterizer(PDDocument document) {
        this.renderer = new PDFRenderer(document);
        this.pageCount = document.getNumberOfPages();
    }

    @Override
    public synchronized BufferedImage rasterize(int pageIndex, double scale) throws IOException {
        if (pageIndex < 0 || pageIndex >= pageCount) {
            throw new IOException("page index " + pageIndex + " out of range [0, " + pageCount + ")");
        }
        long startTime = System.currentTimeMillis();
        BufferedImage image = renderer.renderImage(pageIndex, (float) scale, ImageType.RGB);
        log.debug("渲染页面 {} (scale={}): {}x{}, 耗时={}ms", pageIndex, scale,
                image.getWidth(), image.getHeight(), System.currentTimeMillis() - startTime);
        return image;
    }
}
