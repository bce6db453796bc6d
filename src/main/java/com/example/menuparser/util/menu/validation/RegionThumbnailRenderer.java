package com.example.menuparser.util.menu.validation;

import com.example.menuparser.util.menu.PageRasterizer;
import com.example.menuparser.util.menu.dto.Region;
import com.example.menuparser.util.pdf.PdfCoordinateUtils;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * 区域缩略图：从整页渲染结果中裁剪区域（含外扩边距），编码为 PNG data URL
 */
public class RegionThumbnailRenderer {

    public static final String DATA_URL_PREFIX = "data:image/png;base64,";

    private final PageRasterizer rasterizer;
    private final double scale;
    private final double padding;

    public RegionThumbnailRenderer(PageRasterizer rasterizer, double scale, double padding) {
        this.rasterizer = rasterizer;
        this.scale = scale;
        this.padding = padding;
    }

    /**
     * @throws IOException 页面渲染失败，或区域落在页面之外
     */
    public String render(Region region) throws IOException {
        BufferedImage page = rasterizer.rasterize(region.getPageIndex(), scale);
        if (page == null) {
            throw new IOException("rasterizer returned no image for page " + region.getPageIndex());
        }

        int[] crop = PdfCoordinateUtils.documentToImage(region.getBoundingBox(), region.getPageHeight(),
                scale, padding, page.getWidth(), page.getHeight());
        if (crop == null) {
            throw new IOException("region " + region.getBoundingBox() + " lies outside the rendered page");
        }

        BufferedImage thumbnail = page.getSubimage(crop[0], crop[1], crop[2], crop[3]);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(thumbnail, "PNG", out)) {
            throw new IOException("no PNG writer available");
        }
        return DATA_URL_PREFIX + Base64.getEncoder().encodeToString(out.toByteArray());
    }
}
