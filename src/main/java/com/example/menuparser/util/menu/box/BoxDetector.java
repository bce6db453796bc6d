package com.example.menuparser.util.menu.box;

import com.example.menuparser.util.menu.classifier.MenuTextPatterns;
import com.example.menuparser.util.menu.dto.BoundingBox;
import com.example.menuparser.util.menu.dto.Confidence;
import com.example.menuparser.util.menu.dto.DetectionSource;
import com.example.menuparser.util.menu.dto.PageTokens;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.Region;
import com.example.menuparser.util.menu.dto.Token;
import com.example.menuparser.util.menu.region.RegionDetector;
import com.example.menuparser.util.pdf.PdfCoordinateUtils;
import lombok.Value;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Phase 1（边框模式）：从栅格化页面的线框中检测菜品格子
 *
 * 适用于"名称 / 图片或留白 / 价格"带边框的格子布局。
 *
 * 算法：
 * 1. OpenCV Sobel 梯度幅值，按 edgeThreshold 二值化为强边缘掩码
 * 2. 沿线方向闭运算补上 ≤ lineGapTolerancePx 的断裂，再用 minLineSpanPx 长的线形核开运算，
 *    只留下横线（或竖线）；每个连通轮廓的外接矩形是一条线段，掩码内平均幅值 ≥ lineStrengthThreshold 的保留。
 *    距离 ≤ lineMergeDistancePx 的平行线段合并
 * 3. 上下两条横线 + 覆盖其纵向跨度的左右两条竖线组成矩形，置信度 = 四条线强度均值
 * 4. 重叠面积超过较小矩形 boxOverlapMergeRatio 的矩形合并（外接矩形，取最大置信度）
 * 5. 尺寸、宽高比、页边距校验
 * 6. 映射回文档坐标，收集框内 token（少于 2 个丢弃）
 * 7. 版式校验：上三分之一至少 1 个 token，下三分之一至少 1 个货币 token，中间 token 数 ≤ 上 + 下
 */
public class BoxDetector {

    private static final Logger log = LoggerFactory.getLogger(BoxDetector.class);

    // ========== 数据结构 ==========

    /** 线段（像素坐标） */
    @Value
    public static class Line {
        boolean horizontal;
        /** 横线为 y，竖线为 x */
        double position;
        int start;
        int end;
        double strength;

        public int length() {
            return end - start + 1;
        }

        /**
         * 与另一条平行线段合并：位置取中点，跨度取并集，强度取较大者
         */
        public Line mergedWith(Line other) {
            return new Line(horizontal, (position + other.position) / 2.0, Math.min(start, other.start),
                    Math.max(end, other.end), Math.max(strength, other.strength));
        }

        @Override
        public String toString() {
            return String.format("%s@%.1f[%d-%d] s=%.2f", horizontal ? "H" : "V", position, start, end, strength);
        }
    }

    /** 矩形（像素坐标，左上角原点） */
    @Value
    public static class Rect {
        double x;
        double y;
        double width;
        double height;
        double confidence;

        public double area() {
            return width * height;
        }

        public double intersectionArea(Rect other) {
            double ix = Math.min(x + width, other.x + other.width) - Math.max(x, other.x);
            double iy = Math.min(y + height, other.y + other.height) - Math.max(y, other.y);
            return ix > 0 && iy > 0 ? ix * iy : 0;
        }

        public Rect union(Rect other) {
            double minX = Math.min(x, other.x);
            double minY = Math.min(y, other.y);
            double maxX = Math.max(x + width, other.x + other.width);
            double maxY = Math.max(y + height, other.y + other.height);
            return new Rect(minX, minY, maxX - minX, maxY - minY, Math.max(confidence, other.confidence));
        }

        @Override
        public String toString() {
            return String.format("Rect[%.0f, %.0f, %.0fx%.0f] c=%.2f", x, y, width, height, confidence);
        }
    }

    private final PipelineConfig config;

    public BoxDetector(PipelineConfig config) {
        this.config = config;
    }

    /**
     * 检测单页的格子区域
     *
     * @param image 整页图像（图像坐标系）
     * @param scale 图像像素 / 文档单位
     * @param page  该页 token
     */
    public List<Region> detect(BufferedImage image, double scale, PageTokens page) {
        List<Line> horizontals;
        List<Line> verticals;
        Mat magnitude = OpenCvImages.sobelMagnitude(image);
        try {
            horizontals = mergeParallel(extractLines(magnitude, true));
            verticals = mergeParallel(extractLines(magnitude, false));
        } finally {
            magnitude.release();
        }

        List<Rect> rects = mergeOverlapping(formRectangles(horizontals, verticals));
        List<Rect> valid = new ArrayList<>();
        for (Rect rect : rects) {
            if (isValidRect(rect, image.getWidth(), image.getHeight())) {
                valid.add(rect);
            }
        }

        List<Token> usable = RegionDetector.usableTokens(page.getTokens());
        List<Region> regions = new ArrayList<>();
        for (Rect rect : valid) {
            BoundingBox docBox = toDocument(rect, scale, page.getPageHeight());
            List<Token> contained = collectTokens(docBox, usable);
            if (contained.size() < 2) {
                log.debug("Page {}: {} 内 token 不足 2 个，丢弃", page.getPageIndex(), rect);
                continue;
            }
            if (!passesLayoutGate(docBox, contained)) {
                log.debug("Page {}: {} 不符合 名称/留白/价格 版式，丢弃", page.getPageIndex(), rect);
                continue;
            }
            regions.add(new Region(contained, rect.getConfidence(), page.getPageIndex(), page.getPageHeight(),
                    DetectionSource.BOX));
        }

        log.debug("Page {}: {} 条横线, {} 条竖线, {} 个矩形, {} 个通过尺寸校验, {} 个格子区域",
                page.getPageIndex(), horizontals.size(), verticals.size(), rects.size(), valid.size(), regions.size());
        return regions;
    }

    // ========== 线段提取 ==========

    /**
     * 从梯度幅值图中提取横线或竖线
     *
     * @param magnitude  {@link OpenCvImages#sobelMagnitude} 的结果（CV_32F，[0, 1]）
     * @param horizontal true 提取横线，false 提取竖线
     */
    public List<Line> extractLines(Mat magnitude, boolean horizontal) {
        Mat mask = new Mat();
        Mat closeKernel = null;
        Mat openKernel = null;
        Mat hierarchy = new Mat();
        List<MatOfPoint> contours = new ArrayList<>();
        try {
            Imgproc.threshold(magnitude, mask, config.getEdgeThreshold(), 255, Imgproc.THRESH_BINARY);
            mask.convertTo(mask, CvType.CV_8U);

            int gap = config.getLineGapTolerancePx() + 1;
            int span = config.getMinLineSpanPx();
            closeKernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT,
                    horizontal ? new Size(gap, 1) : new Size(1, gap));
            openKernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT,
                    horizontal ? new Size(span, 1) : new Size(1, span));
            Imgproc.morphologyEx(mask, mask, Imgproc.MORPH_CLOSE, closeKernel);
            Imgproc.morphologyEx(mask, mask, Imgproc.MORPH_OPEN, openKernel);

            Imgproc.findContours(mask, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);
            List<Line> lines = new ArrayList<>();
            for (MatOfPoint contour : contours) {
                org.opencv.core.Rect bounds = Imgproc.boundingRect(contour);
                Line line = toLine(bounds, horizontal, meanStrength(magnitude, mask, bounds));
                if (line.length() >= span && line.getStrength() >= config.getLineStrengthThreshold()) {
                    lines.add(line);
                }
            }
            lines.sort(Comparator.comparingDouble(Line::getPosition).thenComparingInt(Line::getStart));
            return lines;
        } finally {
            OpenCvImages.release(mask, closeKernel, openKernel, hierarchy);
            for (MatOfPoint contour : contours) {
                contour.release();
            }
        }
    }

    /**
     * 轮廓外接矩形 → 线段：线宽方向取中心，线长方向取两端
     */
    private static Line toLine(org.opencv.core.Rect bounds, boolean horizontal, double strength) {
        if (horizontal) {
            return new Line(true, bounds.y + (bounds.height - 1) / 2.0, bounds.x, bounds.x + bounds.width - 1,
                    strength);
        }
        return new Line(false, bounds.x + (bounds.width - 1) / 2.0, bounds.y, bounds.y + bounds.height - 1,
                strength);
    }

    /**
     * 掩码覆盖像素的平均梯度幅值（闭运算补上的断裂像素也计入）
     */
    private static double meanStrength(Mat magnitude, Mat mask, org.opencv.core.Rect bounds) {
        Mat magRoi = magnitude.submat(bounds);
        Mat maskRoi = mask.submat(bounds);
        try {
            return Core.mean(magRoi, maskRoi).val[0];
        } finally {
            OpenCvImages.release(magRoi, maskRoi);
        }
    }

    /**
     * 合并相距很近且跨度重叠的平行线段（粗线两侧的双边缘）
     */
    public List<Line> mergeParallel(List<Line> lines) {
        List<Line> sorted = new ArrayList<>(lines);
        sorted.sort(Comparator.comparingDouble(Line::getPosition).thenComparingInt(Line::getStart));
        List<Line> merged = new ArrayList<>();
        for (Line line : sorted) {
            int target = -1;
            for (int i = merged.size() - 1; i >= 0; i--) {
                Line candidate = merged.get(i);
                if (line.getPosition() - candidate.getPosition() > config.getLineMergeDistancePx()) {
                    break;
                }
                if (line.getStart() <= candidate.getEnd() && candidate.getStart() <= line.getEnd()) {
                    target = i;
                    break;
                }
            }
            if (target < 0) {
                merged.add(line);
            } else {
                merged.set(target, merged.get(target).mergedWith(line));
            }
        }
        return merged;
    }

    // ========== 矩形组装 ==========

    public List<Rect> formRectangles(List<Line> horizontals, List<Line> verticals) {
        List<Line> hs = new ArrayList<>(horizontals);
        hs.sort(Comparator.comparingDouble(Line::getPosition));
        List<Line> vs = new ArrayList<>(verticals);
        vs.sort(Comparator.comparingDouble(Line::getPosition));

        double tolerance = config.getLineMergeDistancePx() + config.getLineGapTolerancePx() + 2;
        List<Rect> rects = new ArrayList<>();

        for (int i = 0; i < hs.size(); i++) {
            Line top = hs.get(i);
            for (int j = i + 1; j < hs.size(); j++) {
                Line bottom = hs.get(j);
                if (bottom.getPosition() - top.getPosition() < config.getMinBoxHeightPx()) {
                    continue;
                }
                int overlapStart = Math.max(top.getStart(), bottom.getStart());
                int overlapEnd = Math.min(top.getEnd(), bottom.getEnd());
                if (overlapEnd - overlapStart < config.getMinBoxWidthPx()) {
                    continue;
                }

                // 覆盖整个纵向跨度、且落在共同 X 范围内的竖线
                List<Line> sides = new ArrayList<>();
                for (Line v : vs) {
                    if (v.getPosition() < overlapStart - tolerance || v.getPosition() > overlapEnd + tolerance) {
                        continue;
                    }
                    if (v.getStart() <= top.getPosition() + tolerance
                            && v.getEnd() >= bottom.getPosition() - tolerance) {
                        sides.add(v);
                    }
                }
                for (int k = 0; k + 1 < sides.size(); k++) {
                    Line left = sides.get(k);
                    Line right = sides.get(k + 1);
                    double width = right.getPosition() - left.getPosition();
                    if (width < config.getMinBoxWidthPx()) {
                        continue;
                    }
                    double confidence = (top.getStrength() + bottom.getStrength()
                            + left.getStrength() + right.getStrength()) / 4.0;
                    rects.add(new Rect(left.getPosition(), top.getPosition(), width,
                            bottom.getPosition() - top.getPosition(), Confidence.clamp(confidence)));
                }
                // 只取最近的下边线，避免跨行拼出大框
                break;
            }
        }
        return rects;
    }

    public List<Rect> mergeOverlapping(List<Rect> rects) {
        List<Rect> result = new ArrayList<>(rects);
        boolean changed = true;
        while (changed) {
            changed = false;
            outer:
            for (int i = 0; i < result.size(); i++) {
                for (int j = i + 1; j < result.size(); j++) {
                    Rect a = result.get(i);
                    Rect b = result.get(j);
                    double smaller = Math.min(a.area(), b.area());
                    if (smaller > 0 && a.intersectionArea(b) > config.getBoxOverlapMergeRatio() * smaller) {
                        result.set(i, a.union(b));
                        result.remove(j);
                        changed = true;
                        break outer;
                    }
                }
            }
        }
        return result;
    }

    public boolean isValidRect(Rect rect, int imageWidth, int imageHeight) {
        if (rect.getWidth() < config.getMinBoxWidthPx() || rect.getHeight() < config.getMinBoxHeightPx()) {
            return false;
        }
        double aspect = rect.getWidth() / rect.getHeight();
        if (aspect < config.getMinAspectRatio() || aspect > config.getMaxAspectRatio()) {
            return false;
        }
        int margin = config.getPageEdgeMarginPx();
        return rect.getX() > margin
                && rect.getY() > margin
                && rect.getX() + rect.getWidth() < imageWidth - margin
                && rect.getY() + rect.getHeight() < imageHeight - margin;
    }

    // ========== 映射与版式校验 ==========

    /**
     * 图像坐标（左上原点）→ 文档坐标（左下原点）
     */
    public static BoundingBox toDocument(Rect rect, double scale, float pageHeight) {
        return PdfCoordinateUtils.imageToDocument(rect.getX(), rect.getY(), rect.getWidth(), rect.getHeight(),
                scale, pageHeight);
    }

    private List<Token> collectTokens(BoundingBox box, List<Token> tokens) {
        List<Token> contained = new ArrayList<>();
        for (Token token : tokens) {
            if (box.contains(token, config.getBoxTokenTolerance())) {
                contained.add(token);
            }
        }
        contained.sort(RegionDetector.READING_ORDER);
        return contained;
    }

    /**
     * 名称 / 留白或图片 / 价格 版式
     */
    public boolean passesLayoutGate(BoundingBox box, List<Token> tokens) {
        double third = box.getHeight() / 3.0;
        double topStart = box.getY() + 2 * third;
        double bottomEnd = box.getY() + third;

        int top = 0;
        int middle = 0;
        int bottom = 0;
        int bottomCurrency = 0;
        for (Token token : tokens) {
            double cy = token.getCenterY();
            if (cy >= topStart) {
                top++;
            } else if (cy < bottomEnd) {
                bottom++;
                if (MenuTextPatterns.hasCurrency(token.getText())) {
                    bottomCurrency++;
                }
            } else {
                middle++;
            }
        }
        return top >= 1 && bottomCurrency >= 1 && middle <= top + bottom;
    }
}
