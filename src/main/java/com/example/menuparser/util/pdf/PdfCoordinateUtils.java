package com.example.menuparser.util.pdf;

import com.example.menuparser.util.menu.dto.BoundingBox;
import org.apache.pdfbox.text.TextPosition;

import java.util.List;

/**
 * PDF坐标转换工具类
 *
 * <h3>坐标系说明</h3>
 * <ul>
 *   <li><b>DirAdj坐标系</b>: TextPosition.getXDirAdj/getYDirAdj返回的坐标
 *     <ul>
 *       <li>已包含所有变换（CTM + Text Matrix + Font Matrix）</li>
 *       <li>YDirAdj 是基线到页面顶部的距离，向下递增</li>
 *     </ul>
 *   </li>
 *   <li><b>文档坐标系</b>（Token / Region 使用）: PDF 用户空间
 *     <ul>
 *       <li>原点：左下角</li>
 *       <li>Y轴向上递增，y 为底边</li>
 *     </ul>
 *   </li>
 *   <li><b>图像坐标系</b>: 渲染后的图像坐标
 *     <ul>
 *       <li>原点：左上角</li>
 *       <li>Y轴向下递增</li>
 *     </ul>
 *   </li>
 * </ul>
 */
public class PdfCoordinateUtils {

    private PdfCoordinateUtils() {
    }

    /**
     * 从TextPosition列表计算文档坐标系下的边界框
     *
     * <ol>
     *   <li>基线（文档坐标）= 页面高度 - YDirAdj</li>
     *   <li>文字底部取基线，顶部 = 基线 + HeightDir</li>
     * </ol>
     *
     * @return 边界框，null表示无法计算
     */
    public static BoundingBox computeBoundingBox(List<TextPosition> positions, float pageHeight) {
        if (positions == null || positions.isEmpty()) {
            return null;
        }

        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;

        for (TextPosition tp : positions) {
            double x = tp.getXDirAdj();
            double width = tp.getWidthDirAdj();
            double height = tp.getHeightDir();
            double baseline = pageHeight - tp.getYDirAdj();

            minX = Math.min(minX, x);
            maxX = Math.max(maxX, x + width);
            minY = Math.min(minY, baseline);
            maxY = Math.max(maxY, baseline + height);
        }

        return new BoundingBox(minX, minY, maxX - minX, maxY - minY);
    }

    /**
     * 文档坐标 → 图像坐标（带外扩边距），结果裁剪到图像范围内
     *
     * @param box        文档坐标边界框
     * @param pageHeight 页面高度（文档单位）
     * @param scale      图像像素 / 文档单位
     * @param padding    外扩边距（文档单位）
     * @return 图像坐标 [x, y, w, h]（像素），null表示与图像不相交
     */
    public static int[] documentToImage(BoundingBox box, float pageHeight, double scale, double padding,
                                        int imageWidth, int imageHeight) {
        double x0 = (box.getX() - padding) * scale;
        double x1 = (box.getRight() + padding) * scale;

        // y坐标需要翻转：文档顶部对应图像里较小的 y
        double y0 = (pageHeight - box.getTop() - padding) * scale;
        double y1 = (pageHeight - box.getY() + padding) * scale;

        int x = (int) Math.floor(Math.max(0, x0));
        int y = (int) Math.floor(Math.max(0, y0));
        int right = (int) Math.ceil(Math.min(imageWidth, x1));
        int bottom = (int) Math.ceil(Math.min(imageHeight, y1));

        if (right - x <= 0 || bottom - y <= 0) {
            return null;
        }
        return new int[]{x, y, right - x, bottom - y};
    }

    /**
     * 图像坐标（左上原点）→ 文档坐标（左下原点）
     */
    public static BoundingBox imageToDocument(double x, double y, double width, double height,
                                              double scale, float pageHeight) {
        double bottom = pageHeight - (y + height) / scale;
        return new BoundingBox(x / scale, bottom, width / scale, height / scale);
    }
}
