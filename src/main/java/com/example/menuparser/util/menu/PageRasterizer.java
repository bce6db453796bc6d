package com.example.menuparser.util.menu;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * 页面栅格化能力（外部协作者）
 *
 * 评分与校验逻辑只依赖该接口，不依赖任何具体渲染后端。
 */
public interface PageRasterizer {

    /**
     * 渲染整页
     *
     * @param pageIndex 页面索引（0-based）
     * @param scale     缩放倍率，1.0 对应 1 文档单位 = 1 像素
     * @return 图像坐标系（左上角原点，Y 向下）的整页图像
     * @throws IOException 渲染失败
     */
    BufferedImage rasterize(int pageIndex, double scale) throws IOException;
}
