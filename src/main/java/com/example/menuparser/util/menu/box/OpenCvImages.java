package com.example.menuparser.util.menu.box;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * OpenCV 图像工具：native 库加载、BufferedImage 转 Mat、梯度幅值
 */
public final class OpenCvImages {

    private static final Logger log = LoggerFactory.getLogger(OpenCvImages.class);

    /** 3x3 Sobel 在理想阶跃边缘上的响应（4 × 255），幅值除以它归一化到 [0, 1] */
    private static final double SOBEL_NORMALIZER = 4.0 * 255.0;

    private static volatile boolean loaded;

    private OpenCvImages() {
    }

    /**
     * 加载 native 库，进程内只加载一次
     *
     * @throws IllegalStateException 当前平台没有可用的 native 库
     */
    public static void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (OpenCvImages.class) {
            if (loaded) {
                return;
            }
            try {
                nu.pattern.OpenCV.loadLocally();
            } catch (UnsatisfiedLinkError | RuntimeException e) {
                throw new IllegalStateException("OpenCV native 库加载失败: " + e.getMessage(), e);
            }
            loaded = true;
            log.info("OpenCV 库加载成功: {}", Core.VERSION);
        }
    }

    /**
     * 转单通道 8 位灰度
     */
    public static Mat toGray(BufferedImage image) {
        ensureLoaded();
        BufferedImage gray = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = gray.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        byte[] pixels = ((DataBufferByte) gray.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(gray.getHeight(), gray.getWidth(), CvType.CV_8UC1);
        mat.put(0, 0, pixels);
        return mat;
    }

    /**
     * Sobel 梯度幅值，CV_32F，截断到 [0, 1]
     *
     * 调用方负责 release 返回的 Mat。
     */
    public static Mat sobelMagnitude(BufferedImage image) {
        Mat gray = null;
        Mat dx = null;
        Mat dy = null;
        try {
            gray = toGray(image);
            dx = new Mat();
            dy = new Mat();
            Imgproc.Sobel(gray, dx, CvType.CV_32F, 1, 0, 3);
            Imgproc.Sobel(gray, dy, CvType.CV_32F, 0, 1, 3);

            Mat magnitude = new Mat();
            Core.magnitude(dx, dy, magnitude);
            magnitude.convertTo(magnitude, CvType.CV_32F, 1.0 / SOBEL_NORMALIZER);
            // 角点处两个方向叠加会超过 1
            Imgproc.threshold(magnitude, magnitude, 1.0, 1.0, Imgproc.THRESH_TRUNC);
            return magnitude;
        } finally {
            release(gray, dx, dy);
        }
    }

    public static void release(Mat... mats) {
        for (Mat mat : mats) {
            if (mat != null) {
                mat.release();
            }
        }
    }
}
