package com.example.menuparser.util.menu;

import com.example.menuparser.MenuFixtures;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CachingPageRasterizerTest {

    @Test
    public void testRendersEachPageAndScaleOnce() throws IOException {
        AtomicInteger calls = new AtomicInteger();
        CachingPageRasterizer rasterizer = new CachingPageRasterizer((pageIndex, scale) -> {
            calls.incrementAndGet();
            return MenuFixtures.blankPage(scale);
        });

        BufferedImage first = rasterizer.rasterize(0, 2.0);
        assertSame(first, rasterizer.rasterize(0, 2.0));
        rasterizer.rasterize(0, 1.0);
        rasterizer.rasterize(1, 2.0);

        assertEquals(3, calls.get());
        assertEquals(3, rasterizer.cachedPageCount());

        rasterizer.invalidate();
        assertEquals(0, rasterizer.cachedPageCount());
        rasterizer.rasterize(0, 2.0);
        assertEquals(4, calls.get());
    }

    @Test
    public void testDifferentPagesRenderConcurrently() throws Exception {
        CountDownLatch secondPageRendered = new CountDownLatch(1);
        CachingPageRasterizer rasterizer = new CachingPageRasterizer((pageIndex, scale) -> {
            if (pageIndex == 0) {
                // 第 0 页等第 1 页渲染完才返回，两页串行时会超时
                try {
                    if (!secondPageRendered.await(5, TimeUnit.SECONDS)) {
                        throw new IOException("第 1 页被第 0 页阻塞");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException(e);
                }
            } else {
                secondPageRendered.countDown();
            }
            return MenuFixtures.blankPage(scale);
        });

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<BufferedImage> first = executor.submit(() -> rasterizer.rasterize(0, 2.0));
            Future<BufferedImage> second = executor.submit(() -> rasterizer.rasterize(1, 2.0));

            assertNotNull(second.get(10, TimeUnit.SECONDS));
            assertNotNull(first.get(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        assertEquals(2, rasterizer.cachedPageCount());
    }

    @Test
    public void testFailedRenderIsNotCached() throws IOException {
        AtomicInteger calls = new AtomicInteger();
        CachingPageRasterizer rasterizer = new CachingPageRasterizer((pageIndex, scale) -> {
            if (calls.incrementAndGet() == 1) {
                throw new IOException("渲染失败");
            }
            return MenuFixtures.blankPage(scale);
        });

        IOException error = assertThrows(IOException.class, () -> rasterizer.rasterize(0, 2.0));
        assertEquals("渲染失败", error.getMessage());
        assertEquals(0, rasterizer.cachedPageCount());

        assertNotNull(rasterizer.rasterize(0, 2.0));
        assertEquals(2, calls.get());
        assertEquals(1, rasterizer.cachedPageCount());
    }
}
