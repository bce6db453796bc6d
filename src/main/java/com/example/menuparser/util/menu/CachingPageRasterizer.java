package com.example.menuparser.util.menu;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 会话级页面缓存
 *
 * 一次解析会话内同一页同一倍率只渲染一次；会话结束时 {@link #invalidate()}。
 * 不得在并发的多个会话之间共享。
 */
public class CachingPageRasterizer implements PageRasterizer {

    private static final Logger log = LoggerFactory.getLogger(CachingPageRasterizer.class);

    private final PageRasterizer delegate;
    private final Map<String, BufferedImage> cache = new ConcurrentHashMap<>();
    private final Map<String, Object> renderLocks = new ConcurrentHashMap<>();

    public CachingPageRasterizer(PageRasterizer delegate) {
        this.delegate = delegate;
    }

    @Override
    public BufferedImage rasterize(int pageIndex, double scale) throws IOException {
        String key = pageIndex + "@" + scale;
        BufferedImage cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        // 按 页@倍率 加锁：同一页只渲染一次，不同页互不阻塞。渲染失败不缓存，下次重试
        Object lock = renderLocks.computeIfAbsent(key, k -> new Object());
        synchronized (lock) {
            cached = cache.get(key);
            if (cached != null) {
                return cached;
            }
            BufferedImage image = delegate.rasterize(pageIndex, scale);
            cache.put(key, image);
            log.debug("页面 {} 渲染完成并缓存 (scale={}, {}x{})", pageIndex, scale, image.getWidth(), image.getHeight());
            return image;
        }
    }

    public int cachedPageCount() {
        return cache.size();
    }

    public void invalidate() {
        cache.clear();
        renderLocks.clear();
    }
}
