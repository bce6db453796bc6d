package com.example.menuparser.util.menu;

import com.example.menuparser.util.menu.classifier.ClassificationResult;
import com.example.menuparser.util.menu.classifier.TokenClassifier;
import com.example.menuparser.util.menu.dto.FailureKind;
import com.example.menuparser.util.menu.dto.NumberClassification;
import com.example.menuparser.util.menu.dto.PageTokens;
import com.example.menuparser.util.menu.dto.ParseLogEntry;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.ProcessingPhase;
import com.example.menuparser.util.menu.dto.ProgressSnapshot;
import com.example.menuparser.util.menu.dto.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.helpers.MessageFormatter;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 解析会话上下文
 *
 * 封装一次解析的全部状态，各阶段通过引用共享：
 * - 配置（只读）
 * - 每页 token
 * - Phase 0 的分类结果与字体指纹
 * - 会话级页面缓存
 * - 结构化日志与进度历史
 * - 取消标记
 *
 * 没有任何进程级共享状态，不同文档的并发解析互不影响。
 *
 * 使用方式：
 * <pre>
 * try (ParseSession session = new ParseSession(config, pages, rasterizer, listener)) {
 *     MenuParseResult result = new MenuParsingPipeline().run(session);
 * }
 * </pre>
 */
public class ParseSession implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ParseSession.class);

    private final String sessionId;
    private final PipelineConfig config;
    private final List<PageTokens> pages;
    private final CachingPageRasterizer rasterizer;
    private final ProgressListener progressListener;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final List<ParseLogEntry> logEntries = Collections.synchronizedList(new ArrayList<>());
    private final List<ProgressSnapshot> progressHistory = Collections.synchronizedList(new ArrayList<>());

    private TokenClassifier classifier;
    private ClassificationResult classification;

    /**
     * @param rasterizer 页面渲染器，可为 null（此时不做缩略图与边框检测）
     * @param progressListener 进度回调，可为 null
     */
    public ParseSession(PipelineConfig config, List<PageTokens> pages,
                        PageRasterizer rasterizer, ProgressListener progressListener) {
        this.sessionId = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        this.config = config;
        this.pages = pages == null ? Collections.emptyList() : Collections.unmodifiableList(pages);
        this.rasterizer = rasterizer == null ? null : new CachingPageRasterizer(rasterizer);
        this.progressListener = progressListener;
        this.classifier = new TokenClassifier(config);
    }

    public ParseSession(PipelineConfig config, List<PageTokens> pages) {
        this(config, pages, null, null);
    }

    // ==================== 日志 ====================

    /**
     * 记录结构化日志，同时转发到 SLF4J
     */
    public void log(ProcessingPhase phase, Level level, String message, Object... args) {
        record(phase, level, null, message, args);
    }

    /**
     * 记录一次可恢复的失败
     */
    public void failure(ProcessingPhase phase, Level level, FailureKind kind, String message, Object... args) {
        record(phase, level, kind, message, args);
    }

    private void record(ProcessingPhase phase, Level level, FailureKind kind, String message, Object[] args) {
        String formatted = MessageFormatter.arrayFormat(message, args).getMessage();
        logEntries.add(new ParseLogEntry(phase, level, kind, formatted, System.currentTimeMillis()));
        log.atLevel(level).log("[{}][{}] {}", sessionId, phase, formatted);
    }

    // ==================== 进度 ====================

    public void progress(ProcessingPhase phase, int percent, String message) {
        ProgressSnapshot snapshot = new ProgressSnapshot(phase, Math.max(0, Math.min(100, percent)), message);
        progressHistory.add(snapshot);
        if (progressListener != null) {
            progressListener.onProgress(snapshot);
        }
    }

    // ==================== 取消 ====================

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 协作式取消检查点
     *
     * @throws CancellationException 会话已被取消
     */
    public void checkCancelled(ProcessingPhase phase) {
        if (cancelled.get()) {
            log(phase, Level.WARN, "解析已取消");
            throw new CancellationException("parse session " + sessionId + " cancelled during " + phase);
        }
    }

    // ==================== Phase 0 产物 ====================

    public TokenClassifier getClassifier() {
        return classifier;
    }

    public ClassificationResult getClassification() {
        if (classification == null) {
            throw new IllegalStateException("Phase 0 has not run for session " + sessionId);
        }
        return classification;
    }

    /**
     * token 中置信度最高的价格分类，没有返回 null
     *
     * 跨页合并后的 token 坐标已平移，不在 Phase 0 的结果表里，此时用当前分类器现场分类。
     */
    public NumberClassification priceOf(Token token) {
        double threshold = config.getPriceClassificationThreshold();
        ClassificationResult result = getClassification();
        if (result.getByToken().containsKey(token)) {
            return result.bestPrice(token, threshold);
        }
        NumberClassification best = null;
        for (NumberClassification c : classifier.classifyToken(token, null)) {
            if (c.isPrice(threshold) && (best == null || c.getConfidence() > best.getConfidence())) {
                best = c;
            }
        }
        return best;
    }

    /**
     * 写入（或在模式回灌后替换）分类结果
     */
    public void updateClassification(TokenClassifier newClassifier, ClassificationResult result) {
        this.classifier = newClassifier;
        this.classification = result;
    }

    // ==================== 访问器 ====================

    public String getSessionId() {
        return sessionId;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public List<PageTokens> getPages() {
        return pages;
    }

    public PageTokens page(int pageIndex) {
        for (PageTokens page : pages) {
            if (page.getPageIndex() == pageIndex) {
                return page;
            }
        }
        return null;
    }

    public PageRasterizer getRasterizer() {
        return rasterizer;
    }

    public boolean hasRasterizer() {
        return rasterizer != null;
    }

    public List<ParseLogEntry> getLogEntries() {
        synchronized (logEntries) {
            return new ArrayList<>(logEntries);
        }
    }

    public List<ProgressSnapshot> getProgressHistory() {
        synchronized (progressHistory) {
            return new ArrayList<>(progressHistory);
        }
    }

    @Override
    public void close() {
        if (rasterizer != null) {
            int cached = rasterizer.cachedPageCount();
            rasterizer.invalidate();
            log.debug("[{}] 会话关闭，释放 {} 个页面缓存", sessionId, cached);
        }
    }
}
