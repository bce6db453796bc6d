package com.example.menuparser.util.menu.validation;

import com.example.menuparser.util.menu.ParseSession;
import com.example.menuparser.util.menu.dto.BoundingBox;
import com.example.menuparser.util.menu.dto.FailureKind;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.ProcessingPhase;
import com.example.menuparser.util.menu.dto.Region;
import com.example.menuparser.util.menu.dto.Token;
import com.example.menuparser.util.menu.region.RegionDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Phase 2：区域校验
 *
 * 每个区域依次通过四道门槛：
 * 1. 尺寸：宽 ≥ minWidthEm、高 ≥ minHeightEm（相对区域自身的平均字号）
 * 2. 内容：≥2 个 token，文字总长 ≥ minTextLength，文字密度（字符数 / 面积）≥ minTextDensity
 * 3. 置信度下限 minimumConfidenceThreshold
 * 4. 启发式：名称长度 + 描述不短于名称（无描述视为满足）+ 存在价格，加权和 ≥ extractionQualityThreshold
 *
 * 通过后渲染缩略图；渲染失败保留区域，置信度乘以 thumbnailFailurePenalty。
 * 区域之间没有依赖，按 renderBatchSize 个线程并行处理，输出保持输入顺序。
 */
public class RegionValidator {

    private static final Logger log = LoggerFactory.getLogger(RegionValidator.class);

    /**
     * 单个区域的校验结论
     */
    public static class Verdict {
        public final Region region;
        /** 未通过的门槛，通过时为 null */
        public final String gate;
        public final String reason;

        private Verdict(Region region, String gate, String reason) {
            this.region = region;
            this.gate = gate;
            this.reason = reason;
        }

        static Verdict accept(Region region) {
            return new Verdict(region, null, null);
        }

        static Verdict reject(Region region, String gate, String reason) {
            return new Verdict(region, gate, reason);
        }

        public boolean isAccepted() {
            return gate == null;
        }
    }

    private final PipelineConfig config;
    private final CrossPageMerger crossPageMerger;

    public RegionValidator(PipelineConfig config) {
        this.config = config;
        this.crossPageMerger = new CrossPageMerger(config);
    }

    /**
     * Phase 2 入口
     *
     * @return 通过校验的区域（输入顺序）
     */
    public List<Region> validate(ParseSession session, List<Region> regions) {
        List<Region> candidates = config.isCrossPageMerge() ? crossPageMerger.merge(regions, session) : regions;
        if (candidates.isEmpty()) {
            return new ArrayList<>();
        }

        RegionThumbnailRenderer renderer = session.hasRasterizer()
                ? new RegionThumbnailRenderer(session.getRasterizer(), config.getThumbnailScale(),
                config.getThumbnailPadding())
                : null;

        int threadCount = Math.min(config.getRenderBatchSize(), candidates.size());
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        List<Future<Verdict>> futures = new ArrayList<>();
        List<Region> accepted = new ArrayList<>();
        int rejected = 0;

        try {
            for (Region region : candidates) {
                futures.add(executor.submit(() -> process(session, renderer, region)));
            }

            for (int i = 0; i < futures.size(); i++) {
                Verdict verdict;
                try {
                    verdict = futures.get(i).get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("region validation interrupted");
                } catch (ExecutionException e) {
                    // 单个区域的意外错误只影响该区域
                    rejected++;
                    session.failure(ProcessingPhase.REGION_VALIDATION, Level.WARN, FailureKind.VALIDATION,
                            "区域 {} 校验异常: {}", candidates.get(i).getBoundingBox(), e.getCause().toString());
                    continue;
                }
                if (verdict.isAccepted()) {
                    accepted.add(verdict.region);
                } else {
                    rejected++;
                    session.failure(ProcessingPhase.REGION_VALIDATION, Level.DEBUG, FailureKind.VALIDATION,
                            "第 {} 页区域 {} 未通过{}: {}", verdict.region.getPageIndex(),
                            verdict.region.getBoundingBox(), verdict.gate, verdict.reason);
                }
            }
        } finally {
            executor.shutdownNow();
        }

        log.debug("Phase 2: {} 个候选区域, 通过 {}, 拒绝 {}", candidates.size(), accepted.size(), rejected);
        return accepted;
    }

    private Verdict process(ParseSession session, RegionThumbnailRenderer renderer, Region region) {
        Verdict verdict = check(session, region);
        if (!verdict.isAccepted() || renderer == null) {
            return verdict;
        }
        try {
            return Verdict.accept(region.withThumbnail(renderer.render(region)));
        } catch (IOException | RuntimeException e) {
            double penalized = region.getConfidence() * config.getThumbnailFailurePenalty();
            session.failure(ProcessingPhase.REGION_VALIDATION, Level.WARN, FailureKind.REGION_EXTRACTION,
                    "第 {} 页区域 {} 缩略图渲染失败，置信度 {} -> {}: {}", region.getPageIndex(),
                    region.getBoundingBox(), String.format("%.2f", region.getConfidence()),
                    String.format("%.2f", penalized), e.getMessage());
            return Verdict.accept(region.withConfidence(penalized));
        }
    }

    /**
     * 依次执行四道门槛（不含缩略图）
     */
    public Verdict check(ParseSession session, Region region) {
        BoundingBox box = region.getBoundingBox();
        double em = RegionDetector.averageFontSize(region.getTokens());

        // 1. 尺寸
        if (box.getWidth() < config.getMinWidthEm() * em || box.getHeight() < config.getMinHeightEm() * em) {
            return Verdict.reject(region, "尺寸门槛", String.format("%.1fx%.1f < %.1fem x %.1fem (em=%.1f)",
                    box.getWidth(), box.getHeight(), config.getMinWidthEm(), config.getMinHeightEm(), em));
        }

        // 2. 内容
        if (region.getTokens().size() < 2) {
            return Verdict.reject(region, "内容门槛", "token 不足 2 个");
        }
        int textLength = 0;
        for (Token token : region.getTokens()) {
            textLength += token.trimmedText().length();
        }
        if (textLength < config.getMinTextLength()) {
            return Verdict.reject(region, "内容门槛", "文字总长 " + textLength + " < " + config.getMinTextLength());
        }
        double density = textLength / box.area();
        if (density < config.getMinTextDensity()) {
            return Verdict.reject(region, "内容门槛", String.format("文字密度 %.5f 过低", density));
        }

        // 3. 置信度
        if (region.getConfidence() < config.getMinimumConfidenceThreshold()) {
            return Verdict.reject(region, "置信度门槛", String.format("%.2f < %.2f",
                    region.getConfidence(), config.getMinimumConfidenceThreshold()));
        }

        // 4. 启发式
        double score = heuristicScore(session, region);
        if (score < config.getExtractionQualityThreshold()) {
            return Verdict.reject(region, "启发式门槛", String.format("得分 %.2f < %.2f",
                    score, config.getExtractionQualityThreshold()));
        }
        return Verdict.accept(region);
    }

    /**
     * 名称 / 描述 / 价格 三项检查的加权和
     *
     * 名称取阅读顺序中第一个非价格 token，其余非价格 token 拼成描述。
     */
    public double heuristicScore(ParseSession session, Region region) {
        String name = null;
        StringBuilder description = new StringBuilder();
        boolean hasPrice = false;

        for (Token token : region.getTokens()) {
            if (session.priceOf(token) != null) {
                hasPrice = true;
            } else if (name == null) {
                name = token.trimmedText();
            } else {
                description.append(token.trimmedText()).append(' ');
            }
        }

        double score = 0;
        if (name != null && name.length() >= config.getMinNameLength() && name.length() <= config.getMaxNameLength()) {
            score += config.getNameLengthWeight();
        }
        String desc = description.toString().trim();
        if (desc.isEmpty() || (name != null && desc.length() >= name.length())) {
            score += config.getDescriptionComplexityWeight();
        }
        if (hasPrice) {
            score += config.getPriceValidationWeight();
        }
        return score;
    }
}
