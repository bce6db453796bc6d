package com.example.menuparser.util.menu.assembler;

import com.example.menuparser.util.menu.ParseSession;
import com.example.menuparser.util.menu.classifier.ClassificationResult;
import com.example.menuparser.util.menu.classifier.TokenClassifier;
import com.example.menuparser.util.menu.dto.AssemblyMode;
import com.example.menuparser.util.menu.dto.BootstrapSummary;
import com.example.menuparser.util.menu.dto.FailureKind;
import com.example.menuparser.util.menu.dto.MenuItem;
import com.example.menuparser.util.menu.dto.NumberType;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.ProcessingPhase;
import com.example.menuparser.util.menu.dto.Region;
import com.example.menuparser.util.menu.dto.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase 3：菜品组装 + 自举循环 + 全文校验
 *
 * 以显式状态机运行（见 {@link AssemblyState}），兜底轮数受 maxBootstrapIterations 限制，
 * 与数据无关地保证终止。
 *
 * 每轮兜底：
 * 1. 按行正则解析全文，得到兜底记录
 * 2. 从兜底记录学习 名称长度 / 价格区间 / 分类分布
 * 3. 第一次学到价格区间时回灌给 Phase 0（新增一条分类规则），重新组装区域
 * 4. 用学到的模式给区域记录重新打分，合并未被区域记录覆盖的兜底记录
 * 5. 对比质量分：改善不足 convergenceThreshold 视为收敛；下降超过 regressionMargin 回退到最佳快照
 */
public class ItemAssembler {

    private static final Logger log = LoggerFactory.getLogger(ItemAssembler.class);

    private static final double SAME_PRICE_EPSILON = 0.005;

    private final PipelineConfig config;
    private final RegionItemExtractor extractor;
    private final FallbackLineParser fallbackParser;
    private final DocumentValidator documentValidator;

    public ItemAssembler(PipelineConfig config) {
        this.config = config;
        this.extractor = new RegionItemExtractor(config);
        this.fallbackParser = new FallbackLineParser(config);
        this.documentValidator = new DocumentValidator(config);
    }

    public AssemblyOutcome assemble(ParseSession session, List<Region> regions) {
        AssemblyMode mode = extractor.resolveMode(regions);
        session.log(ProcessingPhase.ASSEMBLY, Level.INFO, "组装模式: {} ({} 个区域)", mode, regions.size());

        AssemblyState state = AssemblyState.ASSEMBLE;
        List<MenuItem> primary = new ArrayList<>();
        List<MenuItem> current = new ArrayList<>();
        List<MenuItem> fallback = new ArrayList<>();
        List<MenuItem> best = current;
        double bestScore = -1;
        double previousScore = 0;
        List<Double> history = new ArrayList<>();

        int iterations = 0;
        int fallbackAdded = 0;
        boolean triggered = false;
        boolean converged = false;
        boolean reverted = false;
        boolean reinjected = false;
        String stopReason = null;

        while (state != AssemblyState.DONE) {
            switch (state) {
                case ASSEMBLE: {
                    primary = extractor.extractAll(session, regions, mode);
                    current = primary;
                    AssemblyQuality quality = measure(session, current);
                    history.add(quality.getScore());
                    best = current;
                    bestScore = quality.getScore();
                    previousScore = quality.getScore();
                    session.log(ProcessingPhase.ASSEMBLY, Level.INFO, "首轮组装: {}", quality);
                    state = AssemblyState.ASSESS_BOOTSTRAP;
                    break;
                }
                case ASSESS_BOOTSTRAP: {
                    session.checkCancelled(ProcessingPhase.ASSEMBLY);
                    AssemblyQuality quality = measure(session, current);
                    if (quality.isSufficient(config)) {
                        converged = true;
                        stopReason = iterations == 0 ? "首轮结果达标" : "结果达标";
                        state = AssemblyState.VALIDATE;
                    } else if (iterations >= config.getMaxBootstrapIterations()) {
                        stopReason = "达到迭代上限";
                        session.failure(ProcessingPhase.FALLBACK, Level.INFO, FailureKind.CONVERGENCE,
                                "自举 {} 轮后仍未收敛 ({})，返回最佳快照 score={}", iterations, quality,
                                String.format("%.3f", bestScore));
                        current = best;
                        state = AssemblyState.VALIDATE;
                    } else {
                        triggered = true;
                        session.failure(ProcessingPhase.FALLBACK, Level.INFO, FailureKind.LOW_YIELD,
                                "结果不足，触发文本兜底 ({})", quality);
                        state = AssemblyState.FALLBACK;
                    }
                    break;
                }
                case FALLBACK: {
                    iterations++;
                    session.progress(ProcessingPhase.FALLBACK, 80, "文本兜底解析，第 " + iterations + " 轮");
                    fallback = fallbackParser.parse(session.getPages());
                    session.log(ProcessingPhase.FALLBACK, Level.INFO, "第 {} 轮兜底得到 {} 条记录",
                            iterations, fallback.size());
                    state = AssemblyState.REPROCESS;
                    break;
                }
                case REPROCESS: {
                    LearnedPatterns patterns = LearnedPatterns.learn(fallback);
                    if (patterns != null && !reinjected) {
                        reinject(session, patterns);
                        reinjected = true;
                        primary = extractor.extractAll(session, regions, mode);
                    }
                    List<MenuItem> merged = rescore(primary, patterns);
                    List<MenuItem> additions = uncovered(fallback, primary);
                    fallbackAdded = additions.size();
                    merged.addAll(additions);
                    current = merged;
                    state = AssemblyState.CONVERGE;
                    break;
                }
                case CONVERGE: {
                    AssemblyQuality quality = measure(session, current);
                    history.add(quality.getScore());
                    double delta = quality.getScore() - previousScore;
                    if (quality.getScore() > bestScore) {
                        best = current;
                        bestScore = quality.getScore();
                    }
                    if (delta < -config.getRegressionMargin()) {
                        reverted = true;
                        current = best;
                        stopReason = "质量回退";
                        session.log(ProcessingPhase.REFINEMENT, Level.WARN,
                                "第 {} 轮质量下降 {}，回退到最佳快照 score={}", iterations,
                                String.format("%.3f", -delta), String.format("%.3f", bestScore));
                        state = AssemblyState.VALIDATE;
                    } else if (delta < config.getConvergenceThreshold()) {
                        converged = true;
                        stopReason = "已收敛";
                        session.log(ProcessingPhase.REFINEMENT, Level.INFO, "第 {} 轮收敛: {} (Δ={})",
                                iterations, quality, String.format("%.3f", delta));
                        state = AssemblyState.VALIDATE;
                    } else {
                        previousScore = quality.getScore();
                        state = AssemblyState.ASSESS_BOOTSTRAP;
                    }
                    break;
                }
                case VALIDATE: {
                    session.progress(ProcessingPhase.DOCUMENT_VALIDATION, 90, "全文校验");
                    current = documentValidator.validate(session, current);
                    state = AssemblyState.DEDUP;
                    break;
                }
                case DEDUP: {
                    current = documentValidator.deduplicate(session, current);
                    state = AssemblyState.DONE;
                    break;
                }
                default:
                    throw new IllegalStateException("unexpected assembly state " + state);
            }
        }

        int regionItems = 0;
        for (MenuItem item : current) {
            if (item.getPhase() != ProcessingPhase.FALLBACK) {
                regionItems++;
            }
        }
        BootstrapSummary summary = BootstrapSummary.builder()
                .fallbackTriggered(triggered)
                .iterations(iterations)
                .qualityHistory(history)
                .converged(converged)
                .reverted(reverted)
                .patternsReinjected(reinjected)
                .finalQuality(bestScore)
                .regionItemCount(regionItems)
                .fallbackItemCount(current.size() - regionItems)
                .stopReason(stopReason)
                .build();
        log.debug("Phase 3 完成: {} 条记录 (兜底候选 {}), {}", current.size(), fallbackAdded, summary);
        return new AssemblyOutcome(current, summary);
    }

    /**
     * 把学到的价格区间回灌给 Phase 0，重新分类全文
     */
    private void reinject(ParseSession session, LearnedPatterns patterns) {
        TokenClassifier enhanced = session.getClassifier()
                .withLearnedPriceRange(patterns.getMinPrice(), patterns.getMaxPrice());
        ClassificationResult result = enhanced.classify(session.getPages());
        session.updateClassification(enhanced, result);
        session.log(ProcessingPhase.REFINEMENT, Level.INFO, "回灌模式 {}，重新分类后价格数 {}",
                patterns, result.countOf(NumberType.PRICE));
    }

    private static List<MenuItem> rescore(List<MenuItem> items, LearnedPatterns patterns) {
        List<MenuItem> result = new ArrayList<>();
        for (MenuItem item : items) {
            result.add(patterns == null ? item : item.withConfidence(patterns.rescore(item, item.getConfidence())));
        }
        return result;
    }

    /**
     * 未被区域记录覆盖的兜底记录
     *
     * 兜底名称出现在某条区域记录的名称或描述里、且价格相同，视为同一道菜。
     */
    static List<MenuItem> uncovered(List<MenuItem> fallback, List<MenuItem> primary) {
        List<MenuItem> result = new ArrayList<>();
        for (MenuItem candidate : fallback) {
            String name = DocumentValidator.normalizeName(candidate.getName());
            boolean covered = false;
            for (MenuItem item : primary) {
                if (Math.abs(item.getPrice() - candidate.getPrice()) > SAME_PRICE_EPSILON) {
                    continue;
                }
                String primaryName = DocumentValidator.normalizeName(item.getName());
                String primaryDesc = DocumentValidator.normalizeName(item.getDescription());
                if (primaryName.contains(name) || name.contains(primaryName) || primaryDesc.contains(name)) {
                    covered = true;
                    break;
                }
            }
            if (!covered) {
                result.add(candidate);
            }
        }
        return result;
    }

    private static AssemblyQuality measure(ParseSession session, List<MenuItem> items) {
        return AssemblyQuality.measure(items, priceTokenCount(session), session.getConfig());
    }

    private static int priceTokenCount(ParseSession session) {
        ClassificationResult classification = session.getClassification();
        double threshold = session.getConfig().getPriceClassificationThreshold();
        int count = 0;
        for (Token token : classification.getByToken().keySet()) {
            if (classification.hasPrice(token, threshold)) {
                count++;
            }
        }
        return count;
    }
}
