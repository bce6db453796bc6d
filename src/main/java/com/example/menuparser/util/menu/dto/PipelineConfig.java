package com.example.menuparser.util.menu.dto;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * 菜单解析流水线全局配置
 *
 * 设计原则：
 * 1. 硬编码默认值（开箱即用）
 * 2. 支持从 JSON 部分覆盖（外部调参器从这里接入）
 * 3. 容错回退（JSON 解析失败时使用默认值）
 * 4. 加载完成后只读，一次解析过程中不会被修改
 */
@Getter
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    // ========== Phase 0：数字分类与字体指纹 ==========

    /** 价格分类的置信度下限（严格大于） */
    private double priceClassificationThreshold = 0.7;

    /** 内容形态在字体组内的最小出现比例 */
    private double patternExtractionMinSupport = 0.3;

    /** 字体组最少 token 数 */
    private int fingerprintMinGroupSize = 3;

    /** 指纹置信度饱和的样本数 */
    private int fingerprintSampleCap = 10;

    /** 合理价格区间 */
    private double minPrice = 0.5;
    private double maxPrice = 200.0;

    /** 回灌的价格区间规则给出的置信度 */
    private double learnedPriceConfidence = 0.75;

    // ========== Phase 1：区域检测 ==========

    private DetectionMode detectionMode = DetectionMode.AUTO;

    /** 行带垂直邻近阈值（em 单位） */
    private double yProximityEm = 1.5;

    /** 区域内水平间距阈值（em 单位） */
    private double xDistanceEm = 6.0;

    private double baseRegionConfidence = 0.5;
    private double lengthVarietyWeight = 0.2;
    private double pricePatternWeight = 0.3;
    private double itemCountWeight = 0.2;
    private double typographyWeight = 0.1;

    /** 区域置信度下限，低于此值在 Phase 2 丢弃 */
    private double minimumConfidenceThreshold = 0.5;

    // ========== Phase 1：边框检测 ==========

    /** 边框检测所用的栅格化倍率 */
    private double boxRenderScale = 2.0;

    /** Sobel 梯度幅值阈值（归一化到 [0, 1]） */
    private double edgeThreshold = 0.25;

    /** 线段平均强度阈值 */
    private double lineStrengthThreshold = 0.35;

    /** 线段最短长度（像素） */
    private int minLineSpanPx = 40;

    /** 线段断裂容差（像素） */
    private int lineGapTolerancePx = 2;

    /** 相邻平行线合并距离（像素） */
    private int lineMergeDistancePx = 3;

    private int minBoxWidthPx = 60;
    private int minBoxHeightPx = 60;
    private double minAspectRatio = 0.3;
    private double maxAspectRatio = 3.0;

    /** 贴近页面边缘的判定距离（像素） */
    private int pageEdgeMarginPx = 5;

    /** 两矩形重叠面积占较小矩形的比例超过该值则合并 */
    private double boxOverlapMergeRatio = 0.3;

    /** 收集框内 token 时的容差（文档单位） */
    private double boxTokenTolerance = 2.0;

    // ========== Phase 2：区域校验 ==========

    private double minWidthEm = 3.0;
    private double minHeightEm = 0.5;
    private int minTextLength = 5;

    /** 文本密度下限（字符数 / 面积） */
    private double minTextDensity = 0.001;

    private double nameLengthWeight = 0.25;
    private double descriptionComplexityWeight = 0.25;
    private double priceValidationWeight = 0.5;
    private double extractionQualityThreshold = 0.7;

    /** 缩略图外扩（文档单位） */
    private double thumbnailPadding = 10.0;
    private double thumbnailScale = 2.0;

    /** 缩略图渲染失败时的置信度乘数 */
    private double thumbnailFailurePenalty = 0.9;

    /** 并行校验/渲染的批大小（同时也是线程数） */
    private int renderBatchSize = 10;

    private boolean crossPageMerge = true;

    /** 页首/页尾边距占页高的比例 */
    private double crossPageMarginRatio = 0.12;

    /** 跨页区域左边界对齐容差（文档单位） */
    private double crossPageAlignTolerance = 20.0;

    // ========== Phase 3：组装与自举 ==========

    private AssemblyMode assemblyMode = AssemblyMode.AUTO;

    private int minItemCount = 5;
    private double bootstrapQualityThreshold = 0.7;
    private double minCoverageRatio = 0.6;
    private double convergenceThreshold = 0.02;
    private int maxBootstrapIterations = 3;

    /** 质量回退超过该幅度时恢复上一次最佳结果 */
    private double regressionMargin = 0.05;

    private double fallbackItemConfidence = 0.6;

    private double nameValidationWeight = 0.35;
    private double descriptionValidationWeight = 0.25;
    private double tripleParsingPriceWeight = 0.4;

    /** 菜品置信度中区域置信度所占比重 */
    private double regionConfidenceShare = 0.5;

    /** 价格离群判定：mean + k * stdev */
    private double outlierSigma = 3.0;

    private boolean allowPricelessItems = false;

    private int minNameLength = 2;
    private int maxNameLength = 50;

    /**
     * 私有构造函数（使用工厂方法创建）
     */
    private PipelineConfig() {
    }

    /**
     * 加载默认配置
     */
    public static PipelineConfig loadDefault() {
        return new PipelineConfig();
    }

    /**
     * 从 JSON 文件加载配置（部分覆盖）
     *
     * @param jsonPath JSON 配置文件路径
     * @return 配置对象（失败时返回默认配置）
     */
    public static PipelineConfig loadFromJson(String jsonPath) {
        try {
            JsonNode json = MAPPER.readTree(new File(jsonPath));
            PipelineConfig config = fromJsonNode(json);
            log.info("[PipelineConfig] Loaded config from: {}", jsonPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("[PipelineConfig] Failed to load JSON, using default config: {}", e.getMessage());
            return loadDefault();
        }
    }

    /**
     * 从 JSON 字符串加载配置（部分覆盖），格式错误直接抛出
     */
    public static PipelineConfig fromJson(String json) throws IOException {
        return fromJsonNode(MAPPER.readTree(json));
    }

    private static PipelineConfig fromJsonNode(JsonNode json) throws IOException {
        PipelineConfig config = new PipelineConfig();
        if (json == null || json.isNull() || json.isMissingNode()) {
            return config;
        }
        MAPPER.readerForUpdating(config).readValue(json);
        config.validate();
        return config;
    }

    private void validate() {
        if (yProximityEm <= 0 || xDistanceEm <= 0) {
            throw new IllegalArgumentException("proximity thresholds must be positive");
        }
        if (maxBootstrapIterations < 1) {
            throw new IllegalArgumentException("maxBootstrapIterations must be >= 1");
        }
        if (renderBatchSize < 1) {
            throw new IllegalArgumentException("renderBatchSize must be >= 1");
        }
        if (minPrice > maxPrice) {
            throw new IllegalArgumentException("minPrice > maxPrice");
        }
    }

    /**
     * 按请求覆盖检测/组装模式，返回副本，原对象不变
     *
     * @param detection 为 null 时沿用当前值
     * @param assembly  为 null 时沿用当前值
     */
    public PipelineConfig withModes(DetectionMode detection, AssemblyMode assembly) {
        PipelineConfig copy = new PipelineConfig();
        try {
            MAPPER.readerForUpdating(copy).readValue(toJson());
        } catch (IOException e) {
            throw new IllegalStateException("failed to copy pipeline config", e);
        }
        if (detection != null) {
            copy.detectionMode = detection;
        }
        if (assembly != null) {
            copy.assemblyMode = assembly;
        }
        return copy;
    }

    /**
     * 序列化为 JSON 树（用于接口输出与日志）
     */
    public JsonNode toJson() {
        return MAPPER.valueToTree(this);
    }

    @Override
    public String toString() {
        return "PipelineConfig" + toJson();
    }
}
