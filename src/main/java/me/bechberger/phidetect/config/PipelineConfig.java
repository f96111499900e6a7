package me.bechberger.phidetect.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import me.bechberger.phidetect.pipeline.ConfidencePipeline;
import me.bechberger.phidetect.pipeline.ConfidenceReranker;
import me.bechberger.phidetect.pipeline.PipelineStage;
import me.bechberger.phidetect.pipeline.StageSettings;
import me.bechberger.phidetect.pipeline.stages.CalibrationStage;
import me.bechberger.phidetect.pipeline.stages.ContextualConfidenceStage;
import me.bechberger.phidetect.pipeline.stages.CrossTypeReasoningStage;
import me.bechberger.phidetect.pipeline.stages.ExclusivePair;
import me.bechberger.phidetect.pipeline.stages.MlRerankingStage;
import me.bechberger.phidetect.pipeline.stages.SpanEnhancerStage;
import me.bechberger.phidetect.pipeline.stages.VectorDisambiguationStage;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Configuration of the confidence pipeline.
 *
 * <pre>
 * pipeline:
 *   stages:
 *     contextualConfidence: {enabled: true}
 *     calibration: {priority: 70}
 *   borderline_min: 0.4
 *   borderline_max: 0.8
 *   rerank_timeout_ms: 2000
 *   exclusive_pairs: [$PARENT, "NAME/PROVIDER_NAME"]
 * </pre>
 */
public class PipelineConfig {

    static final List<String> DEFAULT_EXCLUSIVE_PAIRS = List.of(
        "DATE/AGE_90_PLUS",
        "SSN/PHONE",
        "MRN/ZIPCODE"
    );

    /**
     * Per-stage overrides; unset fields keep the stage's defaults.
     */
    @JsonProperty("stages")
    private Map<String, StageSettings> stages = new LinkedHashMap<>();

    @JsonProperty("borderline_min")
    private double borderlineMin = MlRerankingStage.DEFAULT_BORDERLINE_MIN;

    @JsonProperty("borderline_max")
    private double borderlineMax = MlRerankingStage.DEFAULT_BORDERLINE_MAX;

    @JsonProperty("rerank_timeout_ms")
    private long rerankTimeoutMs = MlRerankingStage.DEFAULT_TIMEOUT_MS;

    /**
     * Mutually exclusive categories as {@code FIRST/SECOND}; on equal confidence FIRST wins.
     */
    @JsonProperty("exclusive_pairs")
    private @Nullable List<String> exclusivePairs;

    // Getters and setters
    public Map<String, StageSettings> getStages() { return stages; }
    public void setStages(Map<String, StageSettings> stages) { this.stages = stages; }

    public double getBorderlineMin() { return borderlineMin; }
    public void setBorderlineMin(double borderlineMin) { this.borderlineMin = borderlineMin; }

    public double getBorderlineMax() { return borderlineMax; }
    public void setBorderlineMax(double borderlineMax) { this.borderlineMax = borderlineMax; }

    public long getRerankTimeoutMs() { return rerankTimeoutMs; }
    public void setRerankTimeoutMs(long rerankTimeoutMs) { this.rerankTimeoutMs = rerankTimeoutMs; }

    public List<String> getExclusivePairs() { return exclusivePairs != null ? exclusivePairs : DEFAULT_EXCLUSIVE_PAIRS; }
    public void setExclusivePairs(List<String> exclusivePairs) { this.exclusivePairs = exclusivePairs; }

    public List<ExclusivePair> parseExclusivePairs() {
        List<ExclusivePair> pairs = new ArrayList<>();
        for (String pair : getExclusivePairs()) {
            if (DetectionConfig.PARENT_MARKER.equals(pair)) {
                continue;
            }
            try {
                pairs.add(ExclusivePair.parse(pair));
            } catch (IllegalArgumentException e) {
                throw new DetectionConfigException("Invalid exclusive pair '" + pair + "': " + e.getMessage(), e);
            }
        }
        return pairs;
    }

    /**
     * Build the pipeline with the built-in stages configured from this section.
     *
     * @param context  label patterns for the context modifier stage
     * @param reranker optional model for the ML stage
     */
    public ConfidencePipeline createPipeline(ContextPatternConfig context, @Nullable ConfidenceReranker reranker) {
        MlRerankingStage mlStage;
        try {
            mlStage = new MlRerankingStage(reranker, borderlineMin, borderlineMax, rerankTimeoutMs);
        } catch (IllegalArgumentException e) {
            throw new DetectionConfigException("Invalid re-ranking settings: " + e.getMessage(), e);
        }
        List<PipelineStage> builtIn = List.of(
            context.createStage(),
            new SpanEnhancerStage(),
            new VectorDisambiguationStage(),
            mlStage,
            new CrossTypeReasoningStage(parseExclusivePairs()),
            new ContextualConfidenceStage(),
            new CalibrationStage()
        );
        return new ConfidencePipeline(stages, builtIn);
    }

    /**
     * Merge with parent configuration.
     * Stage overrides of the parent apply where the child sets none; the child's own override is
     * completed with the parent's values. Exclusive pairs support "$PARENT".
     */
    public void mergeWith(PipelineConfig parent) {
        if (parent == null) return;

        Map<String, StageSettings> merged = new LinkedHashMap<>(parent.getStages());
        stages.forEach((name, settings) -> {
            StageSettings inherited = merged.get(name);
            merged.put(name, inherited != null ? settings.over(inherited) : settings);
        });
        stages = merged;

        if (exclusivePairs == null) {
            exclusivePairs = new ArrayList<>(parent.getExclusivePairs());
        }
        List<String> expanded = DetectionConfig.expandParentMarkers(exclusivePairs, parent.getExclusivePairs());
        if (expanded != exclusivePairs) {
            exclusivePairs = new ArrayList<>(new LinkedHashSet<>(expanded));
        }
    }
}
