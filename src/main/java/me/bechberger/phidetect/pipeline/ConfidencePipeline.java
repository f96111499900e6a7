package me.bechberger.phidetect.pipeline;

import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import me.bechberger.phidetect.model.SpanSnapshot;
import me.bechberger.phidetect.pipeline.stages.CalibrationStage;
import me.bechberger.phidetect.pipeline.stages.ContextModifierStage;
import me.bechberger.phidetect.pipeline.stages.ContextualConfidenceStage;
import me.bechberger.phidetect.pipeline.stages.CrossTypeReasoningStage;
import me.bechberger.phidetect.pipeline.stages.MlRerankingStage;
import me.bechberger.phidetect.pipeline.stages.SpanEnhancerStage;
import me.bechberger.phidetect.pipeline.stages.VectorDisambiguationStage;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Runs the confidence stages over a list of candidate spans.
 * <p>
 * Stages run one after the other in ascending priority, stages with equal priority in registration
 * order. A disabled stage is recorded as skipped. A failing stage is recorded as failed and has no
 * effect: the confidences and ambiguity sets it changed are restored and its input flows on.
 * <p>
 * Default stages:
 * <pre>
 *   10 contextModifier
 *   20 spanEnhancer
 *   30 vectorDisambiguation
 *   35 mlConfidenceRanking
 *   40 crossTypeReasoning
 *   50 contextualConfidence (disabled)
 *   60 calibration
 * </pre>
 */
public class ConfidencePipeline {

    private static final Logger logger = LoggerFactory.getLogger(ConfidencePipeline.class);

    /** Minimum confidence change for a span to count as modified. */
    static final double MODIFIED_THRESHOLD = 0.001;

    private static final class RegisteredStage {
        final PipelineStage stage;
        final int priority;
        volatile boolean enabled;

        RegisteredStage(PipelineStage stage, StageSettings settings) {
            this.stage = stage;
            this.priority = settings.priorityOr(Integer.MAX_VALUE);
            this.enabled = settings.enabledOr(true);
        }
    }

    private final List<RegisteredStage> stages = new ArrayList<>();
    private volatile @Nullable PipelineSummary lastSummary;

    public ConfidencePipeline() {
        this(Map.of());
    }

    public ConfidencePipeline(Map<String, StageSettings> overrides) {
        this(overrides, defaultStages(null));
    }

    /**
     * @param overrides per stage name, unset fields fall back to the stage's default settings
     * @param stages    stages to register, in registration order
     */
    public ConfidencePipeline(Map<String, StageSettings> overrides, List<PipelineStage> stages) {
        Set<String> names = new HashSet<>();
        for (PipelineStage stage : stages) {
            names.add(stage.getName());
            StageSettings override = overrides.get(stage.getName());
            StageSettings settings = override != null ? override.over(stage.getDefaultSettings()) : stage.getDefaultSettings();
            this.stages.add(new RegisteredStage(stage, settings));
        }
        for (String name : overrides.keySet()) {
            if (!names.contains(name)) {
                logger.warn("Ignoring settings for unknown pipeline stage '{}'", name);
            }
        }
        sortStages();
        logger.debug("ConfidencePipeline initialized with stages {}", getStageNames());
    }

    /**
     * The built-in stages with their default configuration.
     *
     * @param reranker optional model for the ML stage; without one the stage passes spans through
     */
    public static List<PipelineStage> defaultStages(@Nullable ConfidenceReranker reranker) {
        return List.of(
            new ContextModifierStage(),
            new SpanEnhancerStage(),
            new VectorDisambiguationStage(),
            new MlRerankingStage(reranker),
            new CrossTypeReasoningStage(),
            new ContextualConfidenceStage(),
            new CalibrationStage()
        );
    }

    public void registerStage(PipelineStage stage) {
        registerStage(stage, stage.getDefaultSettings());
    }

    /**
     * Add a stage; it runs after already registered stages of the same priority.
     */
    public void registerStage(PipelineStage stage, StageSettings settings) {
        Objects.requireNonNull(stage, "stage");
        synchronized (stages) {
            stages.add(new RegisteredStage(stage, settings.over(stage.getDefaultSettings())));
            sortStages();
        }
        logger.debug("Registered stage {} ({})", stage.getName(), settings);
    }

    private void sortStages() {
        // List.sort is stable, ties keep registration order
        synchronized (stages) {
            stages.sort(Comparator.comparingInt(s -> s.priority));
        }
    }

    /**
     * @return false if no stage with this name is registered
     */
    public boolean setStageEnabled(String name, boolean enabled) {
        synchronized (stages) {
            for (RegisteredStage registered : stages) {
                if (registered.stage.getName().equals(name)) {
                    registered.enabled = enabled;
                    return true;
                }
            }
        }
        logger.debug("No stage named {} to {}", name, enabled ? "enable" : "disable");
        return false;
    }

    public boolean isStageEnabled(String name) {
        synchronized (stages) {
            return stages.stream().anyMatch(s -> s.stage.getName().equals(name) && s.enabled);
        }
    }

    /**
     * Stage names in execution order, disabled stages included.
     */
    public List<String> getStageNames() {
        synchronized (stages) {
            return stages.stream().map(s -> s.stage.getName()).collect(Collectors.toList());
        }
    }

    /**
     * Summary of the most recently completed run, null before the first run.
     */
    public @Nullable PipelineSummary getLastSummary() {
        return lastSummary;
    }

    /**
     * Run all stages. The spans are modified in place; the returned list is the output of the last stage.
     */
    public CompletableFuture<List<Span>> execute(List<Span> spans, String text, @Nullable RedactionContext context) {
        Objects.requireNonNull(spans, "spans");
        Objects.requireNonNull(text, "text");
        RedactionContext ctx = context != null ? context : RedactionContext.empty();
        List<RegisteredStage> order;
        List<Boolean> enabled = new ArrayList<>();
        synchronized (stages) {
            order = new ArrayList<>(stages);
            for (RegisteredStage stage : order) {
                enabled.add(stage.enabled);
            }
        }
        Run run = new Run(order, enabled, text, ctx);
        long start = System.nanoTime();
        return run.next(0, new ArrayList<>(spans)).thenApply(result -> {
            PipelineSummary summary = new PipelineSummary(run.results, (System.nanoTime() - start) / 1_000_000.0,
                spans.size(), result.size());
            lastSummary = summary;
            logger.debug("Pipeline finished: {} -> {} spans, {} modified, {} failed stages in {} ms",
                summary.getInputSpanCount(), summary.getOutputSpanCount(), summary.getTotalSpansModified(),
                summary.getFailedStages(), String.format("%.2f", summary.getTotalTimeMs()));
            return result;
        });
    }

    /**
     * State of one {@link #execute} call.
     */
    private static final class Run {
        private final List<RegisteredStage> order;
        private final List<Boolean> enabled;
        private final String text;
        private final RedactionContext context;
        private final List<StageResult> results = new ArrayList<>();

        Run(List<RegisteredStage> order, List<Boolean> enabled, String text, RedactionContext context) {
            this.order = order;
            this.enabled = enabled;
            this.text = text;
            this.context = context;
        }

        CompletableFuture<List<Span>> next(int index, List<Span> current) {
            if (index == order.size()) {
                return CompletableFuture.completedFuture(current);
            }
            PipelineStage stage = order.get(index).stage;
            if (!enabled.get(index)) {
                results.add(StageResult.skipped(stage.getName()));
                return next(index + 1, current);
            }
            SpanSnapshot snapshot = SpanSnapshot.of(current);
            long start = System.nanoTime();
            CompletableFuture<List<Span>> future;
            try {
                future = stage.apply(new ArrayList<>(current), text, context).toCompletableFuture();
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            return future.handle((output, error) -> {
                double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
                if (error != null || output == null) {
                    Throwable cause = unwrap(error);
                    logger.error("Stage {} failed, continuing with its input spans", stage.getName(), cause);
                    results.add(StageResult.failed(stage.getName(), current.size(), elapsedMs));
                    return snapshot.restore();
                }
                results.add(measure(stage.getName(), snapshot.confidences(), output, elapsedMs));
                logger.debug("Stage {}: {}", stage.getName(), results.get(results.size() - 1));
                return output;
            }).thenCompose(output -> next(index + 1, output));
        }
    }

    private static Throwable unwrap(@Nullable Throwable error) {
        if (error == null) {
            return new IllegalStateException("stage returned no spans");
        }
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Compare confidences by position; positions missing from the output count as unchanged.
     */
    static StageResult measure(String name, double[] before, List<Span> output, double elapsedMs) {
        int modified = 0;
        double totalChange = 0;
        for (int i = 0; i < before.length; i++) {
            double after = i < output.size() ? output.get(i).getConfidence() : before[i];
            double change = Math.abs(after - before[i]);
            totalChange += change;
            if (change > MODIFIED_THRESHOLD) {
                modified++;
            }
        }
        double average = before.length == 0 ? 0.0 : totalChange / before.length;
        return new StageResult(name, before.length, output.size(), modified, average, elapsedMs, true, false);
    }
}
