package me.bechberger.phidetect.pipeline.stages;

import me.bechberger.phidetect.model.FilterType;
import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import me.bechberger.phidetect.pipeline.ConfidenceReranker;
import me.bechberger.phidetect.pipeline.PipelineStage;
import me.bechberger.phidetect.pipeline.StageSettings;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Hands borderline spans to an optional {@link ConfidenceReranker}.
 * <p>
 * The reranker works on copies of every borderline span. Only confidences of returned spans with the
 * category and offsets of a submitted span are taken over; spans sharing category and offsets are
 * matched to the returned spans in submission order. Without a reranker, or if it fails or does not
 * answer within the timeout, the spans pass through unchanged.
 */
public class MlRerankingStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(MlRerankingStage.class);

    public static final String NAME = "mlConfidenceRanking";
    public static final int PRIORITY = 35;
    public static final double DEFAULT_BORDERLINE_MIN = 0.4;
    public static final double DEFAULT_BORDERLINE_MAX = 0.8;
    public static final long DEFAULT_TIMEOUT_MS = 2000;

    private final @Nullable ConfidenceReranker reranker;
    private final double borderlineMin;
    private final double borderlineMax;
    private final long timeoutMs;

    public MlRerankingStage(@Nullable ConfidenceReranker reranker) {
        this(reranker, DEFAULT_BORDERLINE_MIN, DEFAULT_BORDERLINE_MAX, DEFAULT_TIMEOUT_MS);
    }

    public MlRerankingStage(@Nullable ConfidenceReranker reranker, double borderlineMin, double borderlineMax,
                            long timeoutMs) {
        if (borderlineMin > borderlineMax) {
            throw new IllegalArgumentException("Empty borderline band [" + borderlineMin + ", " + borderlineMax + "]");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
        this.reranker = reranker;
        this.borderlineMin = borderlineMin;
        this.borderlineMax = borderlineMax;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public StageSettings getDefaultSettings() {
        return StageSettings.of(true, PRIORITY);
    }

    public boolean isBorderline(double confidence) {
        return confidence >= borderlineMin && confidence <= borderlineMax;
    }

    @Override
    public CompletionStage<List<Span>> apply(List<Span> spans, String text, RedactionContext context) {
        if (reranker == null) {
            return CompletableFuture.completedFuture(spans);
        }
        Map<SpanKey, ArrayDeque<Span>> borderline = new HashMap<>();
        List<Span> submitted = new ArrayList<>();
        for (Span span : spans) {
            if (isBorderline(span.getConfidence())) {
                borderline.computeIfAbsent(SpanKey.of(span), k -> new ArrayDeque<>()).add(span);
                submitted.add(span.copy());
            }
        }
        if (submitted.isEmpty()) {
            logger.debug("No borderline spans to re-rank");
            return CompletableFuture.completedFuture(spans);
        }
        logger.debug("Re-ranking {} borderline spans", submitted.size());

        CompletableFuture<List<Span>> reranked;
        try {
            reranked = Objects.requireNonNull(reranker.rerank(submitted, text), "reranker returned no future")
                .copy()
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            reranked = CompletableFuture.failedFuture(e);
        }
        return reranked.handle((result, error) -> {
            if (error != null || result == null) {
                logger.warn("Re-ranking skipped: {}", error != null ? error.toString() : "no result");
                return spans;
            }
            int applied = 0;
            for (Span rescored : result) {
                ArrayDeque<Span> pending = rescored == null ? null : borderline.get(SpanKey.of(rescored));
                Span original = pending == null ? null : pending.poll();
                if (original != null) {
                    original.setConfidence(rescored.getConfidence());
                    applied++;
                }
            }
            logger.debug("Applied {} of {} re-ranked confidences", applied, result.size());
            return spans;
        });
    }

    public double getBorderlineMin() { return borderlineMin; }
    public double getBorderlineMax() { return borderlineMax; }
    public long getTimeoutMs() { return timeoutMs; }

    /**
     * Identity of a span as far as the reranker is concerned.
     */
    private static final class SpanKey {
        private final FilterType type;
        private final int start;
        private final int end;

        private SpanKey(FilterType type, int start, int end) {
            this.type = type;
            this.start = start;
            this.end = end;
        }

        static SpanKey of(Span span) {
            return new SpanKey(span.getFilterType(), span.getStart(), span.getEnd());
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof SpanKey)) return false;
            SpanKey other = (SpanKey) o;
            return type == other.type && start == other.start && end == other.end;
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, start, end);
        }
    }
}
