package me.bechberger.phidetect.pipeline.stages;

import me.bechberger.phidetect.model.FilterType;
import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import me.bechberger.phidetect.pipeline.SynchronousStage;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reconciles categories across spans.
 * <ol>
 *     <li>Mutual exclusion: for spans of an exclusive pair covering the same range, the more confident
 *     one is raised and the other lowered. A span in several pairs is adjusted once per pair.</li>
 *     <li>Document consistency: a text first seen with one category is penalized when it later shows up
 *     with another.</li>
 * </ol>
 */
public class CrossTypeReasoningStage extends SynchronousStage {

    public static final String NAME = "crossTypeReasoning";
    public static final int PRIORITY = 40;

    public static final List<ExclusivePair> DEFAULT_EXCLUSIVE_PAIRS = List.of(
        ExclusivePair.of(FilterType.DATE, FilterType.AGE_90_PLUS),
        ExclusivePair.of(FilterType.SSN, FilterType.PHONE),
        ExclusivePair.of(FilterType.MRN, FilterType.ZIPCODE)
    );

    static final double WINNER_FACTOR = 1.1;
    static final double LOSER_FACTOR = 0.7;
    static final double INCONSISTENT_FACTOR = 0.95;

    private final List<ExclusivePair> exclusivePairs;

    public CrossTypeReasoningStage() {
        this(DEFAULT_EXCLUSIVE_PAIRS);
    }

    public CrossTypeReasoningStage(List<ExclusivePair> exclusivePairs) {
        super(NAME, PRIORITY);
        this.exclusivePairs = List.copyOf(exclusivePairs);
    }

    @Override
    protected List<Span> process(List<Span> spans, String text, RedactionContext context) {
        applyMutualExclusion(spans);
        applyDocumentConsistency(spans);
        return spans;
    }

    private void applyMutualExclusion(List<Span> spans) {
        Map<FilterType, List<Span>> byType = new EnumMap<>(FilterType.class);
        for (Span span : spans) {
            byType.computeIfAbsent(span.getFilterType(), t -> new ArrayList<>()).add(span);
        }
        for (ExclusivePair pair : exclusivePairs) {
            for (Span first : byType.getOrDefault(pair.getFirst(), List.of())) {
                for (Span second : byType.getOrDefault(pair.getSecond(), List.of())) {
                    if (!first.isIdenticalTo(second)) {
                        continue;
                    }
                    if (first.getConfidence() >= second.getConfidence()) {
                        first.setConfidence(Math.min(1.0, first.getConfidence() * WINNER_FACTOR));
                        second.setConfidence(second.getConfidence() * LOSER_FACTOR);
                    } else {
                        second.setConfidence(Math.min(1.0, second.getConfidence() * WINNER_FACTOR));
                        first.setConfidence(first.getConfidence() * LOSER_FACTOR);
                    }
                }
            }
        }
    }

    private static void applyDocumentConsistency(List<Span> spans) {
        Map<String, FilterType> firstSeen = new HashMap<>();
        for (Span span : spans) {
            String key = span.getText().toLowerCase(Locale.ROOT);
            FilterType known = firstSeen.putIfAbsent(key, span.getFilterType());
            if (known != null && known != span.getFilterType()) {
                span.setConfidence(span.getConfidence() * INCONSISTENT_FACTOR);
            }
        }
    }

    public List<ExclusivePair> getExclusivePairs() {
        return exclusivePairs;
    }
}
