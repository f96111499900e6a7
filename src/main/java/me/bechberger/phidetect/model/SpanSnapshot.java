package me.bechberger.phidetect.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Captures the mutable state (confidence and ambiguity set) of a list of spans so it can be
 * put back if a pipeline stage fails halfway through.
 */
public final class SpanSnapshot {

    private final List<Span> spans;
    private final double[] confidences;
    private final List<Set<FilterType>> ambiguity;

    private SpanSnapshot(List<Span> spans) {
        this.spans = new ArrayList<>(spans);
        this.confidences = new double[spans.size()];
        this.ambiguity = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            Span span = spans.get(i);
            confidences[i] = span.getConfidence();
            ambiguity.add(new LinkedHashSet<>(span.getAmbiguousWith()));
        }
    }

    public static SpanSnapshot of(List<Span> spans) {
        return new SpanSnapshot(spans);
    }

    public double[] confidences() {
        return confidences.clone();
    }

    /**
     * Restore every captured span and return the list as it was when captured.
     */
    public List<Span> restore() {
        for (int i = 0; i < spans.size(); i++) {
            Span span = spans.get(i);
            span.setConfidence(confidences[i]);
            span.replaceAmbiguousWith(ambiguity.get(i));
        }
        return new ArrayList<>(spans);
    }
}
