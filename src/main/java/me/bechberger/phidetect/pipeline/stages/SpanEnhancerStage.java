package me.bechberger.phidetect.pipeline.stages;

import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import me.bechberger.phidetect.pipeline.SynchronousStage;

import java.util.List;
import java.util.Locale;

/**
 * Rewards spans from labeled patterns and confident multi-word spans.
 */
public class SpanEnhancerStage extends SynchronousStage {

    public static final String NAME = "spanEnhancer";
    public static final int PRIORITY = 20;

    static final double LABELED_FACTOR = 1.05;
    static final double MULTI_WORD_FACTOR = 1.02;
    static final double MULTI_WORD_MIN_CONFIDENCE = 0.7;

    public SpanEnhancerStage() {
        super(NAME, PRIORITY);
    }

    @Override
    protected List<Span> process(List<Span> spans, String text, RedactionContext context) {
        for (Span span : spans) {
            String pattern = span.getPattern();
            if (pattern != null) {
                String lower = pattern.toLowerCase(Locale.ROOT);
                if (lower.contains("labeled") || lower.contains("explicit")) {
                    span.setConfidence(Math.min(1.0, span.getConfidence() * LABELED_FACTOR));
                }
            }
            if (wordCount(span.getText()) >= 2 && span.getConfidence() >= MULTI_WORD_MIN_CONFIDENCE) {
                span.setConfidence(Math.min(1.0, span.getConfidence() * MULTI_WORD_FACTOR));
            }
        }
        return spans;
    }

    static int wordCount(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return 1;
        }
        return trimmed.split("\\s+").length;
    }
}
