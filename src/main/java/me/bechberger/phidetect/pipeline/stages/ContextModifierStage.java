package me.bechberger.phidetect.pipeline.stages;

import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import me.bechberger.phidetect.pipeline.SynchronousStage;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Adjusts confidence by the label text right before a span ("Patient: ...", "Dr. ...").
 * <p>
 * Boost and reduce rules are checked independently, each list in order; the first matching rule of
 * each list applies.
 */
public class ContextModifierStage extends SynchronousStage {

    public static final String NAME = "contextModifier";
    public static final int PRIORITY = 10;
    public static final int DEFAULT_WINDOW = 30;

    public static final List<ContextRule> DEFAULT_BOOSTS = List.of(
        ContextRule.trailingLabel("patient", 0.10),
        ContextRule.trailingLabel("name", 0.10),
        ContextRule.trailingLabel("dob", 0.10),
        ContextRule.trailingLabel("ssn", 0.15),
        ContextRule.trailingLabel("mrn", 0.10)
    );

    public static final List<ContextRule> DEFAULT_REDUCTIONS = List.of(
        new ContextRule(Pattern.compile("dr\\.?\\s*$", Pattern.CASE_INSENSITIVE), 0.05),
        ContextRule.trailingLabel("facility", 0.10),
        ContextRule.trailingLabel("hospital", 0.10)
    );

    private final List<ContextRule> boosts;
    private final List<ContextRule> reductions;
    private final int window;

    public ContextModifierStage() {
        this(DEFAULT_BOOSTS, DEFAULT_REDUCTIONS, DEFAULT_WINDOW);
    }

    public ContextModifierStage(List<ContextRule> boosts, List<ContextRule> reductions, int window) {
        super(NAME, PRIORITY);
        this.boosts = List.copyOf(boosts);
        this.reductions = List.copyOf(reductions);
        this.window = window;
    }

    @Override
    protected List<Span> process(List<Span> spans, String text, RedactionContext context) {
        for (Span span : spans) {
            int end = Math.min(span.getStart(), text.length());
            String before = text.substring(Math.max(0, end - window), end);
            for (ContextRule boost : boosts) {
                if (boost.matches(before)) {
                    span.setConfidence(Math.min(1.0, span.getConfidence() + boost.getAmount()));
                    break;
                }
            }
            for (ContextRule reduction : reductions) {
                if (reduction.matches(before)) {
                    span.setConfidence(Math.max(0.0, span.getConfidence() - reduction.getAmount()));
                    break;
                }
            }
        }
        return spans;
    }

    public List<ContextRule> getBoosts() { return boosts; }
    public List<ContextRule> getReductions() { return reductions; }
    public int getWindow() { return window; }
}
