package me.bechberger.phidetect.pipeline.stages;

import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import me.bechberger.phidetect.pipeline.StageSettings;
import me.bechberger.phidetect.pipeline.SynchronousStage;

import java.util.List;
import java.util.Locale;

/**
 * Raises every span slightly when the document reads like a clinical note. Disabled by default.
 */
public class ContextualConfidenceStage extends SynchronousStage {

    public static final String NAME = "contextualConfidence";
    public static final int PRIORITY = 50;

    public static final List<String> CLINICAL_INDICATORS = List.of(
        "patient", "diagnosis", "treatment", "medication", "history",
        "admitted", "discharged", "chief complaint", "assessment", "plan"
    );

    static final double CLINICAL_FACTOR = 1.03;

    public ContextualConfidenceStage() {
        super(NAME, StageSettings.of(false, PRIORITY));
    }

    @Override
    protected List<Span> process(List<Span> spans, String text, RedactionContext context) {
        if (!isClinical(text)) {
            return spans;
        }
        for (Span span : spans) {
            span.setConfidence(Math.min(1.0, span.getConfidence() * CLINICAL_FACTOR));
        }
        return spans;
    }

    static boolean isClinical(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return CLINICAL_INDICATORS.stream().anyMatch(lower::contains);
    }
}
