package me.bechberger.phidetect.pipeline.stages;

import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import me.bechberger.phidetect.pipeline.SynchronousStage;

import java.util.List;

/**
 * Logistic sharpening {@code 1 / (1 + e^(-10 (c - 0.5)))}: pushes confidences away from 0.5,
 * leaves 0.5 itself unchanged.
 */
public class CalibrationStage extends SynchronousStage {

    public static final String NAME = "calibration";
    public static final int PRIORITY = 60;

    static final double STEEPNESS = 10.0;
    static final double MIDPOINT = 0.5;

    public CalibrationStage() {
        super(NAME, PRIORITY);
    }

    @Override
    protected List<Span> process(List<Span> spans, String text, RedactionContext context) {
        for (Span span : spans) {
            span.setConfidence(calibrate(span.getConfidence()));
        }
        return spans;
    }

    public static double calibrate(double confidence) {
        return 1.0 / (1.0 + Math.exp(-STEEPNESS * (confidence - MIDPOINT)));
    }
}
