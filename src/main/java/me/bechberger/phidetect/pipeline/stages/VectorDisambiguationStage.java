package me.bechberger.phidetect.pipeline.stages;

import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import me.bechberger.phidetect.pipeline.SynchronousStage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Marks overlapping spans as ambiguous with each other's category and lowers both confidences.
 * <p>
 * The penalty applies once per overlapping pair, so a span overlapping several others is lowered
 * several times, and running the stage again lowers it again.
 */
public class VectorDisambiguationStage extends SynchronousStage {

    public static final String NAME = "vectorDisambiguation";
    public static final int PRIORITY = 30;

    static final double OVERLAP_FACTOR = 0.98;

    public VectorDisambiguationStage() {
        super(NAME, PRIORITY);
    }

    @Override
    protected List<Span> process(List<Span> spans, String text, RedactionContext context) {
        List<Span> sorted = new ArrayList<>(spans);
        sorted.sort(Comparator.comparingInt(Span::getStart));
        for (int i = 0; i < sorted.size(); i++) {
            Span current = sorted.get(i);
            for (int j = i + 1; j < sorted.size(); j++) {
                Span next = sorted.get(j);
                if (next.getStart() >= current.getEnd()) {
                    break;
                }
                current.addAmbiguousWith(next.getFilterType());
                next.addAmbiguousWith(current.getFilterType());
                current.setConfidence(current.getConfidence() * OVERLAP_FACTOR);
                next.setConfidence(next.getConfidence() * OVERLAP_FACTOR);
            }
        }
        return spans;
    }
}
