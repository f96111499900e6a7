package me.bechberger.phidetect.pipeline;

import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * One step of the {@link ConfidencePipeline}.
 * <p>
 * A stage receives the spans produced by the previous stage, may adjust their confidence and
 * ambiguity sets in place, and returns the span list for the next stage. Failing, either by throwing
 * or by completing exceptionally, makes the pipeline discard all changes of this stage.
 */
public interface PipelineStage {

    String getName();

    /**
     * Settings used when the pipeline is not given an override for this stage.
     */
    StageSettings getDefaultSettings();

    CompletionStage<List<Span>> apply(List<Span> spans, String text, RedactionContext context);
}
