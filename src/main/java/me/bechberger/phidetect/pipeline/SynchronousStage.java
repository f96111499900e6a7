package me.bechberger.phidetect.pipeline;

import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Base class for stages that complete on the calling thread.
 */
public abstract class SynchronousStage implements PipelineStage {

    private final String name;
    private final StageSettings defaultSettings;

    protected SynchronousStage(String name, int priority) {
        this(name, StageSettings.of(true, priority));
    }

    protected SynchronousStage(String name, StageSettings defaultSettings) {
        this.name = name;
        this.defaultSettings = defaultSettings;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public StageSettings getDefaultSettings() {
        return defaultSettings;
    }

    @Override
    public final CompletionStage<List<Span>> apply(List<Span> spans, String text, RedactionContext context) {
        return CompletableFuture.completedFuture(process(spans, text, context));
    }

    protected abstract List<Span> process(List<Span> spans, String text, RedactionContext context);
}
