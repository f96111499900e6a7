package me.bechberger.phidetect.pipeline;

import me.bechberger.phidetect.model.Span;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * External model that re-scores uncertain spans.
 * <p>
 * Implementations may only change confidences. Spans whose category or offsets differ from the
 * input are ignored by the caller.
 */
@FunctionalInterface
public interface ConfidenceReranker {

    CompletableFuture<List<Span>> rerank(List<Span> spans, String text);
}
