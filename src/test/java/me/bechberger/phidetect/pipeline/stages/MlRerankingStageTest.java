package me.bechberger.phidetect.pipeline.stages;

import me.bechberger.phidetect.model.FilterType;
import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import me.bechberger.phidetect.pipeline.ConfidenceReranker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MlRerankingStageTest {

    private static final String TEXT = "John Smith lives in Boston";

    private final Span john = new Span(FilterType.NAME, "John", 0, 4, 0.5, null);
    private final Span smith = new Span(FilterType.NAME, "Smith", 5, 10, 0.95, null);
    private final Span boston = new Span(FilterType.CITY, "Boston", 20, 26, 0.3, null);

    private List<Span> run(MlRerankingStage stage) throws Exception {
        return stage.apply(new ArrayList<>(List.of(john, smith, boston)), TEXT, RedactionContext.empty())
            .toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    /** Reranker that sets every submitted span to the given confidence. */
    private static ConfidenceReranker constant(double confidence, List<Span> seen) {
        return (spans, text) -> {
            seen.addAll(spans);
            spans.forEach(span -> span.setConfidence(confidence));
            return CompletableFuture.completedFuture(spans);
        };
    }

    @Test
    public void testOnlyBorderlineSpansAreRescored() throws Exception {
        List<Span> seen = new ArrayList<>();
        List<Span> result = run(new MlRerankingStage(constant(0.9, seen)));

        assertEquals(List.of(john, smith, boston), result);
        assertEquals(0.9, john.getConfidence());
        assertEquals(0.95, smith.getConfidence());
        assertEquals(0.3, boston.getConfidence());
        assertEquals(List.of("John"), seen.stream().map(Span::getText).collect(Collectors.toList()));
        // the reranker works on copies
        assertNotSame(john, seen.get(0));
    }

    @Test
    public void testChangedOffsetsAreIgnored() throws Exception {
        ConfidenceReranker moving = (spans, text) -> CompletableFuture.completedFuture(List.of(
            new Span(FilterType.NAME, "John S", 0, 6, 0.99, null),
            new Span(FilterType.CITY, "John", 0, 4, 0.99, null)));

        run(new MlRerankingStage(moving));

        assertEquals(0.5, john.getConfidence());
    }

    @Test
    public void testSpansWithSameOffsetsAreAllRescored() throws Exception {
        Span first = new Span(FilterType.NAME, "John", 0, 4, 0.5, "NAME_A");
        Span second = new Span(FilterType.NAME, "John", 0, 4, 0.6, "NAME_B");
        List<Span> seen = new ArrayList<>();
        ConfidenceReranker raising = (spans, text) -> {
            seen.addAll(spans);
            spans.forEach(span -> span.setConfidence(span.getConfidence() + 0.2));
            return CompletableFuture.completedFuture(spans);
        };

        new MlRerankingStage(raising).apply(new ArrayList<>(List.of(first, second)), TEXT, RedactionContext.empty())
            .toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertEquals(2, seen.size());
        assertEquals(0.7, first.getConfidence(), 1e-9);
        assertEquals(0.8, second.getConfidence(), 1e-9);
    }

    @Test
    public void testExtraResultsForSameOffsetsAreIgnored() throws Exception {
        ConfidenceReranker repeating = (spans, text) -> CompletableFuture.completedFuture(List.of(
            new Span(FilterType.NAME, "John", 0, 4, 0.75, null),
            new Span(FilterType.NAME, "John", 0, 4, 0.1, null)));

        run(new MlRerankingStage(repeating));

        assertEquals(0.75, john.getConfidence());
    }

    @Test
    public void testWithoutReranker() throws Exception {
        List<Span> result = run(new MlRerankingStage(null));

        assertEquals(3, result.size());
        assertEquals(0.5, john.getConfidence());
    }

    @Test
    public void testFailingRerankerPassesThrough() throws Exception {
        ConfidenceReranker throwing = (spans, text) -> {
            throw new IllegalStateException("model not loaded");
        };
        ConfidenceReranker failing = (spans, text) -> CompletableFuture.failedFuture(new RuntimeException("timeout"));
        ConfidenceReranker nothing = (spans, text) -> null;

        for (ConfidenceReranker reranker : List.of(throwing, failing, nothing)) {
            List<Span> result = run(new MlRerankingStage(reranker));
            assertEquals(3, result.size());
            assertEquals(0.5, john.getConfidence());
        }
    }

    @Test
    public void testSlowRerankerTimesOut() throws Exception {
        CompletableFuture<List<Span>> never = new CompletableFuture<>();
        MlRerankingStage stage = new MlRerankingStage((spans, text) -> never, 0.4, 0.8, 50);

        List<Span> result = run(stage);

        assertEquals(3, result.size());
        assertEquals(0.5, john.getConfidence());
        // the reranker's own future is left alone
        assertFalse(never.isDone());
    }

    @Test
    public void testNoBorderlineSpansSkipsReranker() throws Exception {
        List<Span> seen = new ArrayList<>();
        john.setConfidence(0.1);

        run(new MlRerankingStage(constant(0.9, seen)));

        assertTrue(seen.isEmpty());
        assertEquals(0.1, john.getConfidence());
    }

    @ParameterizedTest
    @CsvSource({
        "0.39, false",
        "0.4, true",
        "0.6, true",
        "0.8, true",
        "0.81, false"
    })
    public void testBorderlineBand(double confidence, boolean expected) {
        assertEquals(expected, new MlRerankingStage(null).isBorderline(confidence));
    }

    @Test
    public void testInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new MlRerankingStage(null, 0.8, 0.4, 100));
        assertThrows(IllegalArgumentException.class, () -> new MlRerankingStage(null, 0.4, 0.8, 0));
    }
}
