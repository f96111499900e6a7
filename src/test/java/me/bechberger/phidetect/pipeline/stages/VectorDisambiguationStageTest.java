package me.bechberger.phidetect.pipeline.stages;

import me.bechberger.phidetect.model.FilterType;
import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class VectorDisambiguationStageTest {

    private static final String TEXT = "0123456789".repeat(4);

    private static Span span(FilterType type, int start, int end, double confidence) {
        return new Span(type, TEXT.substring(start, end), start, end, confidence, "TEST");
    }

    private static void run(List<Span> spans) {
        new VectorDisambiguationStage().apply(new ArrayList<>(spans), TEXT, RedactionContext.empty())
            .toCompletableFuture().join();
    }

    @Test
    public void testOverlappingPair() {
        Span first = span(FilterType.NAME, 10, 20, 0.7);
        Span second = span(FilterType.CITY, 15, 25, 0.8);

        run(List.of(first, second));

        assertEquals(0.686, first.getConfidence(), 1e-12);
        assertEquals(0.784, second.getConfidence(), 1e-12);
        assertEquals(Set.of(FilterType.CITY), first.getAmbiguousWith());
        assertEquals(Set.of(FilterType.NAME), second.getAmbiguousWith());
    }

    @Test
    public void testInputOrderDoesNotMatter() {
        Span first = span(FilterType.NAME, 10, 20, 0.7);
        Span second = span(FilterType.CITY, 15, 25, 0.8);

        run(List.of(second, first));

        assertEquals(0.686, first.getConfidence(), 1e-12);
        assertEquals(0.784, second.getConfidence(), 1e-12);
    }

    @Test
    public void testAdjacentSpansDoNotOverlap() {
        Span first = span(FilterType.NAME, 0, 5, 0.7);
        Span second = span(FilterType.CITY, 5, 10, 0.8);

        run(List.of(first, second));

        assertEquals(0.7, first.getConfidence());
        assertTrue(first.getAmbiguousWith().isEmpty());
        assertTrue(second.getAmbiguousWith().isEmpty());
    }

    @Test
    public void testPenaltyPerOverlappingPair() {
        Span outer = span(FilterType.NAME, 0, 10, 1.0);
        Span left = span(FilterType.DATE, 2, 5, 1.0);
        Span right = span(FilterType.DATE, 4, 8, 1.0);

        run(List.of(outer, left, right));

        assertEquals(0.98 * 0.98, outer.getConfidence(), 1e-12);
        assertEquals(0.98 * 0.98, left.getConfidence(), 1e-12);
        assertEquals(0.98 * 0.98, right.getConfidence(), 1e-12);
        // the DATE category is recorded once
        assertEquals(Set.of(FilterType.DATE), outer.getAmbiguousWith());
        assertEquals(Set.of(FilterType.NAME, FilterType.DATE), left.getAmbiguousWith());
    }

    @Test
    public void testRunningAgainLowersFurther() {
        Span first = span(FilterType.NAME, 10, 20, 0.7);
        Span second = span(FilterType.CITY, 15, 25, 0.8);

        run(List.of(first, second));
        run(List.of(first, second));

        assertEquals(0.7 * 0.98 * 0.98, first.getConfidence(), 1e-12);
        assertEquals(Set.of(FilterType.CITY), first.getAmbiguousWith());
    }
}
