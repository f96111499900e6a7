package me.bechberger.phidetect.pipeline.stages;

import me.bechberger.phidetect.model.FilterType;
import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CalibrationStageTest {

    @ParameterizedTest
    @CsvSource({
        "0.5, 0.5",
        "0.7, 0.8807970779778823",
        "0.3, 0.11920292202211755",
        "1.0, 0.9933071490757153",
        "0.0, 0.0066928509242848554"
    })
    public void testCalibrate(double input, double expected) {
        assertEquals(expected, CalibrationStage.calibrate(input), 1e-12);
    }

    @Test
    public void testMidpointIsFixed() {
        Span span = new Span(FilterType.NAME, "John", 0, 4, 0.5, null);

        new CalibrationStage().apply(List.of(span), "John", RedactionContext.empty()).toCompletableFuture().join();

        assertEquals(0.5, span.getConfidence());
    }

    @Test
    public void testPushesAwayFromMidpoint() {
        Span high = new Span(FilterType.NAME, "John", 0, 4, 0.6, null);
        Span low = new Span(FilterType.NAME, "Jane", 5, 9, 0.4, null);

        new CalibrationStage().apply(List.of(high, low), "John Jane", RedactionContext.empty())
            .toCompletableFuture().join();

        assertTrue(high.getConfidence() > 0.6);
        assertTrue(low.getConfidence() < 0.4);
    }
}
