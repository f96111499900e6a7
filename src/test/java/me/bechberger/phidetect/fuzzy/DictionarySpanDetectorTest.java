package me.bechberger.phidetect.fuzzy;

import me.bechberger.phidetect.model.FilterType;
import me.bechberger.phidetect.model.Span;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DictionarySpanDetectorTest {

    private static final List<String> FIRST_NAMES = List.of("John", "Jane");

    @Test
    public void testDetectsMisspelledName() {
        DictionarySpanDetector detector = new DictionarySpanDetector("first names", FilterType.NAME,
            FuzzyMatchers.forFirstNames(FIRST_NAMES, false), 0.7);

        List<Span> spans = detector.detect("Seen: Jon Doe");

        assertEquals(1, spans.size());
        Span span = spans.get(0);
        assertEquals(FilterType.NAME, span.getFilterType());
        assertEquals("Jon", span.getText());
        assertEquals(6, span.getStart());
        assertEquals(9, span.getEnd());
        assertEquals(0.736, span.getConfidence(), 1e-9);
        assertEquals("FUZZY_FIRST_NAMES_DELETE_1", span.getPattern());
    }

    @Test
    public void testMinConfidenceFilters() {
        DictionarySpanDetector detector = new DictionarySpanDetector("first_names", FilterType.NAME,
            FuzzyMatchers.forFirstNames(FIRST_NAMES, false), 0.8);

        assertTrue(detector.detect("Seen: Jon Doe").isEmpty());
        assertEquals(1, detector.detect("Seen: John Doe").size());
    }

    @Test
    public void testApostrophesAndHyphensStayInsideWords() {
        DictionarySpanDetector detector = new DictionarySpanDetector("surnames", FilterType.NAME,
            FuzzyMatchers.strict(List.of("O'Brien", "Smith-Jones"), true), 0.7);

        List<Span> spans = detector.detect("Mrs. O'Brien and Mr. Smith-Jones.");

        assertEquals(2, spans.size());
        assertEquals("O'Brien", spans.get(0).getText());
        assertEquals("FUZZY_SURNAMES_EXACT", spans.get(0).getPattern());
        assertEquals(1.0, spans.get(0).getConfidence());
        assertEquals("Smith-Jones", spans.get(1).getText());
        assertEquals(21, spans.get(1).getStart());
    }

    @Test
    public void testLongLetterRunDoesNotStallDetection() {
        DictionarySpanDetector detector = new DictionarySpanDetector("first_names", FilterType.NAME,
            FuzzyMatchers.forFirstNames(FIRST_NAMES, true), 0.7);
        String text = "Seen: Jon " + "qwertyuiop".repeat(150) + " Doe";

        List<Span> spans = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> detector.detect(text));

        assertEquals(1, spans.size());
        assertEquals("Jon", spans.get(0).getText());
        assertEquals(6, spans.get(0).getStart());
    }

    @Test
    public void testEmptyText() {
        DictionarySpanDetector detector = new DictionarySpanDetector("cities", FilterType.CITY,
            FuzzyMatchers.forLocations(List.of("Boston"), false), 0.7);

        assertTrue(detector.detect("").isEmpty());
        assertTrue(detector.detect("12345 !!").isEmpty());
        assertEquals(FilterType.CITY, detector.detect("Bostn").get(0).getFilterType());
    }
}
