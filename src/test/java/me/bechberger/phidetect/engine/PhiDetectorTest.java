package me.bechberger.phidetect.engine;

import me.bechberger.phidetect.ConfigLoader;
import me.bechberger.phidetect.config.DetectionConfig;
import me.bechberger.phidetect.config.DictionaryConfig;
import me.bechberger.phidetect.model.FilterType;
import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import me.bechberger.phidetect.pipeline.ConfidencePipeline;
import me.bechberger.phidetect.pipeline.ConfidenceReranker;
import me.bechberger.phidetect.pipeline.PipelineSummary;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: configuration, candidate collection and scoring.
 */
public class PhiDetectorTest {

    private static final String NOTE = "Patient: Jon Smith\nSSN: 123-45-6789\nLives in 02139\n";

    private static DetectionConfig config(boolean accelerated) throws IOException {
        DetectionConfig config = new ConfigLoader().load(accelerated ? "accelerated" : "default");
        DictionaryConfig firstNames = new DictionaryConfig();
        firstNames.setName("first_names");
        firstNames.setPreset("first_names");
        firstNames.setAccelerated(accelerated);
        firstNames.setTerms(List.of("John", "Jane", "Mary"));
        config.setDictionaries(List.of(firstNames));
        return config;
    }

    private static boolean hasSpan(List<Span> spans, FilterType type, String text) {
        return spans.stream().anyMatch(s -> s.getFilterType() == type && s.getText().equals(text));
    }

    // ========== Candidates ==========

    @Test
    public void testFindCandidates() throws IOException {
        try (PhiDetector detector = new PhiDetector(config(false))) {
            List<Span> candidates = detector.findCandidates(NOTE);

            assertTrue(hasSpan(candidates, FilterType.SSN, "123-45-6789"));
            assertTrue(hasSpan(candidates, FilterType.ZIPCODE, "02139"));
            assertTrue(hasSpan(candidates, FilterType.NAME, "Jon"));
            // dictionary spans follow the scanner spans
            Span last = candidates.get(candidates.size() - 1);
            assertEquals(FilterType.NAME, last.getFilterType());
            assertEquals("FUZZY_FIRST_NAMES_DELETE_1", last.getPattern());
        }
    }

    @Test
    public void testScannerCanBeDisabled() throws IOException {
        DetectionConfig config = config(false);
        config.getScanner().setEnabled(false);

        try (PhiDetector detector = new PhiDetector(config)) {
            assertNull(detector.getScanner());
            List<Span> candidates = detector.findCandidates(NOTE);
            assertEquals(1, candidates.size());
            assertEquals("Jon", candidates.get(0).getText());
        }
    }

    @Test
    public void testDisabledDictionaryIsSkipped() throws IOException {
        DetectionConfig config = config(false);
        config.getDictionaries().get(0).setEnabled(false);

        try (PhiDetector detector = new PhiDetector(config)) {
            assertTrue(detector.getDictionaries().isEmpty());
            assertFalse(hasSpan(detector.findCandidates(NOTE), FilterType.NAME, "Jon"));
        }
    }

    // ========== Detection ==========

    @Test
    public void testDetect() throws Exception {
        try (PhiDetector detector = new PhiDetector(config(false))) {
            List<Span> candidates = detector.findCandidates(NOTE);
            List<Span> spans = detector.detect(NOTE).get(5, TimeUnit.SECONDS);

            assertEquals(candidates.size(), spans.size());
            assertTrue(spans.stream().allMatch(s -> s.getConfidence() >= 0 && s.getConfidence() <= 1));
            PipelineSummary summary = detector.getPipeline().getLastSummary();
            assertNotNull(summary);
            assertEquals(0, summary.getFailedStages());
            assertEquals(spans.size(), summary.getOutputSpanCount());
        }
    }

    @Test
    public void testLabeledSpansEndUpMoreConfident() throws Exception {
        try (PhiDetector detector = new PhiDetector(config(false))) {
            List<Span> plain = detector.detect("Seen: 123-45-6789").get(5, TimeUnit.SECONDS);
            List<Span> labeled = detector.detect("SSN: 123-45-6789").get(5, TimeUnit.SECONDS);

            double plainConfidence = maxConfidence(plain, FilterType.SSN);
            double labeledConfidence = maxConfidence(labeled, FilterType.SSN);
            assertTrue(labeledConfidence >= plainConfidence, labeledConfidence + " < " + plainConfidence);
        }
    }

    private static double maxConfidence(List<Span> spans, FilterType type) {
        return spans.stream().filter(s -> s.getFilterType() == type).mapToDouble(Span::getConfidence).max().orElse(-1);
    }

    @Test
    public void testAcceleratedMatchesReference() throws Exception {
        try (PhiDetector reference = new PhiDetector(config(false));
             PhiDetector accelerated = new PhiDetector(config(true))) {
            assertTrue(accelerated.getScanner().isAccelerated());

            List<Span> expected = reference.detect(NOTE.repeat(100)).get(5, TimeUnit.SECONDS);
            List<Span> actual = accelerated.detect(NOTE.repeat(100)).get(5, TimeUnit.SECONDS);

            assertEquals(expected.size(), actual.size());
            for (int i = 0; i < expected.size(); i++) {
                assertEquals(expected.get(i).getFilterType(), actual.get(i).getFilterType());
                assertEquals(expected.get(i).getStart(), actual.get(i).getStart());
                assertEquals(expected.get(i).getEnd(), actual.get(i).getEnd());
                assertEquals(expected.get(i).getConfidence(), actual.get(i).getConfidence(), 1e-12);
            }
        }
    }

    @Test
    public void testRerankerOnlySeesBorderlineSpans() throws Exception {
        List<Span> seen = Collections.synchronizedList(new ArrayList<>());
        ConfidenceReranker reranker = (spans, text) -> {
            seen.addAll(spans);
            return CompletableFuture.completedFuture(spans);
        };

        try (PhiDetector detector = new PhiDetector(config(false), reranker)) {
            detector.detect(NOTE, RedactionContext.forDocument("note-1")).get(5, TimeUnit.SECONDS);
        }

        assertFalse(seen.isEmpty());
        assertTrue(seen.stream().allMatch(s -> s.getConfidence() >= 0.4 && s.getConfidence() <= 0.8));
        assertTrue(hasSpan(seen, FilterType.ZIPCODE, "02139"));
    }

    @Test
    public void testEmptyDetector() throws Exception {
        try (PhiDetector detector = new PhiDetector(null, List.of(), new ConfidencePipeline())) {
            assertTrue(detector.detect(NOTE).get(5, TimeUnit.SECONDS).isEmpty());
        }
    }
}
