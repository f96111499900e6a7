package me.bechberger.phidetect.engine;

import me.bechberger.phidetect.config.DetectionConfig;
import me.bechberger.phidetect.config.DictionaryConfig;
import me.bechberger.phidetect.fuzzy.DictionarySpanDetector;
import me.bechberger.phidetect.model.RedactionContext;
import me.bechberger.phidetect.model.Span;
import me.bechberger.phidetect.pipeline.ConfidencePipeline;
import me.bechberger.phidetect.pipeline.ConfidenceReranker;
import me.bechberger.phidetect.scan.MultiPatternScanner;
import me.bechberger.phidetect.scan.ScanMatch;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Finds PHI spans in a document and scores them.
 *
 * Main responsibilities:
 * 1. Collect candidate spans from the pattern scanner and the dictionaries
 * 2. Run the candidates through the confidence pipeline
 *
 * Usage:
 * <pre>
 * try (PhiDetector detector = new PhiDetector(new ConfigLoader().load("default"))) {
 *     List&lt;Span&gt; spans = detector.detect("Patient: John Smith, SSN: 123-45-6789").join();
 * }
 * </pre>
 *
 * Overlapping spans are all returned; choosing between them is up to the caller.
 */
public class PhiDetector implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PhiDetector.class);

    private final @Nullable MultiPatternScanner scanner;
    private final List<DictionarySpanDetector> dictionaries;
    private final ConfidencePipeline pipeline;

    public PhiDetector(DetectionConfig config) {
        this(config, null);
    }

    /**
     * @param reranker optional model for borderline spans
     */
    public PhiDetector(DetectionConfig config, @Nullable ConfidenceReranker reranker) {
        this(config.getScanner().isEnabled() ? config.getScanner().createScanner() : null,
            createDictionaries(config),
            config.getPipeline().createPipeline(config.getContext(), reranker));
    }

    public PhiDetector(@Nullable MultiPatternScanner scanner, List<DictionarySpanDetector> dictionaries,
                       ConfidencePipeline pipeline) {
        this.scanner = scanner;
        this.dictionaries = List.copyOf(dictionaries);
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        logger.debug("PhiDetector initialized: scanner {}, {} dictionaries, stages {}",
            scanner == null ? "disabled" : scanner.isAccelerated() ? "accelerated" : "reference",
            this.dictionaries.size(), pipeline.getStageNames());
    }

    private static List<DictionarySpanDetector> createDictionaries(DetectionConfig config) {
        List<DictionarySpanDetector> detectors = new ArrayList<>();
        for (DictionaryConfig dictionary : config.getDictionaries()) {
            if (dictionary.isEnabled()) {
                detectors.add(dictionary.createDetector());
            }
        }
        return detectors;
    }

    /**
     * Candidate spans before scoring: scanner matches in corpus order, then dictionary matches
     * per dictionary.
     */
    public List<Span> findCandidates(String text) {
        Objects.requireNonNull(text, "text");
        List<Span> candidates = new ArrayList<>();
        if (scanner != null) {
            for (ScanMatch match : scanner.scan(text).getMatches()) {
                candidates.add(match.toSpan());
            }
        }
        for (DictionarySpanDetector dictionary : dictionaries) {
            candidates.addAll(dictionary.detect(text));
        }
        logger.debug("Found {} candidate spans in {} characters", candidates.size(), text.length());
        return candidates;
    }

    public CompletableFuture<List<Span>> detect(String text) {
        return detect(text, RedactionContext.empty());
    }

    public CompletableFuture<List<Span>> detect(String text, RedactionContext context) {
        return pipeline.execute(findCandidates(text), text, context);
    }

    public @Nullable MultiPatternScanner getScanner() {
        return scanner;
    }

    public List<DictionarySpanDetector> getDictionaries() {
        return dictionaries;
    }

    public ConfidencePipeline getPipeline() {
        return pipeline;
    }

    @Override
    public void close() {
        if (scanner != null) {
            scanner.close();
        }
    }
}
