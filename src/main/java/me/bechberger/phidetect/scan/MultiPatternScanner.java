package me.bechberger.phidetect.scan;

import me.bechberger.phidetect.model.FilterType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * Scans a text against a corpus of {@link PatternDef}s and reports every validated match.
 * <p>
 * Matches are ordered by pattern (corpus order), then by position within the text.
 * The backend is chosen once at construction: with {@code accelerated} set, scans go through
 * {@link ParallelScanBackend} and fall back to {@link ReferenceScanBackend} if it fails.
 * <p>
 * Thread-safe. Close the scanner to release the worker threads of the accelerated backend.
 */
public class MultiPatternScanner implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MultiPatternScanner.class);

    private final List<PatternDef> patterns;
    private final Map<FilterType, List<PatternDef>> patternsByType;
    private final ScanBackend reference = new ReferenceScanBackend();
    private final ScanBackend backend;

    private final LongAdder totalScans = new LongAdder();
    private final LongAdder totalMatches = new LongAdder();
    private final LongAdder totalNanos = new LongAdder();
    private final LongAdder acceleratedScans = new LongAdder();
    private final LongAdder referenceScans = new LongAdder();

    /**
     * Scanner over the built-in corpus using the reference backend.
     */
    public MultiPatternScanner() {
        this(PhiPatterns.all(), false, 1);
    }

    public MultiPatternScanner(List<PatternDef> patterns, boolean accelerated, int threads) {
        this(patterns, accelerated ? new ParallelScanBackend(Math.max(1, threads)) : null);
    }

    /**
     * @param accelerated backend tried first, or null to always scan with the reference backend
     */
    MultiPatternScanner(List<PatternDef> patterns, ScanBackend accelerated) {
        this.patterns = List.copyOf(patterns);
        this.patternsByType = new EnumMap<>(FilterType.class);
        for (PatternDef pattern : this.patterns) {
            patternsByType.computeIfAbsent(pattern.getFilterType(), t -> new ArrayList<>()).add(pattern);
        }
        this.backend = accelerated != null ? accelerated : reference;
        logger.debug("MultiPatternScanner initialized with {} patterns over {} types, backend {}",
            this.patterns.size(), patternsByType.size(), backend.name());
    }

    /**
     * Scan the text with every pattern of the corpus.
     */
    public ScanResult scan(String text) {
        Objects.requireNonNull(text, "text");
        long startNanos = System.nanoTime();
        List<ScanMatch> matches;
        if (backend != reference) {
            matches = scanAccelerated(text);
        } else {
            matches = reference.scan(text, patterns);
            referenceScans.increment();
        }
        return finish(text, patterns.size(), matches, startNanos);
    }

    /**
     * Scan the text with only the patterns of the given categories, in the given category order.
     * Always uses the reference backend.
     */
    public ScanResult scanForTypes(String text, Collection<FilterType> types) {
        Objects.requireNonNull(text, "text");
        long startNanos = System.nanoTime();
        List<PatternDef> selected = new ArrayList<>();
        for (FilterType type : new LinkedHashSet<>(types)) {
            selected.addAll(patternsByType.getOrDefault(type, List.of()));
        }
        List<ScanMatch> matches = reference.scan(text, selected);
        referenceScans.increment();
        return finish(text, selected.size(), matches, startNanos);
    }

    private List<ScanMatch> scanAccelerated(String text) {
        try {
            List<ScanMatch> matches = backend.scan(text, patterns);
            acceleratedScans.increment();
            return matches;
        } catch (RuntimeException e) {
            logger.debug("Accelerated scan failed, using reference backend: {}", e.toString());
            List<ScanMatch> matches = reference.scan(text, patterns);
            referenceScans.increment();
            return matches;
        }
    }

    private ScanResult finish(String text, int patternsChecked, List<ScanMatch> matches, long startNanos) {
        long elapsed = System.nanoTime() - startNanos;
        totalScans.increment();
        totalMatches.add(matches.size());
        totalNanos.add(elapsed);
        if (logger.isTraceEnabled()) {
            for (ScanMatch match : matches) {
                logger.trace("Matched {}", match);
            }
        }
        return new ScanResult(matches, new ScanResult.ScanStats(text.length(), patternsChecked, matches.size(),
            elapsed / 1_000_000.0));
    }

    public List<PatternDef> getPatterns() {
        return patterns;
    }

    public boolean isAccelerated() {
        return backend != reference;
    }

    public ScannerStats getStats() {
        long scans = totalScans.sum();
        double avg = scans == 0 ? 0.0 : totalNanos.sum() / 1_000_000.0 / scans;
        Map<FilterType, Integer> counts = new EnumMap<>(FilterType.class);
        patternsByType.forEach((type, defs) -> counts.put(type, defs.size()));
        return new ScannerStats(scans, totalMatches.sum(), avg, acceleratedScans.sum(), referenceScans.sum(),
            isAccelerated(), Collections.unmodifiableMap(counts));
    }

    public void resetStats() {
        totalScans.reset();
        totalMatches.reset();
        totalNanos.reset();
        acceleratedScans.reset();
        referenceScans.reset();
    }

    @Override
    public void close() {
        try {
            backend.close();
        } catch (Exception e) {
            logger.debug("Failed to close scan backend {}", backend.name(), e);
        }
    }
}
