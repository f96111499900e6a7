package me.bechberger.phidetect.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accelerated scan backend.
 * <p>
 * Patterns whose {@link TextTrigger} is absent from the text are skipped without running the regex.
 * On texts of at least {@code parallelThreshold} characters the remaining patterns run concurrently;
 * the per-pattern results are concatenated in pattern order, so the output is identical to
 * {@link ReferenceScanBackend}.
 */
public class ParallelScanBackend implements ScanBackend {

    private static final Logger logger = LoggerFactory.getLogger(ParallelScanBackend.class);

    public static final int DEFAULT_PARALLEL_THRESHOLD = 4096;

    private final ExecutorService executor;
    private final int parallelThreshold;

    public ParallelScanBackend(int threads) {
        this(threads, DEFAULT_PARALLEL_THRESHOLD);
    }

    public ParallelScanBackend(int threads, int parallelThreshold) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.executor = Executors.newFixedThreadPool(threads, new ScanThreadFactory());
        this.parallelThreshold = parallelThreshold;
        logger.debug("ParallelScanBackend initialized with {} threads, parallel threshold {}", threads, parallelThreshold);
    }

    @Override
    public String name() {
        return "parallel";
    }

    @Override
    public List<ScanMatch> scan(String text, List<PatternDef> patterns) {
        TextTrigger.TextProfile profile = TextTrigger.TextProfile.of(text);
        List<PatternDef> candidates = new ArrayList<>(patterns.size());
        for (PatternDef pattern : patterns) {
            if (pattern.getTrigger().presentIn(profile)) {
                candidates.add(pattern);
            }
        }
        logger.trace("Prefilter kept {} of {} patterns", candidates.size(), patterns.size());

        List<ScanMatch> matches = new ArrayList<>();
        if (candidates.size() <= 1 || text.length() < parallelThreshold) {
            for (PatternDef pattern : candidates) {
                matches.addAll(pattern.findAll(text));
            }
            return matches;
        }

        List<CompletableFuture<List<ScanMatch>>> futures = new ArrayList<>(candidates.size());
        for (PatternDef pattern : candidates) {
            futures.add(CompletableFuture.supplyAsync(() -> pattern.findAll(text), executor));
        }
        // join in submission order to keep pattern order
        for (CompletableFuture<List<ScanMatch>> future : futures) {
            matches.addAll(future.join());
        }
        return matches;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static class ScanThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "phi-scan-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
