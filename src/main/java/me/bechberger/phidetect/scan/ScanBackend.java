package me.bechberger.phidetect.scan;

import java.util.List;

/**
 * Strategy that evaluates a pattern corpus over a text.
 * <p>
 * Every implementation must return the same matches in the same order as
 * {@link ReferenceScanBackend}: pattern order first, then position within the text.
 */
public interface ScanBackend extends AutoCloseable {

    String name();

    List<ScanMatch> scan(String text, List<PatternDef> patterns);

    @Override
    default void close() {
    }
}
