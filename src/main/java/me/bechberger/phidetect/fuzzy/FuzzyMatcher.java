package me.bechberger.phidetect.fuzzy;

/**
 * Edit-distance tolerant dictionary lookup.
 * <p>
 * Queries are lowercased and trimmed before lookup. Implementations are thread-safe.
 */
public interface FuzzyMatcher {

    FuzzyMatchResult lookup(String query);

    default boolean has(String query) {
        return lookup(query).isMatched();
    }

    default double getConfidence(String query) {
        return lookup(query).getConfidence();
    }

    /** Number of distinct indexed terms. */
    int size();

    /** Number of distinct deletion keys. */
    int indexSize();

    void clearCache();

    FuzzyStats getStats();
}
