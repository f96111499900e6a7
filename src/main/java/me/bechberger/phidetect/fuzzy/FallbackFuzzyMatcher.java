package me.bechberger.phidetect.fuzzy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Answers from a primary (accelerated) matcher and switches to a reference matcher for any lookup
 * the primary fails on. The reference matcher is built on first use.
 */
public class FallbackFuzzyMatcher implements FuzzyMatcher {

    private static final Logger logger = LoggerFactory.getLogger(FallbackFuzzyMatcher.class);

    private final FuzzyMatcher primary;
    private final Supplier<FuzzyMatcher> referenceFactory;
    private volatile FuzzyMatcher reference;

    public FallbackFuzzyMatcher(FuzzyMatcher primary, Supplier<FuzzyMatcher> referenceFactory) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.referenceFactory = Objects.requireNonNull(referenceFactory, "referenceFactory");
    }

    @Override
    public FuzzyMatchResult lookup(String query) {
        Objects.requireNonNull(query, "query");
        try {
            return primary.lookup(query);
        } catch (RuntimeException e) {
            logger.debug("Accelerated lookup of '{}' failed, using reference matcher: {}", query, e.toString());
            return reference().lookup(query);
        }
    }

    FuzzyMatcher reference() {
        FuzzyMatcher result = reference;
        if (result == null) {
            synchronized (this) {
                result = reference;
                if (result == null) {
                    result = referenceFactory.get();
                    reference = result;
                    logger.debug("Built reference fuzzy matcher with {} terms", result.size());
                }
            }
        }
        return result;
    }

    boolean isReferenceBuilt() {
        return reference != null;
    }

    @Override
    public int size() {
        return primary.size();
    }

    @Override
    public int indexSize() {
        return primary.indexSize();
    }

    @Override
    public void clearCache() {
        primary.clearCache();
        FuzzyMatcher ref = reference;
        if (ref != null) {
            ref.clearCache();
        }
    }

    @Override
    public FuzzyStats getStats() {
        FuzzyMatcher ref = reference;
        return ref == null ? primary.getStats() : primary.getStats().plus(ref.getStats());
    }
}
