package me.bechberger.phidetect.fuzzy;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Factory choosing the matcher backend from a {@link FuzzyMatcherConfig}.
 */
public final class FuzzyMatchers {

    private FuzzyMatchers() {
    }

    /**
     * Build a matcher for the terms. With {@link FuzzyMatcherConfig#isAccelerated()} the result is a
     * {@link CompactSymSpellMatcher} guarded by a lazily built {@link SymSpellMatcher}.
     */
    public static FuzzyMatcher create(Collection<String> terms, FuzzyMatcherConfig config) {
        if (!config.isAccelerated()) {
            return new SymSpellMatcher(terms, config);
        }
        List<String> snapshot = terms.stream().filter(Objects::nonNull).collect(Collectors.toList());
        return new FallbackFuzzyMatcher(new CompactSymSpellMatcher(snapshot, config),
            () -> new SymSpellMatcher(snapshot, config));
    }

    public static FuzzyMatcher forFirstNames(Collection<String> names, boolean accelerated) {
        return create(names, FuzzyMatcherConfig.forFirstNames().withAccelerated(accelerated));
    }

    public static FuzzyMatcher forSurnames(Collection<String> names, boolean accelerated) {
        return create(names, FuzzyMatcherConfig.forSurnames().withAccelerated(accelerated));
    }

    public static FuzzyMatcher forLocations(Collection<String> locations, boolean accelerated) {
        return create(locations, FuzzyMatcherConfig.forLocations().withAccelerated(accelerated));
    }

    public static FuzzyMatcher strict(Collection<String> terms, boolean accelerated) {
        return create(terms, FuzzyMatcherConfig.strict().withAccelerated(accelerated));
    }
}
