package me.bechberger.phidetect.fuzzy;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Outcome of a dictionary lookup. Immutable, so results can be shared through the query cache.
 */
public final class FuzzyMatchResult {

    public enum MatchType {
        EXACT,
        DELETE_1,
        DELETE_2,
        PHONETIC,
        NONE
    }

    private static final FuzzyMatchResult NO_MATCH =
        new FuzzyMatchResult(false, null, Integer.MAX_VALUE, 0.0, MatchType.NONE);

    private final boolean matched;
    private final @Nullable String term;
    private final int distance;
    private final double confidence;
    private final MatchType matchType;

    public FuzzyMatchResult(boolean matched, @Nullable String term, int distance, double confidence, MatchType matchType) {
        this.matched = matched;
        this.term = term;
        this.distance = distance;
        this.confidence = confidence;
        this.matchType = Objects.requireNonNull(matchType, "matchType");
    }

    public static FuzzyMatchResult exact(String term) {
        return new FuzzyMatchResult(true, term, 0, 1.0, MatchType.EXACT);
    }

    public static FuzzyMatchResult noMatch() {
        return NO_MATCH;
    }

    public boolean isMatched() { return matched; }
    public @Nullable String getTerm() { return term; }

    /**
     * Edit distance to the matched term, {@link Integer#MAX_VALUE} if nothing matched.
     */
    public int getDistance() { return distance; }
    public double getConfidence() { return confidence; }
    public MatchType getMatchType() { return matchType; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FuzzyMatchResult)) return false;
        FuzzyMatchResult that = (FuzzyMatchResult) o;
        return matched == that.matched && distance == that.distance
            && Double.compare(confidence, that.confidence) == 0
            && Objects.equals(term, that.term) && matchType == that.matchType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(matched, term, distance, confidence, matchType);
    }

    @Override
    public String toString() {
        return matched
            ? String.format("FuzzyMatchResult{%s '%s', distance=%d, confidence=%.4f}", matchType, term, distance, confidence)
            : "FuzzyMatchResult{NONE}";
    }
}
