package me.bechberger.phidetect.fuzzy;

/**
 * Tuning parameters of a SymSpell matcher.
 */
public final class FuzzyMatcherConfig {

    public static final int DEFAULT_MAX_EDIT_DISTANCE = 2;
    public static final boolean DEFAULT_ENABLE_PHONETIC = true;
    public static final int DEFAULT_MIN_TERM_LENGTH = 3;
    public static final int DEFAULT_CACHE_SIZE = 10_000;

    private final int maxEditDistance;
    private final boolean enablePhonetic;
    private final int minTermLength;
    private final int cacheSize;
    private final boolean accelerated;

    public FuzzyMatcherConfig(int maxEditDistance, boolean enablePhonetic, int minTermLength, int cacheSize,
                              boolean accelerated) {
        if (maxEditDistance < 0) {
            throw new IllegalArgumentException("maxEditDistance must not be negative: " + maxEditDistance);
        }
        if (cacheSize < 0) {
            throw new IllegalArgumentException("cacheSize must not be negative: " + cacheSize);
        }
        this.maxEditDistance = maxEditDistance;
        this.enablePhonetic = enablePhonetic;
        this.minTermLength = minTermLength;
        this.cacheSize = cacheSize;
        this.accelerated = accelerated;
    }

    public FuzzyMatcherConfig(int maxEditDistance, boolean enablePhonetic, int minTermLength, int cacheSize) {
        this(maxEditDistance, enablePhonetic, minTermLength, cacheSize, false);
    }

    public static FuzzyMatcherConfig defaults() {
        return new FuzzyMatcherConfig(DEFAULT_MAX_EDIT_DISTANCE, DEFAULT_ENABLE_PHONETIC,
            DEFAULT_MIN_TERM_LENGTH, DEFAULT_CACHE_SIZE);
    }

    public static FuzzyMatcherConfig forFirstNames() {
        return new FuzzyMatcherConfig(2, true, 2, 5000);
    }

    public static FuzzyMatcherConfig forSurnames() {
        return new FuzzyMatcherConfig(2, true, 2, 5000);
    }

    /** Locations are matched without phonetic fallback. */
    public static FuzzyMatcherConfig forLocations() {
        return new FuzzyMatcherConfig(2, false, 3, 2000);
    }

    /** Exact matches only. */
    public static FuzzyMatcherConfig strict() {
        return new FuzzyMatcherConfig(0, false, 1, 1000);
    }

    public FuzzyMatcherConfig withAccelerated(boolean accelerated) {
        return new FuzzyMatcherConfig(maxEditDistance, enablePhonetic, minTermLength, cacheSize, accelerated);
    }

    public int getMaxEditDistance() { return maxEditDistance; }
    public boolean isEnablePhonetic() { return enablePhonetic; }
    public int getMinTermLength() { return minTermLength; }
    public int getCacheSize() { return cacheSize; }
    public boolean isAccelerated() { return accelerated; }

    @Override
    public String toString() {
        return "FuzzyMatcherConfig{maxEditDistance=" + maxEditDistance + ", enablePhonetic=" + enablePhonetic +
            ", minTermLength=" + minTermLength + ", cacheSize=" + cacheSize + ", accelerated=" + accelerated + "}";
    }
}
