package me.bechberger.phidetect.fuzzy;

/**
 * Lookup counters of a matcher. Cache hits are counted separately from the stage that
 * originally produced the cached result.
 */
public class FuzzyStats {
    private final long exactHits;
    private final long deletionHits;
    private final long phoneticHits;
    private final long cacheHits;
    private final long misses;

    public FuzzyStats(long exactHits, long deletionHits, long phoneticHits, long cacheHits, long misses) {
        this.exactHits = exactHits;
        this.deletionHits = deletionHits;
        this.phoneticHits = phoneticHits;
        this.cacheHits = cacheHits;
        this.misses = misses;
    }

    public long getExactHits() { return exactHits; }
    public long getDeletionHits() { return deletionHits; }
    public long getPhoneticHits() { return phoneticHits; }
    public long getCacheHits() { return cacheHits; }
    public long getMisses() { return misses; }

    public long getTotalLookups() {
        return exactHits + deletionHits + phoneticHits + cacheHits + misses;
    }

    public FuzzyStats plus(FuzzyStats other) {
        return new FuzzyStats(exactHits + other.exactHits, deletionHits + other.deletionHits,
            phoneticHits + other.phoneticHits, cacheHits + other.cacheHits, misses + other.misses);
    }

    @Override
    public String toString() {
        return "FuzzyStats{exact=" + exactHits + ", deletion=" + deletionHits + ", phonetic=" + phoneticHits +
            ", cache=" + cacheHits + ", misses=" + misses + "}";
    }
}
