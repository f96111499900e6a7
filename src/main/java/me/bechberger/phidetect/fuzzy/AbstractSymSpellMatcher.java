package me.bechberger.phidetect.fuzzy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lookup flow shared by the SymSpell backends: normalization, query cache, the
 * exact / deletion / phonetic cascade, confidence scoring and hit statistics.
 * Subclasses only provide the index.
 */
abstract class AbstractSymSpellMatcher implements FuzzyMatcher {

    /** Factor applied to the confidence of phonetic matches. */
    static final double PHONETIC_PENALTY = 0.9;

    protected final FuzzyMatcherConfig config;
    private final Cache<String, FuzzyMatchResult> cache;

    private final LongAdder exactHits = new LongAdder();
    private final LongAdder deletionHits = new LongAdder();
    private final LongAdder phoneticHits = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    AbstractSymSpellMatcher(FuzzyMatcherConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.cache = Caffeine.newBuilder()
            .maximumSize(config.getCacheSize())
            .build();
    }

    /**
     * A dictionary term with its edit distance to the query.
     */
    static final class Candidate {
        final String term;
        final int distance;

        Candidate(String term, int distance) {
            this.term = term;
            this.distance = distance;
        }
    }

    /** Whether the normalized query is an indexed term. */
    protected abstract boolean isTerm(String normalized);

    /**
     * The closest candidate of the deletion neighbourhood with distance at most {@code maxEditDistance},
     * the first one found on ties.
     */
    protected abstract @Nullable Candidate bestDeletionCandidate(String normalized);

    /**
     * The closest term sharing the query's Soundex code, the first one found on ties,
     * or null if the bucket is empty.
     */
    protected abstract @Nullable Candidate bestPhoneticCandidate(String normalized);

    /** Length of the longest indexed term, 0 for an empty index. */
    protected abstract int maxTermLength();

    @Override
    public FuzzyMatchResult lookup(String query) {
        String normalized = normalize(Objects.requireNonNull(query, "query"));
        FuzzyMatchResult cached = cache.getIfPresent(normalized);
        if (cached != null) {
            cacheHits.increment();
            return cached;
        }
        FuzzyMatchResult result = compute(normalized);
        cache.put(normalized, result);
        return result;
    }

    private FuzzyMatchResult compute(String query) {
        if (isTerm(query)) {
            exactHits.increment();
            return FuzzyMatchResult.exact(query);
        }
        boolean longEnough = query.length() >= config.getMinTermLength();
        if (longEnough && withinDeletionReach(query)) {
            Candidate best = bestDeletionCandidate(query);
            if (best != null) {
                deletionHits.increment();
                return new FuzzyMatchResult(true, best.term, best.distance,
                    confidence(query, best.term, best.distance),
                    best.distance == 1 ? FuzzyMatchResult.MatchType.DELETE_1 : FuzzyMatchResult.MatchType.DELETE_2);
            }
        }
        if (config.isEnablePhonetic() && longEnough) {
            Candidate best = bestPhoneticCandidate(query);
            if (best != null && best.distance <= config.getMaxEditDistance() + 1) {
                phoneticHits.increment();
                return new FuzzyMatchResult(true, best.term, best.distance,
                    confidence(query, best.term, best.distance) * PHONETIC_PENALTY,
                    FuzzyMatchResult.MatchType.PHONETIC);
            }
        }
        misses.increment();
        return FuzzyMatchResult.noMatch();
    }

    /**
     * Whether some indexed term could be within {@code maxEditDistance} of the query. Longer queries
     * skip the deletion stage, whose neighbourhood grows with the square of the query length.
     */
    boolean withinDeletionReach(String query) {
        return query.length() <= maxTermLength() + config.getMaxEditDistance();
    }

    /**
     * Similarity of query and match, raised by a common-prefix bonus and decayed by 0.92 per edit.
     */
    static double confidence(String query, String matched, int distance) {
        if (distance == 0) {
            return 1.0;
        }
        int maxLen = Math.max(query.length(), matched.length());
        double similarity = 1.0 - (double) distance / maxLen;
        int maxPrefix = Math.min(4, Math.min(query.length(), matched.length()));
        int prefix = 0;
        while (prefix < maxPrefix && query.charAt(prefix) == matched.charAt(prefix)) {
            prefix++;
        }
        double prefixBonus = prefix * 0.1 * (1.0 - similarity);
        return Math.min(0.99, similarity + prefixBonus) * Math.pow(0.92, distance);
    }

    static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT).strip();
    }

    /**
     * All distinct strings reachable by deleting 1 to {@code maxDistance} characters, in breadth-first
     * order. Deletions shorter than {@code minLength} are neither returned nor expanded.
     */
    static List<Deletion> deletions(String term, int maxDistance, int minLength) {
        List<Deletion> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        ArrayDeque<Deletion> queue = new ArrayDeque<>();
        queue.add(new Deletion(term, 0));
        while (!queue.isEmpty()) {
            Deletion current = queue.poll();
            if (current.distance > 0) {
                result.add(current);
            }
            if (current.distance >= maxDistance) {
                continue;
            }
            String text = current.text;
            for (int i = 0; i < text.length(); i++) {
                String deletion = text.substring(0, i) + text.substring(i + 1);
                if (deletion.length() >= minLength && seen.add(deletion)) {
                    queue.add(new Deletion(deletion, current.distance + 1));
                }
            }
        }
        return result;
    }

    static final class Deletion {
        final String text;
        final int distance;

        Deletion(String text, int distance) {
            this.text = text;
            this.distance = distance;
        }
    }

    int minDeletionLength() {
        return config.getMinTermLength() - config.getMaxEditDistance();
    }

    @Override
    public void clearCache() {
        cache.invalidateAll();
    }

    @Override
    public FuzzyStats getStats() {
        return new FuzzyStats(exactHits.sum(), deletionHits.sum(), phoneticHits.sum(), cacheHits.sum(), misses.sum());
    }

    public FuzzyMatcherConfig getConfig() {
        return config;
    }
}
