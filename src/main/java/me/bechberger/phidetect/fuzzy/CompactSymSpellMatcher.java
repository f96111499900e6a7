package me.bechberger.phidetect.fuzzy;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Accelerated symmetric-delete matcher with the same results as {@link SymSpellMatcher}.
 * <p>
 * Terms are stored once and referenced by id; each deletion key maps to an {@code int[]} of term ids.
 * Edit distances are computed with {@link EditDistance#bounded} on per-thread row buffers, and the
 * bound shrinks as better candidates are found.
 */
public class CompactSymSpellMatcher extends AbstractSymSpellMatcher {

    private static final Logger logger = LoggerFactory.getLogger(CompactSymSpellMatcher.class);

    private static final int[] NO_IDS = new int[0];

    private final String[] terms;
    private final Map<String, Integer> termIds;
    private final Map<String, int[]> deletionIndex;
    private final Map<String, int[]> phoneticIndex;
    private final int maxTermLength;
    private final ThreadLocal<Scratch> scratch;

    public CompactSymSpellMatcher(Collection<String> rawTerms, FuzzyMatcherConfig config) {
        super(config);
        List<String> termList = new ArrayList<>();
        Map<String, Integer> ids = new HashMap<>();
        Map<String, IdList> deletions = new HashMap<>();
        Map<String, IdList> phonetic = new HashMap<>();
        int minDeletionLength = minDeletionLength();
        int longest = 0;
        for (String rawTerm : rawTerms) {
            if (rawTerm == null) {
                continue;
            }
            String term = normalize(rawTerm);
            if (term.length() < config.getMinTermLength() || ids.containsKey(term)) {
                continue;
            }
            int id = termList.size();
            termList.add(term);
            ids.put(term, id);
            longest = Math.max(longest, term.length());
            for (Deletion deletion : deletions(term, config.getMaxEditDistance(), minDeletionLength)) {
                deletions.computeIfAbsent(deletion.text, k -> new IdList()).add(id);
            }
            if (config.isEnablePhonetic()) {
                phonetic.computeIfAbsent(Soundex.encode(term), k -> new IdList()).add(id);
            }
        }
        this.terms = termList.toArray(new String[0]);
        this.termIds = ids;
        this.deletionIndex = freeze(deletions);
        this.phoneticIndex = freeze(phonetic);
        this.maxTermLength = longest;
        int termCount = terms.length;
        this.scratch = ThreadLocal.withInitial(() -> new Scratch(termCount));
        logger.debug("CompactSymSpellMatcher built: {} terms, {} deletion keys, {} phonetic buckets ({})",
            terms.length, deletionIndex.size(), phoneticIndex.size(), config);
    }

    private static Map<String, int[]> freeze(Map<String, IdList> lists) {
        Map<String, int[]> frozen = new HashMap<>(lists.size() * 4 / 3 + 1);
        lists.forEach((key, list) -> frozen.put(key, list.toArray()));
        return frozen;
    }

    @Override
    protected boolean isTerm(String normalized) {
        return termIds.containsKey(normalized);
    }

    @Override
    protected int maxTermLength() {
        return maxTermLength;
    }

    @Override
    protected @Nullable Candidate bestDeletionCandidate(String query) {
        Scratch s = scratch.get();
        s.nextRound();
        int[][] rows = s.rows(query.length(), maxTermLength);
        int maxEdit = config.getMaxEditDistance();
        int bestId = -1;
        int bestDistance = Integer.MAX_VALUE;

        // candidate order: the query's own key, then per query deletion the deletion as a term and its key
        List<int[]> sources = new ArrayList<>();
        sources.add(deletionIndex.getOrDefault(query, NO_IDS));
        for (Deletion deletion : deletions(query, maxEdit, minDeletionLength())) {
            Integer termId = termIds.get(deletion.text);
            if (termId != null) {
                sources.add(new int[]{termId});
            }
            sources.add(deletionIndex.getOrDefault(deletion.text, NO_IDS));
        }
        for (int[] ids : sources) {
            for (int id : ids) {
                if (!s.markSeen(id)) {
                    continue;
                }
                int bound = bestId < 0 ? maxEdit : bestDistance - 1;
                int distance = EditDistance.bounded(query, terms[id], maxEdit, bound, rows);
                if (distance <= bound) {
                    bestId = id;
                    bestDistance = distance;
                    if (bestDistance == 1) {
                        // the query is not a term, so no candidate can be closer
                        return new Candidate(terms[bestId], bestDistance);
                    }
                }
            }
        }
        return bestId < 0 ? null : new Candidate(terms[bestId], bestDistance);
    }

    @Override
    protected @Nullable Candidate bestPhoneticCandidate(String query) {
        int[] bucket = phoneticIndex.get(Soundex.encode(query));
        if (bucket == null || bucket.length == 0) {
            return null;
        }
        int[][] rows = scratch.get().rows(query.length(), maxTermLength);
        int maxEdit = config.getMaxEditDistance();
        int bestId = -1;
        int bestDistance = Integer.MAX_VALUE;
        for (int id : bucket) {
            int distance = EditDistance.bounded(query, terms[id], maxEdit, maxEdit + 1, rows);
            if (bestId < 0 || distance < bestDistance) {
                bestId = id;
                bestDistance = distance;
            }
        }
        return new Candidate(terms[bestId], bestDistance);
    }

    @Override
    public int size() {
        return terms.length;
    }

    @Override
    public int indexSize() {
        return deletionIndex.size();
    }

    /**
     * Growable int array used while building the index.
     */
    private static final class IdList {
        private int[] ids = new int[2];
        private int size;

        void add(int id) {
            if (size == ids.length) {
                ids = Arrays.copyOf(ids, size * 2);
            }
            ids[size++] = id;
        }

        int[] toArray() {
            return Arrays.copyOf(ids, size);
        }
    }

    /**
     * Per-thread buffers: three distance rows and a stamp array marking candidates already seen
     * in the current lookup.
     */
    private static final class Scratch {
        private final int[] seen;
        private int stamp;
        private int[][] rows = new int[3][0];

        Scratch(int termCount) {
            this.seen = new int[termCount];
        }

        void nextRound() {
            if (++stamp == 0) {
                Arrays.fill(seen, 0);
                stamp = 1;
            }
        }

        /** @return true if the id was not seen before in this round */
        boolean markSeen(int id) {
            if (seen[id] == stamp) {
                return false;
            }
            seen[id] = stamp;
            return true;
        }

        int[][] rows(int queryLength, int maxTermLength) {
            int needed = Math.max(queryLength, maxTermLength) + 1;
            if (rows[0].length < needed) {
                rows = new int[3][needed];
            }
            return rows;
        }
    }
}
