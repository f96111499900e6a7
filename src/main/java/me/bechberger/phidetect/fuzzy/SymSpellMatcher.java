package me.bechberger.phidetect.fuzzy;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Symmetric-delete fuzzy matcher.
 * <p>
 * Every dictionary term is indexed under all strings obtained by deleting up to
 * {@code maxEditDistance} characters. A query only has to be compared against the terms that share
 * a deletion with it, instead of against the whole dictionary.
 * <p>
 * The index is built once and is read-only afterwards; only the query cache changes.
 */
public class SymSpellMatcher extends AbstractSymSpellMatcher {

    private static final Logger logger = LoggerFactory.getLogger(SymSpellMatcher.class);

    /**
     * Dictionary term together with the number of deletions that lead from it to an index key.
     */
    static final class DeletionEntry {
        final String term;
        final int distance;

        DeletionEntry(String term, int distance) {
            this.term = term;
            this.distance = distance;
        }
    }

    private final Set<String> exactTerms = new HashSet<>();
    private final Map<String, List<DeletionEntry>> deletionIndex = new HashMap<>();
    private final Map<String, List<String>> phoneticIndex = new HashMap<>();
    private int maxTermLength;

    public SymSpellMatcher(Collection<String> terms, FuzzyMatcherConfig config) {
        super(config);
        int minDeletionLength = minDeletionLength();
        for (String rawTerm : terms) {
            if (rawTerm == null) {
                continue;
            }
            String term = normalize(rawTerm);
            if (term.length() < config.getMinTermLength()) {
                continue;
            }
            exactTerms.add(term);
            maxTermLength = Math.max(maxTermLength, term.length());
            for (Deletion deletion : deletions(term, config.getMaxEditDistance(), minDeletionLength)) {
                deletionIndex.computeIfAbsent(deletion.text, k -> new ArrayList<>())
                    .add(new DeletionEntry(term, deletion.distance));
            }
            if (config.isEnablePhonetic()) {
                phoneticIndex.computeIfAbsent(Soundex.encode(term), k -> new ArrayList<>()).add(term);
            }
        }
        logger.debug("SymSpellMatcher built: {} terms, {} deletion keys, {} phonetic buckets ({})",
            exactTerms.size(), deletionIndex.size(), phoneticIndex.size(), config);
    }

    public SymSpellMatcher(Collection<String> terms) {
        this(terms, FuzzyMatcherConfig.defaults());
    }

    public static SymSpellMatcher forFirstNames(Collection<String> names) {
        return new SymSpellMatcher(names, FuzzyMatcherConfig.forFirstNames());
    }

    public static SymSpellMatcher forSurnames(Collection<String> names) {
        return new SymSpellMatcher(names, FuzzyMatcherConfig.forSurnames());
    }

    public static SymSpellMatcher forLocations(Collection<String> locations) {
        return new SymSpellMatcher(locations, FuzzyMatcherConfig.forLocations());
    }

    public static SymSpellMatcher strict(Collection<String> terms) {
        return new SymSpellMatcher(terms, FuzzyMatcherConfig.strict());
    }

    @Override
    protected boolean isTerm(String normalized) {
        return exactTerms.contains(normalized);
    }

    @Override
    protected int maxTermLength() {
        return maxTermLength;
    }

    @Override
    protected @Nullable Candidate bestDeletionCandidate(String query) {
        Candidate best = null;
        int maxEdit = config.getMaxEditDistance();
        for (String term : candidates(query)) {
            int distance = EditDistance.damerauLevenshtein(query, term, maxEdit);
            if (distance <= maxEdit && (best == null || distance < best.distance)) {
                best = new Candidate(term, distance);
            }
        }
        return best;
    }

    /**
     * Terms sharing a deletion with the query: the index entry of the query itself, then for each
     * deletion of the query the deletion as a term followed by its index entry. First occurrence wins.
     */
    Collection<String> candidates(String query) {
        Set<String> candidates = new LinkedHashSet<>();
        addEntries(candidates, deletionIndex.get(query));
        for (Deletion deletion : deletions(query, config.getMaxEditDistance(), minDeletionLength())) {
            if (exactTerms.contains(deletion.text)) {
                candidates.add(deletion.text);
            }
            addEntries(candidates, deletionIndex.get(deletion.text));
        }
        return candidates;
    }

    private static void addEntries(Set<String> candidates, @Nullable List<DeletionEntry> entries) {
        if (entries != null) {
            for (DeletionEntry entry : entries) {
                candidates.add(entry.term);
            }
        }
    }

    @Override
    protected @Nullable Candidate bestPhoneticCandidate(String query) {
        List<String> bucket = phoneticIndex.get(Soundex.encode(query));
        if (bucket == null) {
            return null;
        }
        Candidate best = null;
        for (String term : bucket) {
            int distance = EditDistance.damerauLevenshtein(query, term, config.getMaxEditDistance());
            if (best == null || distance < best.distance) {
                best = new Candidate(term, distance);
            }
        }
        return best;
    }

    @Override
    public int size() {
        return exactTerms.size();
    }

    @Override
    public int indexSize() {
        return deletionIndex.size();
    }
}
