package me.bechberger.phidetect.fuzzy;

import me.bechberger.phidetect.model.FilterType;
import me.bechberger.phidetect.model.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns dictionary lookups into spans: every word of the text is looked up in a {@link FuzzyMatcher}
 * and emitted as a span of the dictionary's category if it matches with enough confidence.
 */
public class DictionarySpanDetector {

    private static final Logger logger = LoggerFactory.getLogger(DictionarySpanDetector.class);

    /** Letter runs, with apostrophes and hyphens allowed between letters (O'Brien, Smith-Jones). */
    static final Pattern WORD = Pattern.compile("\\p{L}+(?:['\\-]\\p{L}+)*");

    private final String name;
    private final FilterType filterType;
    private final FuzzyMatcher matcher;
    private final double minConfidence;
    private final String patternPrefix;

    public DictionarySpanDetector(String name, FilterType filterType, FuzzyMatcher matcher, double minConfidence) {
        this.name = Objects.requireNonNull(name, "name");
        this.filterType = Objects.requireNonNull(filterType, "filterType");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.minConfidence = minConfidence;
        this.patternPrefix = "FUZZY_" + name.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_") + "_";
    }

    public List<Span> detect(String text) {
        Objects.requireNonNull(text, "text");
        List<Span> spans = new ArrayList<>();
        Matcher words = WORD.matcher(text);
        while (words.find()) {
            String word = words.group();
            FuzzyMatchResult result = matcher.lookup(word);
            if (!result.isMatched() || result.getConfidence() < minConfidence) {
                continue;
            }
            logger.trace("Dictionary {} matched '{}' as {}", name, word, result);
            spans.add(new Span(filterType, word, words.start(), words.end(), result.getConfidence(),
                patternPrefix + result.getMatchType()));
        }
        return spans;
    }

    public String getName() { return name; }
    public FilterType getFilterType() { return filterType; }
    public FuzzyMatcher getMatcher() { return matcher; }
    public double getMinConfidence() { return minConfidence; }
}
