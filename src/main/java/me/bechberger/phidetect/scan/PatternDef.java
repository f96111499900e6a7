package me.bechberger.phidetect.scan;

import me.bechberger.phidetect.model.FilterType;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single compiled detection pattern with its category, base confidence and optional validator.
 * <p>
 * Instances are immutable and can be shared between threads: every call to {@link #findAll(String)}
 * creates its own {@link Matcher}.
 */
public class PatternDef {

    private static final Logger logger = LoggerFactory.getLogger(PatternDef.class);

    private final String id;
    private final FilterType filterType;
    private final Pattern regex;
    private final double confidence;
    private final String description;
    private final @Nullable Predicate<String> validator;
    private final TextTrigger trigger;

    public PatternDef(String id, FilterType filterType, Pattern regex, double confidence,
                      String description, @Nullable Predicate<String> validator, TextTrigger trigger) {
        this.id = Objects.requireNonNull(id, "id");
        this.filterType = Objects.requireNonNull(filterType, "filterType");
        this.regex = Objects.requireNonNull(regex, "regex");
        this.confidence = confidence;
        this.description = description != null ? description : "";
        this.validator = validator;
        this.trigger = trigger != null ? trigger : TextTrigger.ANY;
    }

    public PatternDef(String id, FilterType filterType, Pattern regex, double confidence, String description) {
        this(id, filterType, regex, confidence, description, null, TextTrigger.ANY);
    }

    public String getId() { return id; }
    public FilterType getFilterType() { return filterType; }
    public Pattern getRegex() { return regex; }
    public double getConfidence() { return confidence; }
    public String getDescription() { return description; }
    public @Nullable Predicate<String> getValidator() { return validator; }
    public TextTrigger getTrigger() { return trigger; }

    /**
     * Find all matches of this pattern in the text that pass the validator.
     * <p>
     * A validator that throws drops only the offending candidate. A regex failure ends this pattern's
     * iteration; matches found before it are kept.
     */
    public List<ScanMatch> findAll(String text) {
        List<ScanMatch> matches = new ArrayList<>();
        Matcher matcher = regex.matcher(text);
        while (true) {
            boolean found;
            try {
                found = matcher.find();
            } catch (RuntimeException | StackOverflowError e) {
                logger.debug("Pattern {} failed after {} matches: {}", id, matches.size(), e.toString());
                break;
            }
            if (!found) {
                break;
            }
            String matched = matcher.group();
            if (validator != null) {
                boolean valid;
                try {
                    valid = validator.test(matched);
                } catch (RuntimeException e) {
                    logger.debug("Validator of {} threw on '{}', dropping candidate", id, matched, e);
                    valid = false;
                }
                if (!valid) {
                    continue;
                }
            }
            List<String> groups = new ArrayList<>(matcher.groupCount());
            for (int i = 1; i <= matcher.groupCount(); i++) {
                groups.add(matcher.group(i));
            }
            matches.add(new ScanMatch(id, filterType, matched, matcher.start(), matcher.end(), confidence, groups));
        }
        return matches;
    }

    @Override
    public String toString() {
        return "PatternDef{" + id + ", " + filterType + ", " + confidence + "}";
    }
}
