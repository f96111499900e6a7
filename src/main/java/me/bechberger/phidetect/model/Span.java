package me.bechberger.phidetect.model;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A detected entity in a document: a half-open character range tagged with a
 * {@link FilterType} and a confidence.
 * <p>
 * Spans are created by the scanner or a dictionary detector and mutated in place by the
 * confidence pipeline. Confidence is clamped to [0, 1] on every write.
 */
public class Span {

    private final FilterType filterType;
    private final String text;
    private final int start;
    private final int end;
    private final @Nullable String pattern;
    private final List<String> groups;
    private final Set<FilterType> ambiguousWith = new LinkedHashSet<>();
    private double confidence;

    public Span(FilterType filterType, String text, int start, int end, double confidence,
                @Nullable String pattern, List<String> groups) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span range [" + start + ", " + end + ")");
        }
        this.filterType = Objects.requireNonNull(filterType, "filterType");
        this.text = Objects.requireNonNull(text, "text");
        this.start = start;
        this.end = end;
        this.pattern = pattern;
        this.groups = groups != null ? new ArrayList<>(groups) : new ArrayList<>();
        setConfidence(confidence);
    }

    public Span(FilterType filterType, String text, int start, int end, double confidence, @Nullable String pattern) {
        this(filterType, text, start, end, confidence, pattern, List.of());
    }

    public FilterType getFilterType() { return filterType; }
    public String getText() { return text; }
    public int getStart() { return start; }
    public int getEnd() { return end; }
    public @Nullable String getPattern() { return pattern; }
    public double getConfidence() { return confidence; }

    /**
     * Capture groups of the originating pattern match; entries may be null for groups that did not participate.
     */
    public List<String> getGroups() {
        return Collections.unmodifiableList(groups);
    }

    public Set<FilterType> getAmbiguousWith() {
        return Collections.unmodifiableSet(ambiguousWith);
    }

    public void setConfidence(double confidence) {
        this.confidence = clamp(confidence);
    }

    /**
     * Record that this span competes with another category. Idempotent.
     *
     * @return true if the category was not recorded before
     */
    public boolean addAmbiguousWith(FilterType other) {
        return ambiguousWith.add(other);
    }

    void replaceAmbiguousWith(Set<FilterType> types) {
        ambiguousWith.clear();
        ambiguousWith.addAll(types);
    }

    public int length() {
        return end - start;
    }

    public boolean overlapsWith(Span other) {
        return !(end <= other.start || start >= other.end);
    }

    public boolean isIdenticalTo(Span other) {
        return start == other.start && end == other.end;
    }

    public boolean contains(Span other) {
        return start <= other.start && end >= other.end;
    }

    public Span copy() {
        Span copy = new Span(filterType, text, start, end, confidence, pattern, groups);
        copy.ambiguousWith.addAll(ambiguousWith);
        return copy;
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public String toString() {
        return String.format("Span{type=%s, text='%s', pos=%d-%d, confidence=%.4f}",
            filterType, text, start, end, confidence);
    }
}
