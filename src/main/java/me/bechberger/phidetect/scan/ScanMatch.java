package me.bechberger.phidetect.scan;

import me.bechberger.phidetect.model.FilterType;
import me.bechberger.phidetect.model.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Raw match produced by the scanner, before it becomes a {@link Span}.
 */
public class ScanMatch {
    private final String patternId;
    private final FilterType filterType;
    private final String text;
    private final int start;
    private final int end;
    private final double confidence;
    private final List<String> groups;

    public ScanMatch(String patternId, FilterType filterType, String text, int start, int end,
                     double confidence, List<String> groups) {
        this.patternId = patternId;
        this.filterType = filterType;
        this.text = text;
        this.start = start;
        this.end = end;
        this.confidence = confidence;
        this.groups = Collections.unmodifiableList(new ArrayList<>(groups));
    }

    public String getPatternId() { return patternId; }
    public FilterType getFilterType() { return filterType; }
    public String getText() { return text; }
    public int getStart() { return start; }
    public int getEnd() { return end; }
    public double getConfidence() { return confidence; }
    public List<String> getGroups() { return groups; }

    public Span toSpan() {
        return new Span(filterType, text, start, end, confidence, patternId, groups);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScanMatch that = (ScanMatch) o;
        return start == that.start && end == that.end
            && Double.compare(that.confidence, confidence) == 0
            && patternId.equals(that.patternId)
            && filterType == that.filterType
            && text.equals(that.text)
            && groups.equals(that.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patternId, filterType, text, start, end, confidence, groups);
    }

    @Override
    public String toString() {
        return String.format("ScanMatch{%s, type=%s, text='%s', pos=%d-%d}", patternId, filterType, text, start, end);
    }
}
