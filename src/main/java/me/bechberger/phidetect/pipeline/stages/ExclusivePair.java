package me.bechberger.phidetect.pipeline.stages;

import me.bechberger.phidetect.model.FilterType;

import java.util.Objects;

/**
 * Two categories that cannot both describe the same text range. On equal confidence the
 * {@linkplain #getFirst() first} category wins.
 */
public final class ExclusivePair {
    private final FilterType first;
    private final FilterType second;

    public ExclusivePair(FilterType first, FilterType second) {
        this.first = Objects.requireNonNull(first, "first");
        this.second = Objects.requireNonNull(second, "second");
        if (first == second) {
            throw new IllegalArgumentException("A category cannot exclude itself: " + first);
        }
    }

    public static ExclusivePair of(FilterType first, FilterType second) {
        return new ExclusivePair(first, second);
    }

    /**
     * Parse {@code "SSN/PHONE"}.
     */
    public static ExclusivePair parse(String pair) {
        String[] parts = pair.split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected TYPE/TYPE but got '" + pair + "'");
        }
        return new ExclusivePair(FilterType.fromString(parts[0]), FilterType.fromString(parts[1]));
    }

    public FilterType getFirst() { return first; }
    public FilterType getSecond() { return second; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExclusivePair)) return false;
        ExclusivePair that = (ExclusivePair) o;
        return first == that.first && second == that.second;
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return first + "/" + second;
    }
}
