package me.bechberger.phidetect.pipeline.stages;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A pattern tested against the text just before a span, and the confidence amount it adds or removes.
 */
public final class ContextRule {
    private final Pattern pattern;
    private final double amount;

    public ContextRule(Pattern pattern, double amount) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.amount = amount;
    }

    /**
     * Rule matching the keyword at the very end of the preceding text, optionally followed by a colon.
     */
    public static ContextRule trailingLabel(String keyword, double amount) {
        return new ContextRule(Pattern.compile(keyword + "\\s*:?\\s*$", Pattern.CASE_INSENSITIVE), amount);
    }

    public boolean matches(CharSequence precedingText) {
        return pattern.matcher(precedingText).find();
    }

    public Pattern getPattern() { return pattern; }
    public double getAmount() { return amount; }

    @Override
    public String toString() {
        return "ContextRule{" + pattern.pattern() + ", " + amount + "}";
    }
}
