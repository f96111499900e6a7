package me.bechberger.phidetect.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import me.bechberger.phidetect.pipeline.stages.ContextModifierStage;
import me.bechberger.phidetect.pipeline.stages.ContextRule;
import me.bechberger.phidetect.util.RegexCache;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Label patterns checked against the text right before a span.
 *
 * Patterns are regexes matched anywhere in the preceding window (case-insensitive by default), so
 * they usually end in {@code $}. For example, boost pattern {@code "ssn\\s*:?\\s*$"} matches a span
 * preceded by:
 * - "SSN: "
 * - "ssn"
 * - "Patient SSN :"
 *
 * The lists are ordered: per list, the first matching pattern wins.
 */
public class ContextPatternConfig {

    @JsonProperty("case_sensitive")
    private boolean caseSensitive = false;

    /**
     * Number of characters before the span that are inspected.
     */
    @JsonProperty("window")
    private int window = ContextModifierStage.DEFAULT_WINDOW;

    static final List<RuleConfig> DEFAULT_BOOST = RuleConfig.of(ContextModifierStage.DEFAULT_BOOSTS);

    static final List<RuleConfig> DEFAULT_REDUCE = RuleConfig.of(ContextModifierStage.DEFAULT_REDUCTIONS);

    /**
     * Null until set, so that an unset list is inherited from the parent.
     */
    @JsonProperty("boost")
    private @Nullable List<RuleConfig> boost;

    @JsonProperty("reduce")
    private @Nullable List<RuleConfig> reduce;

    private final RegexCache regexCache = new RegexCache();

    /**
     * A pattern with the amount it adds (boost) or removes (reduce).
     */
    public static class RuleConfig {
        @JsonProperty("regex")
        private String regex;

        @JsonProperty("amount")
        private double amount;

        public RuleConfig() {
        }

        public RuleConfig(String regex, double amount) {
            this.regex = regex;
            this.amount = amount;
        }

        static List<RuleConfig> of(List<ContextRule> rules) {
            return rules.stream()
                .map(rule -> new RuleConfig(rule.getPattern().pattern(), rule.getAmount()))
                .collect(Collectors.toUnmodifiableList());
        }

        public String getRegex() { return regex; }
        public void setRegex(String regex) { this.regex = regex; }

        public double getAmount() { return amount; }
        public void setAmount(double amount) { this.amount = amount; }

        boolean isParentMarker() {
            return DetectionConfig.PARENT_MARKER.equals(regex);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof RuleConfig)) return false;
            RuleConfig other = (RuleConfig) o;
            return Objects.equals(regex, other.regex) && Double.compare(amount, other.amount) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(regex, amount);
        }
    }

    // Getters and setters
    public boolean isCaseSensitive() { return caseSensitive; }
    public void setCaseSensitive(boolean caseSensitive) { this.caseSensitive = caseSensitive; }

    public int getWindow() { return window; }
    public void setWindow(int window) { this.window = window; }

    public List<RuleConfig> getBoost() { return boost != null ? boost : DEFAULT_BOOST; }
    public void setBoost(List<RuleConfig> boost) { this.boost = boost; }

    public List<RuleConfig> getReduce() { return reduce != null ? reduce : DEFAULT_REDUCE; }
    public void setReduce(List<RuleConfig> reduce) { this.reduce = reduce; }

    public List<ContextRule> boostRules() {
        return toRules(getBoost());
    }

    public List<ContextRule> reduceRules() {
        return toRules(getReduce());
    }

    /**
     * Compile the rules. A pattern that is not a valid regex is matched as literal text.
     */
    private List<ContextRule> toRules(List<RuleConfig> rules) {
        int flags = caseSensitive ? 0 : Pattern.CASE_INSENSITIVE;
        List<ContextRule> result = new ArrayList<>(rules.size());
        for (RuleConfig rule : rules) {
            if (rule.getRegex() == null || rule.isParentMarker()) {
                continue;
            }
            result.add(new ContextRule(regexCache.getPatternOrLiteral(rule.getRegex(), flags), rule.getAmount()));
        }
        return result;
    }

    public ContextModifierStage createStage() {
        if (window < 0) {
            throw new DetectionConfigException("context.window must not be negative, got " + window);
        }
        return new ContextModifierStage(boostRules(), reduceRules(), window);
    }

    /**
     * Merge with parent configuration.
     *
     * <p>List inheritance behavior:</p>
     * <ul>
     *   <li>If a child list is not set, the parent's list is used</li>
     *   <li>If a child list contains an entry with regex "$PARENT", it's expanded with the parent's entries</li>
     *   <li>Otherwise, the child list completely overrides the parent list</li>
     * </ul>
     */
    public void mergeWith(ContextPatternConfig parent) {
        if (parent == null) return;
        boost = expand(boost, parent.getBoost());
        reduce = expand(reduce, parent.getReduce());
    }

    private static List<RuleConfig> expand(@Nullable List<RuleConfig> child, List<RuleConfig> parent) {
        if (child == null) {
            return new ArrayList<>(parent);
        }
        if (child.stream().noneMatch(RuleConfig::isParentMarker)) {
            return child;
        }
        LinkedHashSet<RuleConfig> result = new LinkedHashSet<>();
        for (RuleConfig rule : child) {
            if (rule.isParentMarker()) {
                result.addAll(parent);
            } else {
                result.add(rule);
            }
        }
        return new ArrayList<>(result);
    }
}
