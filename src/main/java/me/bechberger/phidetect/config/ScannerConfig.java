package me.bechberger.phidetect.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import me.bechberger.phidetect.model.FilterType;
import me.bechberger.phidetect.scan.MultiPatternScanner;
import me.bechberger.phidetect.scan.PatternDef;
import me.bechberger.phidetect.scan.PhiPatterns;
import me.bechberger.phidetect.scan.TextTrigger;
import me.bechberger.phidetect.util.RegexCache;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Configuration of the pattern scanner: backend, disabled categories of the built-in corpus and
 * additional custom patterns.
 */
public class ScannerConfig {

    @JsonProperty("enabled")
    private boolean enabled = true;

    /**
     * Use the parallel backend. Results are the same, only the execution differs.
     */
    @JsonProperty("accelerated")
    private boolean accelerated = false;

    @JsonProperty("threads")
    private int threads = Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));

    /**
     * Categories of the built-in corpus to leave out, e.g. {@code ZIPCODE}.
     * A {@code $PARENT} entry is replaced by the parent's list; if unset, the parent's list is used.
     */
    @JsonProperty("disabled_types")
    private @Nullable List<String> disabledTypes;

    @JsonProperty("custom")
    private List<CustomPatternConfig> custom = new ArrayList<>();

    /**
     * Additional detection pattern.
     *
     * <pre>
     * custom:
     *   - name: EMPLOYEE_ID
     *     type: CUSTOM
     *     regex: "\\bEMP-\\d{6}\\b"
     *     confidence: 0.9
     * </pre>
     */
    public static class CustomPatternConfig {
        @JsonProperty("name")
        private String name;

        @JsonProperty("type")
        private String type = FilterType.CUSTOM.name();

        @JsonProperty("regex")
        private String regex;

        @JsonProperty("confidence")
        private double confidence = 0.9;

        @JsonProperty("case_sensitive")
        private boolean caseSensitive = true;

        public CustomPatternConfig() {
        }

        public CustomPatternConfig(String name, String type, String regex, double confidence) {
            this.name = name;
            this.type = type;
            this.regex = regex;
            this.confidence = confidence;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getRegex() { return regex; }
        public void setRegex(String regex) { this.regex = regex; }

        public double getConfidence() { return confidence; }
        public void setConfidence(double confidence) { this.confidence = confidence; }

        public boolean isCaseSensitive() { return caseSensitive; }
        public void setCaseSensitive(boolean caseSensitive) { this.caseSensitive = caseSensitive; }

        PatternDef toPatternDef(RegexCache regexCache) {
            if (name == null || name.isBlank()) {
                throw new DetectionConfigException("Custom pattern without name: " + regex);
            }
            if (regex == null || regex.isEmpty()) {
                throw new DetectionConfigException("Custom pattern " + name + " has no regex");
            }
            if (confidence < 0 || confidence > 1) {
                throw new DetectionConfigException("Custom pattern " + name + " has confidence " + confidence +
                    " outside [0, 1]");
            }
            FilterType filterType;
            try {
                filterType = FilterType.fromString(type);
            } catch (IllegalArgumentException e) {
                throw new DetectionConfigException("Custom pattern " + name + " has unknown type " + type, e);
            }
            Pattern pattern;
            try {
                pattern = regexCache.getPattern(regex, caseSensitive ? 0 : Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
                throw new DetectionConfigException("Custom pattern " + name + " has an invalid regex: " +
                    e.getDescription(), e);
            }
            return new PatternDef(name, filterType, pattern, confidence, "custom pattern " + name, null, TextTrigger.ANY);
        }
    }

    private final RegexCache regexCache = new RegexCache();

    // Getters and setters
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public boolean isAccelerated() { return accelerated; }
    public void setAccelerated(boolean accelerated) { this.accelerated = accelerated; }

    public int getThreads() { return threads; }
    public void setThreads(int threads) { this.threads = threads; }

    public List<String> getDisabledTypes() { return disabledTypes != null ? disabledTypes : List.of(); }
    public void setDisabledTypes(List<String> disabledTypes) { this.disabledTypes = disabledTypes; }

    public List<CustomPatternConfig> getCustom() { return custom; }
    public void setCustom(List<CustomPatternConfig> custom) { this.custom = custom; }

    /**
     * The built-in corpus without the disabled categories, followed by the custom patterns.
     *
     * @throws DetectionConfigException if a disabled type is unknown or a custom pattern is invalid
     */
    public List<PatternDef> buildPatterns() {
        Set<FilterType> disabled = EnumSet.noneOf(FilterType.class);
        for (String type : getDisabledTypes()) {
            if (DetectionConfig.PARENT_MARKER.equals(type)) {
                continue;
            }
            try {
                disabled.add(FilterType.fromString(type));
            } catch (IllegalArgumentException e) {
                throw new DetectionConfigException("Unknown disabled type " + type, e);
            }
        }
        List<PatternDef> patterns = new ArrayList<>();
        for (PatternDef pattern : PhiPatterns.all()) {
            if (!disabled.contains(pattern.getFilterType())) {
                patterns.add(pattern);
            }
        }
        for (CustomPatternConfig customPattern : custom) {
            patterns.add(customPattern.toPatternDef(regexCache));
        }
        return patterns;
    }

    public MultiPatternScanner createScanner() {
        if (threads < 1) {
            throw new DetectionConfigException("scanner.threads must be positive, got " + threads);
        }
        return new MultiPatternScanner(buildPatterns(), accelerated, threads);
    }

    /**
     * Merge with parent configuration.
     * Custom patterns of the parent are added unless the child has one with the same name.
     */
    public void mergeWith(ScannerConfig parent) {
        if (parent == null) return;

        if (disabledTypes == null) {
            disabledTypes = new ArrayList<>(parent.getDisabledTypes());
        }
        List<String> expanded = DetectionConfig.expandParentMarkers(disabledTypes, parent.getDisabledTypes());
        if (expanded != disabledTypes) {
            disabledTypes = new ArrayList<>(new LinkedHashSet<>(expanded));
        }

        for (CustomPatternConfig customPattern : parent.getCustom()) {
            boolean exists = custom.stream()
                .anyMatch(p -> p.getName() != null && p.getName().equals(customPattern.getName()));
            if (!exists) {
                custom.add(customPattern);
            }
        }
    }
}
