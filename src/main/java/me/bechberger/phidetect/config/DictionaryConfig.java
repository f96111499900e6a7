package me.bechberger.phidetect.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import me.bechberger.phidetect.fuzzy.DictionarySpanDetector;
import me.bechberger.phidetect.fuzzy.FuzzyMatcher;
import me.bechberger.phidetect.fuzzy.FuzzyMatcherConfig;
import me.bechberger.phidetect.fuzzy.FuzzyMatchers;
import me.bechberger.phidetect.model.FilterType;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A dictionary of terms matched fuzzily against the words of a document.
 *
 * <pre>
 * dictionaries:
 *   - name: first_names
 *     type: NAME
 *     preset: first_names
 *     terms: [John, Jane, Jonathan]
 *     terms_file: /data/first-names.txt   # one term per line, '#' starts a comment
 *     min_confidence: 0.7
 * </pre>
 *
 * Unset matcher parameters come from the preset ({@code default}, {@code first_names},
 * {@code surnames}, {@code locations} or {@code strict}).
 */
public class DictionaryConfig {

    private static final Logger logger = LoggerFactory.getLogger(DictionaryConfig.class);

    @JsonProperty("name")
    private String name;

    @JsonProperty("enabled")
    private boolean enabled = true;

    @JsonProperty("type")
    private String type = FilterType.NAME.name();

    @JsonProperty("preset")
    private String preset = "default";

    @JsonProperty("terms")
    private List<String> terms = new ArrayList<>();

    @JsonProperty("terms_file")
    private @Nullable String termsFile;

    @JsonProperty("max_edit_distance")
    private @Nullable Integer maxEditDistance;

    @JsonProperty("enable_phonetic")
    private @Nullable Boolean enablePhonetic;

    @JsonProperty("min_term_length")
    private @Nullable Integer minTermLength;

    @JsonProperty("cache_size")
    private @Nullable Integer cacheSize;

    @JsonProperty("accelerated")
    private boolean accelerated = false;

    @JsonProperty("min_confidence")
    private double minConfidence = 0.7;

    // Getters and setters
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getPreset() { return preset; }
    public void setPreset(String preset) { this.preset = preset; }

    public List<String> getTerms() { return terms; }
    public void setTerms(List<String> terms) { this.terms = terms; }

    public @Nullable String getTermsFile() { return termsFile; }
    public void setTermsFile(@Nullable String termsFile) { this.termsFile = termsFile; }

    public @Nullable Integer getMaxEditDistance() { return maxEditDistance; }
    public void setMaxEditDistance(@Nullable Integer maxEditDistance) { this.maxEditDistance = maxEditDistance; }

    public @Nullable Boolean getEnablePhonetic() { return enablePhonetic; }
    public void setEnablePhonetic(@Nullable Boolean enablePhonetic) { this.enablePhonetic = enablePhonetic; }

    public @Nullable Integer getMinTermLength() { return minTermLength; }
    public void setMinTermLength(@Nullable Integer minTermLength) { this.minTermLength = minTermLength; }

    public @Nullable Integer getCacheSize() { return cacheSize; }
    public void setCacheSize(@Nullable Integer cacheSize) { this.cacheSize = cacheSize; }

    public boolean isAccelerated() { return accelerated; }
    public void setAccelerated(boolean accelerated) { this.accelerated = accelerated; }

    public double getMinConfidence() { return minConfidence; }
    public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }

    /**
     * Matcher parameters: the preset, overridden by explicitly set values.
     */
    public FuzzyMatcherConfig toMatcherConfig() {
        FuzzyMatcherConfig base;
        switch (preset == null ? "default" : preset.toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "default":
                base = FuzzyMatcherConfig.defaults();
                break;
            case "first_names":
                base = FuzzyMatcherConfig.forFirstNames();
                break;
            case "surnames":
                base = FuzzyMatcherConfig.forSurnames();
                break;
            case "locations":
                base = FuzzyMatcherConfig.forLocations();
                break;
            case "strict":
                base = FuzzyMatcherConfig.strict();
                break;
            default:
                throw new DetectionConfigException("Unknown preset '" + preset + "' for dictionary " + name);
        }
        try {
            return new FuzzyMatcherConfig(
                maxEditDistance != null ? maxEditDistance : base.getMaxEditDistance(),
                enablePhonetic != null ? enablePhonetic : base.isEnablePhonetic(),
                minTermLength != null ? minTermLength : base.getMinTermLength(),
                cacheSize != null ? cacheSize : base.getCacheSize(),
                accelerated);
        } catch (IllegalArgumentException e) {
            throw new DetectionConfigException("Invalid matcher settings for dictionary " + name + ": " + e.getMessage(), e);
        }
    }

    /**
     * Inline terms followed by the terms of {@code terms_file}.
     */
    public List<String> resolveTerms() {
        List<String> all = new ArrayList<>(terms);
        if (termsFile != null) {
            try {
                for (String line : Files.readAllLines(Path.of(termsFile), StandardCharsets.UTF_8)) {
                    String term = line.strip();
                    if (!term.isEmpty() && !term.startsWith("#")) {
                        all.add(term);
                    }
                }
            } catch (IOException e) {
                throw new DetectionConfigException("Cannot read terms of dictionary " + name + " from " + termsFile, e);
            }
        }
        return all;
    }

    public DictionarySpanDetector createDetector() {
        if (name == null || name.isBlank()) {
            throw new DetectionConfigException("Dictionary without name");
        }
        FilterType filterType;
        try {
            filterType = FilterType.fromString(type);
        } catch (IllegalArgumentException e) {
            throw new DetectionConfigException("Dictionary " + name + " has unknown type " + type, e);
        }
        List<String> allTerms = resolveTerms();
        FuzzyMatcher matcher = FuzzyMatchers.create(allTerms, toMatcherConfig());
        logger.info("Loaded dictionary {} ({}): {} terms, {} index keys", name, filterType, matcher.size(),
            matcher.indexSize());
        return new DictionarySpanDetector(name, filterType, matcher, minConfidence);
    }
}
