package me.bechberger.phidetect.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Main detection configuration with parent inheritance support.
 */
public class DetectionConfig {

    /** List entry standing for the parent's entries. */
    public static final String PARENT_MARKER = "$PARENT";

    @JsonProperty("parent")
    private String parent = "none";

    @JsonProperty("scanner")
    private ScannerConfig scanner = new ScannerConfig();

    @JsonProperty("dictionaries")
    private List<DictionaryConfig> dictionaries = new ArrayList<>();

    @JsonProperty("pipeline")
    private PipelineConfig pipeline = new PipelineConfig();

    @JsonProperty("context")
    private ContextPatternConfig context = new ContextPatternConfig();

    // Getters and setters
    public String getParent() { return parent; }
    public void setParent(String parent) { this.parent = parent; }

    public ScannerConfig getScanner() { return scanner; }
    public void setScanner(ScannerConfig scanner) { this.scanner = scanner; }

    public List<DictionaryConfig> getDictionaries() { return dictionaries; }
    public void setDictionaries(List<DictionaryConfig> dictionaries) { this.dictionaries = dictionaries; }

    public PipelineConfig getPipeline() { return pipeline; }
    public void setPipeline(PipelineConfig pipeline) { this.pipeline = pipeline; }

    public ContextPatternConfig getContext() { return context; }
    public void setContext(ContextPatternConfig context) { this.context = context; }

    public boolean hasParent() {
        return parent != null && !parent.isBlank() && !"none".equalsIgnoreCase(parent);
    }

    /**
     * Merge this configuration with a parent configuration.
     * Child values override parent values. Dictionaries of the parent are added unless the child
     * defines one with the same name.
     *
     * @param parentConfig The parent configuration
     */
    public void mergeWith(DetectionConfig parentConfig) {
        if (parentConfig == null) return;

        scanner.mergeWith(parentConfig.getScanner());
        pipeline.mergeWith(parentConfig.getPipeline());
        context.mergeWith(parentConfig.getContext());

        List<DictionaryConfig> merged = new ArrayList<>();
        for (DictionaryConfig inherited : parentConfig.getDictionaries()) {
            boolean overridden = dictionaries.stream()
                .anyMatch(d -> d.getName() != null && d.getName().equals(inherited.getName()));
            if (!overridden) {
                merged.add(inherited);
            }
        }
        merged.addAll(dictionaries);
        dictionaries = merged;
    }

    /**
     * Replace every {@value #PARENT_MARKER} entry of the child list with the parent list.
     *
     * @return the child list itself if it contains no marker, a new list otherwise
     */
    public static List<String> expandParentMarkers(List<String> child, List<String> parent) {
        if (child == null || !child.contains(PARENT_MARKER)) {
            return child;
        }
        List<String> result = new ArrayList<>();
        for (String entry : child) {
            if (PARENT_MARKER.equals(entry)) {
                result.addAll(parent);
            } else {
                result.add(entry);
            }
        }
        return result;
    }
}
