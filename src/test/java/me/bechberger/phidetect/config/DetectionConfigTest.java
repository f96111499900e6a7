package me.bechberger.phidetect.config;

import me.bechberger.phidetect.fuzzy.FuzzyMatchResult;
import me.bechberger.phidetect.fuzzy.FuzzyMatcherConfig;
import me.bechberger.phidetect.fuzzy.DictionarySpanDetector;
import me.bechberger.phidetect.model.FilterType;
import me.bechberger.phidetect.pipeline.ConfidencePipeline;
import me.bechberger.phidetect.pipeline.StageSettings;
import me.bechberger.phidetect.pipeline.stages.ContextModifierStage;
import me.bechberger.phidetect.pipeline.stages.ContextRule;
import me.bechberger.phidetect.pipeline.stages.ExclusivePair;
import me.bechberger.phidetect.scan.MultiPatternScanner;
import me.bechberger.phidetect.scan.PatternDef;
import me.bechberger.phidetect.scan.ScanMatch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the configuration classes and how they build detector components.
 */
public class DetectionConfigTest {

    // ========== $PARENT Expansion ==========

    @Test
    public void testExpandParentMarkers() {
        List<String> child = new ArrayList<>(List.of("A", "$PARENT", "B"));

        assertEquals(List.of("A", "X", "Y", "B"), DetectionConfig.expandParentMarkers(child, List.of("X", "Y")));
    }

    @Test
    public void testNoMarkerKeepsChildList() {
        List<String> child = new ArrayList<>(List.of("A"));

        assertSame(child, DetectionConfig.expandParentMarkers(child, List.of("X")));
    }

    // ========== Scanner ==========

    @Test
    public void testDisabledTypes() {
        ScannerConfig config = new ScannerConfig();
        config.setDisabledTypes(List.of("zipcode", "Credit-Card"));

        List<PatternDef> patterns = config.buildPatterns();

        assertFalse(patterns.isEmpty());
        assertTrue(patterns.stream().noneMatch(p -> p.getFilterType() == FilterType.ZIPCODE));
        assertTrue(patterns.stream().noneMatch(p -> p.getFilterType() == FilterType.CREDIT_CARD));
    }

    @Test
    public void testUnknownDisabledType() {
        ScannerConfig config = new ScannerConfig();
        config.setDisabledTypes(List.of("SOCIAL"));

        assertThrows(DetectionConfigException.class, config::buildPatterns);
    }

    @Test
    public void testCustomPattern() {
        ScannerConfig config = new ScannerConfig();
        config.setCustom(new ArrayList<>(List.of(
            new ScannerConfig.CustomPatternConfig("EMPLOYEE_ID", "custom", "\\bEMP-\\d{6}\\b", 0.85))));

        try (MultiPatternScanner scanner = config.createScanner()) {
            List<ScanMatch> matches = scanner.scanForTypes("Badge EMP-123456 issued", List.of(FilterType.CUSTOM))
                .getMatches();
            assertEquals(1, matches.size());
            assertEquals("EMPLOYEE_ID", matches.get(0).getPatternId());
            assertEquals("EMP-123456", matches.get(0).getText());
            assertEquals(0.85, matches.get(0).getConfidence());
        }
    }

    @Test
    public void testInvalidCustomPatterns() {
        assertInvalidCustomPattern(new ScannerConfig.CustomPatternConfig("BROKEN", "custom", "([a-z", 0.9));
        assertInvalidCustomPattern(new ScannerConfig.CustomPatternConfig(null, "custom", "x", 0.9));
        assertInvalidCustomPattern(new ScannerConfig.CustomPatternConfig("EMPTY", "custom", "", 0.9));
        assertInvalidCustomPattern(new ScannerConfig.CustomPatternConfig("HIGH", "custom", "x", 1.5));
        assertInvalidCustomPattern(new ScannerConfig.CustomPatternConfig("TYPE", "nonsense", "x", 0.9));
    }

    private static void assertInvalidCustomPattern(ScannerConfig.CustomPatternConfig pattern) {
        ScannerConfig config = new ScannerConfig();
        config.setCustom(new ArrayList<>(List.of(pattern)));
        assertThrows(DetectionConfigException.class, config::buildPatterns);
    }

    @Test
    public void testInvalidThreads() {
        ScannerConfig config = new ScannerConfig();
        config.setThreads(0);

        assertThrows(DetectionConfigException.class, config::createScanner);
    }

    @Test
    public void testScannerMerge() {
        ScannerConfig parent = new ScannerConfig();
        parent.setDisabledTypes(List.of("ZIPCODE"));
        parent.setCustom(new ArrayList<>(List.of(
            new ScannerConfig.CustomPatternConfig("A", "custom", "a", 0.9),
            new ScannerConfig.CustomPatternConfig("B", "custom", "b", 0.9))));
        ScannerConfig child = new ScannerConfig();
        child.setDisabledTypes(List.of("$PARENT", "IP", "ZIPCODE"));
        child.setCustom(new ArrayList<>(List.of(new ScannerConfig.CustomPatternConfig("B", "custom", "bb", 0.5))));

        child.mergeWith(parent);

        assertEquals(List.of("ZIPCODE", "IP"), child.getDisabledTypes());
        assertEquals(2, child.getCustom().size());
        assertEquals("bb", child.getCustom().stream().filter(p -> p.getName().equals("B")).findFirst()
            .orElseThrow().getRegex());
    }

    // ========== Dictionaries ==========

    @Test
    public void testMatcherPresetsAndOverrides() {
        DictionaryConfig config = new DictionaryConfig();
        config.setName("first_names");
        config.setPreset("first-names");
        config.setMaxEditDistance(1);

        FuzzyMatcherConfig matcherConfig = config.toMatcherConfig();

        assertEquals(1, matcherConfig.getMaxEditDistance());
        assertTrue(matcherConfig.isEnablePhonetic());
        assertEquals(2, matcherConfig.getMinTermLength());
        assertEquals(5000, matcherConfig.getCacheSize());
        assertFalse(matcherConfig.isAccelerated());
    }

    @Test
    public void testUnknownMatcherPreset() {
        DictionaryConfig config = new DictionaryConfig();
        config.setName("x");
        config.setPreset("fuzzy");

        assertThrows(DetectionConfigException.class, config::toMatcherConfig);
    }

    @Test
    public void testTermsFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("cities.txt");
        Files.writeString(file, "# US cities\nBoston\n\n  Springfield  \n#Houston\n");
        DictionaryConfig config = new DictionaryConfig();
        config.setName("cities");
        config.setType("city");
        config.setPreset("locations");
        config.setTerms(List.of("Austin"));
        config.setTermsFile(file.toString());

        assertEquals(List.of("Austin", "Boston", "Springfield"), config.resolveTerms());

        DictionarySpanDetector detector = config.createDetector();
        assertEquals(FilterType.CITY, detector.getFilterType());
        assertEquals(3, detector.getMatcher().size());
        assertFalse(detector.getMatcher().has("Houston"));
        assertEquals(FuzzyMatchResult.MatchType.DELETE_1, detector.getMatcher().lookup("Bostn").getMatchType());
    }

    @Test
    public void testMissingTermsFile(@TempDir Path dir) {
        DictionaryConfig config = new DictionaryConfig();
        config.setName("missing");
        config.setTermsFile(dir.resolve("missing.txt").toString());

        assertThrows(DetectionConfigException.class, config::resolveTerms);
    }

    @Test
    public void testDictionaryWithoutName() {
        assertThrows(DetectionConfigException.class, () -> new DictionaryConfig().createDetector());
    }

    @Test
    public void testDictionaryMerge() {
        DetectionConfig parent = new DetectionConfig();
        parent.setDictionaries(List.of(dictionary("first_names", "John"), dictionary("surnames", "Smith")));
        DetectionConfig child = new DetectionConfig();
        child.setDictionaries(List.of(dictionary("surnames", "Miller"), dictionary("cities", "Boston")));

        child.mergeWith(parent);

        assertEquals(List.of("first_names", "surnames", "cities"),
            child.getDictionaries().stream().map(DictionaryConfig::getName).collect(Collectors.toList()));
        assertEquals(List.of("Miller"), child.getDictionaries().get(1).getTerms());
    }

    private static DictionaryConfig dictionary(String name, String term) {
        DictionaryConfig config = new DictionaryConfig();
        config.setName(name);
        config.setTerms(List.of(term));
        return config;
    }

    // ========== Pipeline ==========

    @Test
    public void testPipelineMerge() {
        PipelineConfig parent = new PipelineConfig();
        parent.setStages(Map.of("calibration", StageSettings.of(false, 60), "spanEnhancer", StageSettings.enabled(false)));
        PipelineConfig child = new PipelineConfig();
        child.setStages(Map.of("calibration", StageSettings.priority(70)));
        child.setExclusivePairs(List.of("$PARENT", "SSN/PHONE", "NAME/PROVIDER_NAME"));

        child.mergeWith(parent);

        assertEquals(StageSettings.of(false, 70), child.getStages().get("calibration"));
        assertEquals(StageSettings.enabled(false), child.getStages().get("spanEnhancer"));
        assertEquals(List.of("DATE/AGE_90_PLUS", "SSN/PHONE", "MRN/ZIPCODE", "NAME/PROVIDER_NAME"),
            child.getExclusivePairs());
        assertEquals(ExclusivePair.of(FilterType.NAME, FilterType.PROVIDER_NAME), child.parseExclusivePairs().get(3));
    }

    @Test
    public void testCreatePipeline() {
        PipelineConfig config = new PipelineConfig();
        config.setStages(Map.of("calibration", StageSettings.enabled(false)));

        ConfidencePipeline pipeline = config.createPipeline(new ContextPatternConfig(), null);

        assertEquals(7, pipeline.getStageNames().size());
        assertFalse(pipeline.isStageEnabled("calibration"));
        assertFalse(pipeline.isStageEnabled("contextualConfidence"));
    }

    @Test
    public void testInvalidPipelineSettings() {
        PipelineConfig pairs = new PipelineConfig();
        pairs.setExclusivePairs(List.of("SSN-PHONE"));
        assertThrows(DetectionConfigException.class, () -> pairs.createPipeline(new ContextPatternConfig(), null));

        PipelineConfig band = new PipelineConfig();
        band.setBorderlineMin(0.9);
        assertThrows(DetectionConfigException.class, () -> band.createPipeline(new ContextPatternConfig(), null));
    }

    // ========== Context Patterns ==========

    @Test
    public void testDefaultContextRulesMatchStageDefaults() {
        ContextModifierStage stage = new ContextPatternConfig().createStage();

        assertEquals(describe(ContextModifierStage.DEFAULT_BOOSTS), describe(stage.getBoosts()));
        assertEquals(describe(ContextModifierStage.DEFAULT_REDUCTIONS), describe(stage.getReductions()));
        assertEquals(ContextModifierStage.DEFAULT_WINDOW, stage.getWindow());
    }

    @Test
    public void testParentMarkerInContextRules() {
        ContextPatternConfig parent = new ContextPatternConfig();
        ContextPatternConfig child = new ContextPatternConfig();
        child.setBoost(List.of(
            new ContextPatternConfig.RuleConfig("member\\s*:?\\s*$", 0.1),
            new ContextPatternConfig.RuleConfig(DetectionConfig.PARENT_MARKER, 0)));

        child.mergeWith(parent);

        assertEquals(6, child.getBoost().size());
        assertEquals("member\\s*:?\\s*$", child.getBoost().get(0).getRegex());
        assertEquals("patient\\s*:?\\s*$", child.getBoost().get(1).getRegex());
        assertEquals(6, child.boostRules().size());
    }

    private static List<String> describe(List<ContextRule> rules) {
        return rules.stream()
            .map(rule -> rule.getPattern().pattern() + "/" + rule.getPattern().flags() + "/" + rule.getAmount())
            .collect(Collectors.toList());
    }

    @Test
    public void testInvalidContextRegexIsMatchedLiterally() {
        ContextPatternConfig config = new ContextPatternConfig();
        config.setBoost(List.of(new ContextPatternConfig.RuleConfig("(ssn", 0.2)));

        ContextModifierStage stage = config.createStage();

        assertEquals(1, stage.getBoosts().size());
        assertTrue(stage.getBoosts().get(0).matches("Patient (SSN"));
        assertFalse(stage.getBoosts().get(0).matches("Patient SSN"));
    }

    @Test
    public void testCaseSensitiveContext() {
        ContextPatternConfig config = new ContextPatternConfig();
        config.setCaseSensitive(true);

        assertFalse(config.boostRules().get(0).matches("Patient: "));
        assertTrue(config.boostRules().get(0).matches("patient: "));
    }

    @Test
    public void testNegativeWindow() {
        ContextPatternConfig config = new ContextPatternConfig();
        config.setWindow(-1);

        assertThrows(DetectionConfigException.class, config::createStage);
    }

    @Test
    public void testContextMergeWithoutMarkerReplaces() {
        ContextPatternConfig parent = new ContextPatternConfig();
        ContextPatternConfig child = new ContextPatternConfig();
        child.setReduce(List.of(new ContextPatternConfig.RuleConfig("clinic\\s*:?\\s*$", 0.1)));

        child.mergeWith(parent);

        assertEquals(1, child.getReduce().size());
        assertEquals(5, child.getBoost().size());
    }
}
