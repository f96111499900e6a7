package me.bechberger.phidetect.scan;

import me.bechberger.phidetect.model.FilterType;

import java.util.Collections;
import java.util.Map;

/**
 * Aggregate scanner statistics. Values are read from concurrent counters and may be
 * slightly out of step with each other under concurrent scans.
 */
public class ScannerStats {
    private final long totalScans;
    private final long totalMatches;
    private final double avgTimeMs;
    private final long acceleratedScans;
    private final long referenceScans;
    private final boolean accelerated;
    private final Map<FilterType, Integer> patternsByType;

    public ScannerStats(long totalScans, long totalMatches, double avgTimeMs, long acceleratedScans,
                        long referenceScans, boolean accelerated, Map<FilterType, Integer> patternsByType) {
        this.totalScans = totalScans;
        this.totalMatches = totalMatches;
        this.avgTimeMs = avgTimeMs;
        this.acceleratedScans = acceleratedScans;
        this.referenceScans = referenceScans;
        this.accelerated = accelerated;
        this.patternsByType = Collections.unmodifiableMap(patternsByType);
    }

    public long getTotalScans() { return totalScans; }
    public long getTotalMatches() { return totalMatches; }
    public double getAvgTimeMs() { return avgTimeMs; }
    public long getAcceleratedScans() { return acceleratedScans; }
    public long getReferenceScans() { return referenceScans; }
    public boolean isAccelerated() { return accelerated; }
    public Map<FilterType, Integer> getPatternsByType() { return patternsByType; }

    public int getTotalPatterns() {
        return patternsByType.values().stream().mapToInt(Integer::intValue).sum();
    }
}
