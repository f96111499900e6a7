package me.bechberger.phidetect.scan;

import java.util.Collections;
import java.util.List;

/**
 * Matches of one scan call together with the statistics of that call.
 */
public class ScanResult {

    /**
     * Statistics of a single scan call.
     */
    public static class ScanStats {
        private final int textLength;
        private final int patternsChecked;
        private final int matchesFound;
        private final double scanTimeMs;

        public ScanStats(int textLength, int patternsChecked, int matchesFound, double scanTimeMs) {
            this.textLength = textLength;
            this.patternsChecked = patternsChecked;
            this.matchesFound = matchesFound;
            this.scanTimeMs = scanTimeMs;
        }

        public int getTextLength() { return textLength; }
        public int getPatternsChecked() { return patternsChecked; }
        public int getMatchesFound() { return matchesFound; }
        public double getScanTimeMs() { return scanTimeMs; }
    }

    private final List<ScanMatch> matches;
    private final ScanStats stats;

    public ScanResult(List<ScanMatch> matches, ScanStats stats) {
        this.matches = Collections.unmodifiableList(matches);
        this.stats = stats;
    }

    public List<ScanMatch> getMatches() { return matches; }
    public ScanStats getStats() { return stats; }
}
