package me.bechberger.phidetect.pipeline;

/**
 * Impact of one stage in one pipeline run.
 */
public class StageResult {
    private final String stageName;
    private final int inputSpans;
    private final int outputSpans;
    private final int spansModified;
    private final double avgConfidenceChange;
    private final double executionTimeMs;
    private final boolean enabled;
    private final boolean failed;

    public StageResult(String stageName, int inputSpans, int outputSpans, int spansModified,
                       double avgConfidenceChange, double executionTimeMs, boolean enabled, boolean failed) {
        this.stageName = stageName;
        this.inputSpans = inputSpans;
        this.outputSpans = outputSpans;
        this.spansModified = spansModified;
        this.avgConfidenceChange = avgConfidenceChange;
        this.executionTimeMs = executionTimeMs;
        this.enabled = enabled;
        this.failed = failed;
    }

    static StageResult skipped(String stageName) {
        return new StageResult(stageName, 0, 0, 0, 0.0, 0.0, false, false);
    }

    static StageResult failed(String stageName, int spans, double executionTimeMs) {
        return new StageResult(stageName, spans, spans, 0, 0.0, executionTimeMs, true, true);
    }

    public String getStageName() { return stageName; }
    public int getInputSpans() { return inputSpans; }
    public int getOutputSpans() { return outputSpans; }

    /** Spans whose confidence moved by more than 0.001. */
    public int getSpansModified() { return spansModified; }
    public double getAvgConfidenceChange() { return avgConfidenceChange; }
    public double getExecutionTimeMs() { return executionTimeMs; }
    public boolean isEnabled() { return enabled; }
    public boolean isFailed() { return failed; }

    @Override
    public String toString() {
        if (!enabled) {
            return stageName + ": skipped";
        }
        return String.format("%s: %d -> %d spans, %d modified, avg change %.4f, %.2f ms%s",
            stageName, inputSpans, outputSpans, spansModified, avgConfidenceChange, executionTimeMs,
            failed ? " (failed)" : "");
    }
}
