package me.bechberger.phidetect.pipeline;

import java.util.Collections;
import java.util.List;

/**
 * Result of the most recent pipeline run: one {@link StageResult} per registered stage, in execution
 * order, plus totals.
 */
public class PipelineSummary {
    private final List<StageResult> stageResults;
    private final double totalTimeMs;
    private final int inputSpanCount;
    private final int outputSpanCount;

    public PipelineSummary(List<StageResult> stageResults, double totalTimeMs, int inputSpanCount, int outputSpanCount) {
        this.stageResults = Collections.unmodifiableList(stageResults);
        this.totalTimeMs = totalTimeMs;
        this.inputSpanCount = inputSpanCount;
        this.outputSpanCount = outputSpanCount;
    }

    public List<StageResult> getStageResults() { return stageResults; }
    public double getTotalTimeMs() { return totalTimeMs; }
    public int getInputSpanCount() { return inputSpanCount; }
    public int getOutputSpanCount() { return outputSpanCount; }

    public int getTotalStages() {
        return stageResults.size();
    }

    public int getEnabledStages() {
        return (int) stageResults.stream().filter(StageResult::isEnabled).count();
    }

    public int getDisabledStages() {
        return getTotalStages() - getEnabledStages();
    }

    public int getFailedStages() {
        return (int) stageResults.stream().filter(StageResult::isFailed).count();
    }

    public int getTotalSpansModified() {
        return stageResults.stream().mapToInt(StageResult::getSpansModified).sum();
    }

    public StageResult getStageResult(String stageName) {
        return stageResults.stream()
            .filter(r -> r.getStageName().equals(stageName))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No result for stage " + stageName));
    }
}
