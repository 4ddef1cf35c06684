package com.casefile.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable progress value streamed once per pipeline transition.
 *
 * <p>Every mutator returns a new snapshot; nothing is updated in place, so a snapshot
 * handed to a subscriber can never change underneath it.
 *
 * <p>A terminal snapshot either carries a {@link DetectiveReport} (state {@code complete})
 * or a user-facing {@code message} (state {@code ready} after an abort).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunSnapshot(
    @JsonProperty("runId")        String runId,
    @JsonProperty("state")        PipelineState state,
    @JsonProperty("steps")        List<StepProgress> steps,
    @JsonProperty("demoMode")     boolean demoMode,
    @JsonProperty("report")       DetectiveReport report,
    @JsonProperty("message")      String message,
    @JsonProperty("fallbackUsed") boolean fallbackUsed
) {
    public RunSnapshot {
        steps = steps == null ? pendingSteps() : List.copyOf(steps);
    }

    /** Snapshot outside of any run, e.g. before the narrator is prepared or after reset. */
    public static RunSnapshot idle(PipelineState state) {
        return new RunSnapshot(null, state, pendingSteps(), false, null, null, false);
    }

    /** First snapshot of a new run: scanning, all steps pending. */
    public static RunSnapshot started(String runId, boolean demoMode) {
        return new RunSnapshot(runId, PipelineState.SCANNING, pendingSteps(), demoMode, null, null, false);
    }

    public RunSnapshot withState(PipelineState next) {
        return new RunSnapshot(runId, next, steps, demoMode, report, message, fallbackUsed);
    }

    public RunSnapshot withStep(ScanStep step, StepStatus status) {
        List<StepProgress> next = new ArrayList<>(steps);
        next.replaceAll(p -> p.step() == step ? p.withStatus(status) : p);
        return new RunSnapshot(runId, state, next, demoMode, report, message, fallbackUsed);
    }

    public RunSnapshot withAllStepsComplete() {
        List<StepProgress> next = new ArrayList<>(steps);
        next.replaceAll(p -> p.withStatus(StepStatus.COMPLETE));
        return new RunSnapshot(runId, state, next, demoMode, report, message, fallbackUsed);
    }

    public RunSnapshot withMessage(String text) {
        return new RunSnapshot(runId, state, steps, demoMode, report, text, fallbackUsed);
    }

    public RunSnapshot completed(DetectiveReport finalReport, boolean usedFallback) {
        return new RunSnapshot(runId, PipelineState.COMPLETE, steps, demoMode, finalReport, null, usedFallback);
    }

    public RunSnapshot aborted(String text) {
        return new RunSnapshot(runId, PipelineState.READY, steps, demoMode, null, text, false);
    }

    private static List<StepProgress> pendingSteps() {
        return Arrays.stream(ScanStep.values()).map(StepProgress::pending).toList();
    }
}
