package com.casefile.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StepProgress(
    @JsonProperty("step")   ScanStep step,
    @JsonProperty("label")  String label,
    @JsonProperty("status") StepStatus status
) {
    public static StepProgress pending(ScanStep step) {
        return new StepProgress(step, step.label(), StepStatus.PENDING);
    }

    public StepProgress withStatus(StepStatus next) {
        return new StepProgress(step, label, next);
    }
}
