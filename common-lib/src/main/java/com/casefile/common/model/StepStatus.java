package com.casefile.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StepStatus {
    PENDING("pending"),
    IN_PROGRESS("inProgress"),
    COMPLETE("complete");

    private final String wireName;

    StepStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
