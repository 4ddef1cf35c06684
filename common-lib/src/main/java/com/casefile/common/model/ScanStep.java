package com.casefile.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The five progress steps reported for every run, in execution order.
 */
public enum ScanStep {
    FETCH_PHOTO("fetch-photo", "Scanning photo metadata..."),
    FETCH_CALENDAR("fetch-calendar", "Cross-referencing calendar..."),
    VERIFY_PRIVACY("verify-privacy", "Verifying device privacy..."),
    DERIVE_INSIGHTS("derive-insights", "Deriving patterns..."),
    COMPOSE_REPORT("compose-report", "Composing detective report...");

    private final String id;
    private final String label;

    ScanStep(String id, String label) {
        this.id    = id;
        this.label = label;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String label() {
        return label;
    }
}
