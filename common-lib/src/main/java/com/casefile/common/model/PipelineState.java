package com.casefile.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of the detective pipeline. A run moves
 * {@code ready → scanning → analyzing → narrating → complete}; aborts return to
 * {@code ready}. {@code notReady} and {@code downloading} precede the first run while the
 * narrator is being prepared.
 */
public enum PipelineState {
    NOT_READY("notReady"),
    DOWNLOADING("downloading"),
    READY("ready"),
    SCANNING("scanning"),
    ANALYZING("analyzing"),
    NARRATING("narrating"),
    COMPLETE("complete");

    private final String wireName;

    PipelineState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** True when a new run may be started. */
    public boolean acceptsRun() {
        return this == READY || this == COMPLETE;
    }
}
