package com.casefile.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of an {@link InsightCandidate}. Wire names match the narration prompt contract.
 */
public enum InsightType {
    PHOTO_PATTERN("photo_pattern"),
    CALENDAR_PATTERN("calendar_pattern"),
    CROSS_PATTERN("cross_pattern"),
    SURPRISING("surprising");

    private final String wireName;

    InsightType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
