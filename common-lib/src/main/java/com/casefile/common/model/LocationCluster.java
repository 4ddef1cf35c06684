package com.casefile.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One geotag cluster reported by the photo provider. Coordinates are informational only;
 * the engine reads {@code count}.
 */
public record LocationCluster(
    @JsonProperty("count")     int count,
    @JsonProperty("latitude")  Double latitude,
    @JsonProperty("longitude") Double longitude
) {
    public static LocationCluster of(int count) {
        return new LocationCluster(count, null, null);
    }
}
