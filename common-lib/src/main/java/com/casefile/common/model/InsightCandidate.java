package com.casefile.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A single deterministically computed fact about a {@link SignalBundle}.
 *
 * <p>Only {@code InsightEngine} creates these. The {@code evidence} text always carries at
 * least one numeral taken from the bundle counts; the narration validator relies on that
 * to decide which generated numbers are legitimate.
 *
 * <p>{@code lowConfidence} is excluded from the JSON handed to the generator.
 */
@JsonPropertyOrder({"type", "headline", "evidence"})
public record InsightCandidate(
    @JsonProperty("type")     InsightType type,
    @JsonProperty("headline") String headline,
    @JsonProperty("evidence") String evidence,
    @JsonIgnore               boolean lowConfidence
) {
    public InsightCandidate {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(headline, "headline");
        Objects.requireNonNull(evidence, "evidence");
    }

    public static InsightCandidate of(InsightType type, String headline, String evidence,
                                      boolean lowConfidence) {
        return new InsightCandidate(type, headline, evidence, lowConfidence);
    }
}
