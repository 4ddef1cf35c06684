package com.casefile.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Terminal artifact of a pipeline run. Field names on the wire are a stable contract:
 * {@code headline}, {@code deductions[{finding, evidence}]}, {@code surprising_fact},
 * {@code privacy_statement}.
 *
 * <p>Instances produced by the validator or the fallback builder always hold exactly
 * {@value #DEDUCTION_COUNT} deductions.
 */
@JsonPropertyOrder({"headline", "deductions", "surprising_fact", "privacy_statement"})
public record DetectiveReport(
    @JsonProperty("headline")          String headline,
    @JsonProperty("deductions")        List<Deduction> deductions,
    @JsonProperty("surprising_fact")   String surprisingFact,
    @JsonProperty("privacy_statement") String privacyStatement
) {
    public static final int DEDUCTION_COUNT = 3;

    public DetectiveReport {
        deductions = deductions == null ? List.of() : List.copyOf(deductions);
    }

    public DetectiveReport withPrivacyStatement(String statement) {
        return new DetectiveReport(headline, deductions, surprisingFact, statement);
    }
}
