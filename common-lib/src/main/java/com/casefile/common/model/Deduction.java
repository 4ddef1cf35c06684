package com.casefile.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"finding", "evidence"})
public record Deduction(
    @JsonProperty("finding")  String finding,
    @JsonProperty("evidence") String evidence
) {
    public static Deduction fromInsight(InsightCandidate insight) {
        return new Deduction(insight.headline(), insight.evidence());
    }
}
