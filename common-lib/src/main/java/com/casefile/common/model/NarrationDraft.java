package com.casefile.common.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Untrusted generator output. Structure is assumed schema-conformant but every field is
 * read leniently: missing text becomes an empty string and a deduction entry that is not
 * an object becomes an empty {@link Deduction}, which can never pass numeric grounding.
 */
public record NarrationDraft(
    String headline,
    List<Deduction> deductions,
    String surprisingFact,
    String privacyStatement
) {
    public NarrationDraft {
        deductions = deductions == null ? List.of() : List.copyOf(deductions);
    }

    public static NarrationDraft fromJson(JsonNode json) {
        if (json == null || !json.isObject()) {
            return new NarrationDraft("", List.of(), "", "");
        }
        List<Deduction> deductions = new ArrayList<>();
        JsonNode items = json.path("deductions");
        if (items.isArray()) {
            for (JsonNode item : items) {
                deductions.add(new Deduction(text(item, "finding"), text(item, "evidence")));
            }
        }
        return new NarrationDraft(
            text(json, "headline"),
            deductions,
            text(json, "surprising_fact"),
            text(json, "privacy_statement"));
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.isObject()) return "";
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText("") : "";
    }
}
