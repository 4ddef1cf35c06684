package com.casefile.orchestrator.ai;

import com.casefile.common.model.DetectiveReport;
import com.casefile.common.model.InsightCandidate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the narration prompt and the JSON schema the generator must conform to.
 *
 * <p>The prompt carries candidates as {@code {type, headline, evidence}} JSON only; the
 * confidence flag is not exposed to the generator.
 */
@Component
public class NarrationPromptBuilder {

    static final String SYSTEM_PROMPT =
        "You are a spy thriller narrator. Write dramatic noir detective reports from provided data. "
            + "Use the exact numbers given to you.";

    private final ObjectMapper objectMapper;
    private final JsonNode schema;

    public NarrationPromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.schema       = buildSchema(objectMapper);
    }

    /**
     * Candidates to narrate: the high-confidence ones when there are at least three of
     * them, otherwise all of them. Validation must use the same list.
     */
    public List<InsightCandidate> select(List<InsightCandidate> insights) {
        List<InsightCandidate> confident = insights.stream().filter(i -> !i.lowConfidence()).toList();
        return confident.size() >= DetectiveReport.DEDUCTION_COUNT ? confident : insights;
    }

    public String buildPrompt(List<InsightCandidate> selected) {
        String insightsJson;
        try {
            insightsJson = objectMapper.writeValueAsString(selected);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise insight candidates", e);
        }
        return """
            Given the following computed deductions about a person's phone data, write a dramatic noir \
            detective report.

            RULES:
            - You MUST use ONLY the provided deductions. Do not invent new findings.
            - Use the EXACT numbers from the evidence provided. Do not round, estimate, or fabricate any statistics.
            - Write exactly 3 deductions with dramatic findings and evidence using the exact numbers.

            DEDUCTIONS:
            """ + insightsJson;
    }

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public JsonNode schema() {
        return schema;
    }

    private static JsonNode buildSchema(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "object");
        ObjectNode props = root.putObject("properties");
        props.putObject("headline").put("type", "string");

        ObjectNode deductions = props.putObject("deductions");
        deductions.put("type", "array");
        ObjectNode item = deductions.putObject("items");
        item.put("type", "object");
        ObjectNode itemProps = item.putObject("properties");
        itemProps.putObject("finding").put("type", "string");
        itemProps.putObject("evidence").put("type", "string");
        item.putArray("required").add("finding").add("evidence");

        props.putObject("surprising_fact").put("type", "string");
        props.putObject("privacy_statement").put("type", "string");

        ArrayNode required = root.putArray("required");
        required.add("headline").add("deductions").add("surprising_fact").add("privacy_statement");
        return root;
    }
}
