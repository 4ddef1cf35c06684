package com.casefile.orchestrator.ai;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sampling options forwarded to the narration generator with every request.
 */
public record GenerateOptions(
    @JsonProperty("max_tokens")  int maxTokens,
    @JsonProperty("temperature") double temperature,
    @JsonProperty("top_p")       double topP
) {
    public static GenerateOptions defaults() {
        return new GenerateOptions(768, 0.7, 0.9);
    }
}
