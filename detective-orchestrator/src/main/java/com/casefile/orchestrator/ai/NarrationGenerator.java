package com.casefile.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Schema-constrained text generator that turns insight candidates into a narrated draft.
 *
 * <p>Output is expected to parse against the schema but its content is untrusted; callers
 * must pass it through {@code NarrationValidator} before showing it to anyone.
 */
public interface NarrationGenerator {

    Mono<JsonNode> generateStructured(String prompt, JsonNode schema, GenerateOptions options);

    /** False when no generator backend is configured; reports are then built without narration. */
    default boolean isConfigured() {
        return true;
    }

    /** Completes once the backend can accept generation requests. */
    default Mono<Void> ensureReady() {
        return Mono.empty();
    }
}
