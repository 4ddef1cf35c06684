package com.casefile.orchestrator.ai;

import com.casefile.common.exception.NarrationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@link NarrationGenerator} backed by a local inference server.
 *
 * <p>Posts {@code {system, prompt, schema, max_tokens, temperature, top_p}} to
 * {@code /v1/generate/structured}. The server answers either with the structured JSON
 * itself or with {@code {"text": "..."}} wrapping it; reasoning blocks ({@code <think>})
 * and markdown fences are stripped before parsing.
 *
 * <p><strong>Reactive contract</strong>: no {@code .block()} anywhere. Cancelling the
 * returned {@code Mono} aborts the in-flight HTTP exchange, which is how the pipeline
 * deadline frees the server.
 *
 * <p>When {@code detective.narrator.base-url} is blank the generator reports itself
 * unconfigured and every call fails fast with {@link NarrationException}.
 */
@Component
public class HttpNarrationGenerator implements NarrationGenerator {

    private static final Logger log = LoggerFactory.getLogger(HttpNarrationGenerator.class);

    private static final Pattern THINK_BLOCK = Pattern.compile("(?s)<think>.*?</think>");

    private final WebClient narratorClient;
    private final ObjectMapper objectMapper;
    private final NarrationPromptBuilder promptBuilder;
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpNarrationGenerator(WebClient.Builder builder,
                                  ObjectMapper objectMapper,
                                  NarrationPromptBuilder promptBuilder,
                                  @Value("${detective.narrator.base-url:}") String baseUrl,
                                  @Value("${detective.narrator.request-timeout-ms:40000}") long requestTimeoutMs) {
        this.baseUrl        = baseUrl == null ? "" : baseUrl.trim();
        this.narratorClient = builder
            .baseUrl(this.baseUrl.isEmpty() ? "http://localhost" : this.baseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper   = objectMapper;
        this.promptBuilder  = promptBuilder;
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
    }

    @Override
    public boolean isConfigured() {
        return !baseUrl.isEmpty();
    }

    @Override
    public Mono<Void> ensureReady() {
        if (!isConfigured()) {
            return Mono.error(new NarrationException("no narrator base-url configured"));
        }
        return narratorClient.get()
            .uri("/health")
            .retrieve()
            .bodyToMono(String.class)
            .timeout(requestTimeout)
            .doOnSuccess(body -> log.info("[Narrator] Backend ready. baseUrl={}", baseUrl))
            .onErrorMap(e -> !(e instanceof NarrationException),
                        e -> new NarrationException("narrator health check failed: " + e.getMessage(), e))
            .then();
    }

    @Override
    public Mono<JsonNode> generateStructured(String prompt, JsonNode schema, GenerateOptions options) {
        if (!isConfigured()) {
            return Mono.error(new NarrationException("no narrator base-url configured"));
        }
        Map<String, Object> requestBody = new LinkedHashMap<>();
        requestBody.put("system", promptBuilder.systemPrompt());
        requestBody.put("prompt", prompt);
        requestBody.put("schema", schema);
        requestBody.put("max_tokens", options.maxTokens());
        requestBody.put("temperature", options.temperature());
        requestBody.put("top_p", options.topP());

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                narratorClient.post()
                    .uri("/v1/generate/structured")
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(requestTimeout))
            .map(this::parseResponse)
            .onErrorMap(e -> !(e instanceof NarrationException),
                        e -> new NarrationException("generation failed: " + e, e));
    }

    // ── response parsing ──────────────────────────────────────────────────────

    JsonNode parseResponse(String response) {
        try {
            JsonNode root = objectMapper.readTree(clean(response));
            if (root != null && root.path("text").isTextual()) {
                root = objectMapper.readTree(clean(root.path("text").asText()));
            }
            if (root == null || !root.isObject()) {
                throw new NarrationException("generator output is not a JSON object");
            }
            return root;
        } catch (NarrationException e) {
            throw e;
        } catch (Exception e) {
            log.error("[Narrator] Failed to parse response: {}", response, e);
            throw new NarrationException("unparseable generator output", e);
        }
    }

    static String clean(String text) {
        if (text == null) return "";
        return THINK_BLOCK.matcher(text).replaceAll("")
            .replace("```json", "")
            .replace("```", "")
            .trim();
    }
}
