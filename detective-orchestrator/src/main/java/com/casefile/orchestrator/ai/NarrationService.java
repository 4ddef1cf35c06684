package com.casefile.orchestrator.ai;

import com.casefile.common.exception.NarrationException;
import com.casefile.common.exception.UngroundedNarrationException;
import com.casefile.common.model.InsightCandidate;
import com.casefile.common.model.NarrationDraft;
import com.casefile.common.narration.FallbackReportBuilder;
import com.casefile.common.narration.NarrationValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Narration layer: prompt → generator → validator, with the fallback report as the
 * answer to every failure.
 *
 * <p><strong>Fallback behaviour</strong>: an unconfigured generator, a generator error,
 * an empty or unparseable response and an ungroundable draft all yield a
 * {@link FallbackReportBuilder} report built from the full candidate list. The returned
 * {@code Mono} never errors; it only ends early if the subscriber cancels it.
 */
@Service
public class NarrationService {

    private static final Logger log = LoggerFactory.getLogger(NarrationService.class);

    private final NarrationGenerator generator;
    private final NarrationPromptBuilder promptBuilder;
    private final GenerateOptions options;

    public NarrationService(NarrationGenerator generator,
                            NarrationPromptBuilder promptBuilder,
                            GenerateOptions options) {
        this.generator     = generator;
        this.promptBuilder = promptBuilder;
        this.options       = options;
    }

    public boolean isGeneratorConfigured() {
        return generator.isConfigured();
    }

    public Mono<Void> prepareGenerator() {
        return generator.ensureReady();
    }

    /**
     * @param insights full candidate list from the rule engine
     * @param runId    used in log lines only
     */
    public Mono<NarrationOutcome> narrate(List<InsightCandidate> insights, String runId) {
        if (!generator.isConfigured()) {
            log.warn("[Narration] No generator configured, returning fallback report. runId={}", runId);
            return Mono.just(fallback(insights, "generator not configured"));
        }

        List<InsightCandidate> selected = promptBuilder.select(insights);

        return Mono.fromCallable(() -> promptBuilder.buildPrompt(selected))
            .flatMap(prompt -> generator.generateStructured(prompt, promptBuilder.schema(), options))
            .switchIfEmpty(Mono.error(() -> new NarrationException("generator returned no output")))
            .map(json -> NarrationValidator.review(NarrationDraft.fromJson(json), selected))
            .map(result -> {
                result.repairs().forEach(r -> log.warn("[Validator] {} runId={}", r, runId));
                log.info("[Narration] Draft validated. runId={} candidates={} repairs={}",
                         runId, selected.size(), result.repairs().size());
                return NarrationOutcome.narrated(result.report());
            })
            .onErrorResume(UngroundedNarrationException.class, e -> {
                log.warn("[Narration] Draft could not be grounded, returning fallback report. runId={} grounded={}",
                         runId, e.getGroundedCount());
                return Mono.just(fallback(insights, "ungrounded draft"));
            })
            .onErrorResume(e -> {
                log.error("[Narration] Generation failed, returning fallback report. runId={} reason={}",
                          runId, e.getMessage());
                return Mono.just(fallback(insights, "generation failed"));
            });
    }

    private static NarrationOutcome fallback(List<InsightCandidate> insights, String reason) {
        return NarrationOutcome.fallback(FallbackReportBuilder.build(insights), reason);
    }
}
