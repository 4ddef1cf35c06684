package com.casefile.orchestrator.logger;

import com.casefile.common.model.InsightCandidate;
import com.casefile.common.model.SignalBundle;
import com.casefile.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.List;
import java.util.function.Consumer;

/**
 * Observability component for the run lifecycle inside the reactive pipeline.
 *
 * <p>Logs each stage of a run without introducing any business logic or modifying
 * pipeline behavior. All methods are pure side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #RUN_STARTED}        : guard acquired, first snapshot emitted</li>
 *   <li>{@link #SIGNALS_GATHERED}   : bundle fetched or served from cache</li>
 *   <li>{@link #INSIGHTS_DERIVED}   : rule engine produced its candidates</li>
 *   <li>{@link #NARRATION_COMPLETED}: validated narration available</li>
 *   <li>{@link #FALLBACK_USED}      : fallback report substituted for narration</li>
 *   <li>{@link #RUN_ABORTED}        : run ended in {@code ready} with a message</li>
 *   <li>{@link #RUN_COMPLETED}      : run ended in {@code complete}</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads the run id from Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(PipelineFlowLogger.SIGNALS_GATHERED))
 * </pre>
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String RUN_STARTED         = "RUN_STARTED";
    public static final String SIGNALS_GATHERED    = "SIGNALS_GATHERED";
    public static final String INSIGHTS_DERIVED    = "INSIGHTS_DERIVED";
    public static final String NARRATION_COMPLETED = "NARRATION_COMPLETED";
    public static final String FALLBACK_USED       = "FALLBACK_USED";
    public static final String RUN_ABORTED         = "RUN_ABORTED";
    public static final String RUN_COMPLETED       = "RUN_COMPLETED";

    /**
     * Returns a {@code doOnEach} consumer that logs the lifecycle stage on {@code onNext}.
     * Errors and completion are ignored.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[PipelineFlow] stage={} runId={}", stageName, traceId)
            );
        };
    }

    /**
     * Logs a lifecycle stage when the run id is at hand, e.g. from a timer callback
     * that has no Reactor Context.
     */
    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} runId={}", stageName, traceId)
        );
    }

    public void logSignals(SignalBundle bundle, boolean fromCache, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} photos={} events={} photoSource={} calendarSource={} "
                     + "fromCache={} runId={}",
                     SIGNALS_GATHERED,
                     bundle.totalPhotos(), bundle.totalEvents(),
                     bundle.photoSourceAvailable(), bundle.calendarSourceAvailable(),
                     fromCache, traceId)
        );
    }

    public void logInsights(List<InsightCandidate> insights, String traceId) {
        long confident = insights.stream().filter(i -> !i.lowConfidence()).count();
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} candidates={} highConfidence={} runId={}",
                     INSIGHTS_DERIVED, insights.size(), confident, traceId)
        );
    }

    public void logFallback(String reason, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("[PipelineFlow] stage={} reason={} runId={}", FALLBACK_USED, reason, traceId)
        );
    }

    public void logAborted(String message, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("[PipelineFlow] stage={} message=\"{}\" runId={}", RUN_ABORTED, message, traceId)
        );
    }

    /** Per-stage wall-clock timings in milliseconds, logged once when a run settles. */
    public void logTimings(String traceId, long fetchMs, long engineMs, long narrationMs, long totalMs) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] timings fetchMs={} engineMs={} narrationMs={} totalMs={} runId={}",
                     fetchMs, engineMs, narrationMs, totalMs, traceId)
        );
    }
}
