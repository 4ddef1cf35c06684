package com.casefile.orchestrator.pipeline;

import com.casefile.common.exception.PipelineException;
import com.casefile.common.exception.PipelineNotReadyException;
import com.casefile.common.exception.RunInProgressException;
import com.casefile.common.insight.InsightEngine;
import com.casefile.common.model.DetectiveReport;
import com.casefile.common.model.InsightCandidate;
import com.casefile.common.model.PipelineState;
import com.casefile.common.model.PrivacyAttestation;
import com.casefile.common.model.RunSnapshot;
import com.casefile.common.model.ScanStep;
import com.casefile.common.model.SignalBundle;
import com.casefile.common.model.StepStatus;
import com.casefile.common.narration.FallbackReportBuilder;
import com.casefile.common.normalizer.DataNormalizer;
import com.casefile.common.trace.TraceContextUtil;
import com.casefile.orchestrator.ai.NarrationOutcome;
import com.casefile.orchestrator.ai.NarrationService;
import com.casefile.orchestrator.cache.CachedSignalBundle;
import com.casefile.orchestrator.cache.SignalBundleCache;
import com.casefile.orchestrator.logger.PipelineFlowLogger;
import com.casefile.orchestrator.signal.CalendarSignalSource;
import com.casefile.orchestrator.signal.PhotoSignalSource;
import com.casefile.orchestrator.signal.PrivacyCheck;
import com.casefile.orchestrator.signal.SyntheticSignalSource;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Drives one detective run: gather signals → derive insights → narrate → deliver.
 *
 * <p><strong>State machine</strong>: {@code notReady → downloading → ready} via
 * {@link #prepare()}, then per run {@code scanning → analyzing → narrating → complete}.
 * Aborts (no data, unexpected failure, cancellation) end in {@code ready} with a message.
 *
 * <p><strong>Deadline</strong>: the whole run is raced against
 * {@code detective.pipeline.timeout-seconds} with Reactor {@code timeout}. On expiry the
 * run subscription is cancelled, which also aborts an in-flight narration request, and
 * the fallback report is built from the best data captured so far.
 *
 * <p><strong>One run at a time</strong>: {@link #startRun(boolean)} fails fast with
 * {@link RunInProgressException} while another run is active and with
 * {@link PipelineNotReadyException} before the narrator is prepared. Every other failure
 * is absorbed into the snapshot stream.
 */
@Service
public class DetectivePipelineService {

    private static final Logger log = LoggerFactory.getLogger(DetectivePipelineService.class);

    static final String NO_DATA_MESSAGE =
        "No photo or calendar data found. Enable Demo Mode to try with synthetic data.";
    static final String NO_SOURCES_MESSAGE =
        "Photo library and calendar are both unavailable. Grant access or enable Demo Mode to try with synthetic data.";
    static final String QUALIFIED_PRIVACY_STATEMENT =
        "This dossier was compiled on-device from aggregated counts only, but offline operation "
            + "could not be verified for this run.";

    private final PhotoSignalSource photoSource;
    private final CalendarSignalSource calendarSource;
    private final PrivacyCheck privacyCheck;
    private final SyntheticSignalSource syntheticSource;
    private final SignalBundleCache cache;
    private final NarrationService narrationService;
    private final PipelineFlowLogger flowLogger;
    private final PipelineSettings settings;

    private final AtomicReference<RunSnapshot> current =
        new AtomicReference<>(RunSnapshot.idle(PipelineState.NOT_READY));
    private final AtomicReference<RunSession> activeRun = new AtomicReference<>();
    private final Object lifecycleLock = new Object();

    public DetectivePipelineService(PhotoSignalSource photoSource,
                                    CalendarSignalSource calendarSource,
                                    PrivacyCheck privacyCheck,
                                    SyntheticSignalSource syntheticSource,
                                    SignalBundleCache cache,
                                    NarrationService narrationService,
                                    PipelineFlowLogger flowLogger,
                                    PipelineSettings settings) {
        this.photoSource      = photoSource;
        this.calendarSource   = calendarSource;
        this.privacyCheck     = privacyCheck;
        this.syntheticSource  = syntheticSource;
        this.cache            = cache;
        this.narrationService = narrationService;
        this.flowLogger       = flowLogger;
        this.settings         = settings;
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    /**
     * Readies the narrator. A no-op outside {@code notReady}; an unconfigured narrator
     * moves straight to {@code ready} and every report will be a fallback report.
     */
    public Mono<RunSnapshot> prepare() {
        return Mono.defer(() -> {
            RunSnapshot downloading;
            synchronized (lifecycleLock) {
                RunSnapshot now = current.get();
                if (now.state() != PipelineState.NOT_READY) {
                    return Mono.just(now);
                }
                if (!narrationService.isGeneratorConfigured()) {
                    log.warn("[Pipeline] No narrator configured, reports will use the fallback builder.");
                    return Mono.just(publish(RunSnapshot.idle(PipelineState.READY)));
                }
                downloading = publish(RunSnapshot.idle(PipelineState.DOWNLOADING));
            }
            log.info("[Pipeline] Preparing narrator.");
            return narrationService.prepareGenerator()
                .then(Mono.fromSupplier(() -> publish(RunSnapshot.idle(PipelineState.READY))))
                .doOnNext(s -> log.info("[Pipeline] Narrator ready."))
                .onErrorResume(e -> {
                    log.error("[Pipeline] Narrator preparation failed. reason={}", e.getMessage());
                    return Mono.just(publish(RunSnapshot.idle(PipelineState.NOT_READY)
                        .withMessage("Narrator unavailable: " + e.getMessage())));
                })
                .doOnCancel(() -> current.compareAndSet(downloading, RunSnapshot.idle(PipelineState.NOT_READY)));
        });
    }

    /**
     * Starts a run and streams its snapshots. The stream completes right after the
     * terminal snapshot. Cancelling the subscription aborts the run.
     */
    public Flux<RunSnapshot> startRun(boolean demoMode) {
        return Flux.defer(() -> {
            Sinks.Many<RunSnapshot> sink = Sinks.many().unicast().onBackpressureBuffer();
            RunSession session = acquire(demoMode, sink);

            session.open();
            flowLogger.logWithTraceId(PipelineFlowLogger.RUN_STARTED, session.runId());
            log.info("[Pipeline] Run started. runId={} demoMode={} timeoutSeconds={}",
                     session.runId(), demoMode, settings.timeout().toSeconds());

            Disposable execution = execute(session).subscribe();
            return sink.asFlux()
                .doOnCancel(() -> {
                    if (!session.isSettled()) {
                        log.info("[Pipeline] Subscriber left, cancelling run. runId={}", session.runId());
                        execution.dispose();
                    }
                });
        });
    }

    /**
     * Clears the cached bundle and any finished run's step statuses. Rejected while a run
     * is active.
     */
    public Mono<RunSnapshot> resetRun() {
        return Mono.fromCallable(() -> {
            synchronized (lifecycleLock) {
                RunSession active = activeRun.get();
                if (active != null) {
                    throw new RunInProgressException(active.runId());
                }
                cache.invalidate();
                RunSnapshot now = current.get();
                if (now.state().acceptsRun()) {
                    now = publish(RunSnapshot.idle(PipelineState.READY));
                }
                log.info("[Pipeline] Reset. state={}", now.state().wireName());
                return now;
            }
        });
    }

    public RunSnapshot currentSnapshot() {
        return current.get();
    }

    private RunSession acquire(boolean demoMode, Sinks.Many<RunSnapshot> sink) {
        synchronized (lifecycleLock) {
            RunSession active = activeRun.get();
            if (active != null) {
                log.warn("[Pipeline] Run rejected, another run is active. activeRunId={}", active.runId());
                throw new RunInProgressException(active.runId());
            }
            PipelineState state = current.get().state();
            if (!state.acceptsRun()) {
                log.warn("[Pipeline] Run rejected, pipeline not ready. state={}", state.wireName());
                throw new PipelineNotReadyException(state);
            }
            RunSession session = new RunSession(
                UUID.randomUUID().toString(), demoMode,
                snapshot -> {
                    current.set(snapshot);
                    sink.tryEmitNext(snapshot);
                },
                settled -> {
                    activeRun.compareAndSet(settled, null);
                    logSettled(settled);
                    sink.tryEmitComplete();
                });
            activeRun.set(session);
            return session;
        }
    }

    private RunSnapshot publish(RunSnapshot snapshot) {
        current.set(snapshot);
        return snapshot;
    }

    // ── run execution ─────────────────────────────────────────────────────────

    private Mono<RunSnapshot> execute(RunSession session) {
        Mono<RunSnapshot> run = gatherSignals(session)
            .flatMap(bundle -> analyzeAndNarrate(session, bundle))
            .timeout(settings.timeout(), Mono.fromSupplier(() -> deadlineFallback(session)))
            .onErrorResume(e -> Mono.just(failed(session, e)))
            .doFinally(signal -> {
                if (signal == SignalType.CANCEL) {
                    session.settle(s -> s.aborted("Run cancelled"));
                }
            });
        return TraceContextUtil.withTraceId(run, session.runId());
    }

    private Mono<SignalBundle> gatherSignals(RunSession session) {
        return Mono.defer(() -> {
            CachedSignalBundle cached = cache.get(session.demoMode());
            if (cached != null) {
                session.advance(s -> s
                    .withStep(ScanStep.FETCH_PHOTO, StepStatus.COMPLETE)
                    .withStep(ScanStep.FETCH_CALENDAR, StepStatus.COMPLETE));
                return Mono.just(cached.bundle()).doOnNext(b -> onBundle(session, b, true));
            }

            PhotoSignalSource photos      = session.demoMode() ? syntheticSource : photoSource;
            CalendarSignalSource calendar = session.demoMode() ? syntheticSource : calendarSource;

            Mono<Optional<JsonNode>> photoStep = fetchStep(session, ScanStep.FETCH_PHOTO, "photo",
                () -> photos.fetchPhotoSignals(settings.photoLimitDays()));
            Mono<Optional<JsonNode>> calendarStep = fetchStep(session, ScanStep.FETCH_CALENDAR, "calendar",
                () -> calendar.fetchCalendarSignals(settings.calendarSinceDays(), settings.calendarUntilDays()));

            return photoStep.flatMap(photo -> calendarStep.map(cal -> {
                SignalBundle bundle = DataNormalizer.normalize(
                    photo.orElse(null), cal.orElse(null), photo.isPresent(), cal.isPresent());
                cache.put(bundle, session.demoMode());
                return bundle;
            })).doOnNext(b -> onBundle(session, b, false));
        }).flatMap(bundle -> verifyPrivacy(session).thenReturn(bundle));
    }

    private void onBundle(RunSession session, SignalBundle bundle, boolean fromCache) {
        session.recordBundle(bundle);
        flowLogger.logSignals(bundle, fromCache, session.runId());
    }

    /** Runs one fetch step. An unavailable source yields an empty Optional, never an error. */
    private Mono<Optional<JsonNode>> fetchStep(RunSession session, ScanStep step, String source,
                                               Supplier<Mono<JsonNode>> fetch) {
        return Mono.fromRunnable(() -> session.advance(s -> s.withStep(step, StepStatus.IN_PROGRESS)))
            .then(Mono.defer(fetch))
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .onErrorResume(e -> {
                log.warn("[Pipeline] Source unavailable, continuing without it. source={} runId={} reason={}",
                         source, session.runId(), e.getMessage());
                return Mono.just(Optional.empty());
            })
            .doOnNext(payload -> {
                if (payload.isEmpty()) {
                    log.warn("[Pipeline] Source returned no payload. source={} runId={}", source, session.runId());
                }
                session.advance(s -> s.withStep(step, StepStatus.COMPLETE));
            });
    }

    private Mono<PrivacyAttestation> verifyPrivacy(RunSession session) {
        return Mono.fromRunnable(() ->
                session.advance(s -> s.withStep(ScanStep.VERIFY_PRIVACY, StepStatus.IN_PROGRESS)))
            .then(Mono.defer(privacyCheck::assertOffline))
            .defaultIfEmpty(PrivacyAttestation.unverified("unknown"))
            .onErrorResume(e -> {
                log.warn("[Pipeline] Offline check failed, privacy unverified. runId={} reason={}",
                         session.runId(), e.getMessage());
                return Mono.just(PrivacyAttestation.unverified("unknown"));
            })
            .doOnNext(attestation -> {
                session.recordAttestation(attestation);
                log.info("[Pipeline] Privacy check. runId={} networkStatus={} verified={}",
                         session.runId(), attestation.networkStatus(), attestation.privacyVerified());
                session.advance(s -> s.withStep(ScanStep.VERIFY_PRIVACY, StepStatus.COMPLETE));
            });
    }

    private Mono<RunSnapshot> analyzeAndNarrate(RunSession session, SignalBundle bundle) {
        if (!bundle.hasAnyData() && !session.demoMode()) {
            String message = bundle.photoSourceAvailable() || bundle.calendarSourceAvailable()
                ? NO_DATA_MESSAGE
                : NO_SOURCES_MESSAGE;
            return Mono.just(session.settle(s -> s.aborted(message)));
        }

        return Mono.fromCallable(() -> {
                session.advance(s -> s
                    .withState(PipelineState.ANALYZING)
                    .withStep(ScanStep.DERIVE_INSIGHTS, StepStatus.IN_PROGRESS));
                List<InsightCandidate> insights = InsightEngine.computeInsights(bundle);
                session.recordInsights(insights);
                flowLogger.logInsights(insights, session.runId());
                if (session.demoMode() && insights.size() < DetectiveReport.DEDUCTION_COUNT) {
                    log.error("[Pipeline] Demo dataset produced too few insights. runId={} count={}",
                              session.runId(), insights.size());
                }
                session.advance(s -> s
                    .withStep(ScanStep.DERIVE_INSIGHTS, StepStatus.COMPLETE)
                    .withState(PipelineState.NARRATING)
                    .withStep(ScanStep.COMPOSE_REPORT, StepStatus.IN_PROGRESS));
                return insights;
            })
            .flatMap(insights -> narrationService.narrate(insights, session.runId()))
            .flatMap(outcome -> outcome.fallbackUsed()
                ? Mono.just(outcome).doOnNext(o -> flowLogger.logFallback(o.reason(), session.runId()))
                : Mono.just(outcome).doOnEach(flowLogger.<NarrationOutcome>stage(PipelineFlowLogger.NARRATION_COMPLETED)))
            .map(outcome -> {
                DetectiveReport report = qualifyPrivacy(outcome.report(), session.attestation());
                return session.settle(s -> s.withAllStepsComplete().completed(report, outcome.fallbackUsed()));
            });
    }

    /**
     * Builds the fallback report when the deadline fires, from the best data captured:
     * insights, then the run's bundle, then the cached bundle, then an empty bundle.
     */
    private RunSnapshot deadlineFallback(RunSession session) {
        log.warn("[Pipeline] Deadline reached, delivering fallback report. runId={} timeoutSeconds={}",
                 session.runId(), settings.timeout().toSeconds());
        List<InsightCandidate> insights = session.insights();
        if (insights == null) {
            SignalBundle bundle = session.bundle();
            if (bundle == null) {
                bundle = cache.peek();
            }
            if (bundle == null) {
                bundle = SignalBundle.empty(false, false);
            }
            insights = InsightEngine.computeInsights(bundle);
        }
        DetectiveReport report = qualifyPrivacy(FallbackReportBuilder.build(insights), session.attestation());
        flowLogger.logFallback("deadline", session.runId());
        return session.settle(s -> s.withAllStepsComplete().completed(report, true));
    }

    private RunSnapshot failed(RunSession session, Throwable e) {
        String stage = e instanceof PipelineException pe ? pe.getStage() : "pipeline";
        log.error("[Pipeline] Run failed. runId={} stage={} reason={}", session.runId(), stage, e.getMessage(), e);
        return session.settle(s -> s.aborted("Analysis failed: " + e.getMessage()));
    }

    private static DetectiveReport qualifyPrivacy(DetectiveReport report, PrivacyAttestation attestation) {
        if (attestation != null && attestation.privacyVerified()) {
            return report;
        }
        return report.withPrivacyStatement(QUALIFIED_PRIVACY_STATEMENT);
    }

    private void logSettled(RunSession session) {
        RunSnapshot terminal = session.snapshot();
        if (terminal.state() == PipelineState.COMPLETE) {
            flowLogger.logWithTraceId(PipelineFlowLogger.RUN_COMPLETED, session.runId());
        } else {
            flowLogger.logAborted(terminal.message(), session.runId());
        }
        flowLogger.logTimings(session.runId(), session.fetchMillis(), session.engineMillis(),
                              session.narrationMillis(), session.totalMillis());
    }
}
