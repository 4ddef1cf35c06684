package com.casefile.orchestrator.pipeline;

import com.casefile.common.exception.NarrationException;
import com.casefile.common.exception.PipelineNotReadyException;
import com.casefile.common.exception.RunInProgressException;
import com.casefile.common.exception.SignalSourceException;
import com.casefile.common.insight.InsightEngine;
import com.casefile.common.model.InsightCandidate;
import com.casefile.common.model.PipelineState;
import com.casefile.common.model.PrivacyAttestation;
import com.casefile.common.model.RunSnapshot;
import com.casefile.common.model.StepProgress;
import com.casefile.common.model.StepStatus;
import com.casefile.common.synthetic.SyntheticSignals;
import com.casefile.orchestrator.ai.GenerateOptions;
import com.casefile.orchestrator.ai.NarrationGenerator;
import com.casefile.orchestrator.ai.NarrationPromptBuilder;
import com.casefile.orchestrator.ai.NarrationService;
import com.casefile.orchestrator.cache.SignalBundleCache;
import com.casefile.orchestrator.logger.PipelineFlowLogger;
import com.casefile.orchestrator.signal.CalendarSignalSource;
import com.casefile.orchestrator.signal.PhotoSignalSource;
import com.casefile.orchestrator.signal.PrivacyCheck;
import com.casefile.orchestrator.signal.SyntheticSignalSource;
import com.casefile.orchestrator.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DetectivePipelineServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final List<InsightCandidate> DEMO = InsightEngine.computeInsights(SyntheticSignals.bundle());
    private static final Duration WAIT = Duration.ofSeconds(5);

    private final AtomicInteger photoCalls = new AtomicInteger();
    private final AtomicInteger calendarCalls = new AtomicInteger();

    private PhotoSignalSource photoSource;
    private CalendarSignalSource calendarSource;
    private PrivacyCheck privacyCheck;
    private NarrationGenerator generator;
    private PipelineSettings settings;

    @BeforeEach
    void setUp() {
        photoSource = limitDays -> {
            photoCalls.incrementAndGet();
            return Mono.just(SyntheticSignals.photoPayload());
        };
        calendarSource = (since, until) -> {
            calendarCalls.incrementAndGet();
            return Mono.just(SyntheticSignals.calendarPayload());
        };
        privacyCheck = () -> Mono.just(new PrivacyAttestation("offline", true));
        generator    = (prompt, schema, options) -> Mono.just(groundedDraft());
        settings     = PipelineSettings.defaults().withTimeout(WAIT);
    }

    private DetectivePipelineService service() {
        SignalBundleCache cache = new SignalBundleCache(
            new MutableClock(Instant.parse("2026-03-02T10:00:00Z")), settings);
        NarrationService narration = new NarrationService(
            generator, new NarrationPromptBuilder(MAPPER), GenerateOptions.defaults());
        return new DetectivePipelineService(photoSource, calendarSource, privacyCheck,
            new SyntheticSignalSource(), cache, narration, new PipelineFlowLogger(), settings);
    }

    private DetectivePipelineService readyService() {
        DetectivePipelineService service = service();
        service.prepare().block(WAIT);
        return service;
    }

    private static List<RunSnapshot> run(DetectivePipelineService service, boolean demo) {
        return service.startRun(demo).collectList().block(WAIT);
    }

    private static RunSnapshot last(List<RunSnapshot> snapshots) {
        return snapshots.get(snapshots.size() - 1);
    }

    private static JsonNode groundedDraft() {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("headline", "Case File: The Saturday Shutterbug");
        ArrayNode deductions = root.putArray("deductions");
        for (int i = 0; i < 3; i++) {
            deductions.addObject()
                .put("finding", "Narrated finding " + (i + 1))
                .put("evidence", DEMO.get(i).evidence());
        }
        root.put("surprising_fact", "The subject never rests on a Saturday.");
        root.put("privacy_statement", "Compiled on-device.");
        return root;
    }

    private static JsonNode zeroPayload() {
        return MAPPER.createObjectNode();
    }

    @Nested
    @DisplayName("prepare")
    class Prepare {

        @Test
        @DisplayName("fresh service starts in notReady")
        void startsNotReady() {
            assertEquals(PipelineState.NOT_READY, service().currentSnapshot().state());
        }

        @Test
        @DisplayName("generator ready → ready")
        void readyAfterCheck() {
            StepVerifier.create(service().prepare())
                .assertNext(s -> assertEquals(PipelineState.READY, s.state()))
                .verifyComplete();
        }

        @Test
        @DisplayName("unconfigured generator → ready directly")
        void unconfigured() {
            generator = new NarrationGenerator() {
                @Override
                public Mono<JsonNode> generateStructured(String prompt, JsonNode schema, GenerateOptions options) {
                    return Mono.empty();
                }

                @Override
                public boolean isConfigured() {
                    return false;
                }
            };
            StepVerifier.create(service().prepare())
                .assertNext(s -> assertEquals(PipelineState.READY, s.state()))
                .verifyComplete();
        }

        @Test
        @DisplayName("readiness check fails → back to notReady with a message")
        void checkFails() {
            generator = new NarrationGenerator() {
                @Override
                public Mono<JsonNode> generateStructured(String prompt, JsonNode schema, GenerateOptions options) {
                    return Mono.empty();
                }

                @Override
                public Mono<Void> ensureReady() {
                    return Mono.error(new NarrationException("model missing"));
                }
            };
            DetectivePipelineService service = service();

            StepVerifier.create(service.prepare())
                .assertNext(s -> {
                    assertEquals(PipelineState.NOT_READY, s.state());
                    assertTrue(s.message().startsWith("Narrator unavailable"), s.message());
                })
                .verifyComplete();
            assertEquals(PipelineState.NOT_READY, service.currentSnapshot().state());
        }

        @Test
        @DisplayName("start before prepare → PipelineNotReadyException")
        void startBeforePrepare() {
            StepVerifier.create(service().startRun(true))
                .expectError(PipelineNotReadyException.class)
                .verify(WAIT);
        }
    }

    @Nested
    @DisplayName("successful runs")
    class SuccessfulRuns {

        @Test
        @DisplayName("demo run walks scanning → analyzing → narrating → complete")
        void demoRunStates() {
            List<RunSnapshot> snapshots = run(readyService(), true);

            assertEquals(List.of(PipelineState.SCANNING, PipelineState.ANALYZING,
                                 PipelineState.NARRATING, PipelineState.COMPLETE),
                snapshots.stream().map(RunSnapshot::state).distinct().toList());
            RunSnapshot terminal = last(snapshots);
            assertFalse(terminal.fallbackUsed());
            assertEquals("Case File: The Saturday Shutterbug", terminal.report().headline());
            assertEquals(3, terminal.report().deductions().size());
            assertTrue(terminal.steps().stream().allMatch(p -> p.status() == StepStatus.COMPLETE));
        }

        @Test
        @DisplayName("every snapshot of one run carries the same run id")
        void sameRunId() {
            List<RunSnapshot> snapshots = run(readyService(), true);
            String runId = snapshots.get(0).runId();

            assertNotNull(runId);
            assertTrue(snapshots.stream().allMatch(s -> runId.equals(s.runId())));
        }

        @Test
        @DisplayName("demo run never touches the real sources")
        void demoUsesSyntheticSource() {
            run(readyService(), true);
            assertEquals(0, photoCalls.get());
            assertEquals(0, calendarCalls.get());
        }

        @Test
        @DisplayName("verified offline check → narrated privacy statement kept")
        void verifiedPrivacy() {
            RunSnapshot terminal = last(run(readyService(), false));
            assertEquals("Compiled on-device.", terminal.report().privacyStatement());
        }

        @Test
        @DisplayName("unverified offline check → qualified privacy statement")
        void unverifiedPrivacy() {
            privacyCheck = () -> Mono.error(new SignalSourceException("privacy", "bridge down"));

            RunSnapshot terminal = last(run(readyService(), false));

            assertEquals(PipelineState.COMPLETE, terminal.state());
            assertEquals(DetectivePipelineService.QUALIFIED_PRIVACY_STATEMENT, terminal.report().privacyStatement());
        }

        @Test
        @DisplayName("a fresh run is accepted after complete")
        void rerunAfterComplete() {
            DetectivePipelineService service = readyService();
            run(service, true);

            assertEquals(PipelineState.COMPLETE, last(run(service, true)).state());
        }
    }

    @Nested
    @DisplayName("degraded runs")
    class DegradedRuns {

        @Test
        @DisplayName("both sources empty, not demo → ready with the demo-mode message")
        void bothZero() {
            photoSource    = limitDays -> Mono.just(zeroPayload());
            calendarSource = (since, until) -> Mono.just(zeroPayload());

            RunSnapshot terminal = last(run(readyService(), false));

            assertEquals(PipelineState.READY, terminal.state());
            assertEquals(DetectivePipelineService.NO_DATA_MESSAGE, terminal.message());
            assertNull(terminal.report());
        }

        @Test
        @DisplayName("both sources unavailable → ready with the access message")
        void bothUnavailable() {
            photoSource    = limitDays -> Mono.error(new SignalSourceException("photo", "denied"));
            calendarSource = (since, until) -> Mono.error(new SignalSourceException("calendar", "denied"));

            RunSnapshot terminal = last(run(readyService(), false));

            assertEquals(PipelineState.READY, terminal.state());
            assertEquals(DetectivePipelineService.NO_SOURCES_MESSAGE, terminal.message());
        }

        @Test
        @DisplayName("calendar unavailable → run continues on photos alone")
        void partialSource() {
            calendarSource = (since, until) -> Mono.error(new SignalSourceException("calendar", "denied"));

            RunSnapshot terminal = last(run(readyService(), false));

            assertEquals(PipelineState.COMPLETE, terminal.state());
            assertEquals(3, terminal.report().deductions().size());
        }

        @Test
        @DisplayName("generator failure → complete with the fallback report")
        void generatorFailure() {
            generator = (prompt, schema, options) -> Mono.error(new NarrationException("backend down"));

            RunSnapshot terminal = last(run(readyService(), true));

            assertEquals(PipelineState.COMPLETE, terminal.state());
            assertTrue(terminal.fallbackUsed());
            assertEquals("Case File: The Weekend Regular", terminal.report().headline());
        }

        @Test
        @DisplayName("deadline while narrating → complete with fallback, generator cancelled")
        void deadlineDuringNarration() {
            AtomicBoolean cancelled = new AtomicBoolean();
            generator = (prompt, schema, options) -> Mono.<JsonNode>never().doOnCancel(() -> cancelled.set(true));
            settings  = settings.withTimeout(Duration.ofMillis(300));

            List<RunSnapshot> snapshots = run(readyService(), true);
            RunSnapshot terminal = last(snapshots);

            assertEquals(PipelineState.COMPLETE, terminal.state());
            assertTrue(terminal.fallbackUsed());
            assertEquals(3, terminal.report().deductions().size());
            assertEquals(PipelineState.NARRATING, snapshots.get(snapshots.size() - 2).state());
            assertTrue(terminal.steps().stream().map(StepProgress::status).allMatch(StepStatus.COMPLETE::equals));
            assertTrue(cancelled.get());
        }

        @Test
        @DisplayName("deadline while fetching → complete with a fallback report from no data")
        void deadlineDuringFetch() {
            photoSource = limitDays -> Mono.never();
            settings    = settings.withTimeout(Duration.ofMillis(300));

            RunSnapshot terminal = last(run(readyService(), false));

            assertEquals(PipelineState.COMPLETE, terminal.state());
            assertTrue(terminal.fallbackUsed());
            assertEquals(3, terminal.report().deductions().size());
            assertEquals(DetectivePipelineService.QUALIFIED_PRIVACY_STATEMENT, terminal.report().privacyStatement());
        }
    }

    @Nested
    @DisplayName("guards and reset")
    class Guards {

        @Test
        @DisplayName("second start while a run is active → RunInProgressException; reset refused")
        void busyGuard() {
            generator = (prompt, schema, options) -> Mono.never();
            DetectivePipelineService service = readyService();

            Disposable first = service.startRun(true).subscribe();
            assertEquals(PipelineState.NARRATING, service.currentSnapshot().state());

            StepVerifier.create(service.startRun(true))
                .expectError(RunInProgressException.class)
                .verify(WAIT);
            StepVerifier.create(service.resetRun())
                .expectError(RunInProgressException.class)
                .verify(WAIT);

            first.dispose();
            assertEquals(PipelineState.READY, service.currentSnapshot().state());
            assertEquals("Run cancelled", service.currentSnapshot().message());
        }

        @Test
        @DisplayName("bundle is reused within the TTL and refetched after reset")
        void cacheAndReset() {
            DetectivePipelineService service = readyService();

            run(service, false);
            run(service, false);
            assertEquals(1, photoCalls.get());
            assertEquals(1, calendarCalls.get());

            StepVerifier.create(service.resetRun())
                .assertNext(s -> {
                    assertEquals(PipelineState.READY, s.state());
                    assertNull(s.report());
                    assertTrue(s.steps().stream().allMatch(p -> p.status() == StepStatus.PENDING));
                })
                .verifyComplete();

            run(service, false);
            assertEquals(2, photoCalls.get());
        }

        @Test
        @DisplayName("partial bundle is not cached")
        void partialNotCached() {
            calendarSource = (since, until) -> {
                calendarCalls.incrementAndGet();
                return Mono.error(new SignalSourceException("calendar", "denied"));
            };
            DetectivePipelineService service = readyService();

            run(service, false);
            run(service, false);

            assertEquals(2, photoCalls.get());
            assertEquals(2, calendarCalls.get());
        }

        @Test
        @DisplayName("reset before prepare leaves notReady")
        void resetBeforePrepare() {
            StepVerifier.create(service().resetRun())
                .assertNext(s -> assertEquals(PipelineState.NOT_READY, s.state()))
                .verifyComplete();
        }
    }
}
