package com.casefile.orchestrator.controller;

import com.casefile.common.exception.PipelineException;
import com.casefile.common.exception.PipelineNotReadyException;
import com.casefile.common.exception.RunInProgressException;
import com.casefile.common.model.RunSnapshot;
import com.casefile.orchestrator.pipeline.DetectivePipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * REST surface of the detective pipeline.
 *
 * <p>Typical client flow:
 * <ol>
 *   <li>POST /prepare, until the snapshot state is {@code ready}</li>
 *   <li>GET  /run?demo=false, an SSE stream of snapshots ending with {@code complete}
 *       (report attached) or {@code ready} (message attached)</li>
 *   <li>POST /reset to drop the cached signals before the next run</li>
 * </ol>
 */
@RestController
@RequestMapping("/api/v1/detective")
public class DetectiveController {

    private static final Logger log = LoggerFactory.getLogger(DetectiveController.class);

    static final String REJECTED_EVENT = "rejected";

    private final DetectivePipelineService pipelineService;

    public DetectiveController(DetectivePipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @PostMapping("/prepare")
    public Mono<ResponseEntity<RunSnapshot>> prepare() {
        log.info("[DetectiveAPI] prepare requested");
        return pipelineService.prepare()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("[DetectiveAPI] prepare error", e));
    }

    /**
     * Streams one run. A start that is refused (busy or not prepared) yields a single
     * {@value #REJECTED_EVENT} event carrying the current snapshot and the reason.
     */
    @GetMapping(value = "/run", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<RunSnapshot>> run(@RequestParam(defaultValue = "false") boolean demo) {
        log.info("[DetectiveAPI] run requested. demo={}", demo);
        return pipelineService.startRun(demo)
            .map(snapshot -> ServerSentEvent.<RunSnapshot>builder()
                .id(snapshot.runId())
                .event(snapshot.state().wireName())
                .data(snapshot)
                .build())
            .onErrorResume(e -> e instanceof RunInProgressException || e instanceof PipelineNotReadyException,
                           e -> Flux.just(rejected((PipelineException) e)));
    }

    @PostMapping("/reset")
    public Mono<ResponseEntity<RunSnapshot>> reset() {
        log.info("[DetectiveAPI] reset requested");
        return pipelineService.resetRun()
            .map(ResponseEntity::ok)
            .onErrorResume(RunInProgressException.class, e -> {
                log.warn("[DetectiveAPI] reset refused. reason={}", e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(pipelineService.currentSnapshot().withMessage(e.getMessage())));
            });
    }

    @GetMapping("/state")
    public ResponseEntity<RunSnapshot> state() {
        return ResponseEntity.ok(pipelineService.currentSnapshot());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    private ServerSentEvent<RunSnapshot> rejected(PipelineException e) {
        log.warn("[DetectiveAPI] run refused. reason={}", e.getMessage());
        return ServerSentEvent.<RunSnapshot>builder()
            .event(REJECTED_EVENT)
            .data(pipelineService.currentSnapshot().withMessage(e.getMessage()))
            .build();
    }
}
