package com.casefile.orchestrator.signal;

import com.casefile.common.exception.SignalSourceException;
import com.casefile.common.model.PrivacyAttestation;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * WebClient adapter over the local device bridge, the process that owns photo-library and
 * calendar permissions on the device and serves aggregated counts only.
 *
 * <p>Endpoints:
 * <pre>
 * GET /api/v1/signals/photos?limitDays=N
 * GET /api/v1/signals/calendar?sinceDays=N&amp;untilDays=M
 * GET /api/v1/device/offline
 * </pre>
 *
 * <p>Transport and HTTP errors are mapped to {@link SignalSourceException} so the pipeline
 * can mark the source unavailable and carry on.
 */
@Component
@Primary
public class DeviceBridgeClient implements PhotoSignalSource, CalendarSignalSource, PrivacyCheck {

    private static final Logger log = LoggerFactory.getLogger(DeviceBridgeClient.class);

    private final WebClient deviceBridgeClient;

    public DeviceBridgeClient(WebClient deviceBridgeClient) {
        this.deviceBridgeClient = deviceBridgeClient;
    }

    @Override
    public Mono<JsonNode> fetchPhotoSignals(int limitDays) {
        return deviceBridgeClient.get()
            .uri(uri -> uri.path("/api/v1/signals/photos").queryParam("limitDays", limitDays).build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .doOnSuccess(body -> log.info("[DeviceBridge] Photo signals fetched. limitDays={} empty={}",
                                          limitDays, body == null))
            .onErrorMap(e -> !(e instanceof SignalSourceException),
                        e -> new SignalSourceException("photo", "photo library unavailable: " + e.getMessage(), e));
    }

    @Override
    public Mono<JsonNode> fetchCalendarSignals(int sinceDays, int untilDays) {
        return deviceBridgeClient.get()
            .uri(uri -> uri.path("/api/v1/signals/calendar")
                .queryParam("sinceDays", sinceDays)
                .queryParam("untilDays", untilDays)
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .doOnSuccess(body -> log.info("[DeviceBridge] Calendar signals fetched. sinceDays={} untilDays={} empty={}",
                                          sinceDays, untilDays, body == null))
            .onErrorMap(e -> !(e instanceof SignalSourceException),
                        e -> new SignalSourceException("calendar", "calendar unavailable: " + e.getMessage(), e));
    }

    @Override
    public Mono<PrivacyAttestation> assertOffline() {
        return deviceBridgeClient.get()
            .uri("/api/v1/device/offline")
            .retrieve()
            .bodyToMono(PrivacyAttestation.class)
            .onErrorMap(e -> !(e instanceof SignalSourceException),
                        e -> new SignalSourceException("privacy", "offline check failed: " + e.getMessage(), e));
    }
}
