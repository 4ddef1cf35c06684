package com.casefile.orchestrator.signal;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Provider of aggregated photo metadata. Payloads may use either the native or the
 * canonical dialect understood by {@code DataNormalizer}.
 */
@FunctionalInterface
public interface PhotoSignalSource {

    /**
     * @param limitDays how many days back to scan
     * @return the raw payload; errors with {@code SignalSourceException} when unavailable
     */
    Mono<JsonNode> fetchPhotoSignals(int limitDays);
}
