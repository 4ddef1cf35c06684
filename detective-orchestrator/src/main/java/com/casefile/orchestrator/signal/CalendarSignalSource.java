package com.casefile.orchestrator.signal;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Provider of aggregated calendar metadata.
 */
@FunctionalInterface
public interface CalendarSignalSource {

    Mono<JsonNode> fetchCalendarSignals(int sinceDays, int untilDays);
}
