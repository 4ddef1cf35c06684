package com.casefile.orchestrator.signal;

import com.casefile.common.synthetic.SyntheticSignals;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Demo-mode source. Serves the fixed {@link SyntheticSignals} dataset regardless of the
 * requested window.
 */
@Component
public class SyntheticSignalSource implements PhotoSignalSource, CalendarSignalSource {

    @Override
    public Mono<JsonNode> fetchPhotoSignals(int limitDays) {
        return Mono.fromSupplier(SyntheticSignals::photoPayload);
    }

    @Override
    public Mono<JsonNode> fetchCalendarSignals(int sinceDays, int untilDays) {
        return Mono.fromSupplier(SyntheticSignals::calendarPayload);
    }
}
