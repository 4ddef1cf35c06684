package com.casefile.orchestrator.pipeline;

import java.time.Duration;

/**
 * Run-level knobs, bound from {@code detective.pipeline.*} and {@code detective.cache.*}.
 *
 * @param timeout           global deadline for one run, after which the fallback report is delivered
 * @param photoLimitDays    look-back window passed to the photo source
 * @param calendarSinceDays look-back window passed to the calendar source
 * @param calendarUntilDays look-ahead window passed to the calendar source
 * @param cacheTtl          how long a gathered bundle may be reused
 */
public record PipelineSettings(
    Duration timeout,
    int photoLimitDays,
    int calendarSinceDays,
    int calendarUntilDays,
    Duration cacheTtl
) {
    public static PipelineSettings defaults() {
        return new PipelineSettings(Duration.ofSeconds(45), 30, 30, 0, Duration.ofMinutes(5));
    }

    public PipelineSettings withTimeout(Duration deadline) {
        return new PipelineSettings(deadline, photoLimitDays, calendarSinceDays, calendarUntilDays, cacheTtl);
    }
}
