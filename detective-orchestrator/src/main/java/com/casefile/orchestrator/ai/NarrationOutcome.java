package com.casefile.orchestrator.ai;

import com.casefile.common.model.DetectiveReport;

/**
 * Result of the narration step: the report plus whether the fallback builder produced it.
 *
 * @param reason why the fallback was used, {@code null} for a narrated report
 */
public record NarrationOutcome(DetectiveReport report, boolean fallbackUsed, String reason) {

    public static NarrationOutcome narrated(DetectiveReport report) {
        return new NarrationOutcome(report, false, null);
    }

    public static NarrationOutcome fallback(DetectiveReport report, String reason) {
        return new NarrationOutcome(report, true, reason);
    }
}
