package com.casefile.orchestrator.pipeline;

import com.casefile.common.model.InsightCandidate;
import com.casefile.common.model.PrivacyAttestation;
import com.casefile.common.model.RunSnapshot;
import com.casefile.common.model.SignalBundle;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * State of one pipeline run, shared between the run's Reactor chain and the deadline timer.
 *
 * <p>Snapshot transitions are serialised on this object. The first {@link #settle} wins;
 * every later {@link #advance} or {@link #settle} is ignored, so a result that arrives
 * after the fallback report was delivered can never overwrite it.
 *
 * <p>Data captured along the way (bundle, insights, attestation) feeds the deadline
 * fallback.
 */
final class RunSession {

    private final String runId;
    private final boolean demoMode;
    private final Consumer<RunSnapshot> onSnapshot;
    private final Consumer<RunSession> onSettled;
    private final long startedAt = System.nanoTime();

    private RunSnapshot snapshot;
    private boolean settled;

    private volatile SignalBundle bundle;
    private volatile List<InsightCandidate> insights;
    private volatile PrivacyAttestation attestation;
    private volatile Long fetchedAt;
    private volatile Long analyzedAt;
    private volatile Long settledAt;

    RunSession(String runId, boolean demoMode,
               Consumer<RunSnapshot> onSnapshot, Consumer<RunSession> onSettled) {
        this.runId      = runId;
        this.demoMode   = demoMode;
        this.onSnapshot = onSnapshot;
        this.onSettled  = onSettled;
        this.snapshot   = RunSnapshot.started(runId, demoMode);
    }

    /** Publishes the initial {@code scanning} snapshot. */
    synchronized RunSnapshot open() {
        onSnapshot.accept(snapshot);
        return snapshot;
    }

    /**
     * Applies a progress transition and publishes it.
     *
     * @return false if the run has already settled and the change was dropped
     */
    synchronized boolean advance(UnaryOperator<RunSnapshot> change) {
        if (settled) return false;
        snapshot = change.apply(snapshot);
        onSnapshot.accept(snapshot);
        return true;
    }

    /**
     * Applies the terminal transition once. Returns the terminal snapshot, which is the
     * earlier one if the run was already settled.
     */
    synchronized RunSnapshot settle(UnaryOperator<RunSnapshot> change) {
        if (settled) return snapshot;
        snapshot  = change.apply(snapshot);
        settled   = true;
        settledAt = System.nanoTime();
        onSnapshot.accept(snapshot);
        onSettled.accept(this);
        return snapshot;
    }

    synchronized boolean isSettled() {
        return settled;
    }

    synchronized RunSnapshot snapshot() {
        return snapshot;
    }

    // ── captured data ─────────────────────────────────────────────────────────

    void recordBundle(SignalBundle b) {
        this.bundle    = b;
        this.fetchedAt = System.nanoTime();
    }

    void recordInsights(List<InsightCandidate> candidates) {
        this.insights   = candidates;
        this.analyzedAt = System.nanoTime();
    }

    void recordAttestation(PrivacyAttestation a) {
        this.attestation = a;
    }

    String runId()                    { return runId; }
    boolean demoMode()                { return demoMode; }
    SignalBundle bundle()             { return bundle; }
    List<InsightCandidate> insights() { return insights; }
    PrivacyAttestation attestation()  { return attestation; }

    // ── timings (ms, 0 when the stage was never reached) ──────────────────────

    long fetchMillis()     { return span(startedAt, fetchedAt); }
    long engineMillis()    { return span(fetchedAt, analyzedAt); }
    long narrationMillis() { return span(analyzedAt, settledAt); }
    long totalMillis()     { return span(startedAt, settledAt); }

    private static long span(Long from, Long to) {
        if (from == null || to == null) return 0;
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, to - from));
    }
}
