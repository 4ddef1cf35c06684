package com.casefile.orchestrator.cache;

import com.casefile.common.model.SignalBundle;

import java.time.Instant;

/**
 * Immutable cache entry wrapping a {@link SignalBundle} with its fetch timestamp and the
 * demo flag it was gathered under.
 */
public record CachedSignalBundle(
    SignalBundle bundle,
    Instant fetchedAt,
    boolean demoMode
) {}
