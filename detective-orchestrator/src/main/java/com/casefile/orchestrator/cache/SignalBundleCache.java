package com.casefile.orchestrator.cache;

import com.casefile.common.model.SignalBundle;
import com.casefile.orchestrator.pipeline.PipelineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-slot in-memory cache for the last gathered {@link SignalBundle}.
 *
 * <p><strong>Fetch once, serve for a while:</strong> repeated runs within the TTL skip the
 * photo and calendar fetches. An entry gathered in the other demo mode counts as a miss and
 * is evicted, as is an expired one. Only bundles with both sources available are stored, so
 * a transient permission failure is never replayed from the cache.
 *
 * <p>Thread-safe via {@link AtomicReference}. No blocking calls.
 */
@Component
public class SignalBundleCache {

    private static final Logger log = LoggerFactory.getLogger(SignalBundleCache.class);

    private final AtomicReference<CachedSignalBundle> slot = new AtomicReference<>();
    private final Clock clock;
    private final Duration ttl;

    public SignalBundleCache(Clock clock, PipelineSettings settings) {
        this.clock = clock;
        this.ttl   = settings.cacheTtl();
    }

    /**
     * Returns the cached entry for the given demo flag, or {@code null} on a miss.
     */
    public CachedSignalBundle get(boolean demoMode) {
        CachedSignalBundle entry = slot.get();
        if (entry == null) {
            log.info("[SignalCache] CACHE_MISS demoMode={} reason=empty", demoMode);
            return null;
        }
        if (entry.demoMode() != demoMode) {
            slot.compareAndSet(entry, null);
            log.info("[SignalCache] CACHE_MISS demoMode={} reason=demo-toggle", demoMode);
            return null;
        }
        if (isExpired(entry)) {
            slot.compareAndSet(entry, null);
            log.info("[SignalCache] CACHE_MISS demoMode={} reason=expired", demoMode);
            return null;
        }
        log.info("[SignalCache] CACHE_HIT demoMode={} ageSeconds={}",
                 demoMode, Duration.between(entry.fetchedAt(), clock.instant()).toSeconds());
        return entry;
    }

    /**
     * Latest bundle regardless of age or demo flag, for the deadline fallback only.
     */
    public SignalBundle peek() {
        CachedSignalBundle entry = slot.get();
        return entry == null ? null : entry.bundle();
    }

    /**
     * Stores a freshly gathered bundle. Partial bundles are skipped.
     *
     * @return true if the bundle was stored
     */
    public boolean put(SignalBundle bundle, boolean demoMode) {
        if (!bundle.photoSourceAvailable() || !bundle.calendarSourceAvailable()) {
            log.info("[SignalCache] CACHE_SKIP demoMode={} reason=partial-bundle", demoMode);
            return false;
        }
        slot.set(new CachedSignalBundle(bundle, clock.instant(), demoMode));
        log.info("[SignalCache] CACHE_REFRESH demoMode={} ttlSeconds={}", demoMode, ttl.toSeconds());
        return true;
    }

    public void invalidate() {
        if (slot.getAndSet(null) != null) {
            log.info("[SignalCache] CACHE_INVALIDATED");
        }
    }

    private boolean isExpired(CachedSignalBundle entry) {
        return !clock.instant().isBefore(entry.fetchedAt().plus(ttl));
    }
}
