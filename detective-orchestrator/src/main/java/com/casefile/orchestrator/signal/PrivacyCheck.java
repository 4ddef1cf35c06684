package com.casefile.orchestrator.signal;

import com.casefile.common.model.PrivacyAttestation;
import reactor.core.publisher.Mono;

/**
 * Confirms that the analysis runs without network egress. A failed or empty check is
 * treated as unverified by the pipeline.
 */
@FunctionalInterface
public interface PrivacyCheck {

    Mono<PrivacyAttestation> assertOffline();
}
