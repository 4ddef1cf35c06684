package com.casefile.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of the offline check. Backs the privacy statement of a report; an unverified
 * attestation forces a qualified statement.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PrivacyAttestation(
    @JsonProperty("network_status")   String networkStatus,
    @JsonProperty("privacy_verified") boolean privacyVerified
) {
    public static PrivacyAttestation unverified(String networkStatus) {
        return new PrivacyAttestation(networkStatus, false);
    }
}
