package com.cachering.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Versioning metadata for a discovered topology.
 * <p>
 * The cluster reports a monotonically increasing configuration version with
 * every membership change. The fingerprint is derived locally from the node
 * list so that two rings built from the same membership can be compared
 * without walking their node lists.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class TopologyVersion {
    /**
     * Version reported by the configuration endpoint; 0 for the empty ring.
     */
    @JsonProperty("version")
    long version;

    /**
     * When this topology was fetched.
     */
    @JsonProperty("fetchedAt")
    Instant fetchedAt;

    /**
     * SHA-256 hex digest of the ordered node addresses.
     */
    @JsonProperty("fingerprint")
    String fingerprint;

    @JsonCreator
    public TopologyVersion(
        @JsonProperty("version") long version,
        @JsonProperty("fetchedAt") Instant fetchedAt,
        @JsonProperty("fingerprint") String fingerprint
    ) {
        this.version = version;
        this.fetchedAt = fetchedAt;
        this.fingerprint = fingerprint;
    }
}
