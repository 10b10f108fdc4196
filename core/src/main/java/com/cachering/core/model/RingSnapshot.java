package com.cachering.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;

/**
 * Serializable view of the active ring and the discovery state around it.
 * <p>
 * Returned by the administrative API; never used for routing.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class RingSnapshot {
    @JsonProperty("version")
    TopologyVersion version;

    /**
     * Node addresses in ring order.
     */
    @JsonProperty("nodes")
    List<String> nodes;

    @JsonProperty("vnodeCount")
    int vnodeCount;

    /**
     * Discovery cycle state at the time of the snapshot.
     */
    @JsonProperty("state")
    String state;

    @JsonProperty("lastDiscoveryAttempt")
    Instant lastDiscoveryAttempt;

    /**
     * Message of the last failed discovery, or null when the last attempt succeeded.
     */
    @JsonProperty("lastDiscoveryError")
    String lastDiscoveryError;
}
