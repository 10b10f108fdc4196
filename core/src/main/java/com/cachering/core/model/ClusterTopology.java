package com.cachering.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one discovery fetch: the configuration version and the node list
 * in the order the configuration endpoint reported it.
 */
@Value
@Builder
public class ClusterTopology {
    long version;

    List<NodeDescriptor> nodes;

    public static ClusterTopology of(long version, List<NodeDescriptor> nodes) {
        return new ClusterTopology(version, List.copyOf(nodes));
    }
}
