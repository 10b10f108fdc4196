package com.cachering.client.discovery;

import com.cachering.core.model.ClusterTopology;

/**
 * Queries the cluster configuration endpoint for the current membership.
 */
public interface ITopologyFetcher {

    /**
     * Performs one discovery round trip.
     *
     * @return Version and nodes as reported by the cluster
     * @throws com.cachering.client.error.DiscoveryUnavailableException on connect, timeout or parse failure
     */
    ClusterTopology fetch();

    /**
     * Releases connections to the configuration endpoint.
     */
    void close();
}
