package com.cachering.client.discovery;

import com.cachering.client.pool.PoolEntry;
import com.cachering.core.hash.Ring;
import com.cachering.core.model.NodeDescriptor;
import com.cachering.core.model.RingSnapshot;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Owns the active ring and the per-node pool registry.
 */
public interface IDiscoveryManager {

    /**
     * Starts the periodic refresh timer (if configured) and runs the initial
     * discovery. A failed initial discovery is logged, not thrown.
     */
    void start();

    /**
     * Current ring, possibly empty. Never blocks.
     */
    Ring currentRing();

    /**
     * Returns a non-empty ring, discovering synchronously if none exists yet.
     *
     * @throws com.cachering.client.error.DiscoveryUnavailableException if discovery fails
     */
    Ring ensureRing();

    /**
     * Pool entry of a node of the current ring, created on first use.
     *
     * @return Empty when the node is not (or no longer) part of the ring
     */
    Optional<PoolEntry> poolEntry(NodeDescriptor node);

    /**
     * Fetches the topology now, ignoring any retry window.
     *
     * @return Ring in effect after the refresh
     */
    Ring refreshNow();

    /**
     * {@link #refreshNow()} on a worker thread.
     */
    Mono<Ring> refreshAsync();

    DiscoveryState state();

    RingSnapshot snapshot();

    /**
     * {@link #snapshot()} rendered as JSON.
     */
    String describeTopology();

    /**
     * Cancels timers, closes every pool and the fetcher. Idempotent.
     */
    void shutdown();
}
