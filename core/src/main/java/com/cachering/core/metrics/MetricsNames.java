package com.cachering.core.metrics;

/**
 * Micrometer metric names used across the client.
 * <p>
 * <b>Naming convention:</b> {@code cachering.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Discovery fetch attempts.
     * <p>
     * Tags: result (success/failure/regressed), trigger (scheduled/on_demand/manual/retry)
     * </p>
     */
    public static final String DISCOVERY_ATTEMPTS_TOTAL = "cachering.discovery.attempts.total";

    /**
     * Counter: Ring swaps that changed membership.
     */
    public static final String TOPOLOGY_CHANGES_TOTAL = "cachering.discovery.topology.changes.total";

    /**
     * Gauge: Number of physical nodes in the active ring.
     */
    public static final String RING_NODES = "cachering.ring.nodes";

    /**
     * Gauge: Configuration version of the active ring.
     */
    public static final String RING_VERSION = "cachering.ring.version";

    /**
     * Counter: Acquisitions that timed out on a full pool.
     * <p>
     * Tags: node
     * </p>
     */
    public static final String POOL_EXHAUSTED_TOTAL = "cachering.pool.exhausted.total";

    /**
     * Counter: Nodes taken out of routing for their dead timeout.
     * <p>
     * Tags: node
     * </p>
     */
    public static final String NODE_EJECTIONS_TOTAL = "cachering.routing.node.ejections.total";

    /**
     * Timer: Routed cache operation latency including connection acquisition.
     * <p>
     * Tags: operation, result (success/failure)
     * </p>
     */
    public static final String OPERATION_LATENCY = "cachering.operation.latency";
}
