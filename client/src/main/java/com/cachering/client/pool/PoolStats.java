package com.cachering.client.pool;

/**
 * Point-in-time statistics of a {@link ConnectionPool}.
 *
 * @param liveConnections   connections currently open (checked out + idle)
 * @param checkedOut        connections currently held by callers
 * @param idleConnections   connections available for reuse
 * @param totalCreated      cumulative connections opened
 * @param totalDestroyed    cumulative connections closed by the pool
 * @param totalExhausted    cumulative acquisitions that timed out at capacity
 * @param closed            whether {@link ConnectionPool#closeAll()} has run
 */
public record PoolStats(
        int liveConnections,
        int checkedOut,
        int idleConnections,
        long totalCreated,
        long totalDestroyed,
        long totalExhausted,
        boolean closed
) {
}
