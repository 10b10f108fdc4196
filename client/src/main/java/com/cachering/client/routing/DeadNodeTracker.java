package com.cachering.client.routing;

import com.cachering.client.config.CacheRingConfig;
import com.cachering.core.model.NodeDescriptor;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Takes nodes that keep failing to connect out of routing for a while.
 * <p>
 * A node is marked dead on its {@code retryAttempts + 1}-th counted failure.
 * Failures less than {@code retryTimeout} after the previously counted one
 * do not count, so a burst of concurrent failures is one attempt. A dead node
 * is skipped until {@code deadTimeout} has passed, then routed to again with
 * a clean record. A successful operation clears the record of a live node.
 * </p>
 * <p>
 * {@code deadTimeout = 0} turns ejection off.
 * </p>
 */
public class DeadNodeTracker {
    private static final Logger log = LoggerFactory.getLogger(DeadNodeTracker.class);

    private final int retryAttempts;
    private final Duration retryTimeout;
    private final Duration deadTimeout;
    private final Ticker ticker;
    private final ConcurrentMap<NodeDescriptor, FailureRecord> records = new ConcurrentHashMap<>();

    public DeadNodeTracker(int retryAttempts, Duration retryTimeout, Duration deadTimeout, Ticker ticker) {
        Preconditions.checkArgument(retryAttempts >= 0, "retryAttempts must be >= 0");
        Preconditions.checkArgument(!retryTimeout.isNegative(), "retryTimeout must be >= 0");
        Preconditions.checkArgument(!deadTimeout.isNegative(), "deadTimeout must be >= 0");
        this.retryAttempts = retryAttempts;
        this.retryTimeout = retryTimeout;
        this.deadTimeout = deadTimeout;
        this.ticker = ticker;
    }

    public static DeadNodeTracker from(CacheRingConfig config) {
        return new DeadNodeTracker(config.getRetryAttempts(), config.getRetryTimeout(),
                config.getDeadTimeout(), Ticker.systemTicker());
    }

    public boolean isEnabled() {
        return !deadTimeout.isZero();
    }

    /**
     * @return False while {@code node} sits out its dead timeout
     */
    public boolean isAlive(NodeDescriptor node) {
        FailureRecord record = records.get(node);
        if (record == null || !record.dead()) {
            return true;
        }
        if (ticker.read() - record.deadUntilNanos() < 0) {
            return false;
        }
        if (records.remove(node, record)) {
            log.info("Dead timeout for {} expired, routing to it again", node);
        }
        return true;
    }

    /**
     * Counts a failed attempt to reach {@code node}.
     *
     * @return True if this failure marked the node dead
     */
    public boolean recordFailure(NodeDescriptor node) {
        if (!isEnabled()) {
            return false;
        }
        long now = ticker.read();
        AtomicBoolean markedDead = new AtomicBoolean(false);
        FailureRecord after = records.compute(node, (n, record) -> {
            FailureRecord updated = next(record, now);
            markedDead.set(updated.dead() && updated != record);
            return updated;
        });
        if (markedDead.get()) {
            log.warn("Marking {} dead for {}s after {} failed attempts",
                    node, deadTimeout.toSeconds(), after.failures());
        } else if (!after.dead()) {
            log.debug("Failed attempt {} of {} against {}", after.failures(), retryAttempts + 1, node);
        }
        return markedDead.get();
    }

    /**
     * Clears the failure record of a node that answered.
     */
    public void recordSuccess(NodeDescriptor node) {
        if (!records.isEmpty()) {
            records.computeIfPresent(node, (n, record) -> record.dead() ? record : null);
        }
    }

    private FailureRecord next(FailureRecord record, long now) {
        if (record == null || record.dead() && expired(record, now)) {
            return mark(1, now);
        }
        if (record.dead() || now - record.lastFailureNanos() < retryTimeout.toNanos()) {
            return record;
        }
        return mark(record.failures() + 1, now);
    }

    private FailureRecord mark(int failures, long now) {
        boolean dead = failures > retryAttempts;
        return new FailureRecord(failures, now, dead, dead ? now + deadTimeout.toNanos() : 0L);
    }

    private static boolean expired(FailureRecord record, long now) {
        return now - record.deadUntilNanos() >= 0;
    }

    private record FailureRecord(int failures, long lastFailureNanos, boolean dead, long deadUntilNanos) {
    }
}
