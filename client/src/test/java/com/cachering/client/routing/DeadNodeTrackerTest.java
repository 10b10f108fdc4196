package com.cachering.client.routing;

import com.cachering.client.config.CacheRingConfig;
import com.cachering.client.support.ManualTicker;
import com.cachering.core.model.NodeDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DeadNodeTrackerTest {

    private static final NodeDescriptor NODE = NodeDescriptor.of("10.0.0.1", 11211);

    private ManualTicker ticker;

    @BeforeEach
    void setUp() {
        ticker = new ManualTicker();
    }

    @Test
    void testZeroRetryAttemptsEjectsOnFirstFailure() {
        DeadNodeTracker tracker = new DeadNodeTracker(0, Duration.ofSeconds(1), Duration.ofSeconds(30), ticker);

        assertTrue(tracker.recordFailure(NODE));
        assertFalse(tracker.isAlive(NODE));
        assertFalse(tracker.recordFailure(NODE), "already dead");
    }

    @Test
    @DisplayName("Dead node comes back after the dead timeout with a clean record")
    void testRevivalAfterDeadTimeout() {
        DeadNodeTracker tracker = new DeadNodeTracker(1, Duration.ZERO, Duration.ofSeconds(30), ticker);
        tracker.recordFailure(NODE);
        assertTrue(tracker.recordFailure(NODE));

        ticker.advance(Duration.ofSeconds(29));
        assertFalse(tracker.isAlive(NODE));
        ticker.advance(Duration.ofSeconds(1));
        assertTrue(tracker.isAlive(NODE));

        assertFalse(tracker.recordFailure(NODE), "first failure after revival only counts once");
        assertTrue(tracker.isAlive(NODE));
    }

    @Test
    void testSuccessClearsFailures() {
        DeadNodeTracker tracker = new DeadNodeTracker(1, Duration.ZERO, Duration.ofSeconds(30), ticker);

        tracker.recordFailure(NODE);
        tracker.recordSuccess(NODE);

        assertFalse(tracker.recordFailure(NODE));
        assertTrue(tracker.isAlive(NODE));
    }

    @Test
    void testSuccessDoesNotReviveDeadNode() {
        DeadNodeTracker tracker = new DeadNodeTracker(0, Duration.ZERO, Duration.ofSeconds(30), ticker);
        tracker.recordFailure(NODE);

        tracker.recordSuccess(NODE);

        assertFalse(tracker.isAlive(NODE));
    }

    @Test
    void testZeroDeadTimeoutDisablesEjection() {
        DeadNodeTracker tracker = new DeadNodeTracker(0, Duration.ZERO, Duration.ZERO, ticker);

        assertFalse(tracker.isEnabled());
        assertFalse(tracker.recordFailure(NODE));
        assertTrue(tracker.isAlive(NODE));
    }

    @Test
    void testFromConfigDefaults() {
        CacheRingConfig config = CacheRingConfig.builder()
                .configurationEndpoint("cluster.cfg.use1.cache.amazonaws.com:11211")
                .build();

        assertTrue(DeadNodeTracker.from(config).isEnabled());
        assertEquals(2, config.getRetryAttempts());
        assertEquals(Duration.ofSeconds(1), config.getRetryTimeout());
        assertEquals(Duration.ofSeconds(60), config.getDeadTimeout());
    }
}
