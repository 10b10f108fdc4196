package com.cachering.client.pool;

import com.cachering.client.config.CacheRingConfig;
import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Sizing and timing of one {@link ConnectionPool}.
 */
@Value
@Builder(toBuilder = true)
public class PoolSettings {
    @Builder.Default
    int maxSize = 32;

    /**
     * Upper bound on waiting for a free slot in {@link ConnectionPool#acquire()}.
     */
    @Builder.Default
    Duration acquireTimeout = Duration.ofSeconds(5);

    /**
     * Idle connections older than this are closed; zero disables eviction.
     */
    @Builder.Default
    Duration idleTimeout = Duration.ZERO;

    /**
     * False turns the pool into open-per-acquire, close-per-release; {@code maxSize}
     * and {@code acquireTimeout} then no longer apply.
     */
    @Builder.Default
    boolean retainIdle = true;

    public static PoolSettings from(CacheRingConfig config) {
        return PoolSettings.builder()
                .maxSize(config.getMaxPoolSize())
                .acquireTimeout(config.getConnectTimeout())
                .idleTimeout(config.getPoolIdleTimeout())
                .retainIdle(config.isUsePooling())
                .build()
                .validate();
    }

    public PoolSettings validate() {
        Preconditions.checkArgument(maxSize > 0, "maxSize must be > 0");
        Preconditions.checkArgument(!acquireTimeout.isNegative(), "acquireTimeout must be >= 0");
        Preconditions.checkArgument(!idleTimeout.isNegative(), "idleTimeout must be >= 0");
        return this;
    }
}
