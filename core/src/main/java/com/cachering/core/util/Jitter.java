package com.cachering.core.util;

import com.google.common.base.Preconditions;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Randomized spreading of periodic intervals.
 * <p>
 * Many clients started together against the same cluster would otherwise
 * query the configuration endpoint in lock-step.
 * </p>
 */
public final class Jitter {
    private Jitter() {
    }

    /**
     * Scales {@code base} by a uniform factor in {@code [1 - spread, 1 + spread]}.
     *
     * @param base   Nominal interval
     * @param spread Fraction of {@code base}, in {@code [0, 1)}
     * @return Jittered interval; {@code Duration.ZERO} stays zero
     */
    public static Duration spread(Duration base, double spread) {
        Preconditions.checkArgument(spread >= 0.0 && spread < 1.0, "spread must be in [0, 1)");
        if (base.isZero() || spread == 0.0) {
            return base;
        }
        double factor = ThreadLocalRandom.current().nextDouble(1.0 - spread, 1.0 + spread);
        return Duration.ofNanos((long) (base.toNanos() * factor));
    }

    /**
     * The ±20% spread applied to discovery intervals.
     */
    public static Duration discoveryInterval(Duration base) {
        return spread(base, 0.2);
    }
}
