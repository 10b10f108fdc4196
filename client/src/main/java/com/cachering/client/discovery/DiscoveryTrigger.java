package com.cachering.client.discovery;

import java.util.Locale;

/**
 * What started a discovery attempt. Used as a metric tag and in log lines.
 */
public enum DiscoveryTrigger {
    /** First attempt when the client starts. */
    INITIAL,
    /** Periodic timer tick. */
    SCHEDULED,
    /** An operation found the ring empty. */
    ON_DEMAND,
    /** Administrative refresh. */
    MANUAL,
    /** Background retry after a failed attempt. */
    RETRY;

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether this trigger may fetch while a recent failure's retry window is open.
     */
    boolean bypassesRetryWindow() {
        return this == MANUAL || this == RETRY || this == INITIAL;
    }
}
