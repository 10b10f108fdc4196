package com.cachering.client.discovery;

/**
 * Phase of the discovery cycle.
 * <pre>
 *   IDLE -> FETCHING -> SUCCEEDED -> IDLE
 *                    -> FAILED -> RETRY_WAIT -> IDLE
 * </pre>
 */
public enum DiscoveryState {
    IDLE,
    FETCHING,
    SUCCEEDED,
    FAILED,
    /**
     * A fetch failed recently; scheduled and on-demand attempts are held back
     * until the retry delay elapses.
     */
    RETRY_WAIT
}
