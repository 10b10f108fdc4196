package com.cachering.client.error;

/**
 * The configuration endpoint could not be queried or its reply could not be parsed.
 * <p>
 * Surfaces to callers only when no ring has been discovered yet.
 * </p>
 */
public class DiscoveryUnavailableException extends CacheClientException {

    public DiscoveryUnavailableException(String message) {
        super(message);
    }

    public DiscoveryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
