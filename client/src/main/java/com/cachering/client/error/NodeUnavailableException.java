package com.cachering.client.error;

/**
 * The node a key resolved to left the topology (its pool is closed) and
 * re-resolving against the newer ring did not help.
 */
public class NodeUnavailableException extends CacheClientException {

    public NodeUnavailableException(String message) {
        super(message);
    }
}
