package com.cachering.client.error;

/**
 * Opening a new connection to a node failed.
 */
public class ConnectFailedException extends CacheClientException {

    public ConnectFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
