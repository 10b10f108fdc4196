package com.cachering.client.error;

/**
 * No connection became available within the connect timeout and the pool is at capacity.
 */
public class PoolExhaustedException extends CacheClientException {

    public PoolExhaustedException(String message) {
        super(message);
    }
}
