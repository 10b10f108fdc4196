package com.cachering.client.error;

/**
 * Root of the client's failure taxonomy.
 * <p>
 * All subclasses are unchecked: the cache facade is used from code paths that
 * typically treat a cache failure as a miss, and {@code ignore_exc} turns them
 * into exactly that at the routing boundary.
 * </p>
 */
public abstract class CacheClientException extends RuntimeException {

    protected CacheClientException(String message) {
        super(message);
    }

    protected CacheClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
