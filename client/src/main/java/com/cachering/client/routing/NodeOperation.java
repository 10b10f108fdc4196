package com.cachering.client.routing;

import com.cachering.client.protocol.CacheConnection;

import java.io.IOException;

/**
 * Work done on a checked-out connection to the node owning a key.
 * An {@link IOException} marks the connection unhealthy.
 */
@FunctionalInterface
public interface NodeOperation<T> {
    T apply(CacheConnection connection) throws IOException;
}
