package com.cachering.client.pool;

import com.cachering.client.protocol.CacheConnection;

import java.io.IOException;

/**
 * Opens a fresh connection for a pool.
 */
@FunctionalInterface
public interface Connector {
    CacheConnection connect() throws IOException;
}
