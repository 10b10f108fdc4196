package com.cachering.client.pool;

import com.cachering.core.model.NodeDescriptor;

/**
 * A node paired with its dedicated connection pool. Owned by the discovery manager.
 */
public record PoolEntry(NodeDescriptor node, ConnectionPool pool) {
}
