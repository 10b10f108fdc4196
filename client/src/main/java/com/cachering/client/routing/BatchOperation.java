package com.cachering.client.routing;

import com.cachering.client.protocol.CacheConnection;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Work done once per node for the keys routed to it.
 *
 * @param <T> Per-key result type
 */
@FunctionalInterface
public interface BatchOperation<T> {

    /**
     * @param connection Connection to the node owning every key in {@code keys}
     * @param keys       Keys in first-seen order
     * @return Results keyed by key; keys without a result are simply absent
     */
    Map<String, T> apply(CacheConnection connection, List<String> keys) throws IOException;
}
