package com.cachering.client;

import com.cachering.client.config.CacheRingConfig;
import com.cachering.client.discovery.DiscoveryManager;
import com.cachering.client.discovery.IDiscoveryManager;
import com.cachering.client.discovery.TopologyFetcher;
import com.cachering.client.protocol.ProtocolClient;
import com.cachering.client.protocol.NettyProtocolClient;
import com.cachering.client.routing.DeadNodeTracker;
import com.cachering.client.routing.NodeRouter;
import com.cachering.core.model.RingSnapshot;
import com.google.common.base.Preconditions;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cache client for an elastic memcached cluster addressed through its
 * configuration endpoint.
 * <p>
 * Keys are routed with consistent hashing over the discovered nodes; the node
 * set is refreshed in the background (every {@code discoveryInterval}) or on
 * first use. Values are raw bytes.
 * </p>
 * <pre>{@code
 * try (CacheRingClient client = CacheRingClient.create(CacheRingConfig.fromEnv())) {
 *     client.set("user:42", payload, 300);
 *     byte[] cached = client.get("user:42");
 * }
 * }</pre>
 */
public class CacheRingClient implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(CacheRingClient.class);

    private final CacheRingConfig config;
    private final IDiscoveryManager discovery;
    private final NodeRouter router;
    private final CacheKeys keys;

    /**
     * Wires the client around an existing discovery manager and starts it.
     */
    public CacheRingClient(CacheRingConfig config, IDiscoveryManager discovery, MeterRegistry meterRegistry) {
        this.config = config.validate();
        this.discovery = discovery;
        this.router = new NodeRouter(discovery, config.isIgnoreExc(), DeadNodeTracker.from(config), meterRegistry);
        this.keys = new CacheKeys(config.getKeyPrefix(), config.isAllowUnicodeKeys());

        discovery.start();
        log.info("Cache ring client for {} started with {} nodes",
                config.getConfigurationEndpoint(), discovery.currentRing().nodes().size());
    }

    public static CacheRingClient create(CacheRingConfig config, ProtocolClient protocolClient,
                                         MeterRegistry meterRegistry) {
        config.validate();
        IDiscoveryManager discovery = new DiscoveryManager(
                config,
                TopologyFetcher.create(config, protocolClient),
                DiscoveryManager.poolFactory(config, protocolClient),
                meterRegistry);
        return new CacheRingClient(config, discovery, meterRegistry);
    }

    public static CacheRingClient create(CacheRingConfig config) {
        return create(config, new NettyProtocolClient(), new SimpleMeterRegistry());
    }

    /**
     * @return The value, or null on a miss
     */
    public byte[] get(String key) {
        String wireKey = keys.toWireKey(key);
        return router.withNode("get", wireKey, connection -> connection.get(wireKey), null);
    }

    /**
     * @return Hits keyed by the caller's keys; misses are absent
     */
    public Map<String, byte[]> getMany(Collection<String> keyList) {
        Map<String, String> wireToKey = toWireKeys(keyList);
        Map<String, byte[]> found = router.withNodes("get_many", wireToKey.keySet(),
                (connection, nodeKeys) -> connection.getMany(nodeKeys));

        Map<String, byte[]> result = new LinkedHashMap<>();
        found.forEach((wireKey, value) -> result.put(wireToKey.get(wireKey), value));
        return result;
    }

    public boolean set(String key, byte[] value, int ttlSeconds) {
        checkValue(value, ttlSeconds);
        String wireKey = keys.toWireKey(key);
        return router.withNode("set", wireKey, connection -> connection.set(wireKey, value, ttlSeconds), false);
    }

    /**
     * Stores every entry, one round of requests per node.
     *
     * @return Keys that were not stored
     */
    public List<String> setMany(Map<String, byte[]> values, int ttlSeconds) {
        Preconditions.checkArgument(ttlSeconds >= 0, "ttlSeconds must be >= 0");
        Map<String, String> wireToKey = toWireKeys(values.keySet());
        Map<String, byte[]> wireValues = new LinkedHashMap<>();
        wireToKey.forEach((wireKey, key) -> wireValues.put(wireKey, values.get(key)));
        wireValues.values().forEach(value -> Preconditions.checkArgument(value != null, "value must not be null"));

        Map<String, Boolean> stored = router.withNodes("set_many", wireValues.keySet(), (connection, nodeKeys) -> {
            Map<String, Boolean> outcome = new LinkedHashMap<>();
            for (String wireKey : nodeKeys) {
                outcome.put(wireKey, connection.set(wireKey, wireValues.get(wireKey), ttlSeconds));
            }
            return outcome;
        });

        List<String> failed = new ArrayList<>();
        wireToKey.forEach((wireKey, key) -> {
            if (!Boolean.TRUE.equals(stored.get(wireKey))) {
                failed.add(key);
            }
        });
        return failed;
    }

    /**
     * Stores only if the key does not exist yet.
     */
    public boolean add(String key, byte[] value, int ttlSeconds) {
        checkValue(value, ttlSeconds);
        String wireKey = keys.toWireKey(key);
        return router.withNode("add", wireKey, connection -> connection.add(wireKey, value, ttlSeconds), false);
    }

    /**
     * @return True if the key existed
     */
    public boolean delete(String key) {
        String wireKey = keys.toWireKey(key);
        return router.withNode("delete", wireKey, connection -> connection.delete(wireKey), false);
    }

    /**
     * @return Number of keys that existed and were deleted
     */
    public int deleteMany(Collection<String> keyList) {
        Map<String, String> wireToKey = toWireKeys(keyList);
        Map<String, Boolean> deleted = router.withNodes("delete_many", wireToKey.keySet(), (connection, nodeKeys) -> {
            Map<String, Boolean> outcome = new LinkedHashMap<>();
            for (String wireKey : nodeKeys) {
                outcome.put(wireKey, connection.delete(wireKey));
            }
            return outcome;
        });
        return (int) deleted.values().stream().filter(Boolean::booleanValue).count();
    }

    /**
     * @return New value, or null if the key does not exist
     */
    public Long incr(String key, long delta) {
        Preconditions.checkArgument(delta >= 0, "delta must be >= 0");
        String wireKey = keys.toWireKey(key);
        return router.withNode("incr", wireKey, connection -> connection.incr(wireKey, delta), null);
    }

    /**
     * @return New value (never below zero), or null if the key does not exist
     */
    public Long decr(String key, long delta) {
        Preconditions.checkArgument(delta >= 0, "delta must be >= 0");
        String wireKey = keys.toWireKey(key);
        return router.withNode("decr", wireKey, connection -> connection.decr(wireKey, delta), null);
    }

    /**
     * Re-reads the cluster configuration now.
     *
     * @return Snapshot of the ring in effect afterwards
     */
    public RingSnapshot refreshTopology() {
        discovery.refreshNow();
        return discovery.snapshot();
    }

    /**
     * Current ring and discovery state as JSON.
     */
    public String describeTopology() {
        return discovery.describeTopology();
    }

    public CacheRingConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        discovery.shutdown();
    }

    private Map<String, String> toWireKeys(Collection<String> keyList) {
        Map<String, String> wireToKey = new LinkedHashMap<>();
        for (String key : keyList) {
            wireToKey.put(keys.toWireKey(key), key);
        }
        return wireToKey;
    }

    private static void checkValue(byte[] value, int ttlSeconds) {
        Preconditions.checkArgument(value != null, "value must not be null");
        Preconditions.checkArgument(ttlSeconds >= 0, "ttlSeconds must be >= 0");
    }
}
