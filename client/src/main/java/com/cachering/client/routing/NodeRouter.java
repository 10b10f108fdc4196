package com.cachering.client.routing;

import com.cachering.client.discovery.IDiscoveryManager;
import com.cachering.client.error.CacheClientException;
import com.cachering.client.error.ConnectFailedException;
import com.cachering.client.error.NodeUnavailableException;
import com.cachering.client.error.OperationFailedException;
import com.cachering.client.error.PoolExhaustedException;
import com.cachering.client.pool.ConnectionPool;
import com.cachering.client.pool.PoolEntry;
import com.cachering.client.protocol.CacheConnection;
import com.cachering.core.hash.Ring;
import com.cachering.core.metrics.MetricsNames;
import com.cachering.core.metrics.MetricsTags;
import com.cachering.core.model.NodeDescriptor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Routes keyed work to the node that owns the key.
 * <p>
 * Each call reads the ring once, resolves the node, borrows a connection from
 * that node's pool and hands it back with health = "no I/O error". If the node
 * left the topology between lookup and acquire, the ring is read again and the
 * call retried once.
 * </p>
 * <p>
 * Nodes that keep failing to connect are skipped for their dead timeout
 * (see {@link DeadNodeTracker}); their keys go to the next live node on the
 * ring, and each ejection kicks off a background topology refresh.
 * </p>
 * <p>
 * With {@code ignoreExc} set, any {@link CacheClientException} is logged and
 * the caller's fallback returned instead.
 * </p>
 */
public class NodeRouter {
    private static final Logger log = LoggerFactory.getLogger(NodeRouter.class);

    private final IDiscoveryManager discovery;
    private final boolean ignoreExc;
    private final DeadNodeTracker deadNodes;
    private final MeterRegistry meterRegistry;

    public NodeRouter(IDiscoveryManager discovery,
                      boolean ignoreExc,
                      DeadNodeTracker deadNodes,
                      MeterRegistry meterRegistry) {
        this.discovery = discovery;
        this.ignoreExc = ignoreExc;
        this.deadNodes = deadNodes;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Runs {@code op} against the node owning {@code key}.
     *
     * @param operation Operation name for logs and metrics
     * @param key       Routing key, already prefixed and validated
     * @param op        Work to run on the connection
     * @param fallback  Returned instead of failing when {@code ignoreExc} is set
     */
    public <T> T withNode(String operation, String key, NodeOperation<T> op, T fallback) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String result = "success";
        try {
            return routeWithRetry(key, op);
        } catch (CacheClientException e) {
            result = "failure";
            return handleFailure(operation, e, fallback);
        } finally {
            sample.stop(operationTimer(operation, result));
        }
    }

    /**
     * Groups {@code keys} by owning node (first-seen order), runs {@code op} once
     * per node and merges the results. With {@code ignoreExc} set, the keys of a
     * failed node are left out of the result.
     */
    public <T> Map<String, T> withNodes(String operation, Collection<String> keys, BatchOperation<T> op) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String result = "success";
        Map<String, T> merged = new LinkedHashMap<>();
        try {
            Map<NodeDescriptor, List<String>> groups = groupByLiveNode(discovery.ensureRing(), keys);
            for (Map.Entry<NodeDescriptor, List<String>> group : groups.entrySet()) {
                try {
                    merged.putAll(runBatchWithRetry(group.getKey(), group.getValue(), op));
                } catch (CacheClientException e) {
                    result = "failure";
                    handleFailure(operation, e, null);
                }
            }
            return merged;
        } catch (CacheClientException e) {
            result = "failure";
            handleFailure(operation, e, null);
            return merged;
        } finally {
            sample.stop(operationTimer(operation, result));
        }
    }

    private <T> T routeWithRetry(String key, NodeOperation<T> op) {
        NodeDescriptor node = resolve(discovery.ensureRing(), key);
        try {
            return runOn(node, op);
        } catch (NodeUnavailableException e) {
            NodeDescriptor retryNode = resolve(discovery.ensureRing(), key);
            log.debug("Node {} left the topology, retrying on {}", node, retryNode);
            return runOn(retryNode, op);
        }
    }

    private <T> Map<String, T> runBatchWithRetry(NodeDescriptor node, List<String> keys, BatchOperation<T> op) {
        try {
            return runOn(node, connection -> op.apply(connection, keys));
        } catch (NodeUnavailableException e) {
            log.debug("Node {} left the topology, re-routing {} keys", node, keys.size());
            Map<String, T> merged = new LinkedHashMap<>();
            for (Map.Entry<NodeDescriptor, List<String>> group
                    : groupByLiveNode(discovery.ensureRing(), keys).entrySet()) {
                List<String> groupKeys = group.getValue();
                merged.putAll(runOn(group.getKey(), connection -> op.apply(connection, groupKeys)));
            }
            return merged;
        }
    }

    private <T> T runOn(NodeDescriptor node, NodeOperation<T> op) {
        PoolEntry entry = discovery.poolEntry(node)
                .orElseThrow(() -> new NodeUnavailableException("Node " + node + " is not part of the topology"));
        ConnectionPool pool = entry.pool();
        CacheConnection connection;
        try {
            connection = pool.acquire();
        } catch (PoolExhaustedException e) {
            meterRegistry.counter(MetricsNames.POOL_EXHAUSTED_TOTAL, MetricsTags.NODE, node.address()).increment();
            throw e;
        } catch (ConnectFailedException e) {
            onNodeFailure(node);
            throw e;
        }
        boolean healthy = false;
        try {
            T value = op.apply(connection);
            healthy = true;
            deadNodes.recordSuccess(node);
            return value;
        } catch (IOException e) {
            onNodeFailure(node);
            throw new OperationFailedException("I/O error talking to " + node + ": " + e.getMessage(), e);
        } catch (OperationFailedException e) {
            // Error reply: the stream is still in sync
            healthy = true;
            deadNodes.recordSuccess(node);
            throw e;
        } finally {
            pool.release(connection, healthy);
        }
    }

    private NodeDescriptor resolve(Ring ring, String key) {
        NodeDescriptor owner = ring.lookup(key);
        if (deadNodes.isAlive(owner)) {
            return owner;
        }
        return ring.lookup(key, deadNodes::isAlive)
                .orElseThrow(() -> new NodeUnavailableException("Every node of the topology is marked dead"));
    }

    private Map<NodeDescriptor, List<String>> groupByLiveNode(Ring ring, Collection<String> keys) {
        return groupByNode(keys, key -> resolve(ring, key));
    }

    private void onNodeFailure(NodeDescriptor node) {
        if (!deadNodes.recordFailure(node)) {
            return;
        }
        meterRegistry.counter(MetricsNames.NODE_EJECTIONS_TOTAL, MetricsTags.NODE, node.address()).increment();
        discovery.refreshAsync().subscribe(
                ring -> log.debug("Topology refreshed after ejecting {}: version {}", node, ring.version().getVersion()),
                err -> log.debug("Topology refresh after ejecting {} failed: {}", node, err.getMessage())
        );
    }

    static Map<NodeDescriptor, List<String>> groupByNode(Collection<String> keys,
                                                         Function<String, NodeDescriptor> owner) {
        Map<NodeDescriptor, List<String>> groups = new LinkedHashMap<>();
        for (String key : keys) {
            groups.computeIfAbsent(owner.apply(key), node -> new ArrayList<>()).add(key);
        }
        return groups;
    }

    private <T> T handleFailure(String operation, CacheClientException e, T fallback) {
        if (!ignoreExc) {
            throw e;
        }
        log.warn("Ignoring {} failure: {}", operation, e.getMessage());
        return fallback;
    }

    private Timer operationTimer(String operation, String result) {
        return Timer.builder(MetricsNames.OPERATION_LATENCY)
                .tags(MetricsTags.OPERATION, operation, MetricsTags.RESULT, result)
                .register(meterRegistry);
    }
}
