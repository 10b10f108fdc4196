package com.cachering.client.discovery;

import com.cachering.client.config.CacheRingConfig;
import com.cachering.client.error.CacheClientException;
import com.cachering.client.error.DiscoveryUnavailableException;
import com.cachering.client.error.OperationFailedException;
import com.cachering.client.pool.ConnectionPool;
import com.cachering.client.pool.PoolSettings;
import com.cachering.client.protocol.CacheConnection;
import com.cachering.client.protocol.ProtocolClient;
import com.cachering.core.model.ClusterTopology;
import com.cachering.core.model.NodeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Discovery client for the cluster configuration endpoint.
 * <p>
 * Talks to the endpoint through its own {@link ConnectionPool}. The first
 * successful fetch checks the engine version once to choose between
 * {@code config get cluster} (1.4.14 and later) and the legacy
 * {@code get AmazonElastiCache:cluster}.
 * </p>
 */
public class TopologyFetcher implements ITopologyFetcher {
    private static final Logger log = LoggerFactory.getLogger(TopologyFetcher.class);

    static final byte[] CONFIG_GET_CLUSTER = "config get cluster".getBytes(StandardCharsets.US_ASCII);
    static final byte[] LEGACY_GET_CLUSTER = "get AmazonElastiCache:cluster".getBytes(StandardCharsets.US_ASCII);
    static final byte[] END_TOKEN = "\n\r\nEND\r\n".getBytes(StandardCharsets.US_ASCII);

    private static final int[] CONFIG_COMMAND_SINCE = {1, 4, 14};

    private final NodeDescriptor endpoint;
    private final ConnectionPool pool;
    private final ClusterConfigParser parser;
    private final boolean ignoreClusterErrors;

    private volatile byte[] discoveryCommand;

    public TopologyFetcher(NodeDescriptor endpoint,
                           ConnectionPool pool,
                           ClusterConfigParser parser,
                           boolean ignoreClusterErrors) {
        this.endpoint = endpoint;
        this.pool = pool;
        this.parser = parser;
        this.ignoreClusterErrors = ignoreClusterErrors;
    }

    public static TopologyFetcher create(CacheRingConfig config, ProtocolClient protocolClient) {
        NodeDescriptor endpoint = config.endpoint();
        ConnectionPool pool = ConnectionPool.forNode(
                endpoint, PoolSettings.from(config), protocolClient, config.connectionSettings());
        return new TopologyFetcher(
                endpoint, pool, new ClusterConfigParser(config.isUseVpcIpAddress()), config.isIgnoreClusterErrors());
    }

    @Override
    public ClusterTopology fetch() {
        CacheConnection connection;
        try {
            connection = pool.acquire();
        } catch (CacheClientException e) {
            throw new DiscoveryUnavailableException(
                    "Cannot reach configuration endpoint " + endpoint + ": " + e.getMessage(), e);
        }

        boolean healthy = false;
        try {
            byte[] command = discoveryCommand(connection);
            byte[] response = connection.rawCommand(command, END_TOKEN);
            healthy = true;
            return parser.parse(response);
        } catch (IOException e) {
            log.warn("Cluster discovery against {} failed: {}", endpoint, e.toString());
            throw new DiscoveryUnavailableException("Cluster discovery against " + endpoint + " failed", e);
        } catch (OperationFailedException e) {
            healthy = true;
            return fallbackOrThrow(new DiscoveryUnavailableException(
                    "Configuration endpoint " + endpoint + " rejected discovery: " + e.getMessage(), e));
        } catch (DiscoveryUnavailableException e) {
            return fallbackOrThrow(e);
        } finally {
            pool.release(connection, healthy);
        }
    }

    @Override
    public void close() {
        pool.closeAll();
    }

    private ClusterTopology fallbackOrThrow(DiscoveryUnavailableException e) {
        if (!ignoreClusterErrors) {
            throw e;
        }
        log.warn("Ignoring cluster discovery error, using {} as the only node: {}", endpoint, e.getMessage());
        return ClusterTopology.of(0L, List.of(endpoint));
    }

    private byte[] discoveryCommand(CacheConnection connection) throws IOException {
        byte[] command = discoveryCommand;
        if (command != null) {
            return command;
        }
        try {
            String version = connection.version();
            command = supportsConfigCommand(version) ? CONFIG_GET_CLUSTER : LEGACY_GET_CLUSTER;
            log.info("Configuration endpoint {} runs engine {}; using '{}'",
                    endpoint, version, new String(command, StandardCharsets.US_ASCII));
        } catch (OperationFailedException e) {
            log.debug("Version check against {} failed, assuming 'config get cluster': {}", endpoint, e.getMessage());
            command = CONFIG_GET_CLUSTER;
        }
        discoveryCommand = command;
        return command;
    }

    /**
     * Compares a dotted engine version against 1.4.14; unparseable versions count as new.
     */
    static boolean supportsConfigCommand(String version) {
        String[] parts = version.trim().split("\\.");
        for (int i = 0; i < CONFIG_COMMAND_SINCE.length; i++) {
            if (i >= parts.length) {
                return false;
            }
            String digits = parts[i].replaceAll("^(\\d+).*$", "$1");
            int value;
            try {
                value = Integer.parseInt(digits);
            } catch (NumberFormatException e) {
                return true;
            }
            if (value != CONFIG_COMMAND_SINCE[i]) {
                return value > CONFIG_COMMAND_SINCE[i];
            }
        }
        return true;
    }
}
