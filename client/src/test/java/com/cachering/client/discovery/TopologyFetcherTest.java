package com.cachering.client.discovery;

import com.cachering.client.error.DiscoveryUnavailableException;
import com.cachering.client.error.OperationFailedException;
import com.cachering.client.pool.ConnectionPool;
import com.cachering.client.pool.PoolSettings;
import com.cachering.client.protocol.ConnectionSettings;
import com.cachering.client.support.FakeCacheConnection;
import com.cachering.client.support.FakeProtocolClient;
import com.cachering.core.model.ClusterTopology;
import com.cachering.core.model.NodeDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopologyFetcherTest {

    private static final NodeDescriptor ENDPOINT = NodeDescriptor.parse("cluster.cfg.use1.cache.amazonaws.com:11211");
    private static final byte[] REPLY = ("CONFIG cluster 0 60\r\n9\n"
            + "node1|10.0.0.1|11211 node2|10.0.0.2|11211\n\r\nEND\r\n").getBytes(StandardCharsets.US_ASCII);

    private FakeProtocolClient protocolClient;

    @BeforeEach
    void setUp() {
        protocolClient = new FakeProtocolClient()
                .customize(connection -> connection.respondRaw(() -> REPLY.clone()));
    }

    private TopologyFetcher fetcher(boolean ignoreClusterErrors) {
        ConnectionPool pool = ConnectionPool.forNode(ENDPOINT,
                PoolSettings.builder().maxSize(1).acquireTimeout(Duration.ofMillis(100)).build(),
                protocolClient, ConnectionSettings.builder().build());
        return new TopologyFetcher(ENDPOINT, pool, new ClusterConfigParser(true), ignoreClusterErrors);
    }

    // ========== Happy path ==========

    @Test
    @DisplayName("Modern engines are queried with 'config get cluster'")
    void testFetchWithConfigCommand() {
        TopologyFetcher fetcher = fetcher(false);

        ClusterTopology topology = fetcher.fetch();

        assertEquals(9L, topology.getVersion());
        assertEquals(List.of(NodeDescriptor.of("10.0.0.1", 11211), NodeDescriptor.of("10.0.0.2", 11211)),
                topology.getNodes());
        assertEquals(List.of("version", "config get cluster"), protocolClient.opened().get(0).commands());
    }

    @Test
    @DisplayName("Engines older than 1.4.14 use the legacy key; the version check runs once")
    void testLegacyEngine() {
        protocolClient.customize(connection -> connection
                .engineVersion("1.4.5")
                .respondRaw(() -> REPLY.clone()));
        TopologyFetcher fetcher = fetcher(false);

        fetcher.fetch();
        fetcher.fetch();

        List<String> commands = protocolClient.opened().get(0).commands();
        assertEquals(List.of("version", "get AmazonElastiCache:cluster", "get AmazonElastiCache:cluster"), commands);
    }

    @Test
    void testVersionCheckUnsupported() {
        protocolClient.customize(connection -> connection
                .engineVersion(null)
                .respondRaw(() -> REPLY.clone()));

        fetcher(false).fetch();

        assertEquals(List.of("version", "config get cluster"), protocolClient.opened().get(0).commands());
    }

    @Test
    void testSupportsConfigCommand() {
        assertTrue(TopologyFetcher.supportsConfigCommand("1.4.14"));
        assertTrue(TopologyFetcher.supportsConfigCommand("1.4.34"));
        assertTrue(TopologyFetcher.supportsConfigCommand("1.6.22"));
        assertTrue(TopologyFetcher.supportsConfigCommand("1.10.0"));
        assertFalse(TopologyFetcher.supportsConfigCommand("1.4.5"));
        assertFalse(TopologyFetcher.supportsConfigCommand("1.3.20"));
        assertTrue(TopologyFetcher.supportsConfigCommand("garbage"));
    }

    // ========== Failures ==========

    @Test
    @DisplayName("A timed-out fetch raises DiscoveryUnavailable and discards the connection")
    void testTimeoutDiscardsConnection() {
        protocolClient.customize(connection -> connection.failWith(new SocketTimeoutException("read timed out")));
        TopologyFetcher fetcher = fetcher(false);

        assertThrows(DiscoveryUnavailableException.class, fetcher::fetch);

        FakeCacheConnection used = protocolClient.opened().get(0);
        assertFalse(used.isOpen());
    }

    @Test
    void testUnreachableEndpoint() {
        protocolClient.makeUnreachable(ENDPOINT);

        DiscoveryUnavailableException error = assertThrows(DiscoveryUnavailableException.class, fetcher(false)::fetch);
        assertTrue(error.getMessage().contains(ENDPOINT.address()));
    }

    @Test
    void testMalformedReply() {
        protocolClient.customize(connection -> connection.respondRaw(() -> "garbage\r\n".getBytes()));

        assertThrows(DiscoveryUnavailableException.class, fetcher(false)::fetch);
    }

    @Test
    @DisplayName("ignore_cluster_errors falls back to the endpoint as the only node")
    void testIgnoreClusterErrors() {
        protocolClient.customize(connection -> connection.respondRaw(() -> {
            throw new OperationFailedException("Command not supported by node");
        }));

        ClusterTopology topology = fetcher(true).fetch();

        assertEquals(0L, topology.getVersion());
        assertEquals(List.of(ENDPOINT), topology.getNodes());
        // Error replies leave the stream in sync, so the connection is kept
        assertTrue(protocolClient.opened().get(0).isOpen());
    }

    @Test
    void testClusterErrorWithoutFallback() {
        protocolClient.customize(connection -> connection.respondRaw(() -> {
            throw new OperationFailedException("Command not supported by node");
        }));

        assertThrows(DiscoveryUnavailableException.class, fetcher(false)::fetch);
    }

    @Test
    void testCloseClosesPool() {
        TopologyFetcher fetcher = fetcher(false);
        fetcher.fetch();

        fetcher.close();

        assertFalse(protocolClient.opened().get(0).isOpen());
    }
}
