package com.cachering.client.protocol;

import com.cachering.client.error.OperationFailedException;
import com.cachering.client.support.StubMemcachedServer;
import com.cachering.core.model.NodeDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NettyCacheConnectionTest {

    private static final byte[] END_TOKEN = "\n\r\nEND\r\n".getBytes(StandardCharsets.US_ASCII);

    private StubMemcachedServer server;
    private CacheConnection connection;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubMemcachedServer();
        connection = new NettyProtocolClient().open(NodeDescriptor.of("127.0.0.1", server.port()),
                ConnectionSettings.builder().operationTimeout(Duration.ofSeconds(2)).noDelay(true).build());
    }

    @AfterEach
    void tearDown() {
        connection.close();
        server.close();
    }

    // ========== Storage commands ==========

    @Test
    void testSetGetDelete() throws IOException {
        assertTrue(connection.set("greeting", "hello".getBytes(), 0));
        assertArrayEquals("hello".getBytes(), connection.get("greeting"));

        assertTrue(connection.delete("greeting"));
        assertFalse(connection.delete("greeting"));
        assertNull(connection.get("greeting"));
    }

    @Test
    void testAddOnlyWhenAbsent() throws IOException {
        assertTrue(connection.add("k", "1".getBytes(), 60));
        assertFalse(connection.add("k", "2".getBytes(), 60));
        assertArrayEquals("1".getBytes(), connection.get("k"));
    }

    @Test
    void testGetManyReturnsHitsOnly() throws IOException {
        connection.set("a", "1".getBytes(), 0);
        connection.set("c", "3".getBytes(), 0);

        Map<String, byte[]> hits = connection.getMany(List.of("a", "b", "c"));

        assertEquals(List.of("a", "c"), List.copyOf(hits.keySet()));
        assertArrayEquals("3".getBytes(), hits.get("c"));
        assertTrue(connection.getMany(List.of()).isEmpty());
    }

    @Test
    void testIncrDecr() throws IOException {
        assertNull(connection.incr("counter", 1));

        connection.set("counter", "10".getBytes(), 0);
        assertEquals(15L, connection.incr("counter", 5));
        assertEquals(0L, connection.decr("counter", 100));
    }

    @Test
    @DisplayName("Values containing line breaks survive line-based framing")
    void testMultiLineValue() throws IOException {
        byte[] value = "line one\r\nline two\nEND\r\n".getBytes(StandardCharsets.UTF_8);

        assertTrue(connection.set("multi", value, 0));

        assertArrayEquals(value, connection.get("multi"));
        assertArrayEquals(value, connection.getMany(List.of("multi", "other")).get("multi"));
    }

    @Test
    void testEmptyValue() throws IOException {
        assertTrue(connection.set("empty", new byte[0], 0));

        assertArrayEquals(new byte[0], connection.get("empty"));
    }

    // ========== Error replies ==========

    @Test
    @DisplayName("CLIENT_ERROR replies surface as OperationFailedException and keep the stream usable")
    void testClientError() throws IOException {
        connection.set("text", "abc".getBytes(), 0);

        assertThrows(OperationFailedException.class, () -> connection.incr("text", 1));

        assertTrue(connection.isOpen());
        assertArrayEquals("abc".getBytes(), connection.get("text"));
    }

    @Test
    @DisplayName("A malformed VALUE length is an I/O error, not a stray runtime exception")
    void testMalformedValueLength() {
        server.replyOnce("VALUE k 0 abc\r\n");

        IOException error = assertThrows(IOException.class, () -> connection.get("k"));

        assertTrue(error.getMessage().contains("Malformed VALUE line"), error.getMessage());
    }

    @Test
    void testOperationTimeout() throws IOException {
        try (CacheConnection impatient = new NettyProtocolClient().open(NodeDescriptor.of("127.0.0.1", server.port()),
                ConnectionSettings.builder().operationTimeout(Duration.ofMillis(200)).build())) {
            server.replyOnce("");

            assertThrows(SocketTimeoutException.class, () -> impatient.get("k"));
        }
    }

    // ========== Discovery commands ==========

    @Test
    void testVersion() throws IOException {
        assertEquals("1.6.22", connection.version());
    }

    @Test
    void testRawConfigCommand() throws IOException {
        server.clusterConfig(3, "localhost|127.0.0.1|11211");

        byte[] reply = connection.rawCommand("config get cluster".getBytes(StandardCharsets.US_ASCII), END_TOKEN);

        String text = new String(reply, StandardCharsets.US_ASCII);
        assertTrue(text.startsWith("CONFIG cluster 0 "), text);
        assertTrue(text.contains("localhost|127.0.0.1|11211"), text);
        assertTrue(text.endsWith("END\r\n"), text);
    }

    @Test
    @DisplayName("An ERROR reply to a raw command means the node does not support it")
    void testRawCommandUnsupported() {
        OperationFailedException error = assertThrows(OperationFailedException.class,
                () -> connection.rawCommand("config get cluster".getBytes(StandardCharsets.US_ASCII), END_TOKEN));

        assertTrue(error.getMessage().contains("not supported"));
    }

    // ========== Lifecycle ==========

    @Test
    void testCloseIsIdempotent() {
        connection.close();
        connection.close();

        assertFalse(connection.isOpen());
        assertThrows(IOException.class, () -> connection.get("k"));
    }

    @Test
    void testConnectRefused() {
        StubMemcachedServer stopped = new StubMemcachedServer();
        int freePort = stopped.port();
        stopped.close();

        assertThrows(ConnectException.class, () -> new NettyProtocolClient().open(
                NodeDescriptor.of("127.0.0.1", freePort), ConnectionSettings.builder().build()));
    }
}
