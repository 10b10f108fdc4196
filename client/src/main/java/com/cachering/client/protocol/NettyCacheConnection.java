package com.cachering.client.protocol;

import com.cachering.client.error.OperationFailedException;
import com.cachering.core.model.NodeDescriptor;
import com.google.common.primitives.Bytes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A {@link CacheConnection} over one reactor-netty {@link Connection}.
 * <p>
 * Inbound lines are drained into a queue as they arrive; each command writes
 * its request and then blocks on that queue for the reply, bounded by the
 * operation timeout. A timed out connection is out of sync and must be
 * discarded by the caller.
 * </p>
 */
public class NettyCacheConnection implements CacheConnection {
    private static final Logger log = LoggerFactory.getLogger(NettyCacheConnection.class);

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] END_OF_STREAM = new byte[0];

    private final NodeDescriptor node;
    private final Connection connection;
    private final Duration operationTimeout;
    private final BlockingQueue<byte[]> lines = new LinkedBlockingQueue<>();
    private final Disposable inbound;

    private volatile Throwable inboundError;
    private volatile boolean closed;

    NettyCacheConnection(NodeDescriptor node, Connection connection, Duration operationTimeout) {
        this.node = node;
        this.connection = connection;
        this.operationTimeout = operationTimeout;
        this.inbound = connection.inbound().receive().asByteArray()
                .subscribe(
                        lines::add,
                        error -> {
                            inboundError = error;
                            lines.add(END_OF_STREAM);
                        },
                        () -> lines.add(END_OF_STREAM)
                );
    }

    @Override
    public NodeDescriptor node() {
        return node;
    }

    @Override
    public byte[] rawCommand(byte[] command, byte[] endToken) throws IOException {
        send(command, CRLF);

        ByteArrayOutputStream reply = new ByteArrayOutputStream();
        while (true) {
            byte[] line = nextLine();
            reply.write(line);
            byte[] soFar = reply.toByteArray();
            if (endsWith(soFar, endToken)) {
                return soFar;
            }
            // Error replies are a single line and never carry the end token
            checkError(new String(soFar, StandardCharsets.UTF_8).trim());
        }
    }

    @Override
    public String version() throws IOException {
        String line = command("version");
        if (!line.startsWith("VERSION ")) {
            throw new OperationFailedException("Unexpected reply to version from " + node + ": " + line);
        }
        return line.substring("VERSION ".length()).trim();
    }

    @Override
    public byte[] get(String key) throws IOException {
        return getMany(List.of(key)).get(key);
    }

    @Override
    public Map<String, byte[]> getMany(Collection<String> keys) throws IOException {
        Map<String, byte[]> hits = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            return hits;
        }
        send(utf8("get " + String.join(" ", keys)), CRLF);
        while (true) {
            String line = readLine();
            if (line.equals("END")) {
                return hits;
            }
            checkError(line);
            // VALUE <key> <flags> <bytes> [<cas unique>]
            String[] parts = line.split(" ");
            if (parts.length < 4 || !parts[0].equals("VALUE")) {
                throw new OperationFailedException("Unexpected reply to get from " + node + ": " + line);
            }
            hits.put(parts[1], readDataBlock(parseLength(parts[3], line)));
        }
    }

    @Override
    public boolean set(String key, byte[] value, int ttlSeconds) throws IOException {
        return store("set", key, value, ttlSeconds);
    }

    @Override
    public boolean add(String key, byte[] value, int ttlSeconds) throws IOException {
        return store("add", key, value, ttlSeconds);
    }

    @Override
    public boolean delete(String key) throws IOException {
        String line = command("delete " + key);
        switch (line) {
            case "DELETED":
                return true;
            case "NOT_FOUND":
                return false;
            default:
                throw new OperationFailedException("Unexpected reply to delete from " + node + ": " + line);
        }
    }

    @Override
    public Long incr(String key, long delta) throws IOException {
        return arithmetic("incr", key, delta);
    }

    @Override
    public Long decr(String key, long delta) throws IOException {
        return arithmetic("decr", key, delta);
    }

    @Override
    public boolean isOpen() {
        return !closed && !connection.isDisposed();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        inbound.dispose();
        connection.dispose();
        log.debug("Closed connection to {}", node);
    }

    private boolean store(String verb, String key, byte[] value, int ttlSeconds) throws IOException {
        send(utf8(verb + " " + key + " 0 " + ttlSeconds + " " + value.length), CRLF, value, CRLF);

        String line = readLine();
        switch (line) {
            case "STORED":
                return true;
            case "NOT_STORED":
                return false;
            default:
                checkError(line);
                throw new OperationFailedException("Unexpected reply to " + verb + " from " + node + ": " + line);
        }
    }

    private Long arithmetic(String verb, String key, long delta) throws IOException {
        String line = command(verb + " " + key + " " + Long.toUnsignedString(delta));
        if (line.equals("NOT_FOUND")) {
            return null;
        }
        try {
            return Long.parseUnsignedLong(line);
        } catch (NumberFormatException e) {
            throw new OperationFailedException("Unexpected reply to " + verb + " from " + node + ": " + line, e);
        }
    }

    private String command(String line) throws IOException {
        send(utf8(line), CRLF);
        String reply = readLine();
        checkError(reply);
        return reply;
    }

    private void send(byte[]... parts) throws IOException {
        if (!isOpen()) {
            throw new IOException("Connection to " + node + " is closed");
        }
        Mono<Void> write = connection.outbound().sendByteArray(Mono.just(Bytes.concat(parts))).then();
        try {
            if (operationTimeout.isZero()) {
                write.block();
            } else {
                write.block(operationTimeout);
            }
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            throw new IOException("Write to " + node + " failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Next line including its delimiter.
     */
    private byte[] nextLine() throws IOException {
        byte[] line;
        try {
            line = operationTimeout.isZero()
                    ? lines.take()
                    : lines.poll(operationTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for a reply from " + node);
        }
        if (line == null) {
            throw new SocketTimeoutException("No reply from " + node + " within " + operationTimeout.toMillis() + "ms");
        }
        if (line == END_OF_STREAM) {
            lines.add(END_OF_STREAM);
            Throwable error = inboundError;
            if (error != null) {
                throw new IOException("Connection to " + node + " failed: " + error.getMessage(), error);
            }
            throw new EOFException("Connection to " + node + " closed while reading reply");
        }
        return line;
    }

    private String readLine() throws IOException {
        byte[] line = nextLine();
        int length = line.length;
        if (length > 0 && line[length - 1] == '\n') {
            length--;
        }
        if (length > 0 && line[length - 1] == '\r') {
            length--;
        }
        return new String(line, 0, length, StandardCharsets.UTF_8);
    }

    /**
     * Reads {@code length} data bytes and the CRLF after them. The data may
     * itself contain newlines, so it spans any number of decoded lines.
     */
    private byte[] readDataBlock(int length) throws IOException {
        ByteArrayOutputStream block = new ByteArrayOutputStream(length + CRLF.length);
        while (block.size() < length + CRLF.length) {
            block.write(nextLine());
        }
        byte[] data = block.toByteArray();
        if (data.length != length + CRLF.length || data[length] != '\r' || data[length + 1] != '\n') {
            throw new IOException("Malformed data block of " + length + " bytes from " + node);
        }
        return Arrays.copyOf(data, length);
    }

    /**
     * The data block of a malformed VALUE line cannot be skipped, so the
     * connection is out of sync: reported as an I/O error.
     */
    private int parseLength(String value, String line) throws IOException {
        int length;
        try {
            length = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IOException("Malformed VALUE line from " + node + ": " + line, e);
        }
        if (length < 0) {
            throw new IOException("Malformed VALUE line from " + node + ": " + line);
        }
        return length;
    }

    private void checkError(String line) {
        if (line.equals("ERROR")) {
            throw new OperationFailedException("Command not supported by " + node);
        }
        if (line.startsWith("CLIENT_ERROR") || line.startsWith("SERVER_ERROR")) {
            throw new OperationFailedException(node + " replied " + line);
        }
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static boolean endsWith(byte[] data, byte[] suffix) {
        if (data.length < suffix.length) {
            return false;
        }
        return Arrays.equals(data, data.length - suffix.length, data.length, suffix, 0, suffix.length);
    }
}
