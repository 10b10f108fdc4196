package com.cachering.client.protocol;

import com.cachering.core.model.NodeDescriptor;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collection;
import java.util.Map;

/**
 * One connection to one cache node. Not thread-safe; a connection is used by
 * exactly one caller between pool acquire and release.
 * <p>
 * Methods throw {@link IOException} for transport failures (the connection is
 * then discarded) and {@link com.cachering.client.error.OperationFailedException}
 * when the node answers with an error (the connection stays usable).
 * </p>
 */
public interface CacheConnection extends Closeable {

    NodeDescriptor node();

    /**
     * Sends a raw command line and reads until the reply ends with {@code endToken}.
     *
     * @param command  Command without the trailing CRLF
     * @param endToken Byte sequence that terminates the reply
     * @return Full reply including the end token
     */
    byte[] rawCommand(byte[] command, byte[] endToken) throws IOException;

    /**
     * @return Server version string, e.g. {@code 1.6.12}
     */
    String version() throws IOException;

    /**
     * @return The value, or null on a miss
     */
    byte[] get(String key) throws IOException;

    /**
     * @return Hits only; missing keys are absent from the map
     */
    Map<String, byte[]> getMany(Collection<String> keys) throws IOException;

    boolean set(String key, byte[] value, int ttlSeconds) throws IOException;

    boolean add(String key, byte[] value, int ttlSeconds) throws IOException;

    boolean delete(String key) throws IOException;

    /**
     * @return New value, or null when the key does not exist
     */
    Long incr(String key, long delta) throws IOException;

    Long decr(String key, long delta) throws IOException;

    boolean isOpen();

    @Override
    void close();
}
