package com.cachering.client.protocol;

import com.cachering.core.model.NodeDescriptor;

import java.io.IOException;

/**
 * Opens connections to single cache nodes.
 * <p>
 * This is the seam to the wire protocol: the discovery and routing layers only
 * ever open, use and close {@link CacheConnection}s through it.
 * </p>
 */
public interface ProtocolClient {

    /**
     * Opens a connection.
     *
     * @param node     Target node
     * @param settings Timeouts, TCP options and TLS context
     * @return An open connection owned by the caller
     * @throws IOException if the connection cannot be established
     */
    CacheConnection open(NodeDescriptor node, ConnectionSettings settings) throws IOException;
}
