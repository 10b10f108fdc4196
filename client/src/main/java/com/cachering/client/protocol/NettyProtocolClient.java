package com.cachering.client.protocol;

import com.cachering.core.model.NodeDescriptor;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.JdkSslContext;
import io.netty.handler.ssl.SslContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.netty.Connection;
import reactor.netty.tcp.TcpClient;

import java.io.IOException;

/**
 * Memcached text protocol over reactor-netty.
 * <p>
 * Each {@link #open} makes one dedicated TCP connection; reactor-netty's own
 * connection pool is not used because the caller's pool owns connection
 * lifetime. Replies are split into lines by a {@link LineBasedFrameDecoder}
 * that keeps the delimiters, so data blocks are reassembled byte for byte.
 * </p>
 */
public class NettyProtocolClient implements ProtocolClient {
    private static final Logger log = LoggerFactory.getLogger(NettyProtocolClient.class);

    /**
     * Longest run of bytes without a newline; covers the 1 MiB default item size.
     */
    static final int MAX_FRAME_LENGTH = 2 * 1024 * 1024;

    private static final String FRAME_DECODER = "cacheRingFrameDecoder";

    @Override
    public CacheConnection open(NodeDescriptor node, ConnectionSettings settings) throws IOException {
        TcpClient client = TcpClient.newConnection()
                .host(node.getHost())
                .port(node.getPort())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) settings.getConnectTimeout().toMillis())
                .option(ChannelOption.TCP_NODELAY, settings.isNoDelay())
                .doOnConnected(conn -> conn.addHandlerLast(FRAME_DECODER,
                        new LineBasedFrameDecoder(MAX_FRAME_LENGTH, false, true)));

        if (settings.getTlsContext() != null) {
            SslContext sslContext = new JdkSslContext(settings.getTlsContext(), true, ClientAuth.NONE);
            client = client.secure(ssl -> ssl.sslContext(sslContext)
                    .handshakeTimeout(settings.getConnectTimeout()));
        }

        Connection connection;
        try {
            connection = client.connect().block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Failed to connect to " + node + ": " + cause.getMessage(), cause);
        }
        if (connection == null) {
            throw new IOException("Failed to connect to " + node + ": no connection");
        }

        log.debug("Opened connection to {}", node);
        return new NettyCacheConnection(node, connection, settings.getOperationTimeout());
    }
}
