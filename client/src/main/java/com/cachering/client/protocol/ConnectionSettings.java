package com.cachering.client.protocol;

import lombok.Builder;
import lombok.Value;

import javax.net.ssl.SSLContext;
import java.time.Duration;

/**
 * Per-connection socket options handed to a {@link ProtocolClient}.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionSettings {
    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * Read timeout for each command; zero means wait indefinitely.
     */
    @Builder.Default
    Duration operationTimeout = Duration.ofSeconds(5);

    boolean noDelay;

    /**
     * Opaque TLS context; forwarded to the protocol client unmodified. Null for plaintext.
     */
    SSLContext tlsContext;
}
