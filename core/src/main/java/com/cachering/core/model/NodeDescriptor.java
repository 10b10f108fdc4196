package com.cachering.core.model;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable address of a cache node (or of the cluster configuration endpoint).
 * <p>
 * Equality is by {@code (host, port)} only, so a descriptor is a stable key for
 * the pool registry across topology refreshes.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class NodeDescriptor {
    /**
     * Accepts {@code host:port} with a dotted DNS name, or {@code [a.b.c.d]:port}.
     */
    private static final Pattern ENDPOINT_PATTERN = Pattern.compile(
            "^((?:[\\w-]{0,61}\\w\\.)+\\w{1,6}|\\[(?:\\d{1,3}\\.){3}\\d{1,3}]):(\\d{1,5})$"
    );

    /**
     * DNS hostname or IP address.
     */
    String host;

    /**
     * TCP port.
     */
    int port;

    public static NodeDescriptor of(String host, int port) {
        Preconditions.checkArgument(host != null && !host.isBlank(), "host must not be blank");
        Preconditions.checkArgument(port > 0 && port <= 65535, "port out of range: %s", port);
        return new NodeDescriptor(host, port);
    }

    /**
     * Parses a configuration endpoint string.
     *
     * @param endpoint {@code host:port} or {@code [ipv4]:port}
     * @return descriptor with brackets stripped from IP literals
     * @throws IllegalArgumentException if the endpoint does not match the expected form
     */
    public static NodeDescriptor parse(String endpoint) {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint must not be null");
        }
        Matcher matcher = ENDPOINT_PATTERN.matcher(endpoint.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                    "Invalid configuration endpoint '" + endpoint + "' (expected 'host:port' or '[ip]:port')");
        }
        String host = matcher.group(1);
        if (host.startsWith("[")) {
            host = host.substring(1, host.length() - 1);
        }
        return of(host, Integer.parseInt(matcher.group(2)));
    }

    /**
     * @return {@code host:port}
     */
    public String address() {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return address();
    }
}
