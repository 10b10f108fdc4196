package com.cachering.client.config;

import com.cachering.client.protocol.ConnectionSettings;
import com.cachering.core.hash.Ring;
import com.cachering.core.model.NodeDescriptor;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import lombok.Builder;
import lombok.Value;

import javax.net.ssl.SSLContext;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for one auto-discovering cache client.
 * <p>
 * Built programmatically, from environment variables ({@link #fromEnv()}), or
 * from a flat option map as host frameworks pass them ({@link #fromOptions}).
 * Option names in the map form are the snake_case names listed in
 * {@link #OPTION_NAMES}; anything else is rejected.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class CacheRingConfig {

    public static final Set<String> OPTION_NAMES = ImmutableSortedSet.of(
            "discovery_interval",
            "discovery_retry_delay",
            "use_vpc_ip_address",
            "use_pooling",
            "max_pool_size",
            "pool_idle_timeout",
            "connect_timeout",
            "timeout",
            "ignore_exc",
            "ignore_cluster_errors",
            "key_prefix",
            "allow_unicode_keys",
            "no_delay",
            "vnodes_per_node",
            "retry_attempts",
            "retry_timeout",
            "dead_timeout",
            "tls_context"
    );

    /**
     * Cluster configuration endpoint, {@code host:port} or {@code [ip]:port}.
     */
    String configurationEndpoint;

    // Discovery
    @Builder.Default
    Duration discoveryInterval = Duration.ZERO;     // 0 = on-demand only
    @Builder.Default
    Duration discoveryRetryDelay = Duration.ZERO;
    @Builder.Default
    boolean useVpcIpAddress = true;
    @Builder.Default
    boolean ignoreClusterErrors = false;

    // Pooling
    @Builder.Default
    boolean usePooling = false;
    @Builder.Default
    int maxPoolSize = 32;
    @Builder.Default
    Duration poolIdleTimeout = Duration.ZERO;       // 0 = never evict

    // Connections
    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(5);
    @Builder.Default
    Duration timeout = Duration.ofSeconds(5);
    @Builder.Default
    boolean noDelay = false;
    SSLContext tlsContext;

    // Keys and routing
    @Builder.Default
    String keyPrefix = "";
    @Builder.Default
    boolean allowUnicodeKeys = false;
    @Builder.Default
    boolean ignoreExc = false;
    @Builder.Default
    int vnodesPerNode = Ring.DEFAULT_VNODES_PER_NODE;

    // Dead-node ejection
    @Builder.Default
    int retryAttempts = 2;
    @Builder.Default
    Duration retryTimeout = Duration.ofSeconds(1);
    @Builder.Default
    Duration deadTimeout = Duration.ofSeconds(60);  // 0 = never eject

    /**
     * Checks field ranges and the endpoint syntax.
     *
     * @return this config
     * @throws IllegalArgumentException on the first invalid field
     */
    public CacheRingConfig validate() {
        NodeDescriptor.parse(configurationEndpoint);
        checkNonNegative(discoveryInterval, "discovery_interval");
        checkNonNegative(discoveryRetryDelay, "discovery_retry_delay");
        checkNonNegative(poolIdleTimeout, "pool_idle_timeout");
        checkNonNegative(connectTimeout, "connect_timeout");
        checkNonNegative(timeout, "timeout");
        checkNonNegative(retryTimeout, "retry_timeout");
        checkNonNegative(deadTimeout, "dead_timeout");
        Preconditions.checkArgument(retryAttempts >= 0, "retry_attempts must be >= 0");
        Preconditions.checkArgument(maxPoolSize > 0, "max_pool_size must be > 0");
        Preconditions.checkArgument(vnodesPerNode > 0, "vnodes_per_node must be > 0");
        Preconditions.checkArgument(keyPrefix != null, "key_prefix must not be null");
        return this;
    }

    public NodeDescriptor endpoint() {
        return NodeDescriptor.parse(configurationEndpoint);
    }

    public ConnectionSettings connectionSettings() {
        return ConnectionSettings.builder()
                .connectTimeout(connectTimeout)
                .operationTimeout(timeout)
                .noDelay(noDelay)
                .tlsContext(tlsContext)
                .build();
    }

    public static CacheRingConfig fromEnv() {
        return CacheRingConfig.builder()
                .configurationEndpoint(getEnv("CACHE_CONFIGURATION_ENDPOINT", "127.0.0.1:11211"))
                .discoveryInterval(seconds(Double.parseDouble(getEnv("CACHE_DISCOVERY_INTERVAL_SEC", "0"))))
                .discoveryRetryDelay(seconds(Double.parseDouble(getEnv("CACHE_DISCOVERY_RETRY_DELAY_SEC", "0"))))
                .useVpcIpAddress(Boolean.parseBoolean(getEnv("CACHE_USE_VPC_IP_ADDRESS", "true")))
                .usePooling(Boolean.parseBoolean(getEnv("CACHE_USE_POOLING", "false")))
                .maxPoolSize(Integer.parseInt(getEnv("CACHE_MAX_POOL_SIZE", "32")))
                .poolIdleTimeout(seconds(Double.parseDouble(getEnv("CACHE_POOL_IDLE_TIMEOUT_SEC", "0"))))
                .connectTimeout(seconds(Double.parseDouble(getEnv("CACHE_CONNECT_TIMEOUT_SEC", "5"))))
                .timeout(seconds(Double.parseDouble(getEnv("CACHE_TIMEOUT_SEC", "5"))))
                .noDelay(Boolean.parseBoolean(getEnv("CACHE_NO_DELAY", "false")))
                .ignoreExc(Boolean.parseBoolean(getEnv("CACHE_IGNORE_EXC", "false")))
                .ignoreClusterErrors(Boolean.parseBoolean(getEnv("CACHE_IGNORE_CLUSTER_ERRORS", "false")))
                .keyPrefix(getEnv("CACHE_KEY_PREFIX", ""))
                .allowUnicodeKeys(Boolean.parseBoolean(getEnv("CACHE_ALLOW_UNICODE_KEYS", "false")))
                .vnodesPerNode(Integer.parseInt(getEnv("CACHE_VNODES_PER_NODE",
                        String.valueOf(Ring.DEFAULT_VNODES_PER_NODE))))
                .retryAttempts(Integer.parseInt(getEnv("CACHE_RETRY_ATTEMPTS", "2")))
                .retryTimeout(seconds(Double.parseDouble(getEnv("CACHE_RETRY_TIMEOUT_SEC", "1"))))
                .deadTimeout(seconds(Double.parseDouble(getEnv("CACHE_DEAD_TIMEOUT_SEC", "60"))))
                .build()
                .validate();
    }

    /**
     * Builds a config from a flat option map.
     *
     * @param configurationEndpoint Cluster configuration endpoint
     * @param options               Options keyed by {@link #OPTION_NAMES}; durations in seconds
     * @return Validated config
     * @throws IllegalArgumentException on an unknown option or a value of the wrong type
     */
    public static CacheRingConfig fromOptions(String configurationEndpoint, Map<String, ?> options) {
        CacheRingConfigBuilder builder = CacheRingConfig.builder().configurationEndpoint(configurationEndpoint);
        for (Map.Entry<String, ?> option : options.entrySet()) {
            String name = option.getKey();
            Object value = option.getValue();
            switch (name) {
                case "discovery_interval" -> builder.discoveryInterval(toDuration(name, value));
                case "discovery_retry_delay" -> builder.discoveryRetryDelay(toDuration(name, value));
                case "use_vpc_ip_address" -> builder.useVpcIpAddress(toBoolean(name, value));
                case "use_pooling" -> builder.usePooling(toBoolean(name, value));
                case "max_pool_size" -> builder.maxPoolSize(toInt(name, value));
                case "pool_idle_timeout" -> builder.poolIdleTimeout(toDuration(name, value));
                case "connect_timeout" -> builder.connectTimeout(toDuration(name, value));
                case "timeout" -> builder.timeout(toDuration(name, value));
                case "ignore_exc" -> builder.ignoreExc(toBoolean(name, value));
                case "ignore_cluster_errors" -> builder.ignoreClusterErrors(toBoolean(name, value));
                case "key_prefix" -> builder.keyPrefix(value == null ? "" : value.toString());
                case "allow_unicode_keys" -> builder.allowUnicodeKeys(toBoolean(name, value));
                case "no_delay" -> builder.noDelay(toBoolean(name, value));
                case "vnodes_per_node" -> builder.vnodesPerNode(toInt(name, value));
                case "retry_attempts" -> builder.retryAttempts(toInt(name, value));
                case "retry_timeout" -> builder.retryTimeout(toDuration(name, value));
                case "dead_timeout" -> builder.deadTimeout(toDuration(name, value));
                case "tls_context" -> {
                    if (value != null && !(value instanceof SSLContext)) {
                        throw new IllegalArgumentException("tls_context must be a javax.net.ssl.SSLContext");
                    }
                    builder.tlsContext((SSLContext) value);
                }
                default -> throw new IllegalArgumentException(
                        "Unknown cache option '" + name + "'; supported options: " + OPTION_NAMES);
            }
        }
        return builder.build().validate();
    }

    private static Duration toDuration(String name, Object value) {
        if (value instanceof Duration duration) {
            return duration;
        }
        if (value == null) {
            return Duration.ZERO;
        }
        if (value instanceof Number number) {
            return seconds(number.doubleValue());
        }
        try {
            return seconds(Double.parseDouble(value.toString()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number of seconds, got '" + value + "'", e);
        }
    }

    private static boolean toBoolean(String name, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = String.valueOf(value).trim().toLowerCase();
        if (text.equals("true") || text.equals("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new IllegalArgumentException(name + " must be a boolean, got '" + value + "'");
    }

    private static int toInt(String name, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static Duration seconds(double seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("duration must be >= 0 seconds, got " + seconds);
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }

    private static void checkNonNegative(Duration duration, String name) {
        Preconditions.checkArgument(duration != null && !duration.isNegative(), "%s must be >= 0", name);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
