package com.cachering.client.config;

import com.cachering.client.pool.PoolSettings;
import com.cachering.core.model.NodeDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheRingConfigTest {

    private static final String ENDPOINT = "cluster.cfg.use1.cache.amazonaws.com:11211";

    @Test
    void testDefaults() {
        CacheRingConfig config = CacheRingConfig.builder().configurationEndpoint(ENDPOINT).build().validate();

        assertEquals(Duration.ZERO, config.getDiscoveryInterval());
        assertTrue(config.isUseVpcIpAddress());
        assertFalse(config.isUsePooling());
        assertFalse(config.isIgnoreExc());
        assertEquals(NodeDescriptor.of("cluster.cfg.use1.cache.amazonaws.com", 11211), config.endpoint());
    }

    @Test
    @DisplayName("Options map onto typed fields; durations are seconds")
    void testFromOptions() {
        Map<String, Object> options = new HashMap<>();
        options.put("discovery_interval", 60);
        options.put("discovery_retry_delay", "2.5");
        options.put("use_pooling", true);
        options.put("max_pool_size", 8);
        options.put("pool_idle_timeout", Duration.ofMinutes(5));
        options.put("ignore_exc", "true");
        options.put("key_prefix", "app:");
        options.put("use_vpc_ip_address", false);

        CacheRingConfig config = CacheRingConfig.fromOptions(ENDPOINT, options);

        assertEquals(Duration.ofSeconds(60), config.getDiscoveryInterval());
        assertEquals(Duration.ofMillis(2500), config.getDiscoveryRetryDelay());
        assertEquals(8, config.getMaxPoolSize());
        assertEquals(Duration.ofMinutes(5), config.getPoolIdleTimeout());
        assertTrue(config.isIgnoreExc());
        assertEquals("app:", config.getKeyPrefix());
        assertFalse(config.isUseVpcIpAddress());
    }

    @Test
    void testUnknownOptionRejected() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> CacheRingConfig.fromOptions(ENDPOINT, Map.of("discovery_intervall", 5)));

        assertTrue(error.getMessage().contains("discovery_intervall"));
        assertTrue(error.getMessage().contains("discovery_interval"));
    }

    @Test
    void testInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> CacheRingConfig.fromOptions(ENDPOINT, Map.of("discovery_interval", -1)));
        assertThrows(IllegalArgumentException.class,
                () -> CacheRingConfig.fromOptions(ENDPOINT, Map.of("use_pooling", "yes")));
        assertThrows(IllegalArgumentException.class,
                () -> CacheRingConfig.fromOptions(ENDPOINT, Map.of("max_pool_size", 0)));
        assertThrows(IllegalArgumentException.class,
                () -> CacheRingConfig.fromOptions(ENDPOINT, Map.of("tls_context", "not-a-context")));
    }

    @Test
    void testInvalidEndpoint() {
        assertThrows(IllegalArgumentException.class, () -> CacheRingConfig.fromOptions("not an endpoint", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> CacheRingConfig.fromOptions("cache.example.com", Map.of()));
    }

    @Test
    void testPoolSettingsFollowPooling() {
        CacheRingConfig pooled = CacheRingConfig.fromOptions(ENDPOINT,
                Map.of("use_pooling", true, "max_pool_size", 4, "connect_timeout", 2));
        CacheRingConfig unpooled = CacheRingConfig.fromOptions(ENDPOINT, Map.of("max_pool_size", 4));

        PoolSettings pooledSettings = PoolSettings.from(pooled);
        PoolSettings unpooledSettings = PoolSettings.from(unpooled);

        assertEquals(4, pooledSettings.getMaxSize());
        assertTrue(pooledSettings.isRetainIdle());
        assertEquals(Duration.ofSeconds(2), pooledSettings.getAcquireTimeout());
        assertFalse(unpooledSettings.isRetainIdle());
    }

    @Test
    void testDeadNodeOptions() {
        CacheRingConfig config = CacheRingConfig.fromOptions(ENDPOINT,
                Map.of("retry_attempts", 0, "retry_timeout", 0.5, "dead_timeout", 0));

        assertEquals(0, config.getRetryAttempts());
        assertEquals(Duration.ofMillis(500), config.getRetryTimeout());
        assertEquals(Duration.ZERO, config.getDeadTimeout());
        assertThrows(IllegalArgumentException.class,
                () -> CacheRingConfig.fromOptions(ENDPOINT, Map.of("retry_attempts", -1)));
    }

    @Test
    void testFromEnvDefaults() {
        CacheRingConfig config = CacheRingConfig.fromEnv();

        assertNotNull(config.endpoint());
        assertTrue(config.getMaxPoolSize() > 0);
        assertTrue(config.getVnodesPerNode() > 0);
        assertTrue(config.getDeadTimeout().compareTo(Duration.ZERO) >= 0);
    }
}
