package com.cachering.client.discovery;

import com.cachering.client.config.CacheRingConfig;
import com.cachering.client.error.DiscoveryUnavailableException;
import com.cachering.client.pool.ConnectionPool;
import com.cachering.client.pool.PoolEntry;
import com.cachering.client.pool.PoolSettings;
import com.cachering.client.protocol.ProtocolClient;
import com.cachering.core.hash.Ring;
import com.cachering.core.metrics.MetricsNames;
import com.cachering.core.metrics.MetricsTags;
import com.cachering.core.model.ClusterTopology;
import com.cachering.core.model.NodeDescriptor;
import com.cachering.core.model.RingSnapshot;
import com.cachering.core.util.Jitter;
import com.cachering.core.util.JsonUtils;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Keeps the ring in step with the cluster configuration.
 * <p>
 * Readers take the ring from an {@link AtomicReference} and never lock. All
 * discovery attempts, whatever their trigger, run under one {@link ReentrantLock},
 * so at most one fetch is in flight and concurrent on-demand callers that find
 * the ring empty share a single fetch.
 * </p>
 * <p>
 * On a membership change, pools for new nodes are registered before the ring is
 * swapped and pools of vanished nodes are removed and closed after it, so a
 * reader holding the new ring always finds a pool for every node in it.
 * </p>
 */
public class DiscoveryManager implements IDiscoveryManager {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryManager.class);

    private final CacheRingConfig config;
    private final ITopologyFetcher fetcher;
    private final Function<NodeDescriptor, ConnectionPool> poolFactory;
    private final MeterRegistry meterRegistry;
    private final Scheduler scheduler;
    private final boolean ownsScheduler;
    private final Ticker ticker;

    private final AtomicReference<Ring> currentRing = new AtomicReference<>(Ring.empty());
    private final Map<NodeDescriptor, PoolEntry> registry = new ConcurrentHashMap<>();
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicBoolean retryScheduled = new AtomicBoolean(false);

    private volatile DiscoveryState state = DiscoveryState.IDLE;
    private volatile Instant lastDiscoveryAttempt;
    private volatile Throwable lastDiscoveryError;
    private volatile long retryNotBeforeNanos;

    private volatile Disposable periodicRefresh;
    private volatile Disposable pendingRetry;

    public DiscoveryManager(CacheRingConfig config,
                            ITopologyFetcher fetcher,
                            Function<NodeDescriptor, ConnectionPool> poolFactory,
                            MeterRegistry meterRegistry,
                            Scheduler scheduler,
                            Ticker ticker) {
        this(config, fetcher, poolFactory, meterRegistry, scheduler, false, ticker);
    }

    public DiscoveryManager(CacheRingConfig config,
                            ITopologyFetcher fetcher,
                            Function<NodeDescriptor, ConnectionPool> poolFactory,
                            MeterRegistry meterRegistry) {
        this(config, fetcher, poolFactory, meterRegistry,
                Schedulers.newSingle("cache-ring-discovery", true), true, Ticker.systemTicker());
    }

    private DiscoveryManager(CacheRingConfig config,
                             ITopologyFetcher fetcher,
                             Function<NodeDescriptor, ConnectionPool> poolFactory,
                             MeterRegistry meterRegistry,
                             Scheduler scheduler,
                             boolean ownsScheduler,
                             Ticker ticker) {
        this.config = config;
        this.fetcher = fetcher;
        this.poolFactory = poolFactory;
        this.meterRegistry = meterRegistry;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.ticker = ticker;

        Gauge.builder(MetricsNames.RING_NODES, this, m -> m.currentRing.get().nodes().size())
                .description("Physical nodes in the active ring")
                .register(meterRegistry);
        Gauge.builder(MetricsNames.RING_VERSION, this, m -> m.currentRing.get().version().getVersion())
                .description("Configuration version of the active ring")
                .register(meterRegistry);
    }

    /**
     * Data-node pools opened through {@code protocolClient} with the configured pool settings.
     */
    public static Function<NodeDescriptor, ConnectionPool> poolFactory(CacheRingConfig config,
                                                                      ProtocolClient protocolClient) {
        PoolSettings settings = PoolSettings.from(config);
        return node -> ConnectionPool.forNode(node, settings, protocolClient, config.connectionSettings());
    }

    @Override
    public void start() {
        ensureNotShutdown();
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = config.getDiscoveryInterval();
        if (!interval.isZero()) {
            Duration period = Jitter.discoveryInterval(interval);
            periodicRefresh = Flux.interval(period, period, scheduler)
                    .onBackpressureDrop(tick -> log.debug("Discovery still running, dropping tick {}", tick))
                    .subscribe(
                            tick -> refreshQuietly(DiscoveryTrigger.SCHEDULED),
                            err -> log.error("Periodic discovery stopped", err)
                    );
            log.info("Periodic discovery every {} (jittered from {}) against {}",
                    period, interval, config.getConfigurationEndpoint());
        }

        refreshQuietly(DiscoveryTrigger.INITIAL);
    }

    @Override
    public Ring currentRing() {
        return currentRing.get();
    }

    @Override
    public Ring ensureRing() {
        Ring ring = currentRing.get();
        if (!ring.isEmpty()) {
            return ring;
        }
        ensureNotShutdown();
        ring = refresh(DiscoveryTrigger.ON_DEMAND);
        if (ring.isEmpty()) {
            throw new DiscoveryUnavailableException("Cluster discovery returned no nodes");
        }
        return ring;
    }

    @Override
    public Optional<PoolEntry> poolEntry(NodeDescriptor node) {
        PoolEntry entry = registry.get(node);
        if (entry != null) {
            return Optional.of(entry);
        }
        if (shutdown.get() || !currentRing.get().contains(node)) {
            return Optional.empty();
        }

        entry = registry.computeIfAbsent(node, this::newPoolEntry);
        // A swap may have dropped the node between the ring check and the insert
        if (!currentRing.get().contains(node)) {
            if (registry.remove(node, entry)) {
                entry.pool().closeAll();
            }
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public Ring refreshNow() {
        ensureNotShutdown();
        return refresh(DiscoveryTrigger.MANUAL);
    }

    @Override
    public Mono<Ring> refreshAsync() {
        return Mono.fromCallable(this::refreshNow)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public DiscoveryState state() {
        DiscoveryState current = state;
        if (current == DiscoveryState.RETRY_WAIT && !inRetryWindow()) {
            return DiscoveryState.IDLE;
        }
        return current;
    }

    @Override
    public RingSnapshot snapshot() {
        Throwable error = lastDiscoveryError;
        return currentRing.get().snapshotBuilder()
                .state(state().name())
                .lastDiscoveryAttempt(lastDiscoveryAttempt)
                .lastDiscoveryError(error == null ? null : error.getMessage())
                .build();
    }

    @Override
    public String describeTopology() {
        return JsonUtils.writeValueAsString(snapshot());
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        dispose(periodicRefresh);
        dispose(pendingRetry);

        refreshLock.lock();
        try {
            currentRing.set(Ring.empty());
            registry.values().forEach(entry -> entry.pool().closeAll());
            registry.clear();
            state = DiscoveryState.IDLE;
        } finally {
            refreshLock.unlock();
        }

        fetcher.close();
        if (ownsScheduler) {
            scheduler.dispose();
        }
        log.info("Discovery manager for {} shut down", config.getConfigurationEndpoint());
    }

    /**
     * Number of registered pools. Visible for tests.
     */
    int registeredPools() {
        return registry.size();
    }

    private Ring refresh(DiscoveryTrigger trigger) {
        refreshLock.lock();
        try {
            ensureNotShutdown();
            Ring current = currentRing.get();

            // Another caller discovered while this one waited on the lock
            if (trigger == DiscoveryTrigger.ON_DEMAND && !current.isEmpty()) {
                return current;
            }

            if (!trigger.bypassesRetryWindow() && inRetryWindow()) {
                if (trigger == DiscoveryTrigger.ON_DEMAND) {
                    Throwable cause = lastDiscoveryError;
                    throw new DiscoveryUnavailableException(
                            "Cluster discovery failed recently, next attempt in "
                                    + Duration.ofNanos(retryNotBeforeNanos - ticker.read()).toMillis() + " ms",
                            cause);
                }
                log.debug("Skipping {} discovery during retry window", trigger.tagValue());
                return current;
            }

            state = DiscoveryState.FETCHING;
            lastDiscoveryAttempt = Instant.now();

            ClusterTopology topology;
            try {
                topology = fetcher.fetch();
            } catch (RuntimeException e) {
                onFailure(trigger, e);
                if (e instanceof DiscoveryUnavailableException) {
                    throw e;
                }
                throw new DiscoveryUnavailableException("Cluster discovery failed: " + e.getMessage(), e);
            }
            return onSuccess(trigger, topology, current);
        } finally {
            refreshLock.unlock();
        }
    }

    private Ring onSuccess(DiscoveryTrigger trigger, ClusterTopology topology, Ring current) {
        lastDiscoveryError = null;
        retryNotBeforeNanos = 0L;
        state = DiscoveryState.SUCCEEDED;

        try {
            // Versions reset when a cluster is recreated behind the same endpoint
            if (!current.isEmpty() && topology.getVersion() < current.version().getVersion()) {
                countAttempt(trigger, "regressed");
                log.warn("Topology version went backwards from {} to {}, adopting {}",
                        current.version().getVersion(), topology.getVersion(), topology.getNodes());
            } else {
                countAttempt(trigger, "success");
            }

            Ring candidate = Ring.build(topology.getVersion(), topology.getNodes(), config.getVnodesPerNode());
            if (candidate.sameTopologyAs(current)) {
                log.debug("Topology unchanged at version {}", topology.getVersion());
                return current;
            }
            swap(current, candidate);
            return candidate;
        } finally {
            state = DiscoveryState.IDLE;
        }
    }

    private void swap(Ring current, Ring candidate) {
        Set<NodeDescriptor> next = ImmutableSet.copyOf(candidate.nodes());
        Set<NodeDescriptor> previous = ImmutableSet.copyOf(current.nodes());
        Set<NodeDescriptor> added = ImmutableSet.copyOf(Sets.difference(next, previous));
        Set<NodeDescriptor> removed = ImmutableSet.copyOf(Sets.difference(previous, next));

        for (NodeDescriptor node : added) {
            registry.computeIfAbsent(node, this::newPoolEntry);
        }

        currentRing.set(candidate);

        for (NodeDescriptor node : removed) {
            PoolEntry entry = registry.remove(node);
            if (entry != null) {
                entry.pool().closeAll();
            }
        }

        if (!added.isEmpty() || !removed.isEmpty()) {
            meterRegistry.counter(MetricsNames.TOPOLOGY_CHANGES_TOTAL).increment();
        }
        log.info("Topology version {} -> {}: {} nodes, added={}, removed={}",
                current.version().getVersion(), candidate.version().getVersion(),
                next.size(), added, removed);
    }

    private void onFailure(DiscoveryTrigger trigger, RuntimeException e) {
        countAttempt(trigger, "failure");
        state = DiscoveryState.FAILED;
        lastDiscoveryError = e;
        log.warn("Cluster discovery ({}) against {} failed: {}",
                trigger.tagValue(), config.getConfigurationEndpoint(), e.getMessage());

        Duration retryDelay = config.getDiscoveryRetryDelay();
        retryNotBeforeNanos = ticker.read() + retryDelay.toNanos();
        state = DiscoveryState.RETRY_WAIT;
        if (!retryDelay.isZero()) {
            scheduleRetry(retryDelay);
        }
    }

    private void scheduleRetry(Duration retryDelay) {
        if (shutdown.get() || !retryScheduled.compareAndSet(false, true)) {
            return;
        }
        log.debug("Retrying cluster discovery in {}", retryDelay);
        pendingRetry = Mono.delay(retryDelay, scheduler)
                .subscribe(tick -> {
                    retryScheduled.set(false);
                    refreshQuietly(DiscoveryTrigger.RETRY);
                });
    }

    private void refreshQuietly(DiscoveryTrigger trigger) {
        if (shutdown.get()) {
            return;
        }
        try {
            refresh(trigger);
        } catch (DiscoveryUnavailableException e) {
            log.debug("{} discovery failed, ring left at version {}",
                    trigger.tagValue(), currentRing.get().version().getVersion(), e);
        } catch (IllegalStateException e) {
            log.debug("{} discovery skipped: {}", trigger.tagValue(), e.getMessage());
        }
    }

    private boolean inRetryWindow() {
        return retryNotBeforeNanos != 0L && ticker.read() - retryNotBeforeNanos < 0;
    }

    private PoolEntry newPoolEntry(NodeDescriptor node) {
        log.debug("Creating connection pool for {}", node);
        return new PoolEntry(node, poolFactory.apply(node));
    }

    private void countAttempt(DiscoveryTrigger trigger, String result) {
        meterRegistry.counter(MetricsNames.DISCOVERY_ATTEMPTS_TOTAL,
                MetricsTags.RESULT, result,
                MetricsTags.TRIGGER, trigger.tagValue()).increment();
    }

    private void ensureNotShutdown() {
        if (shutdown.get()) {
            throw new IllegalStateException("Discovery manager is shut down");
        }
    }

    private static void dispose(Disposable disposable) {
        if (disposable != null) {
            disposable.dispose();
        }
    }
}
