package com.cachering.client.pool;

import com.cachering.client.error.ConnectFailedException;
import com.cachering.client.error.NodeUnavailableException;
import com.cachering.client.error.PoolExhaustedException;
import com.cachering.client.protocol.CacheConnection;
import com.cachering.client.protocol.ConnectionSettings;
import com.cachering.client.protocol.ProtocolClient;
import com.cachering.core.model.NodeDescriptor;
import com.google.common.base.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded pool of connections to a single node.
 * <p>
 * A fair {@link Semaphore} with {@code maxSize} permits gates callers: every
 * checked-out connection holds one permit, and a new connection is only opened
 * by a permit holder that found no idle connection, so checked-out plus idle
 * never exceeds {@code maxSize}. Idle connections sit in a LIFO deque; the
 * least recently used ones age out first.
 * </p>
 * <p>
 * With idle retention off the pool only tracks connections: every acquire
 * opens a fresh one without taking a permit, and every release closes it.
 * </p>
 * <p>
 * <b>Thread-safety:</b> all methods may be called concurrently. Pools of
 * different nodes share nothing.
 * </p>
 */
public class ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final NodeDescriptor node;
    private final PoolSettings settings;
    private final Connector connector;
    private final Ticker ticker;

    private final Semaphore permits;
    private final ConcurrentLinkedDeque<IdleConnection> idle = new ConcurrentLinkedDeque<>();
    private final Set<CacheConnection> checkedOut = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong totalCreated = new AtomicLong();
    private final AtomicLong totalDestroyed = new AtomicLong();
    private final AtomicLong totalExhausted = new AtomicLong();

    public ConnectionPool(NodeDescriptor node, PoolSettings settings, Connector connector, Ticker ticker) {
        this.node = node;
        this.settings = settings.validate();
        this.connector = connector;
        this.ticker = ticker;
        this.permits = new Semaphore(settings.getMaxSize(), true);
    }

    public ConnectionPool(NodeDescriptor node, PoolSettings settings, Connector connector) {
        this(node, settings, connector, Ticker.systemTicker());
    }

    /**
     * Pool whose connections are opened through a {@link ProtocolClient}.
     */
    public static ConnectionPool forNode(NodeDescriptor node,
                                         PoolSettings settings,
                                         ProtocolClient protocolClient,
                                         ConnectionSettings connectionSettings) {
        return new ConnectionPool(node, settings, () -> protocolClient.open(node, connectionSettings));
    }

    public NodeDescriptor node() {
        return node;
    }

    /**
     * Checks out a connection, reusing an idle one when possible.
     *
     * @return Connection owned by the caller until {@link #release}
     * @throws PoolExhaustedException   if no slot frees up within the acquire timeout
     * @throws ConnectFailedException   if a new connection cannot be opened
     * @throws NodeUnavailableException if the pool has been closed
     */
    public CacheConnection acquire() {
        ensureOpen();
        if (!settings.isRetainIdle()) {
            return acquireFresh();
        }

        try {
            if (!permits.tryAcquire(settings.getAcquireTimeout().toNanos(), TimeUnit.NANOSECONDS)) {
                totalExhausted.incrementAndGet();
                throw new PoolExhaustedException("Timed out after " + settings.getAcquireTimeout().toMillis()
                        + "ms waiting for a connection to " + node + " (maxSize=" + settings.getMaxSize() + ")");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectFailedException("Interrupted while waiting for a connection to " + node, e);
        }

        try {
            evictExpired();
            CacheConnection connection = pollIdle();
            if (connection == null) {
                connection = open();
            }
            checkedOut.add(connection);

            if (closed.get()) {
                // closeAll() ran while we were opening
                checkedOut.remove(connection);
                destroy(connection);
                throw poolClosed();
            }
            return connection;
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    /**
     * Returns a connection. Unhealthy connections, and all connections once the
     * pool is closed or when idle retention is off, are closed instead.
     *
     * @param connection Connection obtained from {@link #acquire()}
     * @param healthy    False when the caller saw a transport error on it
     */
    public void release(CacheConnection connection, boolean healthy) {
        if (connection == null) {
            return;
        }
        if (!checkedOut.remove(connection)) {
            log.warn("Ignoring release of a connection not checked out from pool {}", node);
            return;
        }

        if (!settings.isRetainIdle()) {
            destroy(connection);
            return;
        }

        try {
            if (!healthy || closed.get() || !connection.isOpen()) {
                destroy(connection);
            } else {
                idle.addFirst(new IdleConnection(connection, ticker.read()));
                if (closed.get()) {
                    drainIdle();
                }
            }
        } finally {
            permits.release();
        }
        evictExpired();
    }

    /**
     * Closes idle connections and refuses further acquisitions. Connections
     * still checked out are closed when they are released; in-flight
     * operations are not interrupted.
     */
    public void closeAll() {
        if (closed.compareAndSet(false, true)) {
            drainIdle();
            log.info("Closed connection pool for {} ({} connections still in flight)", node, checkedOut.size());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public PoolStats stats() {
        int idleCount = idle.size();
        int inUse = checkedOut.size();
        return new PoolStats(
                inUse + idleCount,
                inUse,
                idleCount,
                totalCreated.get(),
                totalDestroyed.get(),
                totalExhausted.get(),
                closed.get()
        );
    }

    private CacheConnection acquireFresh() {
        CacheConnection connection = open();
        checkedOut.add(connection);
        if (closed.get()) {
            checkedOut.remove(connection);
            destroy(connection);
            throw poolClosed();
        }
        return connection;
    }

    private CacheConnection pollIdle() {
        IdleConnection candidate;
        while ((candidate = idle.pollFirst()) != null) {
            if (isExpired(candidate, ticker.read()) || !candidate.connection().isOpen()) {
                destroy(candidate.connection());
                continue;
            }
            return candidate.connection();
        }
        return null;
    }

    private CacheConnection open() {
        try {
            CacheConnection connection = connector.connect();
            totalCreated.incrementAndGet();
            log.debug("Opened connection to {} (live={})", node, checkedOut.size() + idle.size() + 1);
            return connection;
        } catch (IOException e) {
            throw new ConnectFailedException("Failed to connect to " + node + ": " + e.getMessage(), e);
        }
    }

    private void evictExpired() {
        if (settings.getIdleTimeout().isZero()) {
            return;
        }
        long now = ticker.read();
        for (IdleConnection candidate : idle) {
            if (isExpired(candidate, now) && idle.remove(candidate)) {
                log.debug("Evicting connection to {} idle for over {}ms", node, settings.getIdleTimeout().toMillis());
                destroy(candidate.connection());
            }
        }
    }

    private boolean isExpired(IdleConnection candidate, long now) {
        return !settings.getIdleTimeout().isZero()
                && now - candidate.idleSinceNanos() > settings.getIdleTimeout().toNanos();
    }

    private void drainIdle() {
        IdleConnection candidate;
        while ((candidate = idle.pollFirst()) != null) {
            destroy(candidate.connection());
        }
    }

    private void destroy(CacheConnection connection) {
        totalDestroyed.incrementAndGet();
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.warn("Error closing connection to {}: {}", node, e.getMessage());
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw poolClosed();
        }
    }

    private NodeUnavailableException poolClosed() {
        return new NodeUnavailableException("Connection pool for " + node + " is closed");
    }

    private record IdleConnection(CacheConnection connection, long idleSinceNanos) {
    }
}
