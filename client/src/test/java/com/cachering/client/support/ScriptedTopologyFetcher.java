package com.cachering.client.support;

import com.cachering.client.discovery.ITopologyFetcher;
import com.cachering.client.error.DiscoveryUnavailableException;
import com.cachering.core.model.ClusterTopology;
import com.cachering.core.model.NodeDescriptor;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Fetcher that replays queued outcomes; once the queue is empty the last
 * outcome repeats.
 */
public class ScriptedTopologyFetcher implements ITopologyFetcher {

    private final ConcurrentLinkedQueue<Supplier<ClusterTopology>> script = new ConcurrentLinkedQueue<>();
    private final AtomicInteger fetches = new AtomicInteger();
    private final AtomicInteger closes = new AtomicInteger();

    private volatile Supplier<ClusterTopology> last = () -> {
        throw new DiscoveryUnavailableException("nothing scripted");
    };
    private volatile CountDownLatch gate;

    public ScriptedTopologyFetcher thenReturn(long version, NodeDescriptor... nodes) {
        ClusterTopology topology = ClusterTopology.of(version, List.of(nodes));
        script.add(() -> topology);
        return this;
    }

    public ScriptedTopologyFetcher thenFail(String message) {
        script.add(() -> {
            throw new DiscoveryUnavailableException(message);
        });
        return this;
    }

    /**
     * Fetches block until {@link #open()} is called.
     */
    public ScriptedTopologyFetcher gated() {
        gate = new CountDownLatch(1);
        return this;
    }

    public void open() {
        gate.countDown();
    }

    public int fetches() {
        return fetches.get();
    }

    public int closes() {
        return closes.get();
    }

    @Override
    public ClusterTopology fetch() {
        fetches.incrementAndGet();
        CountDownLatch latch = gate;
        if (latch != null) {
            try {
                if (!latch.await(10, TimeUnit.SECONDS)) {
                    throw new DiscoveryUnavailableException("gate never opened");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DiscoveryUnavailableException("interrupted", e);
            }
        }
        Supplier<ClusterTopology> next = script.poll();
        if (next != null) {
            last = next;
        }
        return last.get();
    }

    @Override
    public void close() {
        closes.incrementAndGet();
    }
}
