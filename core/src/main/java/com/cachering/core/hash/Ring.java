package com.cachering.core.hash;

import com.cachering.core.model.NodeDescriptor;
import com.cachering.core.model.RingSnapshot;
import com.cachering.core.model.TopologyVersion;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Immutable consistent hash ring over the discovered cache nodes.
 * <p>
 * <b>Consistent hashing properties:</b>
 * <ul>
 *   <li>Each node owns {@code vnodesPerNode} points derived only from its own address,
 *       so adding or removing a node moves only the keys that node gains or loses.</li>
 *   <li>Deterministic key → node mapping for a given ring instance.</li>
 *   <li>Lookup is O(log v) over the v virtual nodes.</li>
 * </ul>
 * </p>
 * <p>
 * <b>Thread-safety:</b> Immutable after construction; safe for concurrent reads.
 * A topology change always produces a new instance.
 * </p>
 */
public final class Ring {
    private static final Logger log = LoggerFactory.getLogger(Ring.class);

    public static final int DEFAULT_VNODES_PER_NODE = 160;

    private static final Ring EMPTY = new Ring(
            Collections.emptyNavigableMap(),
            ImmutableList.of(),
            new TopologyVersion(0L, Instant.EPOCH, Hashers.fingerprint(List.of()))
    );

    private final NavigableMap<Long, NodeDescriptor> continuum; // hash → node
    private final ImmutableList<NodeDescriptor> nodes;
    private final ImmutableSet<NodeDescriptor> members;
    private final TopologyVersion version;

    private Ring(NavigableMap<Long, NodeDescriptor> continuum,
                 ImmutableList<NodeDescriptor> nodes,
                 TopologyVersion version) {
        this.continuum = continuum;
        this.nodes = nodes;
        this.members = ImmutableSet.copyOf(nodes);
        this.version = version;
    }

    /**
     * The ring that exists before any discovery has succeeded.
     */
    public static Ring empty() {
        return EMPTY;
    }

    /**
     * Builds a ring from an ordered node list.
     *
     * @param version       Configuration version reported by the cluster
     * @param nodeList      Nodes in discovery order; duplicates are dropped
     * @param vnodesPerNode Number of points each node contributes to the continuum
     * @return Immutable ring
     */
    public static Ring build(long version, List<NodeDescriptor> nodeList, int vnodesPerNode) {
        Preconditions.checkArgument(vnodesPerNode > 0, "vnodesPerNode must be > 0");
        ImmutableList<NodeDescriptor> ordered = ImmutableSet.copyOf(nodeList).asList();

        TreeMap<Long, NodeDescriptor> continuum = new TreeMap<>();
        for (NodeDescriptor node : ordered) {
            for (int i = 0; i < vnodesPerNode; i++) {
                long hash = Hashers.murmur3Hash(node.address() + "#" + i);
                // Deterministic tie-break so collisions don't depend on list order
                continuum.merge(hash, node, (a, b) -> a.address().compareTo(b.address()) <= 0 ? a : b);
            }
        }

        TopologyVersion topologyVersion = TopologyVersion.builder()
                .version(version)
                .fetchedAt(Instant.now())
                .fingerprint(Hashers.fingerprint(ordered))
                .build();

        log.debug("Built ring with {} vnodes from {} nodes (version={})",
                continuum.size(), ordered.size(), version);

        return new Ring(Collections.unmodifiableNavigableMap(continuum), ordered, topologyVersion);
    }

    public static Ring build(long version, List<NodeDescriptor> nodeList) {
        return build(version, nodeList, DEFAULT_VNODES_PER_NODE);
    }

    /**
     * Finds the node owning a key: the first vnode whose hash is ≥ the key hash,
     * wrapping around to the first vnode.
     *
     * @param key Cache key bytes
     * @return Owning node
     * @throws IllegalStateException if the ring is empty
     */
    public NodeDescriptor lookup(byte[] key) {
        if (continuum.isEmpty()) {
            throw new IllegalStateException("Ring is empty");
        }
        Map.Entry<Long, NodeDescriptor> entry = continuum.ceilingEntry(Hashers.murmur3Hash(key));
        if (entry == null) {
            entry = continuum.firstEntry();
        }
        return entry.getValue();
    }

    public NodeDescriptor lookup(String key) {
        return lookup(key.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Finds the first node clockwise from the key's hash that {@code eligible}
     * accepts. Keys of a rejected node spread over its ring successors the same
     * way they would if the node were removed.
     *
     * @param key      Cache key
     * @param eligible Nodes that may own keys right now
     * @return Owning node, or empty when no node is eligible
     * @throws IllegalStateException if the ring is empty
     */
    public Optional<NodeDescriptor> lookup(String key, Predicate<NodeDescriptor> eligible) {
        if (continuum.isEmpty()) {
            throw new IllegalStateException("Ring is empty");
        }
        long hash = Hashers.murmur3Hash(key.getBytes(StandardCharsets.UTF_8));
        Iterable<NodeDescriptor> clockwise = Iterables.concat(
                continuum.tailMap(hash, true).values(),
                continuum.headMap(hash, false).values());
        for (NodeDescriptor node : clockwise) {
            if (eligible.test(node)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public boolean contains(NodeDescriptor node) {
        return members.contains(node);
    }

    /**
     * @return Nodes in the order discovery reported them
     */
    public List<NodeDescriptor> nodes() {
        return nodes;
    }

    public TopologyVersion version() {
        return version;
    }

    public int vnodeCount() {
        return continuum.size();
    }

    /**
     * True when both rings were built from the same version and the same ordered members.
     */
    public boolean sameTopologyAs(Ring other) {
        return other != null
                && version.getVersion() == other.version.getVersion()
                && version.getFingerprint().equals(other.version.getFingerprint());
    }

    public RingSnapshot.RingSnapshotBuilder snapshotBuilder() {
        return RingSnapshot.builder()
                .version(version)
                .nodes(nodes.stream().map(NodeDescriptor::address).collect(Collectors.toList()))
                .vnodeCount(continuum.size());
    }

    @Override
    public String toString() {
        return "Ring{version=" + version.getVersion() + ", nodes=" + nodes + "}";
    }
}
