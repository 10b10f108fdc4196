package com.cachering.client.discovery;

import com.cachering.client.error.DiscoveryUnavailableException;
import com.cachering.core.model.ClusterTopology;
import com.cachering.core.model.NodeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parses the cluster configuration reply.
 * <pre>
 *   CONFIG cluster 0 147
 *   12
 *   node1.example.com|10.0.0.1|11211 node2.example.com|10.0.0.2|11211
 *
 *   END
 * </pre>
 * Legacy engines answer {@code VALUE AmazonElastiCache:cluster 0 147} in place of
 * the {@code CONFIG} header; the body is the same. Membership may span several
 * lines.
 */
public class ClusterConfigParser {
    private static final Logger log = LoggerFactory.getLogger(ClusterConfigParser.class);

    private static final String END = "END";

    private final boolean useVpcIpAddress;

    public ClusterConfigParser(boolean useVpcIpAddress) {
        this.useVpcIpAddress = useVpcIpAddress;
    }

    /**
     * @param response Raw reply bytes, terminated by {@code END}
     * @return Version and nodes in reply order
     * @throws DiscoveryUnavailableException if the reply is malformed or lists no usable node
     */
    public ClusterTopology parse(byte[] response) {
        List<String> lines = Arrays.stream(new String(response, StandardCharsets.UTF_8).split("\r?\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());

        if (lines.isEmpty()) {
            throw new DiscoveryUnavailableException("Cluster discovery: empty response");
        }
        if (lines.size() < 3) {
            log.warn("Cluster discovery: response too short: {}", lines);
            throw new DiscoveryUnavailableException("Cluster discovery: response too short: " + lines.size() + " lines");
        }
        int endIndex = lines.indexOf(END);
        if (endIndex < 0) {
            log.warn("Cluster discovery: response missing END token: {}", lines);
            throw new DiscoveryUnavailableException("Cluster discovery: response missing END token");
        }

        int versionIndex = isHeader(lines.get(0)) ? 1 : 0;
        if (versionIndex + 1 >= endIndex) {
            log.warn("Cluster discovery: no membership line in response: {}", lines);
            throw new DiscoveryUnavailableException("Cluster discovery: no membership line found");
        }

        long version;
        try {
            version = Long.parseLong(lines.get(versionIndex));
        } catch (NumberFormatException e) {
            log.warn("Cluster discovery: cannot parse version line: {}", lines.get(versionIndex));
            throw new DiscoveryUnavailableException(
                    "Cluster discovery: cannot parse version '" + lines.get(versionIndex) + "'", e);
        }

        List<NodeDescriptor> nodes = new ArrayList<>();
        for (String membership : lines.subList(versionIndex + 1, endIndex)) {
            for (String token : membership.split("\\s+")) {
                NodeDescriptor node = parseNode(token);
                if (node != null) {
                    nodes.add(node);
                }
            }
        }
        if (nodes.isEmpty()) {
            log.warn("Cluster discovery: no nodes parsed from response: {}", lines);
            throw new DiscoveryUnavailableException("Cluster discovery: no nodes parsed");
        }

        return ClusterTopology.of(version, nodes);
    }

    private NodeDescriptor parseNode(String token) {
        String[] fields = token.split("\\|", -1);
        if (fields.length != 3) {
            log.warn("Cluster discovery: bad node format in token: {}", token);
            return null;
        }
        String host = fields[0].trim();
        String ip = fields[1].trim();
        String address = useVpcIpAddress && !ip.isEmpty() ? ip : host;
        if (address.isEmpty()) {
            log.warn("Cluster discovery: node token without address: {}", token);
            return null;
        }
        try {
            return NodeDescriptor.of(address, Integer.parseInt(fields[2].trim()));
        } catch (IllegalArgumentException e) {
            log.warn("Cluster discovery: bad port in token {}: {}", token, e.getMessage());
            return null;
        }
    }

    private static boolean isHeader(String line) {
        return line.startsWith("CONFIG ") || line.startsWith("VALUE ");
    }
}
