package com.cachering.core.hash;

import com.cachering.core.model.NodeDescriptor;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stable hash functions for the ring and for topology fingerprints.
 * <p>
 * Murmur3 positions keys and virtual nodes on the continuum; SHA-256 only
 * fingerprints node lists and is kept off the lookup path.
 * </p>
 */
public final class Hashers {
    private Hashers() {
    }

    /**
     * Computes Murmur3 128-bit hash and returns the lower 64 bits as a long.
     *
     * @param data Input bytes
     * @return 64-bit hash value (signed long)
     */
    public static long murmur3Hash(byte[] data) {
        HashCode hash = Hashing.murmur3_128().hashBytes(data);
        return hash.asLong();
    }

    /**
     * Computes Murmur3 hash of a UTF-8 string.
     *
     * @param str Input string
     * @return 64-bit hash value
     */
    public static long murmur3Hash(String str) {
        return murmur3Hash(str.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Computes SHA-256 hash and returns the full 256 bits.
     *
     * @param data Input bytes
     * @return 32-byte SHA-256 hash
     */
    public static byte[] sha256(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static byte[] sha256(String str) {
        return sha256(str.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Converts a byte array to a lowercase hex string.
     */
    public static String toHex(byte[] bytes) {
        return HashCode.fromBytes(bytes).toString();
    }

    /**
     * Fingerprints an ordered node list. Order matters: the same members in a
     * different order yield a different fingerprint.
     *
     * @param nodes Node list as reported by discovery
     * @return Hex SHA-256 of the comma-joined addresses
     */
    public static String fingerprint(List<NodeDescriptor> nodes) {
        return toHex(sha256(nodes.stream()
                .map(NodeDescriptor::address)
                .collect(Collectors.joining(","))));
    }
}
