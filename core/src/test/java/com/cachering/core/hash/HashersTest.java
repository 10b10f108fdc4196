package com.cachering.core.hash;

import com.cachering.core.model.NodeDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashersTest {

    @Test
    void testMurmurIsStable() {
        assertEquals(Hashers.murmur3Hash("10.0.0.1:11211#0"), Hashers.murmur3Hash("10.0.0.1:11211#0"));
        assertNotEquals(Hashers.murmur3Hash("10.0.0.1:11211#0"), Hashers.murmur3Hash("10.0.0.1:11211#1"));
    }

    @Test
    void testSha256Hex() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                Hashers.toHex(Hashers.sha256("")));
    }

    @Test
    void testFingerprintDependsOnOrder() {
        NodeDescriptor a = NodeDescriptor.of("10.0.0.1", 11211);
        NodeDescriptor b = NodeDescriptor.of("10.0.0.2", 11211);

        assertEquals(Hashers.fingerprint(List.of(a, b)), Hashers.fingerprint(List.of(a, b)));
        assertNotEquals(Hashers.fingerprint(List.of(a, b)), Hashers.fingerprint(List.of(b, a)));
        assertEquals(64, Hashers.fingerprint(List.of(a)).length());
    }
}
