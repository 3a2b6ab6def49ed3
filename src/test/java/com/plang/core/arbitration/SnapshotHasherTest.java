package com.plang.core.arbitration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotHasherTest {

    private final SnapshotHasher hasher = new SnapshotHasher();

    @Test
    @DisplayName("canonical JSON sorts keys at every level and keeps nulls")
    void canonicalJson() {
        var nested = new LinkedHashMap<String, Object>();
        nested.put("z", 1);
        nested.put("a", 2);
        var snapshot = new LinkedHashMap<String, Object>();
        snapshot.put("b", nested);
        snapshot.put("a", null);
        snapshot.put("c", List.of("y", "x"));

        assertEquals("{\"a\":null,\"b\":{\"a\":2,\"z\":1},\"c\":[\"y\",\"x\"]}", hasher.canonicalJson(snapshot));
    }

    @Test
    @DisplayName("insertion order does not change the hash")
    void orderIndependent() {
        var one = new HashMap<String, Object>();
        one.put("token_limit", 50L);
        one.put("breach_action", "kill");
        var two = new LinkedHashMap<String, Object>();
        two.put("breach_action", "kill");
        two.put("token_limit", 50L);
        assertEquals(hasher.hash(one), hasher.hash(two));
    }

    @Test
    @DisplayName("hash is lowercase SHA-256 hex")
    void knownDigest() {
        // sha256("{}")
        assertEquals("44136fa355b3678a1146ad16f7e8649e94fb4fc21fe77e8310c060f61caaff8a", hasher.hash(Map.of()));
    }
}
