package com.eventedge.hypepipe.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeysTest {

    @Test
    @DisplayName("key order does not matter, at any depth")
    void orderIndependent() {
        Map<String, Object> nestedA = new LinkedHashMap<>();
        nestedA.put("window", "24h");
        nestedA.put("venue", "All");
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("asset", "BTC");
        a.put("opts", nestedA);
        a.put("fields", List.of("price", "oi"));

        Map<String, Object> nestedB = new LinkedHashMap<>();
        nestedB.put("venue", "All");
        nestedB.put("window", "24h");
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("fields", List.of("price", "oi"));
        b.put("opts", nestedB);
        b.put("asset", "BTC");

        assertEquals(CacheKeys.of("core.asset.snapshot", a), CacheKeys.of("core.asset.snapshot", b));
    }

    @Test
    void differentValueDifferentKey() {
        assertNotEquals(
            CacheKeys.of("core.asset.snapshot", Map.of("asset", "BTC")),
            CacheKeys.of("core.asset.snapshot", Map.of("asset", "ETH")));
    }

    @Test
    @DisplayName("capability name is part of the key")
    void capabilityIsPartOfKey() {
        assertNotEquals(
            CacheKeys.of("macro.regime", Map.of()),
            CacheKeys.of("macro.pillars", Map.of()));
    }

    @Test
    @DisplayName("list order is significant")
    void listOrderMatters() {
        assertNotEquals(
            CacheKeys.of("c", Map.of("fields", List.of("a", "b"))),
            CacheKeys.of("c", Map.of("fields", List.of("b", "a"))));
    }

    @Test
    void nullInputEqualsEmptyInput() {
        assertEquals(CacheKeys.of("hypepipe.ping", null), CacheKeys.of("hypepipe.ping", Map.of()));
    }

    @Test
    void keyIsSha256Hex() {
        assertTrue(CacheKeys.of("macro.regime", Map.of()).matches("[0-9a-f]{64}"));
    }

    @Test
    void canonicalJsonSortsKeys() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("b", 1);
        input.put("a", 2);
        assertEquals("{\"a\":2,\"b\":1}", CacheKeys.canonicalJson(input));
    }
}
