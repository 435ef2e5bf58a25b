package com.eventedge.hypepipe.capability;

import com.eventedge.hypepipe.support.StubCapability;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityRegistryTest {

    private static final String ASOF = "2026-03-01T12:00:00Z";

    private final CapabilityRegistry registry = new CapabilityRegistry(List.of(
        StubCapability.returning("sentiment.fear_greed", 300, Map.of(), ASOF),
        StubCapability.returning("core.asset.snapshot", 30, Map.of(), ASOF),
        StubCapability.returning("hypepipe.ping", 0, Map.of(), ASOF)));

    @Test
    @DisplayName("known capabilities are listed ascending")
    void sortedNames() {
        assertEquals(List.of("core.asset.snapshot", "hypepipe.ping", "sentiment.fear_greed"),
            registry.knownCapabilities());
    }

    @Test
    void resolve() {
        assertEquals("core.asset.snapshot", registry.resolve("core.asset.snapshot").orElseThrow().name());
        assertTrue(registry.resolve("unknown.capability").isEmpty());
        assertTrue(registry.resolve(null).isEmpty());
    }

    @Test
    void defaultTtl() {
        assertEquals(300, registry.defaultTtlSeconds("sentiment.fear_greed"));
        assertEquals(0, registry.defaultTtlSeconds("hypepipe.ping"));
        assertEquals(0, registry.defaultTtlSeconds("unknown.capability"));
    }

    @Test
    @DisplayName("two handlers with one name fail start-up")
    void duplicateNames() {
        List<CapabilityHandler> handlers = List.of(
            StubCapability.returning("macro.regime", 60, Map.of(), ASOF),
            StubCapability.returning("macro.regime", 60, Map.of(), ASOF));

        assertThrows(IllegalStateException.class, () -> new CapabilityRegistry(handlers));
    }

    @Test
    @DisplayName("results carry asof inside data; degraded results also carry the note")
    void resultShapes() {
        CapabilityResult ok = CapabilityResult.ok(Map.of("price", 1.0), ASOF);
        assertEquals(Map.of("price", 1.0, "asof", ASOF), ok.data());

        CapabilityResult degraded = CapabilityResult.degraded(Map.of("asset", "DOGE"), ASOF, "stub");
        assertEquals(CapabilityResult.Status.DEGRADED, degraded.status());
        assertEquals(Map.of("asset", "DOGE", "note", "stub", "asof", ASOF), degraded.data());
        assertFalse(degraded.isFault());

        assertTrue(CapabilityResult.fault("boom").isFault());
    }
}
