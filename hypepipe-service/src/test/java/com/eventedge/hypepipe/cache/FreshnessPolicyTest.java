package com.eventedge.hypepipe.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FreshnessPolicyTest {

    @Test
    @DisplayName("no override → default TTL")
    void noOverride() {
        assertEquals(30L, FreshnessPolicy.effectiveMaxAgeSeconds(null, 30));
    }

    @Test
    @DisplayName("override above the default is clamped down: 1000 → 30")
    void neverStaler() {
        assertEquals(30L, FreshnessPolicy.effectiveMaxAgeSeconds(1000, 30));
    }

    @Test
    void fresherAllowed() {
        assertEquals(5L, FreshnessPolicy.effectiveMaxAgeSeconds(5, 30));
    }

    @Test
    @DisplayName("negative override → 0, a forced miss")
    void negativeClampsToZero() {
        assertEquals(0L, FreshnessPolicy.effectiveMaxAgeSeconds(-5, 30));
        assertEquals(0L, FreshnessPolicy.effectiveMaxAgeSeconds(0, 30));
    }

    @Test
    @DisplayName("non-positive TTL disables caching whatever the override")
    void uncacheable() {
        assertEquals(0L, FreshnessPolicy.effectiveMaxAgeSeconds(null, 0));
        assertEquals(0L, FreshnessPolicy.effectiveMaxAgeSeconds(60, 0));
    }
}
