package com.eventedge.hypepipe.policy;

import com.eventedge.hypepipe.auth.AuthClaims;
import com.eventedge.hypepipe.auth.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScopePolicyTest {

    private final ScopePolicy policy = new ScopePolicy();

    private static AuthClaims claims(String... scopes) {
        return new AuthClaims("agent-7", Set.of(scopes), Tier.READONLY, null, Instant.parse("2026-03-01T13:00:00Z"));
    }

    @Test
    void requiredScopePerCapability() {
        assertEquals(Optional.of("read:core.asset.snapshot"), policy.requiredScope("core.asset.snapshot"));
        assertEquals(Optional.of("read:macro.regime"), policy.requiredScope("macro.regime"));
        assertEquals(Optional.of("read:macro.pillars"), policy.requiredScope("macro.pillars"));
        assertEquals(Optional.of("read:sentiment.fear_greed"), policy.requiredScope("sentiment.fear_greed"));
    }

    @Test
    @DisplayName("capabilities outside the table are open to any authenticated caller")
    void unlistedCapabilityIsOpen() {
        assertTrue(policy.requiredScope("hypepipe.ping").isEmpty());
        assertTrue(policy.missingScope(claims(), "hypepipe.ping").isEmpty());
    }

    @Test
    void authorizedWithExactScope() {
        assertTrue(policy.missingScope(claims("read:macro.regime"), "macro.regime").isEmpty());
    }

    @Test
    @DisplayName("matching is exact: no case folding, no prefixes")
    void exactMatchOnly() {
        assertTrue(policy.missingScope(claims("READ:macro.regime"), "macro.regime").isPresent());
        assertTrue(policy.missingScope(claims("read:macro"), "macro.regime").isPresent());
        assertTrue(policy.missingScope(claims("read:*"), "macro.regime").isPresent());
    }

    @Test
    void missingScopeIsReported() {
        assertEquals(Optional.of("read:macro.pillars"),
            policy.missingScope(claims("read:macro.regime"), "macro.pillars"));
    }
}
