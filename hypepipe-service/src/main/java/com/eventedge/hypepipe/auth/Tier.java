package com.eventedge.hypepipe.auth;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Caller classification carried in the token. Informational beyond being a
 * required, well-typed claim.
 */
public enum Tier {
    READONLY("readonly"),
    PAPER("paper"),
    ORCHESTRATOR("orchestrator");

    private final String claim;

    Tier(String claim) {
        this.claim = claim;
    }

    @JsonValue
    public String claim() {
        return claim;
    }

    /** Exact, case-sensitive match against the token's {@code tier} claim. */
    public static Optional<Tier> fromClaim(String value) {
        for (Tier tier : values()) {
            if (tier.claim.equals(value)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
