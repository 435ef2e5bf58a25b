package com.eventedge.hypepipe.auth;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Verified identity of one caller for one call. Built fresh per request by
 * {@link TokenVerifier}; never cached or persisted.
 *
 * @param policyVersion opaque tag passed through for audit correlation, may be {@code null}
 */
public record AuthClaims(
    String agentId,
    Set<String> scopes,
    Tier tier,
    String policyVersion,
    Instant expiry
) {
    public AuthClaims {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(expiry, "expiry");
        scopes = scopes != null ? Set.copyOf(scopes) : Set.of();
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }
}
