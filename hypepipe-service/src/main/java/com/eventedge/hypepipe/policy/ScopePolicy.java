package com.eventedge.hypepipe.policy;

import com.eventedge.hypepipe.auth.AuthClaims;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Static capability → required-scope table.
 *
 * <p>Capabilities absent from the table are open to any authenticated caller.
 * Matching is exact and case-sensitive; there are no wildcards or hierarchies.
 */
@Component
public class ScopePolicy {

    private static final Map<String, String> REQUIRED_SCOPE = Map.of(
        "core.asset.snapshot",  "read:core.asset.snapshot",
        "macro.regime",         "read:macro.regime",
        "macro.pillars",        "read:macro.pillars",
        "sentiment.fear_greed", "read:sentiment.fear_greed"
    );

    public Optional<String> requiredScope(String capability) {
        return Optional.ofNullable(capability).map(REQUIRED_SCOPE::get);
    }

    /**
     * @return the scope the caller lacks, or empty when the call is authorized
     */
    public Optional<String> missingScope(AuthClaims claims, String capability) {
        return requiredScope(capability).filter(scope -> !claims.hasScope(scope));
    }
}
