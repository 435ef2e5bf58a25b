package com.eventedge.hypepipe.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Verifies the {@code Authorization: Bearer <jwt>} credential and binds it to the
 * {@code X-Agent-Id} header.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>agent header present                         → else {@link DenyReason#MISSING_HEADER}</li>
 *   <li>bearer credential present and non-blank      → else {@link DenyReason#MISSING_TOKEN}</li>
 *   <li>signing secret configured                    → else {@link AuthConfigurationException}</li>
 *   <li>HS256 signature valid and not expired        → {@link DenyReason#INVALID_TOKEN} / {@link DenyReason#EXPIRED}</li>
 *   <li>{@code agent_id, scopes, tier, exp} present  → else {@link DenyReason#INVALID_TOKEN}</li>
 *   <li>{@code agent_id} equals the header           → else {@link DenyReason#AGENT_MISMATCH}</li>
 *   <li>{@code scopes} is a list of strings, {@code tier} is a known tier → else {@link DenyReason#INVALID_TOKEN}</li>
 * </ol>
 */
@Component
public class TokenVerifier {

    static final String BEARER_PREFIX = "Bearer ";

    static final String CLAIM_AGENT_ID       = "agent_id";
    static final String CLAIM_SCOPES         = "scopes";
    static final String CLAIM_TIER           = "tier";
    static final String CLAIM_POLICY_VERSION = "policy_version";

    private final SigningSecretProvider secretProvider;
    private final Clock clock;

    public TokenVerifier(SigningSecretProvider secretProvider, Clock clock) {
        this.secretProvider = secretProvider;
        this.clock          = clock;
    }

    /**
     * @param agentIdHeader raw {@code X-Agent-Id} header value, may be {@code null}
     * @param authorization raw {@code Authorization} header value, may be {@code null}
     * @throws AuthDeniedException         the caller is not authenticated
     * @throws AuthConfigurationException  no caller can be authenticated
     */
    public AuthClaims verify(String agentIdHeader, String authorization) {
        if (agentIdHeader == null || agentIdHeader.isBlank()) {
            throw new AuthDeniedException(DenyReason.MISSING_HEADER, "Missing X-Agent-Id header");
        }
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw new AuthDeniedException(DenyReason.MISSING_TOKEN, "Missing or invalid Authorization Bearer token");
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new AuthDeniedException(DenyReason.MISSING_TOKEN, "Empty bearer token");
        }

        Claims claims = parse(token, secretProvider.signingKey());

        Object agentId = claims.get(CLAIM_AGENT_ID);
        Object scopes = claims.get(CLAIM_SCOPES);
        Object tier = claims.get(CLAIM_TIER);
        Date expiry = expiryOf(claims);
        if (agentId == null || scopes == null || tier == null || expiry == null) {
            throw new AuthDeniedException(DenyReason.INVALID_TOKEN,
                "Invalid token: missing one of agent_id, scopes, tier, exp");
        }
        if (!(agentId instanceof String) || ((String) agentId).isBlank()) {
            throw new AuthDeniedException(DenyReason.INVALID_TOKEN, "Invalid token: agent_id must be a string");
        }
        if (!agentId.equals(agentIdHeader)) {
            throw new AuthDeniedException(DenyReason.AGENT_MISMATCH,
                "X-Agent-Id header does not match token agent_id claim");
        }

        Set<String> scopeSet = scopeSet(scopes);
        Tier parsedTier = tier instanceof String ? Tier.fromClaim((String) tier).orElse(null) : null;
        if (parsedTier == null) {
            throw new AuthDeniedException(DenyReason.INVALID_TOKEN, "Unknown tier: " + tier);
        }

        Object policyVersion = claims.get(CLAIM_POLICY_VERSION);
        return new AuthClaims(
            (String) agentId,
            scopeSet,
            parsedTier,
            policyVersion != null ? String.valueOf(policyVersion) : null,
            expiry.toInstant());
    }

    private Claims parse(String token, SecretKey key) {
        try {
            return Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthDeniedException(DenyReason.EXPIRED, "Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthDeniedException(DenyReason.INVALID_TOKEN, "Invalid token: " + e.getMessage(), e);
        }
    }

    private static Date expiryOf(Claims claims) {
        try {
            return claims.getExpiration();
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthDeniedException(DenyReason.INVALID_TOKEN, "Invalid token: exp must be numeric", e);
        }
    }

    private static Set<String> scopeSet(Object raw) {
        if (!(raw instanceof List)) {
            throw new AuthDeniedException(DenyReason.INVALID_TOKEN, "Token scopes claim must be an array");
        }
        Set<String> scopes = new LinkedHashSet<>();
        for (Object scope : (List<?>) raw) {
            if (!(scope instanceof String)) {
                throw new AuthDeniedException(DenyReason.INVALID_TOKEN, "Token scopes claim must contain strings");
            }
            scopes.add((String) scope);
        }
        return scopes;
    }
}
