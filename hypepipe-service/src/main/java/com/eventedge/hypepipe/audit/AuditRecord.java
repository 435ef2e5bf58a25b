package com.eventedge.hypepipe.audit;

import java.time.OffsetDateTime;

/**
 * One audit row per capability request that passed shape validation.
 *
 * <p>{@code denyReason} is set for every non-allow decision except {@link AuditDecision#ERROR};
 * {@code cacheHit} is {@code null} whenever the cache was not consulted.
 */
public record AuditRecord(
    OffsetDateTime ts,
    String agentId,
    Long userId,
    String cap,
    String requestId,
    String traceId,
    AuditDecision decision,
    int latencyMs,
    String policyVersion,
    String denyReason,
    String asof,
    Boolean cacheHit
) {}
