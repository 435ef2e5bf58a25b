package com.eventedge.hypepipe.audit;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * Append-only audit row. Rows are never updated or deleted by the service.
 *
 * Column mapping (R2DBC snake_case convention):
 *   agentId       → agent_id
 *   userId        → user_id
 *   requestId     → request_id
 *   traceId       → trace_id
 *   latencyMs     → latency_ms
 *   policyVersion → policy_version
 *   denyReason    → deny_reason
 *   cacheHit      → cache_hit
 */
@Data
@NoArgsConstructor
@Table("hypepipe_audit_events")
public class HypePipeAuditEvent {

    @Id
    private Long id;

    private OffsetDateTime ts;

    private String agentId;

    private Long userId;

    private String cap;

    private String requestId;

    private String traceId;

    /** Wire value of {@link AuditDecision} */
    private String decision;

    private Integer latencyMs;

    // ── later columns (added in place by the schema migration, nullable) ──

    private String policyVersion;

    private String denyReason;

    private String asof;

    private Boolean cacheHit;

    public static HypePipeAuditEvent from(AuditRecord record) {
        HypePipeAuditEvent event = new HypePipeAuditEvent();
        event.setTs(record.ts());
        event.setAgentId(record.agentId());
        event.setUserId(record.userId());
        event.setCap(record.cap());
        event.setRequestId(record.requestId());
        event.setTraceId(record.traceId());
        event.setDecision(record.decision().wire());
        event.setLatencyMs(record.latencyMs());
        event.setPolicyVersion(record.policyVersion());
        event.setDenyReason(record.denyReason());
        event.setAsof(record.asof());
        event.setCacheHit(record.cacheHit());
        return event;
    }
}
