package com.eventedge.hypepipe.audit;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome column of {@code hypepipe_audit_events}. */
public enum AuditDecision {
    ALLOW("allow"),
    DENY("deny"),
    SCOPE_DENIED("scope_denied"),
    UNKNOWN_CAP("unknown_cap"),
    ERROR("error");

    private final String wire;

    AuditDecision(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
