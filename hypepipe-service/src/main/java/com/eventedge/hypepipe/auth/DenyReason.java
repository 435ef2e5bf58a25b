package com.eventedge.hypepipe.auth;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable reason a gateway call was refused. The code is what callers
 * see in the {@code error} field and what the audit row stores in {@code deny_reason}.
 */
public enum DenyReason {
    MISSING_HEADER("missing_header"),
    MISSING_TOKEN("missing_token"),
    INVALID_TOKEN("invalid_token"),
    EXPIRED("expired"),
    AGENT_MISMATCH("agent_mismatch"),
    SCOPE_DENIED("scope_denied"),
    UNKNOWN_CAP("unknown_cap");

    private final String code;

    DenyReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
