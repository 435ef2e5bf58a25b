package com.eventedge.hypepipe.auth;

/**
 * A caller failed authentication. Carries the {@link DenyReason} reported to the
 * caller and written to the audit row.
 */
public class AuthDeniedException extends RuntimeException {
    private final DenyReason reason;

    public AuthDeniedException(DenyReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthDeniedException(DenyReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public DenyReason getReason() {
        return reason;
    }
}
