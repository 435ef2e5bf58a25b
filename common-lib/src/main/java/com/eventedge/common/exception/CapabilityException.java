package com.eventedge.common.exception;

/**
 * Raised by a capability handler for conditions that are genuinely exceptional
 * (an internal invariant broke). Missing upstream data is never a reason to throw.
 * The message is prefixed with the capability name.
 */
public class CapabilityException extends RuntimeException {

    public CapabilityException(String capability, String message) {
        super("[" + capability + "] " + message);
    }

    public CapabilityException(String capability, String message, Throwable cause) {
        super("[" + capability + "] " + message, cause);
    }
}
