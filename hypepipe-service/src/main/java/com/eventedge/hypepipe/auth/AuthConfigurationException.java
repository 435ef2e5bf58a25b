package com.eventedge.hypepipe.auth;

/**
 * The server cannot verify any token: the signing secret is missing or unusable.
 * Surfaced as a 500, never as a per-caller 401.
 */
public class AuthConfigurationException extends RuntimeException {

    public AuthConfigurationException(String message) {
        super(message);
    }
}
