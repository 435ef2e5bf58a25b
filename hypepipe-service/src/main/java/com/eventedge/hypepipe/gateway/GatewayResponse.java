package com.eventedge.hypepipe.gateway;

import com.eventedge.hypepipe.dto.CapEnvelope;
import org.springframework.http.HttpStatus;

/**
 * Transport-neutral result of one dispatch.
 *
 * @param wwwAuthenticate challenge header value for 401 responses, otherwise {@code null}
 */
public record GatewayResponse(
    HttpStatus status,
    CapEnvelope body,
    String wwwAuthenticate
) {}
