package com.eventedge.hypepipe.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of {@code POST /api/v1/hypepipe/cap}.
 *
 * @param cap       registered capability name
 * @param input     capability-specific arguments; {@code null} is treated as empty
 * @param ctx       optional caller context
 * @param opts      optional dispatch options
 * @param requestId caller-supplied correlation id, required non-blank
 */
public record CapRequest(
    String cap,
    Map<String, Object> input,
    CapContext ctx,
    CapOptions opts,
    @JsonProperty("request_id") String requestId
) {
    public CapRequest {
        input = input != null ? input : Map.of();
    }
}
