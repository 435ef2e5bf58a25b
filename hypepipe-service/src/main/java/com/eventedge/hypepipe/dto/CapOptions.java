package com.eventedge.hypepipe.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param freshnessSeconds caller's max-age override; clamped to the capability TTL
 * @param trace            accepted for compatibility, no effect
 */
public record CapOptions(
    @JsonProperty("freshness_s") Integer freshnessSeconds,
    Boolean trace
) {}
