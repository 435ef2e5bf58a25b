package com.eventedge.hypepipe.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One row of {@code GET /api/v1/hypepipe/caps}. {@code requiredScope} is null for open capabilities. */
public record CapabilityDescriptor(
    String name,
    @JsonProperty("required_scope") String requiredScope,
    @JsonProperty("default_ttl_s") int defaultTtlSeconds
) {}
