package com.eventedge.hypepipe.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Present on every envelope; {@code asof} and {@code cache_hit} are null off the success path. */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record CapMeta(
    String cap,
    @JsonProperty("trace_id") String traceId,
    String asof,
    @JsonProperty("cache_hit") Boolean cacheHit
) {}
