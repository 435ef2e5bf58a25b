package com.eventedge.hypepipe.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Uniform response of the dispatch endpoint: {@code data} on success,
 * {@code error}/{@code detail} otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CapEnvelope(
    boolean ok,
    Map<String, Object> data,
    String error,
    String detail,
    @JsonProperty("known_caps") List<String> knownCaps,
    CapMeta meta
) {
    public static CapEnvelope success(Map<String, Object> data, CapMeta meta) {
        return new CapEnvelope(true, data, null, null, null, meta);
    }

    public static CapEnvelope failure(String error, String detail, CapMeta meta) {
        return new CapEnvelope(false, null, error, detail, null, meta);
    }

    public static CapEnvelope unknownCapability(String detail, List<String> knownCaps, CapMeta meta) {
        return new CapEnvelope(false, null, "unknown_cap", detail, knownCaps, meta);
    }
}
