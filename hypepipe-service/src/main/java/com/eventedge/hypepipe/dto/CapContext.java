package com.eventedge.hypepipe.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param agentId optional; when present it must match the verified token identity
 * @param userId  optional end-user id, carried into the audit row
 * @param tier    informational only; the token's tier is authoritative
 */
public record CapContext(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("user_id") Long userId,
    String tier
) {}
