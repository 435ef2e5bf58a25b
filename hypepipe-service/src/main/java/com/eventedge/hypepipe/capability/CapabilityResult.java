package com.eventedge.hypepipe.capability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one handler invocation.
 *
 * <ul>
 *   <li>{@link Status#OK}: live data; {@code data} carries {@code asof}</li>
 *   <li>{@link Status#DEGRADED}: upstream data missing; a placeholder payload with a
 *       synthesized {@code asof} and a {@code note}. Served exactly like {@code OK}.</li>
 *   <li>{@link Status#FAULT}: the handler failed; becomes a sanitized 500</li>
 * </ul>
 */
public record CapabilityResult(
    Status status,
    Map<String, Object> data,
    String asof,
    String note
) {
    public enum Status { OK, DEGRADED, FAULT }

    public static CapabilityResult ok(Map<String, Object> payload, String asof) {
        Objects.requireNonNull(asof, "asof");
        return new CapabilityResult(Status.OK, withAsof(payload, asof, null), asof, null);
    }

    public static CapabilityResult degraded(Map<String, Object> payload, String asof, String note) {
        Objects.requireNonNull(asof, "asof");
        return new CapabilityResult(Status.DEGRADED, withAsof(payload, asof, note), asof, note);
    }

    /**
     * @param reason server-side description; never sent to the caller
     */
    public static CapabilityResult fault(String reason) {
        return new CapabilityResult(Status.FAULT, null, null, reason);
    }

    public boolean isFault() {
        return status == Status.FAULT;
    }

    private static Map<String, Object> withAsof(Map<String, Object> payload, String asof, String note) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (payload != null) {
            data.putAll(payload);
        }
        if (note != null) {
            data.put("note", note);
        }
        data.put("asof", asof);
        return Collections.unmodifiableMap(data);
    }
}
