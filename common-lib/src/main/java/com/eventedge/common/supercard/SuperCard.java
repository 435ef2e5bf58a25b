package com.eventedge.common.supercard;

import com.eventedge.common.model.Confidence;

import java.util.List;

/**
 * Composite per-asset scorecard: six pillars plus a one-line stance.
 */
public record SuperCard(
    String symbol,
    String version,
    Summary summary,
    List<Pillar> pillars,
    String disclaimer
) {
    public record Summary(String headline, String stance, Confidence confidence, List<String> notes) {}

    public record Pillar(String key, String label, String value, PillarStatus status, String hint) {}
}
