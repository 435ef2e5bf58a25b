package com.eventedge.common.model;

import java.util.List;

/**
 * Explainable regime output: a label, four interpretive axes and three drivers.
 * No weights or formulas are exposed.
 */
public record RegimeView(
    String version,
    Regime regime,
    List<Axis> axes,
    List<String> drivers,
    String disclaimer
) {
    public record Regime(MarketRegime label, Confidence confidence) {}

    public record Axis(String key, String label, String value) {}
}
