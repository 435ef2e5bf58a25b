package com.eventedge.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse market regime produced by {@link com.eventedge.common.classifier.MarketRegimeClassifier}.
 */
public enum MarketRegime {
    RISK_OFF("Risk-Off"),
    TREND("Trend"),
    RISK_ON("Risk-On"),
    CHOP("Chop");

    private final String label;

    MarketRegime(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
