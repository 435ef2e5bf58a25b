package com.eventedge.common.supercard;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PillarStatus {
    POSITIVE,
    NEUTRAL,
    NEGATIVE;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
