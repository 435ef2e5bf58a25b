package com.eventedge.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How many of a view's inputs were actually available.
 */
public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * @param available  inputs that were present
     * @param highAtLeast threshold for {@link #HIGH}
     * @param mediumAtLeast threshold for {@link #MEDIUM}
     */
    public static Confidence fromParts(int available, int highAtLeast, int mediumAtLeast) {
        if (available >= highAtLeast) {
            return HIGH;
        }
        if (available >= mediumAtLeast) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
