package com.agentmeta.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendDirection {
    UP("up"),
    DOWN("down"),
    NEUTRAL("neutral");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Sign of the total-period trend; exactly zero maps to {@link #NEUTRAL}. */
    public static TrendDirection of(double trend) {
        if (trend > 0) return UP;
        if (trend < 0) return DOWN;
        return NEUTRAL;
    }

    @JsonCreator
    public static TrendDirection fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Trend direction label must not be null");
        }
        return TrendDirection.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return label;
    }
}
