package com.agentmeta.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discrete market regime produced by
 * {@link com.agentmeta.common.classifier.MarketRegimeClassifier}.
 *
 * <p>Persisted and logged by its lower-case {@link #label()}.
 */
public enum MarketRegime {
    BULL("bull"),
    BEAR("bear"),
    NEUTRAL("neutral"),
    VOLATILE("volatile"),
    TRENDING("trending");

    private final String label;

    MarketRegime(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves a stored label (case-insensitive) back to the enum constant.
     *
     * @throws IllegalArgumentException when the label is null or unrecognised
     */
    @JsonCreator
    public static MarketRegime fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Market regime label must not be null");
        }
        return MarketRegime.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return label;
    }
}
