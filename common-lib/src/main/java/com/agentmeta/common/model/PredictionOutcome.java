package com.agentmeta.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A single resolved prediction made by an agent: what it called, what the market
 * actually did, and how confident it was at the time.
 */
public record PredictionOutcome(
    @JsonProperty("confidence")         double confidence,
    @JsonProperty("predictedDirection") String predictedDirection,
    @JsonProperty("actualDirection")    String actualDirection,
    @JsonProperty("timestamp")          Instant timestamp
) {

    /** {@code true} when the predicted direction matched the realised one. */
    public boolean isCorrect() {
        return predictedDirection != null && predictedDirection.equals(actualDirection);
    }
}
