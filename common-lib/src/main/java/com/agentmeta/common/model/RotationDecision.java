package com.agentmeta.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Recommendation to replace the active agent {@code fromAgent} with the
 * higher-scoring {@code toAgent}. Append-only; never applied by the engine itself.
 */
public record RotationDecision(
    @JsonProperty("decisionId")          String decisionId,
    @JsonProperty("fromAgent")           String fromAgent,
    @JsonProperty("toAgent")             String toAgent,
    @JsonProperty("reason")              String reason,
    @JsonProperty("confidence")          double confidence,
    @JsonProperty("expectedImprovement") double expectedImprovement,
    @JsonProperty("regime")              MarketRegime regime,
    @JsonProperty("timestamp")           Instant timestamp
) {}
