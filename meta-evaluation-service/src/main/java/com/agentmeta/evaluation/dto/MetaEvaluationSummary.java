package com.agentmeta.evaluation.dto;

import com.agentmeta.common.model.MarketRegime;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Consolidated, read-only view of the engine's latest state for external consumers.
 *
 * <p>{@code lastUpdated} is the newest timestamp among the artifacts the summary was
 * built from, or {@code null} when nothing has been stored yet.
 */
public record MetaEvaluationSummary(
    @JsonProperty("currentRegime")      MarketRegime currentRegime,
    @JsonProperty("regimeConfidence")   double regimeConfidence,
    @JsonProperty("topAgents")          List<RankedAgentView> topAgents,
    @JsonProperty("recentRotations")    List<RotationView> recentRotations,
    @JsonProperty("performanceSummary") PerformanceSummary performanceSummary,
    @JsonProperty("lastUpdated")        Instant lastUpdated
) {
    static final double DEFAULT_REGIME_CONFIDENCE = 0.6;

    public MetaEvaluationSummary {
        topAgents       = topAgents == null ? List.of() : List.copyOf(topAgents);
        recentRotations = recentRotations == null ? List.of() : List.copyOf(recentRotations);
    }

    /** Payload returned when the store cannot be read. */
    public static MetaEvaluationSummary defaulted() {
        return new MetaEvaluationSummary(MarketRegime.NEUTRAL, DEFAULT_REGIME_CONFIDENCE,
            List.of(), List.of(), PerformanceSummary.empty(), null);
    }
}
