package com.agentmeta.evaluation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate statistics over all performance records of a trailing window.
 */
public record PerformanceSummary(
    @JsonProperty("totalAgents")     long   totalAgents,
    @JsonProperty("avgAccuracy")     double avgAccuracy,
    @JsonProperty("avgSharpeRatio")  double avgSharpeRatio,
    @JsonProperty("avgTotalReturn")  double avgTotalReturn,
    @JsonProperty("avgResponseTime") double avgResponseTime
) {
    public static PerformanceSummary empty() {
        return new PerformanceSummary(0, 0.0, 0.0, 0.0, 0.0);
    }
}
