package com.agentmeta.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Position of one agent inside the ranking set of a regime. Rank 1 is the best
 * composite score; the constituent metrics are carried alongside for display.
 */
public record AgentRanking(
    @JsonProperty("agentName")      String agentName,
    @JsonProperty("regime")         MarketRegime regime,
    @JsonProperty("rank")           int rank,
    @JsonProperty("compositeScore") double compositeScore,
    @JsonProperty("accuracy")       double accuracy,
    @JsonProperty("sharpeRatio")    double sharpeRatio,
    @JsonProperty("totalReturn")    double totalReturn,
    @JsonProperty("maxDrawdown")    double maxDrawdown,
    @JsonProperty("winRate")        double winRate,
    @JsonProperty("confidence")     double confidence,
    @JsonProperty("responseTime")   double responseTime,
    @JsonProperty("synthetic")      boolean synthetic,
    @JsonProperty("timestamp")      Instant timestamp
) {

    public AgentRanking withRank(int newRank) {
        return new AgentRanking(agentName, regime, newRank, compositeScore, accuracy, sharpeRatio,
            totalReturn, maxDrawdown, winRate, confidence, responseTime, synthetic, timestamp);
    }
}
