package com.agentmeta.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Performance of one agent for one collection cycle, scored against the regime
 * that was active when the cycle ran.
 *
 * <ul>
 *   <li>{@code accuracy}, {@code winRate}, {@code confidence} – fractions in [0.0, 1.0].</li>
 *   <li>{@code sharpeRatio} – risk-adjusted-return score derived from accuracy.</li>
 *   <li>{@code totalReturn} – cumulative return estimate derived from accuracy.</li>
 *   <li>{@code maxDrawdown} – never negative.</li>
 *   <li>{@code responseTime} – agent response latency in seconds, always positive.</li>
 *   <li>{@code synthetic} – metrics came from an estimate rather than prediction history.</li>
 * </ul>
 */
public record AgentPerformanceRecord(
    @JsonProperty("agentName")    String agentName,
    @JsonProperty("accuracy")     double accuracy,
    @JsonProperty("sharpeRatio")  double sharpeRatio,
    @JsonProperty("totalReturn")  double totalReturn,
    @JsonProperty("maxDrawdown")  double maxDrawdown,
    @JsonProperty("winRate")      double winRate,
    @JsonProperty("confidence")   double confidence,
    @JsonProperty("responseTime") double responseTime,
    @JsonProperty("regime")       MarketRegime regime,
    @JsonProperty("synthetic")    boolean synthetic,
    @JsonProperty("timestamp")    Instant timestamp
) {}
