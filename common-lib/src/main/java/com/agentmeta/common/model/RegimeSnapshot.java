package com.agentmeta.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Result of one regime classification cycle.
 *
 * <p>{@code marketIndicators} holds the auxiliary indicator bag keyed by
 * {@code rsi}, {@code macd} and {@code bollinger_position}.
 */
public record RegimeSnapshot(
    @JsonProperty("regime")           MarketRegime regime,
    @JsonProperty("confidence")       double confidence,
    @JsonProperty("volatility")       double volatility,
    @JsonProperty("trendStrength")    double trendStrength,
    @JsonProperty("volumeRatio")      double volumeRatio,
    @JsonProperty("trendDirection")   TrendDirection trendDirection,
    @JsonProperty("marketIndicators") Map<String, Double> marketIndicators,
    @JsonProperty("timestamp")        Instant timestamp
) {
    public RegimeSnapshot {
        marketIndicators = marketIndicators == null ? Map.of() : Map.copyOf(marketIndicators);
    }
}
