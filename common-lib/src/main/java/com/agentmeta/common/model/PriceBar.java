package com.agentmeta.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One daily OHLCV bar of the price series consumed by the regime classifier.
 * Series are always ordered oldest-first.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PriceBar(
    @JsonProperty("date")   LocalDate date,
    @JsonProperty("open")   double open,
    @JsonProperty("high")   double high,
    @JsonProperty("low")    double low,
    @JsonProperty("close")  double close,
    @JsonProperty("volume") long volume
) {}
