package com.agentmeta.evaluation.client;

import com.agentmeta.common.model.PriceBar;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code GET /api/v1/market-data/history/{symbol}} on the market-data service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PriceHistoryResponse(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("bars")   List<PriceBar> bars
) {}
