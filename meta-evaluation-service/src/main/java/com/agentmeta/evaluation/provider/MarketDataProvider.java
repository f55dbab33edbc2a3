package com.agentmeta.evaluation.provider;

import com.agentmeta.common.model.PriceBar;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Source of daily price history. May complete with an empty list or fail;
 * callers degrade to a fallback regime snapshot in both cases.
 */
public interface MarketDataProvider {

    /**
     * @param symbol   instrument used as the market proxy (e.g. "SPY")
     * @param lookback calendar window to cover, counted back from today
     * @return bars ordered oldest-first
     */
    Mono<List<PriceBar>> getPriceHistory(String symbol, Duration lookback);
}
