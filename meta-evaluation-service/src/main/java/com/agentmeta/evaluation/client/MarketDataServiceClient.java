package com.agentmeta.evaluation.client;

import com.agentmeta.common.exception.MetaEvaluationException;
import com.agentmeta.common.model.PriceBar;
import com.agentmeta.evaluation.provider.MarketDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link MarketDataProvider} backed by the platform's market-data service.
 *
 * <p>Bars are re-sorted oldest-first regardless of the order the service returns.
 * Errors propagate to the caller, which owns the fallback.
 */
@Component
public class MarketDataServiceClient implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(MarketDataServiceClient.class);

    private final WebClient marketDataClient;

    public MarketDataServiceClient(WebClient marketDataClient) {
        this.marketDataClient = marketDataClient;
    }

    @Override
    public Mono<List<PriceBar>> getPriceHistory(String symbol, Duration lookback) {
        long days = Math.max(1, lookback.toDays());
        log.debug("Fetching price history. symbol={} days={}", symbol, days);

        return marketDataClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/market-data/history/{symbol}")
                .queryParam("days", days)
                .build(symbol))
            .retrieve()
            .bodyToMono(PriceHistoryResponse.class)
            .map(response -> toOrderedBars(symbol, response))
            .defaultIfEmpty(List.of())
            .doOnNext(bars -> log.debug("Price history fetched. symbol={} bars={}", symbol, bars.size()));
    }

    private List<PriceBar> toOrderedBars(String symbol, PriceHistoryResponse response) {
        if (response.bars() == null) {
            return List.of();
        }
        List<PriceBar> bars = new ArrayList<>(response.bars().size());
        for (PriceBar bar : response.bars()) {
            if (bar == null || bar.date() == null) {
                throw new MetaEvaluationException("market-data",
                    "Malformed bar without date for symbol=" + symbol);
            }
            bars.add(bar);
        }
        bars.sort(Comparator.comparing(PriceBar::date));
        return bars;
    }
}
