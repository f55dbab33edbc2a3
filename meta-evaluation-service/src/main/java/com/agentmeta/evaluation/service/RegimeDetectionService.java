package com.agentmeta.evaluation.service;

import com.agentmeta.common.classifier.MarketRegimeClassifier;
import com.agentmeta.common.model.RegimeSnapshot;
import com.agentmeta.common.trace.TraceContextUtil;
import com.agentmeta.evaluation.provider.MarketDataProvider;
import com.agentmeta.evaluation.store.MetaEvaluationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Classifies the current market regime from the proxy symbol's recent price history.
 *
 * <p>Never fails: an empty series, a provider error or a timeout all yield
 * {@link MarketRegimeClassifier#fallback the fallback snapshot}.
 */
@Service
public class RegimeDetectionService {

    private static final Logger log = LoggerFactory.getLogger(RegimeDetectionService.class);

    private final MarketDataProvider marketDataProvider;
    private final MetaEvaluationStore store;
    private final Clock clock;
    private final String proxySymbol;
    private final Duration lookback;
    private final Duration callTimeout;

    public RegimeDetectionService(MarketDataProvider marketDataProvider,
                                  MetaEvaluationStore store,
                                  Clock clock,
                                  @Value("${meta-evaluation.regime.proxy-symbol:SPY}") String proxySymbol,
                                  @Value("${meta-evaluation.regime.lookback-days:30}") long lookbackDays,
                                  @Value("${meta-evaluation.external-call-timeout-seconds:10}") long timeoutSeconds) {
        this.marketDataProvider = marketDataProvider;
        this.store              = store;
        this.clock              = clock;
        this.proxySymbol        = proxySymbol;
        this.lookback           = Duration.ofDays(lookbackDays);
        this.callTimeout        = Duration.ofSeconds(timeoutSeconds);
    }

    /**
     * Classifies the regime without persisting anything.
     */
    public Mono<RegimeSnapshot> detect() {
        return marketDataProvider.getPriceHistory(proxySymbol, lookback)
            .timeout(callTimeout)
            .map(bars -> {
                if (bars.isEmpty()) {
                    log.warn("No price history returned — using fallback regime. symbol={}", proxySymbol);
                }
                return MarketRegimeClassifier.classify(bars, clock.instant());
            })
            .switchIfEmpty(Mono.fromSupplier(() -> MarketRegimeClassifier.fallback(clock.instant())))
            .onErrorResume(e -> {
                log.warn("Price history unavailable — using fallback regime. symbol={} reason={}",
                         proxySymbol, e.toString());
                return Mono.just(MarketRegimeClassifier.fallback(clock.instant()));
            });
    }

    /**
     * Classifies the regime and appends the snapshot to the history.
     * A failed write is logged and the snapshot is still returned.
     */
    public Mono<RegimeSnapshot> refresh() {
        return detect()
            .flatMap(snapshot -> store.appendRegimeSnapshot(snapshot)
                .doOnSuccess(v -> log.info("REGIME_UPDATED regime={} confidence={} volatility={} trend={} direction={}",
                    snapshot.regime(), fmt(snapshot.confidence()), fmt(snapshot.volatility()),
                    fmt(snapshot.trendStrength()), snapshot.trendDirection()))
                .onErrorResume(e -> Mono.deferContextual(ctx -> {
                    TraceContextUtil.withMdc(ctx, () ->
                        log.warn("Regime snapshot write failed (dropped). regime={} reason={}",
                                 snapshot.regime(), e.toString()));
                    return Mono.empty();
                }))
                .thenReturn(snapshot));
    }

    private static String fmt(double value) {
        return String.format("%.4f", value);
    }
}
