package com.agentmeta.common.classifier;

import com.agentmeta.common.indicator.TechnicalIndicators;
import com.agentmeta.common.model.MarketRegime;
import com.agentmeta.common.model.PriceBar;
import com.agentmeta.common.model.RegimeSnapshot;
import com.agentmeta.common.model.TrendDirection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure stateless classifier that maps a daily price series to a {@link RegimeSnapshot}.
 *
 * <p>Signals:
 * <ul>
 *   <li>volatility = stdDev(daily returns) × √252</li>
 *   <li>trend = lastClose / firstClose − 1</li>
 *   <li>volumeRatio = mean(last 5 volumes) / mean(all volumes)</li>
 * </ul>
 *
 * <p>Classification rules (evaluated in priority order, first match wins):
 * <ol>
 *   <li>volatility &gt; 0.25 → {@link MarketRegime#VOLATILE}, confidence min(0.95, volatility × 2)</li>
 *   <li>trend &gt; 0.05      → {@link MarketRegime#BULL}, confidence min(0.95, |trend| × 10)</li>
 *   <li>trend &lt; −0.05     → {@link MarketRegime#BEAR}, confidence min(0.95, |trend| × 10)</li>
 *   <li>|trend| &lt; 0.02    → {@link MarketRegime#NEUTRAL}, confidence 0.8</li>
 *   <li>otherwise            → {@link MarketRegime#TRENDING}, confidence min(0.95, |trend| × 8)</li>
 * </ol>
 *
 * <p>An unusable series yields the {@link #fallback(Instant) fallback snapshot}, never an exception.
 * No reactive types. No logging. No side-effects.
 */
public final class MarketRegimeClassifier {

    static final double VOLATILITY_THRESHOLD = 0.25;
    static final double BULL_THRESHOLD       = 0.05;
    static final double BEAR_THRESHOLD       = -0.05;
    static final double NEUTRAL_BAND         = 0.02;

    static final double MAX_CONFIDENCE      = 0.95;
    static final double NEUTRAL_CONFIDENCE  = 0.8;
    static final double FALLBACK_CONFIDENCE = 0.6;

    static final int RECENT_VOLUME_WINDOW = 5;

    static final int    RSI_PERIOD       = 14;
    static final int    BOLLINGER_PERIOD = 20;
    static final double BOLLINGER_WIDTH  = 2.0;

    public static final String RSI                = "rsi";
    public static final String MACD               = "macd";
    public static final String BOLLINGER_POSITION = "bollinger_position";

    static final double NEUTRAL_RSI       = 50.0;
    static final double NEUTRAL_MACD      = 0.0;
    static final double NEUTRAL_BOLLINGER = 0.5;

    private MarketRegimeClassifier() {}

    /**
     * Classify the regime of the given series.
     *
     * @param bars daily bars, oldest-first; null, empty or single-bar input falls back
     * @param now  timestamp stamped on the snapshot
     * @return detected snapshot, or {@link #fallback(Instant)} when the series is unusable
     */
    public static RegimeSnapshot classify(List<PriceBar> bars, Instant now) {
        if (bars == null || bars.size() < 2) {
            return fallback(now);
        }

        List<Double> closes = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) closes.add(bar.close());

        double firstClose = closes.get(0);
        if (firstClose <= 0.0) {
            return fallback(now);
        }

        double volatility  = TechnicalIndicators.annualizedVolatility(closes);
        double trend       = closes.get(closes.size() - 1) / firstClose - 1.0;
        double volumeRatio = volumeRatio(bars);

        MarketRegime regime = resolveRegime(volatility, trend);
        double confidence   = resolveConfidence(regime, volatility, trend);

        return new RegimeSnapshot(regime, confidence, volatility, Math.abs(trend), volumeRatio,
            TrendDirection.of(trend), indicators(closes), now);
    }

    /**
     * Applies the precedence rules to already computed signals.
     */
    public static MarketRegime resolveRegime(double volatility, double trend) {
        if (volatility > VOLATILITY_THRESHOLD) return MarketRegime.VOLATILE;
        if (trend > BULL_THRESHOLD)            return MarketRegime.BULL;
        if (trend < BEAR_THRESHOLD)            return MarketRegime.BEAR;
        if (Math.abs(trend) < NEUTRAL_BAND)    return MarketRegime.NEUTRAL;
        return MarketRegime.TRENDING;
    }

    /**
     * Confidence grows with the magnitude of the signal that triggered the regime.
     */
    public static double resolveConfidence(MarketRegime regime, double volatility, double trend) {
        return switch (regime) {
            case VOLATILE     -> Math.min(MAX_CONFIDENCE, volatility * 2);
            case BULL, BEAR   -> Math.min(MAX_CONFIDENCE, Math.abs(trend) * 10);
            case NEUTRAL      -> NEUTRAL_CONFIDENCE;
            case TRENDING     -> Math.min(MAX_CONFIDENCE, Math.abs(trend) * 8);
        };
    }

    /**
     * Degraded-but-valid snapshot used when no usable price data is available.
     */
    public static RegimeSnapshot fallback(Instant now) {
        return new RegimeSnapshot(MarketRegime.NEUTRAL, FALLBACK_CONFIDENCE, 0.15, 0.02, 1.0,
            TrendDirection.NEUTRAL, neutralIndicators(), now);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static double volumeRatio(List<PriceBar> bars) {
        double total = 0.0;
        for (PriceBar bar : bars) total += bar.volume();
        double average = total / bars.size();
        if (average <= 0.0) return 1.0;

        int from = Math.max(0, bars.size() - RECENT_VOLUME_WINDOW);
        double recent = 0.0;
        for (int i = from; i < bars.size(); i++) recent += bars.get(i).volume();
        recent /= (bars.size() - from);
        return recent / average;
    }

    private static Map<String, Double> indicators(List<Double> closes) {
        Map<String, Double> indicators = new LinkedHashMap<>();
        indicators.put(RSI, orDefault(TechnicalIndicators.rsi(closes, RSI_PERIOD), NEUTRAL_RSI));
        indicators.put(MACD, orDefault(TechnicalIndicators.macd(closes), NEUTRAL_MACD));
        indicators.put(BOLLINGER_POSITION, orDefault(
            TechnicalIndicators.bollingerPosition(closes, BOLLINGER_PERIOD, BOLLINGER_WIDTH), NEUTRAL_BOLLINGER));
        return indicators;
    }

    private static Map<String, Double> neutralIndicators() {
        Map<String, Double> indicators = new LinkedHashMap<>();
        indicators.put(RSI, NEUTRAL_RSI);
        indicators.put(MACD, NEUTRAL_MACD);
        indicators.put(BOLLINGER_POSITION, NEUTRAL_BOLLINGER);
        return indicators;
    }

    private static double orDefault(double value, double placeholder) {
        return Double.isNaN(value) || Double.isInfinite(value) ? placeholder : value;
    }
}
