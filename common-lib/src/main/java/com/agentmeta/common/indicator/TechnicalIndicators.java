package com.agentmeta.common.indicator;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure calculation utilities for technical indicators.
 * Input prices are expected oldest-first (last index = most recent close).
 */
public final class TechnicalIndicators {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    private TechnicalIndicators() {}

    // ── Returns & volatility ─────────────────────────────────────────────────

    /**
     * Close-to-close simple returns. A bar whose predecessor closed at zero is skipped.
     *
     * @param prices closing prices, oldest-first
     * @return {@code n - 1} returns at most; empty for fewer than two prices
     */
    public static List<Double> dailyReturns(List<Double> prices) {
        List<Double> returns = new ArrayList<>();
        if (prices == null) return returns;
        for (int i = 1; i < prices.size(); i++) {
            double previous = prices.get(i - 1);
            if (previous == 0.0) continue;
            returns.add(prices.get(i) / previous - 1.0);
        }
        return returns;
    }

    /**
     * Sample standard deviation (n − 1 denominator).
     *
     * @return 0.0 when fewer than two values are supplied
     */
    public static double sampleStdDev(List<Double> values) {
        if (values == null || values.size() < 2) return 0.0;
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            double diff = v - mean;
            sumSq += diff * diff;
        }
        return Math.sqrt(sumSq / (values.size() - 1));
    }

    /** Daily-return standard deviation scaled by √252. */
    public static double annualizedVolatility(List<Double> prices) {
        return sampleStdDev(dailyReturns(prices)) * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.size();
    }

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * Computes RSI using Wilder's Smoothed Moving Average.
     * @param prices  closing prices, oldest-first
     * @param period  lookback period (typically 14)
     * @return RSI value 0–100, or NaN if insufficient data
     */
    public static double rsi(List<Double> prices, int period) {
        if (prices == null || prices.size() < period + 1) return Double.NaN;
        int n = prices.size();

        double avgGain = 0;
        double avgLoss = 0;

        for (int i = 1; i <= period; i++) {
            double change = prices.get(i) - prices.get(i - 1);
            if (change > 0) avgGain += change;
            else avgLoss += Math.abs(change);
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < n; i++) {
            double change = prices.get(i) - prices.get(i - 1);
            double gain = Math.max(change, 0);
            double loss = Math.max(-change, 0);
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
        }

        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── Moving averages ──────────────────────────────────────────────────────

    /**
     * @param prices  closing prices, oldest-first
     * @param period  number of most recent periods
     * @return SMA value, or NaN if insufficient data
     */
    public static double sma(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return Double.NaN;
        double sum = 0;
        for (int i = prices.size() - period; i < prices.size(); i++) sum += prices.get(i);
        return sum / period;
    }

    /**
     * @param prices  closing prices, oldest-first
     * @param period  EMA period
     * @return most-recent EMA value, or NaN if insufficient data
     */
    public static double ema(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return Double.NaN;
        double k = 2.0 / (period + 1);
        double ema = prices.get(0);
        for (int i = 1; i < prices.size(); i++) {
            ema = prices.get(i) * k + ema * (1 - k);
        }
        return ema;
    }

    /** MACD line = EMA(12) − EMA(26). NaN with fewer than 26 prices. */
    public static double macd(List<Double> prices) {
        double ema12 = ema(prices, 12);
        double ema26 = ema(prices, 26);
        if (Double.isNaN(ema12) || Double.isNaN(ema26)) return Double.NaN;
        return ema12 - ema26;
    }

    /** Population standard deviation of the most recent {@code period} prices. */
    public static double stdDev(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return Double.NaN;
        double mean = sma(prices, period);
        double variance = 0;
        for (int i = prices.size() - period; i < prices.size(); i++) {
            double diff = prices.get(i) - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / period);
    }

    // ── Bollinger ────────────────────────────────────────────────────────────

    /**
     * Position of the latest close inside the Bollinger band:
     * 0.0 = lower band, 1.0 = upper band (can fall outside when price breaks a band).
     *
     * @param prices     closing prices, oldest-first
     * @param period     SMA period (typically 20)
     * @param bandWidth  band distance in standard deviations (typically 2)
     * @return band position, 0.5 for a flat band, NaN if insufficient data
     */
    public static double bollingerPosition(List<Double> prices, int period, double bandWidth) {
        double middle = sma(prices, period);
        double sigma  = stdDev(prices, period);
        if (Double.isNaN(middle) || Double.isNaN(sigma)) return Double.NaN;
        double lower = middle - bandWidth * sigma;
        double upper = middle + bandWidth * sigma;
        if (upper == lower) return 0.5;
        double latest = prices.get(prices.size() - 1);
        return (latest - lower) / (upper - lower);
    }
}
