package com.agentmeta.common.scoring;

import com.agentmeta.common.model.AgentPerformanceRecord;
import com.agentmeta.common.model.MarketRegime;
import com.agentmeta.common.model.PredictionOutcome;
import com.agentmeta.common.synthetic.SyntheticEstimator;

import java.time.Instant;
import java.util.List;

/**
 * Turns an agent's recent prediction history into an {@link AgentPerformanceRecord}.
 *
 * <p>Only accuracy and mean confidence are observed. Every other metric is a
 * deterministic function of accuracy:
 * <pre>
 *   sharpeRatio = max(0, (accuracy − 0.5) × 4)
 *   totalReturn = (accuracy − 0.5) × 0.2
 *   maxDrawdown = max(0, 0.1 − accuracy × 0.2)
 *   winRate     = accuracy
 * </pre>
 * Response latency is never in the history and always comes from the
 * {@link SyntheticEstimator}.
 *
 * <p>An agent without history is scored from a single synthetic base draw in
 * [0.4, 0.7] pushed through the same formulas, so it lands among mediocre agents
 * rather than at either extreme.
 */
public final class AgentPerformanceScorer {

    static final double NEUTRAL_ACCURACY = 0.5;
    static final double SHARPE_SCALE     = 4.0;
    static final double RETURN_SCALE     = 0.2;
    static final double DRAWDOWN_CEILING = 0.1;
    static final double DRAWDOWN_SCALE   = 0.2;

    private AgentPerformanceScorer() {}

    /**
     * Scores an agent from its prediction history, falling back to
     * {@link #fromSyntheticBase} when the history is null or empty.
     */
    public static AgentPerformanceRecord score(String agentName,
                                               MarketRegime regime,
                                               List<PredictionOutcome> history,
                                               SyntheticEstimator estimator,
                                               Instant now) {
        if (history == null || history.isEmpty()) {
            return fromSyntheticBase(agentName, regime, estimator, now);
        }

        long correct = history.stream().filter(PredictionOutcome::isCorrect).count();
        double accuracy = (double) correct / history.size();
        double avgConfidence = history.stream()
            .mapToDouble(PredictionOutcome::confidence)
            .average()
            .orElse(NEUTRAL_ACCURACY);

        return build(agentName, regime, accuracy, avgConfidence,
            estimator.observedResponseTime(), false, now);
    }

    /**
     * Scores an agent that has no observable history.
     */
    public static AgentPerformanceRecord fromSyntheticBase(String agentName,
                                                           MarketRegime regime,
                                                           SyntheticEstimator estimator,
                                                           Instant now) {
        double base = estimator.basePerformance();
        return build(agentName, regime, base, base, estimator.unobservedResponseTime(), true, now);
    }

    /**
     * Record emitted when scoring failed outright: coin-flip accuracy, no excess return.
     */
    public static AgentPerformanceRecord neutralDefault(String agentName, MarketRegime regime, Instant now) {
        return new AgentPerformanceRecord(agentName, NEUTRAL_ACCURACY, 0.0, 0.0, DRAWDOWN_CEILING,
            NEUTRAL_ACCURACY, NEUTRAL_ACCURACY, 1.0, regime, true, now);
    }

    // ── derived metrics ──────────────────────────────────────────────────────

    public static double sharpeRatio(double accuracy) {
        return Math.max(0.0, (accuracy - NEUTRAL_ACCURACY) * SHARPE_SCALE);
    }

    public static double totalReturn(double accuracy) {
        return (accuracy - NEUTRAL_ACCURACY) * RETURN_SCALE;
    }

    public static double maxDrawdown(double accuracy) {
        return Math.max(0.0, DRAWDOWN_CEILING - accuracy * DRAWDOWN_SCALE);
    }

    private static AgentPerformanceRecord build(String agentName, MarketRegime regime,
                                                double accuracy, double confidence,
                                                double responseTime, boolean synthetic, Instant now) {
        return new AgentPerformanceRecord(
            agentName,
            accuracy,
            sharpeRatio(accuracy),
            totalReturn(accuracy),
            maxDrawdown(accuracy),
            accuracy,
            confidence,
            responseTime,
            regime,
            synthetic,
            now);
    }
}
