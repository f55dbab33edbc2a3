package com.agentmeta.common.synthetic;

/**
 * Source of bounded estimates used wherever a metric cannot be observed:
 * agents without prediction history, response latency, and fallback rankings.
 *
 * <p>Production wires a {@link SeededSyntheticEstimator}; tests pass a lambda
 * such as {@code (lower, upper) -> (lower + upper) / 2}.
 */
@FunctionalInterface
public interface SyntheticEstimator {

    /**
     * @return a value in {@code [lower, upper)}
     */
    double draw(double lower, double upper);

    /** Base performance of an agent that has no prediction history. */
    default double basePerformance() {
        return draw(0.4, 0.7);
    }

    /** Latency of an agent whose predictions were observed, in seconds. */
    default double observedResponseTime() {
        return draw(0.1, 2.0);
    }

    /** Latency of an agent with no observations, in seconds. */
    default double unobservedResponseTime() {
        return draw(0.5, 3.0);
    }

    /** Composite score of a fallback ranking entry. */
    default double fallbackRankingScore() {
        return draw(0.4, 0.8);
    }

    /** Latency attached to a fallback ranking entry, in seconds. */
    default double fallbackRankingResponseTime() {
        return draw(0.5, 2.0);
    }
}
