package com.agentmeta.common.synthetic;

import java.util.Random;

/**
 * {@link SyntheticEstimator} backed by a seeded {@link Random}; the same seed
 * replays the same sequence of estimates.
 *
 * <p>Give each consumer its own instance from {@link #forStream(long, String)} so one
 * consumer's draws never shift another's sequence.
 */
public final class SeededSyntheticEstimator implements SyntheticEstimator {

    private final Random random;

    public SeededSyntheticEstimator(long seed) {
        this.random = new Random(seed);
    }

    /** Instance for a named consumer; same base seed and name, same sequence. */
    public static SeededSyntheticEstimator forStream(long baseSeed, String stream) {
        return new SeededSyntheticEstimator(baseSeed * 31 + stream.hashCode());
    }

    @Override
    public double draw(double lower, double upper) {
        if (upper <= lower) {
            return lower;
        }
        return lower + random.nextDouble() * (upper - lower);
    }
}
