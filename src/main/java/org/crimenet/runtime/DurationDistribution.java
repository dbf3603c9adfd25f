package org.crimenet.runtime;

import org.crimenet.runtime.spi.IRandomProvider;

/**
 * Distribution family for detention and prison stay lengths, in days.
 * Every draw is at least one day.
 */
public enum DurationDistribution {

    /** {@code max(1, floor(Exp(mean)))}. */
    EXPONENTIAL {
        @Override
        public int draw(IRandomProvider random, double meanDays) {
            return Math.max(1, (int) random.nextExponential(meanDays));
        }
    },

    /** Always {@code max(1, round(mean))}; consumes no randomness. */
    FIXED {
        @Override
        public int draw(IRandomProvider random, double meanDays) {
            return Math.max(1, (int) Math.round(meanDays));
        }
    };

    /**
     * Draws a stay length.
     *
     * @param random The run's random provider.
     * @param meanDays The configured mean. Must be positive.
     * @return A positive number of days.
     */
    public abstract int draw(IRandomProvider random, double meanDays);
}
