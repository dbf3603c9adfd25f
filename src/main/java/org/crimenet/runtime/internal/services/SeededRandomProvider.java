package org.crimenet.runtime.internal.services;

import java.util.Random;

import org.crimenet.runtime.spi.IRandomProvider;

/**
 * {@link IRandomProvider} backed by {@link java.util.Random}.
 * <p>
 * Derived streams are seeded with a SplitMix64 mix of the parent seed, the context hash and the
 * salt, so they are decorrelated from the parent and from each other.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Random random;

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    @Override
    public double nextGaussian() {
        return random.nextGaussian();
    }

    @Override
    public IRandomProvider deriveFor(String context, long salt) {
        long mixed = mix(seed ^ mix(context.hashCode() * 0x9E3779B97F4A7C15L + salt));
        return new SeededRandomProvider(mixed);
    }

    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
