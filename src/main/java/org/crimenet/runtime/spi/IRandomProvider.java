package org.crimenet.runtime.spi;

/**
 * Source of randomness for a simulation replicate.
 * <p>
 * A run owns exactly one root provider, seeded from configuration. Initialization steps that
 * must not perturb the dynamics stream obtain their own stream via
 * {@link #deriveFor(String, long)}, which is a pure function of the root seed, the context
 * name and the salt. Given the same seed, every draw sequence is reproducible.
 */
public interface IRandomProvider {

    /**
     * @return A uniformly distributed value in [0, 1).
     */
    double nextDouble();

    /**
     * @param bound Exclusive upper bound. Must be positive.
     * @return A uniformly distributed value in [0, bound).
     */
    int nextInt(int bound);

    /**
     * @return A standard normally distributed value.
     */
    double nextGaussian();

    /**
     * Draws from an exponential distribution by inversion.
     *
     * @param mean The distribution mean. Must be positive.
     * @return A non-negative sample.
     */
    default double nextExponential(double mean) {
        return -mean * Math.log(1.0 - nextDouble());
    }

    /**
     * Creates an independent, deterministic child stream.
     *
     * @param context A name identifying the consumer (e.g. "network").
     * @param salt An additional discriminator.
     * @return A new provider whose seed depends only on this provider's seed, the context and the salt.
     */
    IRandomProvider deriveFor(String context, long salt);
}
