package org.feralsim.runtime.spi;

/**
 * Provides deterministic randomness scoped to a single trial.
 * Implementations should be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
 * <p>
 * Every stochastic decision of the combat engine (damage rolls, proc rolls,
 * fight-length jitter) draws from exactly one provider, so a fixed seed
 * reproduces a trial draw for draw.
 * </p>
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Returns a normally distributed value with mean 0 and standard deviation 1.
     *
     * @return the random gaussian
     */
    double nextGaussian();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     * Use this to create independent sub-streams (e.g., per trial or per perturbed stat).
     *
     * @param scope a stable, descriptive scope name (e.g., "trial", "bootstrap")
     * @param key a stable numeric key (e.g., trial index)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
