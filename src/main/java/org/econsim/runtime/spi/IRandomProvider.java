package org.econsim.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to a simulation.
 * Implementations must be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
 * <p>
 * The decision engine never sees a provider. Only scenario setup and resource respawn draw from it.
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
     * Provides access to an underlying {@link Random} instance for APIs that require it
     * (e.g., {@code Collections.shuffle}).
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     * Use this to create independent sub-streams (e.g., scenario setup vs. respawn).
     *
     * @param scope a stable, descriptive scope name (e.g., "scenario", "respawn")
     * @param key a stable numeric key
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
