package org.econsim.runtime.worldgen;

import org.econsim.runtime.model.SpatialGrid;
import org.econsim.runtime.spi.IRandomProvider;

/**
 * A strategy for putting new resources onto the grid between steps.
 */
public interface IResourceRespawnStrategy {

    /**
     * Called by the step executor once after every step.
     *
     * @param grid The live resource grid to modify.
     * @param rng The caller-supplied random provider; the only randomness a strategy may use.
     * @param stepIndex The zero-based index of the step that just finished.
     * @return The number of resources placed.
     */
    int respawn(SpatialGrid grid, IRandomProvider rng, long stepIndex);
}
