package org.econsim.runtime.worldgen;

import java.util.Map;

/**
 * A functional interface for creating respawn strategies from loosely typed parameters.
 */
@FunctionalInterface
public interface IRespawnStrategyCreator {
    /**
     * Creates a new respawn strategy.
     * @param params The parameters for the strategy.
     * @return The created strategy.
     */
    IResourceRespawnStrategy create(Map<String, Object> params);
}
