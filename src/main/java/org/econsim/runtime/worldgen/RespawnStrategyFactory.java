package org.econsim.runtime.worldgen;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A factory for respawn strategies backed by a registry of named creators.
 */
public class RespawnStrategyFactory {

    private static final Map<String, IRespawnStrategyCreator> registry = new HashMap<>();

    static {
        register("density", params -> {
            double targetDensity = ((Number) params.getOrDefault("targetDensity", DensityRespawnStrategy.DEFAULT_TARGET_DENSITY)).doubleValue();
            double rate = ((Number) params.getOrDefault("rate", DensityRespawnStrategy.DEFAULT_RATE)).doubleValue();
            int maxPerStep = ((Number) params.getOrDefault("maxPerStep", DensityRespawnStrategy.DEFAULT_MAX_PER_STEP)).intValue();
            int interval = ((Number) params.getOrDefault("interval", 1)).intValue();
            return new DensityRespawnStrategy(targetDensity, rate, maxPerStep, interval);
        });
    }

    private RespawnStrategyFactory() {}

    /**
     * Registers a new respawn strategy creator.
     * @param type The type name of the strategy.
     * @param creator The creator for the strategy.
     */
    public static void register(String type, IRespawnStrategyCreator creator) {
        registry.put(type.toLowerCase(), creator);
    }

    /**
     * Creates a new respawn strategy.
     * @param type The type of the strategy to create.
     * @param params The parameters for the strategy, may be {@code null}.
     * @return The created strategy.
     * @throws IllegalArgumentException if the strategy type is unknown.
     */
    public static IResourceRespawnStrategy create(String type, Map<String, Object> params) {
        Objects.requireNonNull(type, "Strategy type cannot be null.");
        IRespawnStrategyCreator creator = registry.get(type.toLowerCase());
        if (creator == null) {
            throw new IllegalArgumentException("Unknown respawn strategy type: " + type);
        }
        return creator.create(params != null ? params : Map.of());
    }
}
