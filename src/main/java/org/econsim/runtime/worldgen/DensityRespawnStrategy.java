package org.econsim.runtime.worldgen;

import org.econsim.runtime.model.Good;
import org.econsim.runtime.model.Position;
import org.econsim.runtime.model.SpatialGrid;
import org.econsim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Tops the grid up toward a target resource density.
 * <p>
 * Each due step spawns {@code ceil(deficit * rate)} resources, capped by {@code maxPerStep} and by the
 * deficit itself, into randomly chosen empty cells. Each new resource is Good 1 or Good 2 with equal
 * probability. The grid never ends up above {@code floor(targetDensity * cells)} resources through respawn.
 */
public class DensityRespawnStrategy implements IResourceRespawnStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(DensityRespawnStrategy.class);

    public static final double DEFAULT_TARGET_DENSITY = 0.25;
    public static final double DEFAULT_RATE = 0.25;
    public static final int DEFAULT_MAX_PER_STEP = 100;

    private final double targetDensity;
    private final double rate;
    private final int maxPerStep;
    private final int interval;

    /**
     * @param targetDensity Desired fraction of occupied cells, in [0, 1].
     * @param rate Fraction of the deficit filled per due step, non-negative; values above 1 act as 1.
     * @param maxPerStep Upper bound on resources placed per due step; 0 disables respawn.
     * @param interval Respawn runs on steps whose index is a multiple of this; must be positive.
     */
    public DensityRespawnStrategy(double targetDensity, double rate, int maxPerStep, int interval) {
        if (!(targetDensity >= 0.0 && targetDensity <= 1.0)) {
            throw new IllegalArgumentException("Target density must be within [0, 1], got " + targetDensity);
        }
        if (!(rate >= 0.0)) {
            throw new IllegalArgumentException("Respawn rate must be non-negative, got " + rate);
        }
        if (maxPerStep < 0) {
            throw new IllegalArgumentException("Max spawn per step must be non-negative, got " + maxPerStep);
        }
        if (interval <= 0) {
            throw new IllegalArgumentException("Respawn interval must be positive, got " + interval);
        }
        this.targetDensity = targetDensity;
        this.rate = Math.min(1.0, rate);
        this.maxPerStep = maxPerStep;
        this.interval = interval;
    }

    /**
     * Config-based constructor.
     * @param config Configuration object holding {@code target-density}, {@code rate}, {@code max-per-step}
     *               and {@code interval}.
     */
    public DensityRespawnStrategy(com.typesafe.config.Config config) {
        this(
            config.getDouble("target-density"),
            config.getDouble("rate"),
            config.getInt("max-per-step"),
            config.getInt("interval")
        );
    }

    @Override
    public int respawn(SpatialGrid grid, IRandomProvider rng, long stepIndex) {
        if (stepIndex % interval != 0 || maxPerStep == 0 || rate <= 0.0) {
            return 0;
        }
        int targetCount = targetCount(grid);
        int deficit = targetCount - grid.resourceCount();
        if (deficit <= 0) {
            return 0;
        }
        int toSpawn = Math.min(Math.min((int) Math.ceil(deficit * rate), maxPerStep), deficit);

        List<Position> empties = grid.emptyCells();
        if (empties.isEmpty()) {
            return 0;
        }
        Collections.shuffle(empties, rng.asJavaRandom());
        int spawned = Math.min(toSpawn, empties.size());
        for (int i = 0; i < spawned; i++) {
            Good good = rng.nextDouble() < 0.5 ? Good.GOOD1 : Good.GOOD2;
            grid.addResource(empties.get(i), good);
        }
        if (grid.resourceCount() > targetCount) {
            throw new IllegalStateException("Respawn overshot target of " + targetCount + " resources");
        }
        LOG.debug("Step={} respawned {} resources (target={}, now={})", stepIndex, spawned, targetCount, grid.resourceCount());
        return spawned;
    }

    /**
     * @param grid The grid.
     * @return {@code floor(targetDensity * cellCount)}.
     */
    public int targetCount(SpatialGrid grid) {
        return (int) Math.floor(targetDensity * grid.cellCount());
    }

    public double getTargetDensity() { return targetDensity; }

    public double getRate() { return rate; }

    public int getMaxPerStep() { return maxPerStep; }

    public int getInterval() { return interval; }
}
