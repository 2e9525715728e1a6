package org.econsim.runtime.worldgen;

import org.econsim.runtime.config.SimulationConfig;
import org.econsim.runtime.model.Agent;
import org.econsim.runtime.model.Good;
import org.econsim.runtime.model.Position;
import org.econsim.runtime.model.ResourceCell;
import org.econsim.runtime.model.SpatialGrid;
import org.econsim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the initial world from a {@link SimulationConfig}.
 * All randomness comes from the provider passed in, so the same seed yields the same world.
 */
public final class ScenarioFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ScenarioFactory.class);

    private ScenarioFactory() {}

    /**
     * Creates the resource grid with the configured initial resources.
     * Explicit cells are placed as given; otherwise {@code floor(initialDensity * cells)} random cells
     * get Good 1 or Good 2 with equal probability.
     *
     * @param config The configuration.
     * @param rng The random provider for random placement.
     * @return The populated grid.
     */
    public static SpatialGrid createGrid(SimulationConfig config, IRandomProvider rng) {
        SimulationConfig.GridSettings settings = config.grid();
        SpatialGrid grid = new SpatialGrid(settings.width(), settings.height());
        List<ResourceCell> initial = config.resources().initial();
        if (!initial.isEmpty()) {
            for (ResourceCell cell : initial) {
                grid.addResource(cell.position(), cell.good());
            }
            return grid;
        }
        int count = (int) Math.floor(config.resources().initialDensity() * grid.cellCount());
        List<Position> cells = grid.emptyCells();
        Collections.shuffle(cells, rng.asJavaRandom());
        for (int i = 0; i < count; i++) {
            grid.addResource(cells.get(i), rng.nextDouble() < 0.5 ? Good.GOOD1 : Good.GOOD2);
        }
        return grid;
    }

    /**
     * Creates the agents. Ids run from 0 in creation order, utility profiles are assigned cyclically,
     * and every agent's home is its spawn cell.
     *
     * @param config The configuration.
     * @param rng The random provider for spawn cells, unused when positions are configured.
     * @return The agents in ascending id order.
     */
    public static List<Agent> createAgents(SimulationConfig config, IRandomProvider rng) {
        SimulationConfig.AgentSettings settings = config.agents();
        List<Position> positions = settings.positions().isEmpty()
                ? spawnPositions(settings.count(), config.grid().width(), config.grid().height(), rng)
                : settings.positions();
        List<Agent> agents = new ArrayList<>(settings.count());
        for (int i = 0; i < settings.count(); i++) {
            Position pos = positions.get(i);
            agents.add(new Agent(i, pos, pos, settings.profileFor(i), settings.carryingCapacity()));
        }
        return agents;
    }

    /**
     * Picks spawn cells. Cells are distinct while the grid has room for all agents; beyond that
     * the remaining agents share randomly chosen cells.
     *
     * @param count Number of cells to pick.
     * @param width Grid width.
     * @param height Grid height.
     * @param rng The random provider.
     * @return The cells, one per agent.
     */
    public static List<Position> spawnPositions(int count, int width, int height, IRandomProvider rng) {
        int cellCount = SpatialGrid.checkedCellCount(width, height);
        List<Position> all = new ArrayList<>(cellCount);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                all.add(new Position(x, y));
            }
        }
        Collections.shuffle(all, rng.asJavaRandom());
        if (count <= cellCount) {
            return new ArrayList<>(all.subList(0, count));
        }
        LOG.warn("Grid {}x{} has only {} cells for {} agents; some agents will share spawn cells",
                width, height, cellCount, count);
        List<Position> result = new ArrayList<>(all);
        for (int i = cellCount; i < count; i++) {
            result.add(all.get(rng.nextInt(cellCount)));
        }
        return result;
    }
}
