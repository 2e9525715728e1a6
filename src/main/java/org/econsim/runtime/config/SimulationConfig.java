package org.econsim.runtime.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.econsim.runtime.decision.DecisionParameters;
import org.econsim.runtime.model.Good;
import org.econsim.runtime.model.Position;
import org.econsim.runtime.model.ResourceCell;
import org.econsim.runtime.model.SpatialGrid;
import org.econsim.runtime.utility.UtilityFunction;
import org.econsim.runtime.utility.UtilityFunctionFactory;
import org.econsim.runtime.worldgen.IResourceRespawnStrategy;
import org.econsim.runtime.worldgen.RespawnStrategyFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable simulation configuration, read once from the {@code econsim} block.
 *
 * @param seed Base seed for all randomness.
 * @param grid Grid dimensions.
 * @param agents Agent population settings.
 * @param decision Decision parameters including the feature flags.
 * @param resources Initial resource placement.
 * @param respawn Resource respawn settings.
 */
public record SimulationConfig(long seed,
                               GridSettings grid,
                               AgentSettings agents,
                               DecisionParameters decision,
                               ResourceSettings resources,
                               RespawnSettings respawn) {

    public static final String ROOT_PATH = "econsim";

    /**
     * @param width Number of columns.
     * @param height Number of rows.
     */
    public record GridSettings(int width, int height) {
        public GridSettings {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Grid dimensions must be positive, got " + width + "x" + height);
            }
            SpatialGrid.checkedCellCount(width, height);
        }

        public int cellCount() {
            return width * height;
        }
    }

    /**
     * @param count Number of agents.
     * @param carryingCapacity Carrying capacity of every agent.
     * @param profiles Utility functions assigned to agents cyclically by index.
     * @param positions Fixed spawn cells; empty means random spawn.
     */
    public record AgentSettings(int count, int carryingCapacity, List<UtilityFunction> profiles, List<Position> positions) {
        public AgentSettings {
            if (count < 0) {
                throw new IllegalArgumentException("Agent count must be non-negative, got " + count);
            }
            if (carryingCapacity <= 0) {
                throw new IllegalArgumentException("Carrying capacity must be positive, got " + carryingCapacity);
            }
            if (profiles.isEmpty()) {
                throw new IllegalArgumentException("At least one utility profile is required");
            }
            if (!positions.isEmpty() && positions.size() != count) {
                throw new IllegalArgumentException("Expected " + count + " agent positions, got " + positions.size());
            }
            profiles = List.copyOf(profiles);
            positions = List.copyOf(positions);
        }

        public UtilityFunction profileFor(int agentIndex) {
            return profiles.get(agentIndex % profiles.size());
        }
    }

    /**
     * @param initialDensity Fraction of cells seeded randomly at setup, used only when {@code initial} is empty.
     * @param initial Explicit resource cells placed at setup.
     */
    public record ResourceSettings(double initialDensity, List<ResourceCell> initial) {
        public ResourceSettings {
            if (!(initialDensity >= 0.0 && initialDensity <= 1.0)) {
                throw new IllegalArgumentException("Initial resource density must be within [0, 1], got " + initialDensity);
            }
            initial = List.copyOf(initial);
        }
    }

    /**
     * @param enabled Whether a respawn strategy runs after each step.
     * @param type Registered strategy name.
     * @param targetDensity Desired fraction of occupied cells.
     * @param rate Fraction of the deficit filled per due step.
     * @param maxPerStep Upper bound on resources placed per due step.
     * @param interval Run every {@code interval} steps.
     */
    public record RespawnSettings(boolean enabled, String type, double targetDensity, double rate, int maxPerStep, int interval) {

        /**
         * Builds the configured strategy.
         * @return The strategy, or empty when respawn is disabled.
         */
        public Optional<IResourceRespawnStrategy> createStrategy() {
            if (!enabled) {
                return Optional.empty();
            }
            Map<String, Object> params = new HashMap<>();
            params.put("targetDensity", targetDensity);
            params.put("rate", rate);
            params.put("maxPerStep", maxPerStep);
            params.put("interval", interval);
            return Optional.of(RespawnStrategyFactory.create(type, params));
        }
    }

    /**
     * Reads and validates the {@code econsim} block.
     *
     * @param root The full configuration, typically from {@link ConfigLoader}.
     * @return The configuration.
     * @throws ConfigException if a key is missing or has the wrong type.
     * @throws IllegalArgumentException if a value is out of range.
     */
    public static SimulationConfig fromConfig(Config root) {
        Config c = root.getConfig(ROOT_PATH);

        GridSettings grid = new GridSettings(c.getInt("grid.width"), c.getInt("grid.height"));

        List<UtilityFunction> profiles = new ArrayList<>();
        for (Config profile : c.getConfigList("agents.profiles")) {
            Map<String, Object> params = new HashMap<>(profile.root().unwrapped());
            Object kind = params.remove("kind");
            if (kind == null) {
                throw new ConfigException.Missing(profile.origin(), "kind");
            }
            profiles.add(UtilityFunctionFactory.create(kind.toString(), params));
        }
        List<Position> positions = new ArrayList<>();
        for (Config pos : c.getConfigList("agents.positions")) {
            positions.add(requireInside(grid, new Position(pos.getInt("x"), pos.getInt("y"))));
        }
        AgentSettings agents = new AgentSettings(
                c.getInt("agents.count"),
                c.getInt("agents.carrying-capacity"),
                profiles,
                positions);

        DecisionParameters decision = new DecisionParameters(
                c.getInt("decision.perception-radius"),
                c.getDouble("decision.distance-discount"),
                c.getDouble("decision.min-trade-gain"),
                c.getBoolean("features.forage-enabled"),
                c.getBoolean("features.trade-enabled"));

        List<ResourceCell> initial = new ArrayList<>();
        for (Config cell : c.getConfigList("resources.initial")) {
            Position pos = requireInside(grid, new Position(cell.getInt("x"), cell.getInt("y")));
            initial.add(new ResourceCell(pos, parseGood(cell.getString("good"))));
        }
        ResourceSettings resources = new ResourceSettings(c.getDouble("resources.initial-density"), initial);

        RespawnSettings respawn = new RespawnSettings(
                c.getBoolean("respawn.enabled"),
                c.getString("respawn.type"),
                c.getDouble("respawn.target-density"),
                c.getDouble("respawn.rate"),
                c.getInt("respawn.max-per-step"),
                c.getInt("respawn.interval"));
        respawn.createStrategy();

        return new SimulationConfig(c.getLong("seed"), grid, agents, decision, resources, respawn);
    }

    private static Position requireInside(GridSettings grid, Position pos) {
        if (pos.x() < 0 || pos.x() >= grid.width() || pos.y() < 0 || pos.y() >= grid.height()) {
            throw new IllegalArgumentException("Coordinate " + pos + " out of bounds for " + grid.width() + "x" + grid.height() + " grid");
        }
        return pos;
    }

    /**
     * Accepts {@code good1}/{@code good2} and the single-letter aliases {@code A}/{@code B}.
     */
    static Good parseGood(String name) {
        return switch (name.trim().toLowerCase()) {
            case "good1", "good_1", "a" -> Good.GOOD1;
            case "good2", "good_2", "b" -> Good.GOOD2;
            default -> throw new IllegalArgumentException("Unknown good: " + name);
        };
    }
}
