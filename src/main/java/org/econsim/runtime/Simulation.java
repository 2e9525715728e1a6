package org.econsim.runtime;

import org.econsim.runtime.config.SimulationConfig;
import org.econsim.runtime.decision.DecisionParameters;
import org.econsim.runtime.internal.services.SeededRandomProvider;
import org.econsim.runtime.model.Agent;
import org.econsim.runtime.model.SpatialGrid;
import org.econsim.runtime.spi.IRandomProvider;
import org.econsim.runtime.worldgen.IResourceRespawnStrategy;
import org.econsim.runtime.worldgen.ScenarioFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Coordinates a simulation run: owns the world through its {@link StepExecutor}, the tick counter
 * and the random provider that is threaded into every step.
 */
public class Simulation {
    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final StepExecutor executor;
    private final IRandomProvider randomProvider;
    private long currentTick = 0L;

    /**
     * Constructs a new Simulation.
     *
     * @param grid The resource grid.
     * @param agents The agents.
     * @param params Decision parameters.
     * @param respawnStrategy Strategy run after every step, or {@code null}.
     * @param randomProvider Randomness passed to every step.
     */
    public Simulation(SpatialGrid grid, List<Agent> agents, DecisionParameters params,
                      IResourceRespawnStrategy respawnStrategy, IRandomProvider randomProvider) {
        this.executor = new StepExecutor(grid, agents, params, respawnStrategy);
        this.randomProvider = randomProvider;
    }

    /**
     * Builds a simulation from configuration. Scenario setup and stepping draw from separate streams
     * derived from the configured seed.
     *
     * @param config The configuration.
     * @return The ready-to-run simulation at tick 0.
     */
    public static Simulation fromConfig(SimulationConfig config) {
        IRandomProvider root = new SeededRandomProvider(config.seed());
        SpatialGrid grid = ScenarioFactory.createGrid(config, root.deriveFor("resources", 0));
        List<Agent> agents = ScenarioFactory.createAgents(config, root.deriveFor("agents", 0));
        IResourceRespawnStrategy respawn = config.respawn().createStrategy().orElse(null);
        Simulation simulation = new Simulation(grid, agents, config.decision(), respawn, root.deriveFor("step", 0));
        LOG.info("Simulation created: seed={} grid={}x{} agents={} resources={} forage={} trade={} respawn={}",
                config.seed(), grid.getWidth(), grid.getHeight(), agents.size(), grid.resourceCount(),
                config.decision().forageEnabled(), config.decision().tradeEnabled(), respawn != null);
        return simulation;
    }

    /**
     * Executes a single step.
     */
    public void tick() {
        executor.step(randomProvider);
        currentTick++;
    }

    /**
     * Executes several steps.
     * @param steps Number of steps, non-negative.
     */
    public void run(int steps) {
        if (steps < 0) {
            throw new IllegalArgumentException("Step count must be non-negative, got " + steps);
        }
        for (int i = 0; i < steps; i++) {
            tick();
        }
    }

    public List<Agent> getAgents() { return executor.getAgents(); }

    public SpatialGrid getGrid() { return executor.getGrid(); }

    public StepExecutor getExecutor() { return executor; }

    public IRandomProvider getRandomProvider() { return randomProvider; }

    /**
     * Returns the current simulation tick count.
     * @return The current tick.
     */
    public long getCurrentTick() { return currentTick; }
}
