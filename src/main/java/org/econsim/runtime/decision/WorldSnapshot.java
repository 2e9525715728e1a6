package org.econsim.runtime.decision;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import org.econsim.runtime.model.Agent;
import org.econsim.runtime.model.AgentSpatialGrid;
import org.econsim.runtime.model.Position;
import org.econsim.runtime.model.ResourceCell;
import org.econsim.runtime.model.SpatialGrid;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The world as it was at the start of a step.
 * <p>
 * Holds a private copy of the resource grid and one {@link AgentState} per agent, so nothing
 * applied during Phase 2 can leak back into decisions of the same step.
 */
public final class WorldSnapshot implements IWorldReader {

    private final SpatialGrid resources;
    private final AgentSpatialGrid agentIndex;
    private final Int2ObjectOpenHashMap<AgentState> states;

    private WorldSnapshot(SpatialGrid resources, AgentSpatialGrid agentIndex, Int2ObjectOpenHashMap<AgentState> states) {
        this.resources = resources;
        this.agentIndex = agentIndex;
        this.states = states;
    }

    /**
     * Captures the current world. {@code agentIndex} is rebuilt from {@code agents} as part of the capture.
     *
     * @param agents All agents.
     * @param grid The live resource grid; it is copied.
     * @param agentIndex The index to rebuild and use for neighbor queries.
     * @return The frozen snapshot.
     */
    public static WorldSnapshot capture(Collection<Agent> agents, SpatialGrid grid, AgentSpatialGrid agentIndex) {
        agentIndex.rebuild(agents);
        Int2ObjectOpenHashMap<AgentState> states = new Int2ObjectOpenHashMap<>(agents.size());
        for (Agent agent : agents) {
            states.put(agent.getId(), AgentState.of(agent));
        }
        return new WorldSnapshot(grid.copy(), agentIndex, states);
    }

    @Override
    public Optional<AgentState> agent(int agentId) {
        return Optional.ofNullable(states.get(agentId));
    }

    @Override
    public List<ResourceCell> resourcesWithin(Position center, int radius) {
        return resources.resourcesWithin(center, radius);
    }

    @Override
    public int[] agentsWithin(Position center, int radius) {
        return agentIndex.queryRadius(center, radius);
    }

    @Override
    public int getWidth() {
        return resources.getWidth();
    }

    @Override
    public int getHeight() {
        return resources.getHeight();
    }
}
