package org.econsim.runtime.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.econsim.runtime.Simulation;
import org.econsim.runtime.model.Agent;
import org.econsim.runtime.model.ResourceCell;
import org.econsim.runtime.model.SpatialGrid;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders post-step world state as JSON. Reads only through public accessors.
 * Agents appear in ascending id order and resources in row-major order, so equal states serialize identically.
 */
public class WorldStateSerializer {

    private final ObjectMapper objectMapper;

    public WorldStateSerializer() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public record AgentView(int id, int x, int y, int homeX, int homeY,
                            int carrying1, int carrying2, int home1, int home2,
                            String mode, Integer partnerId, String utility, double totalUtility) {}

    public record ResourceView(int x, int y, String good) {}

    public record WorldView(long tick, int width, int height, List<AgentView> agents, List<ResourceView> resources) {}

    /**
     * Captures the current state of a simulation.
     * @param simulation The simulation.
     * @return The state view.
     */
    public WorldView capture(Simulation simulation) {
        List<AgentView> agents = new ArrayList<>();
        for (Agent a : simulation.getAgents()) {
            agents.add(new AgentView(a.getId(),
                    a.getPosition().x(), a.getPosition().y(),
                    a.getHomePosition().x(), a.getHomePosition().y(),
                    a.getCarrying().q1(), a.getCarrying().q2(),
                    a.getHome().q1(), a.getHome().q2(),
                    a.getMode().name(), a.getPartnerId(),
                    a.getUtility().kind().configName(), a.currentUtility()));
        }
        SpatialGrid grid = simulation.getGrid();
        List<ResourceView> resources = new ArrayList<>();
        for (ResourceCell cell : grid.iterateResources()) {
            resources.add(new ResourceView(cell.position().x(), cell.position().y(), cell.good().name()));
        }
        return new WorldView(simulation.getCurrentTick(), grid.getWidth(), grid.getHeight(), agents, resources);
    }

    /**
     * Serializes the current state of a simulation.
     * @param simulation The simulation.
     * @return The JSON document.
     * @throws IllegalStateException if serialization fails.
     */
    public String toJson(Simulation simulation) {
        try {
            return objectMapper.writeValueAsString(capture(simulation));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize world state at tick " + simulation.getCurrentTick(), e);
        }
    }
}
