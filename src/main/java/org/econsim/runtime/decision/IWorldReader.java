package org.econsim.runtime.decision;

import org.econsim.runtime.model.ResourceCell;
import org.econsim.runtime.model.Position;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the world the decision engine works on.
 */
public interface IWorldReader {

    /**
     * Looks up an agent by id.
     * @param agentId The agent id.
     * @return The agent's state, or empty if no such agent exists.
     */
    Optional<AgentState> agent(int agentId);

    /**
     * Returns the resources within a Manhattan radius in row-major order.
     * @param center The query center.
     * @param radius The radius, inclusive.
     * @return The resource cells.
     */
    List<ResourceCell> resourcesWithin(Position center, int radius);

    /**
     * Returns the ids of agents within a Manhattan radius, ascending.
     * @param center The query center.
     * @param radius The radius, inclusive.
     * @return The agent ids, possibly including an agent standing on {@code center}.
     */
    int[] agentsWithin(Position center, int radius);

    int getWidth();

    int getHeight();
}
