package org.econsim.runtime.decision;

import org.econsim.runtime.model.Agent;
import org.econsim.runtime.model.Bundle;
import org.econsim.runtime.model.Position;
import org.econsim.runtime.utility.UtilityFunction;

/**
 * Immutable copy of the decision-relevant part of an {@link Agent}, taken at the start of a step.
 *
 * @param id The agent id.
 * @param position The agent's cell.
 * @param carrying The carrying inventory.
 * @param home The home inventory.
 * @param homePosition The home cell.
 * @param utility The agent's preferences.
 * @param carryingCapacity Maximum units carried.
 * @param partnerId The paired agent, or {@code null}.
 */
public record AgentState(int id,
                         Position position,
                         Bundle carrying,
                         Bundle home,
                         Position homePosition,
                         UtilityFunction utility,
                         int carryingCapacity,
                         Integer partnerId) {

    public static AgentState of(Agent agent) {
        return new AgentState(agent.getId(), agent.getPosition(), agent.getCarrying(), agent.getHome(),
                agent.getHomePosition(), agent.getUtility(), agent.getCarryingCapacity(), agent.getPartnerId());
    }

    public Bundle totalBundle() {
        return carrying.plus(home);
    }

    public boolean isAtHome() {
        return position.equals(homePosition);
    }

    public boolean isCarryingFull() {
        return carrying.total() >= carryingCapacity;
    }

    public boolean isPaired() {
        return partnerId != null;
    }
}
