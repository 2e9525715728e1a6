package org.econsim.runtime;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.econsim.runtime.decision.AgentAction;
import org.econsim.runtime.decision.AgentState;
import org.econsim.runtime.decision.DecisionEngine;
import org.econsim.runtime.decision.DecisionParameters;
import org.econsim.runtime.decision.Movement;
import org.econsim.runtime.decision.SwapProposal;
import org.econsim.runtime.decision.TradeEvaluator;
import org.econsim.runtime.decision.WorldSnapshot;
import org.econsim.runtime.model.Agent;
import org.econsim.runtime.model.AgentMode;
import org.econsim.runtime.model.AgentSpatialGrid;
import org.econsim.runtime.model.Bundle;
import org.econsim.runtime.model.Direction;
import org.econsim.runtime.model.Good;
import org.econsim.runtime.model.Position;
import org.econsim.runtime.model.ResourceCell;
import org.econsim.runtime.model.SpatialGrid;
import org.econsim.runtime.spi.IRandomProvider;
import org.econsim.runtime.worldgen.IResourceRespawnStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Advances the world by one step in two phases.
 * <p>
 * Phase 1 freezes a {@link WorldSnapshot} and lets every agent decide against it, in ascending id order,
 * without touching live state. Phase 2 applies the planned actions in the same order against live state,
 * re-validating each one. An action that has gone stale is degraded to idle rather than failing the step.
 * An action that releases a partner dissolves that link first, whether or not the action itself then executes.
 * After Phase 2 the optional respawn strategy runs with the caller's random provider.
 */
public class StepExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(StepExecutor.class);

    /**
     * Outcome of applying a planned action.
     */
    public enum ExecutionStatus {
        EXECUTED,
        DEGRADED_TO_IDLE
    }

    /**
     * What one agent planned and what became of it.
     *
     * @param agentId The agent.
     * @param action The action planned in Phase 1.
     * @param status The Phase 2 outcome.
     * @param detail Why the action was degraded, or {@code null} when it executed.
     */
    public record ActionResult(int agentId, AgentAction action, ExecutionStatus status, String detail) {}

    private final SpatialGrid grid;
    private final List<Agent> agents;
    private final Int2ObjectOpenHashMap<Agent> agentsById;
    private final AgentSpatialGrid agentIndex;
    private final DecisionParameters params;
    private final DecisionEngine decisionEngine;
    private final TradeEvaluator tradeEvaluator;
    private final IResourceRespawnStrategy respawnStrategy;
    private long stepCount = 0L;
    private List<ActionResult> lastActions = List.of();

    /**
     * Creates an executor owning the given world.
     *
     * @param grid The resource grid.
     * @param agents The agents; ids must be unique and positions inside the grid.
     * @param params Decision parameters.
     * @param respawnStrategy Strategy run after every step, or {@code null} for none.
     */
    public StepExecutor(SpatialGrid grid, Collection<Agent> agents, DecisionParameters params,
                        IResourceRespawnStrategy respawnStrategy) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.params = Objects.requireNonNull(params, "params");
        this.respawnStrategy = respawnStrategy;
        this.agents = new ArrayList<>(agents);
        this.agents.sort(Comparator.comparingInt(Agent::getId));
        this.agentsById = new Int2ObjectOpenHashMap<>(agents.size());
        for (Agent agent : this.agents) {
            if (agentsById.put(agent.getId(), agent) != null) {
                throw new IllegalArgumentException("Duplicate agent id " + agent.getId());
            }
        }
        this.agentIndex = new AgentSpatialGrid(grid.getWidth(), grid.getHeight());
        this.decisionEngine = new DecisionEngine(params);
        this.tradeEvaluator = decisionEngine.getTradeEvaluator();
        validateAgents();
    }

    /**
     * Executes one step.
     *
     * @param rng Randomness for the respawn strategy. Decisions never consult it.
     * @throws IllegalStateException if an agent is in a malformed state at the start of the step.
     */
    public void step(IRandomProvider rng) {
        validateAgents();

        WorldSnapshot snapshot = WorldSnapshot.capture(agents, grid, agentIndex);

        Int2ObjectOpenHashMap<AgentAction> planned = new Int2ObjectOpenHashMap<>(agents.size());
        List<AgentAction> plannedInOrder = new ArrayList<>(agents.size());
        for (Agent agent : agents) {
            AgentState self = snapshot.agent(agent.getId()).orElseThrow();
            AgentAction action = decisionEngine.decide(self, snapshot);
            planned.put(agent.getId(), action);
            plannedInOrder.add(action);
        }

        LongOpenHashSet tradedPairs = new LongOpenHashSet();
        List<ActionResult> results = new ArrayList<>(agents.size());
        for (int i = 0; i < agents.size(); i++) {
            Agent agent = agents.get(i);
            AgentAction action = plannedInOrder.get(i);
            String degradeReason = apply(agent, action, planned, tradedPairs);
            ExecutionStatus status = degradeReason == null ? ExecutionStatus.EXECUTED : ExecutionStatus.DEGRADED_TO_IDLE;
            if (status == ExecutionStatus.EXECUTED) {
                finishExecuted(agent, action);
            } else {
                finishDegraded(agent);
                LOG.debug("Step={} Agent={} action {} degraded to idle: {}", stepCount, agent.getId(), action.type(), degradeReason);
            }
            results.add(new ActionResult(agent.getId(), action, status, degradeReason));
            if (agent.isLoggingEnabled()) {
                LOG.debug("Step={} Agent={} Action={} Status={}", stepCount, agent.getId(), action, status);
                LOG.debug("  Pos={} Carrying={} Home={} Mode={} Partner={}",
                        agent.getPosition(), agent.getCarrying(), agent.getHome(), agent.getMode(), agent.getPartnerId());
            }
        }
        this.lastActions = Collections.unmodifiableList(results);

        long stepIndex = stepCount;
        this.stepCount++;
        if (respawnStrategy != null) {
            respawnStrategy.respawn(grid, rng, stepIndex);
        }
    }

    /**
     * Applies one action to live state.
     * @return {@code null} if the action executed, otherwise the reason it was degraded.
     */
    private String apply(Agent agent, AgentAction action, Int2ObjectOpenHashMap<AgentAction> planned, LongOpenHashSet tradedPairs) {
        if (action.releasedPartnerId() != null && Objects.equals(agent.getPartnerId(), action.releasedPartnerId())) {
            applyUnpair(agent);
        }
        return switch (action.type()) {
            case MOVE -> applyMove(agent, action);
            case COLLECT -> applyCollect(agent, action);
            case DEPOSIT -> applyDeposit(agent);
            case WITHDRAW -> applyWithdraw(agent, action.withdrawal());
            case PROPOSE_PAIR -> applyProposePair(agent, action.partnerId(), planned);
            case TRADE -> applyTrade(agent, action, tradedPairs);
            case UNPAIR -> applyUnpair(agent);
            case IDLE -> null;
        };
    }

    private String applyMove(Agent agent, AgentAction action) {
        Direction direction = action.direction();
        if (action.isPartnerDirected()) {
            Agent partner = agentsById.get(action.partnerId().intValue());
            if (partner == null || !Objects.equals(agent.getPartnerId(), action.partnerId())) {
                return "no longer paired with " + action.partnerId();
            }
            Optional<Direction> retarget = Movement.stepToward(agent.getPosition(), partner.getPosition());
            if (retarget.isEmpty()) {
                return "already co-located with partner";
            }
            direction = retarget.get();
        }
        Position next = agent.getPosition().translate(direction);
        if (!grid.contains(next)) {
            return "blocked by grid edge";
        }
        agent.moveTo(next);
        return null;
    }

    private String applyCollect(Agent agent, AgentAction action) {
        if (!agent.getPosition().equals(action.target())) {
            return "not on resource cell";
        }
        if (agent.isCarryingFull()) {
            return "carrying inventory full";
        }
        Optional<ResourceCell> cell = grid.resourceAt(agent.getPosition());
        if (cell.isEmpty()) {
            return "resource already taken";
        }
        grid.removeResource(agent.getPosition());
        agent.collect(cell.get().good());
        return null;
    }

    private String applyDeposit(Agent agent) {
        if (!agent.isAtHome()) {
            return "not at home";
        }
        Bundle carrying = agent.getCarrying();
        if (carrying.isEmpty()) {
            return "nothing to deposit";
        }
        for (Good good : Good.values()) {
            if (carrying.get(good) > 0) {
                agent.depositToHome(good, carrying.get(good));
            }
        }
        return null;
    }

    private String applyWithdraw(Agent agent, Bundle requested) {
        if (!agent.isAtHome()) {
            return "not at home";
        }
        int free = agent.freeCapacity();
        Bundle home = agent.getHome();
        int q1 = Math.min(Math.min(requested.q1(), home.q1()), free);
        int q2 = Math.min(Math.min(requested.q2(), home.q2()), free - q1);
        if (q1 + q2 == 0) {
            return "nothing to withdraw";
        }
        if (q1 > 0) agent.withdrawFromHome(Good.GOOD1, q1);
        if (q2 > 0) agent.withdrawFromHome(Good.GOOD2, q2);
        return null;
    }

    private String applyProposePair(Agent agent, int partnerId, Int2ObjectOpenHashMap<AgentAction> planned) {
        Agent partner = agentsById.get(partnerId);
        if (partner == null) {
            return "partner " + partnerId + " does not exist";
        }
        // A mutual proposal is already linked once the lower id has been applied.
        if (Objects.equals(agent.getPartnerId(), partnerId) && Objects.equals(partner.getPartnerId(), agent.getId())) {
            return null;
        }
        if (agent.hasPartner() || partner.hasPartner()) {
            return "already paired";
        }
        if (agent.getPosition().manhattanDistance(partner.getPosition()) > params.perceptionRadius()) {
            return "partner out of range";
        }
        AgentAction partnerPlan = planned.get(partnerId);
        boolean partnerAvailable = partnerPlan != null
                && (partnerPlan.type() == AgentAction.Type.IDLE
                    || (partnerPlan.type() == AgentAction.Type.PROPOSE_PAIR
                        && Objects.equals(partnerPlan.partnerId(), agent.getId())));
        if (!partnerAvailable) {
            return "partner busy";
        }
        agent.setPartnerId(partnerId);
        partner.setPartnerId(agent.getId());
        partner.setMode(AgentMode.PAIRED);
        partner.setTarget(agent.getPosition());
        return null;
    }

    private String applyTrade(Agent agent, AgentAction action, LongOpenHashSet tradedPairs) {
        int partnerId = action.partnerId();
        Agent partner = agentsById.get(partnerId);
        if (partner == null || !Objects.equals(agent.getPartnerId(), partnerId)
                || !Objects.equals(partner.getPartnerId(), agent.getId())) {
            return "no longer paired with " + partnerId;
        }
        long pairKey = pairKey(agent.getId(), partnerId);
        if (tradedPairs.contains(pairKey)) {
            return "pair already traded this step";
        }
        if (!agent.getPosition().equals(partner.getPosition())) {
            return "not co-located with partner";
        }
        Optional<SwapProposal> swap = tradeEvaluator.evaluate(AgentState.of(agent), AgentState.of(partner), action.goodGiven());
        if (swap.isEmpty() || !swap.get().executable() || !swap.get().pareto()) {
            return "swap no longer improves both sides";
        }
        agent.exchange(action.goodGiven(), action.goodReceived());
        partner.exchange(action.goodReceived(), action.goodGiven());
        partner.setMode(AgentMode.TRADING);
        tradedPairs.add(pairKey);
        return null;
    }

    private String applyUnpair(Agent agent) {
        Integer partnerId = agent.getPartnerId();
        if (partnerId == null) {
            return "already unpaired";
        }
        agent.setPartnerId(null);
        Agent partner = agentsById.get(partnerId.intValue());
        if (partner != null && Objects.equals(partner.getPartnerId(), agent.getId())) {
            partner.setPartnerId(null);
            partner.setMode(AgentMode.IDLE);
            partner.setTarget(null);
        }
        return null;
    }

    private void finishExecuted(Agent agent, AgentAction action) {
        switch (action.type()) {
            case MOVE -> {
                agent.setMode(action.resultingMode());
                if (action.isPartnerDirected()) {
                    agent.setTarget(agentsById.get(action.partnerId().intValue()).getPosition());
                } else {
                    agent.setTarget(action.target());
                }
            }
            case PROPOSE_PAIR -> {
                agent.setMode(AgentMode.PAIRED);
                agent.setTarget(agentsById.get(action.partnerId().intValue()).getPosition());
            }
            case IDLE -> {
                agent.setMode(agent.hasPartner() ? AgentMode.PAIRED : AgentMode.IDLE);
                agent.setTarget(null);
            }
            default -> {
                agent.setMode(action.resultingMode());
                agent.setTarget(null);
            }
        }
    }

    private void finishDegraded(Agent agent) {
        agent.setMode(agent.hasPartner() ? AgentMode.PAIRED : AgentMode.IDLE);
        agent.setTarget(null);
    }

    private static long pairKey(int a, int b) {
        int lo = Math.min(a, b);
        int hi = Math.max(a, b);
        return ((long) lo << 32) | (hi & 0xFFFFFFFFL);
    }

    private void validateAgents() {
        for (Agent agent : agents) {
            agent.validate();
            if (!grid.contains(agent.getPosition())) {
                throw new IllegalStateException("Agent " + agent.getId() + " at " + agent.getPosition() + " is outside the grid");
            }
            if (!grid.contains(agent.getHomePosition())) {
                throw new IllegalStateException("Agent " + agent.getId() + " home " + agent.getHomePosition() + " is outside the grid");
            }
        }
    }

    /**
     * Returns the agents in ascending id order.
     * @return An unmodifiable view of the agents.
     */
    public List<Agent> getAgents() {
        return Collections.unmodifiableList(agents);
    }

    public Optional<Agent> getAgent(int agentId) {
        return Optional.ofNullable(agentsById.get(agentId));
    }

    public SpatialGrid getGrid() {
        return grid;
    }

    public DecisionParameters getParameters() {
        return params;
    }

    /**
     * Returns the number of completed steps.
     * @return The step count.
     */
    public long getStepCount() {
        return stepCount;
    }

    /**
     * Returns the planned actions and their outcomes from the most recent step, in ascending agent id order.
     * @return An unmodifiable list, empty before the first step.
     */
    public List<ActionResult> getLastActions() {
        return lastActions;
    }
}
