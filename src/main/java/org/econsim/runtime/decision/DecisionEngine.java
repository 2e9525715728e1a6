package org.econsim.runtime.decision;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import org.econsim.runtime.model.AgentMode;
import org.econsim.runtime.model.Bundle;
import org.econsim.runtime.model.Direction;
import org.econsim.runtime.model.Good;
import org.econsim.runtime.model.Position;
import org.econsim.runtime.model.ResourceCell;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Chooses one action per agent per step from a frozen {@link IWorldReader}.
 * <p>
 * The engine holds no mutable state and draws no random numbers. Given the same snapshot and
 * parameters it always returns the same action. Branches are tried in a fixed priority order:
 * deposit, return home, partnership, forage, partner search, withdraw bootstrap, return home with leftover
 * goods, idle. A partner out of perception range is released and the agent falls through to the later branches.
 */
public class DecisionEngine {

    /** Partner gains closer than this are treated as equal. */
    static final double GAIN_TIE_TOLERANCE = 1e-9;

    private final DecisionParameters params;
    private final TradeEvaluator tradeEvaluator;

    public DecisionEngine(DecisionParameters params) {
        this.params = params;
        this.tradeEvaluator = new TradeEvaluator(params.minTradeGain());
    }

    /**
     * Decides what {@code self} does this step.
     *
     * @param self The deciding agent as captured in the snapshot.
     * @param world The snapshot.
     * @return The planned action, never {@code null}.
     */
    public AgentAction decide(AgentState self, IWorldReader world) {
        if (self.isCarryingFull()) {
            if (self.isAtHome()) {
                return AgentAction.deposit(self.homePosition(), "carrying full - depositing at home");
            }
            return moveToward(self.position(), self.homePosition(), AgentMode.FORAGING, "carrying full - returning home");
        }

        Integer releasedPartner = null;
        if (self.isPaired()) {
            Optional<AgentState> partner = world.agent(self.partnerId());
            if (partner.isEmpty() || !isInRange(self, partner.get())) {
                // out of reach: drop the link and fall through
                releasedPartner = self.partnerId();
            } else {
                return continuePartnership(self, partner.get());
            }
        }

        if (params.forageEnabled()) {
            Optional<AgentAction> forage = forage(self, world);
            if (forage.isPresent()) {
                return releasing(forage.get(), releasedPartner);
            }
        }

        if (params.tradeEnabled()) {
            Optional<AgentAction> proposal = seekPartner(self, world);
            if (proposal.isPresent()) {
                return releasing(proposal.get(), releasedPartner);
            }
            if (self.carrying().isEmpty() && !self.home().isEmpty() && self.carryingCapacity() > 1) {
                if (self.isAtHome()) {
                    return releasing(AgentAction.withdraw(withdrawal(self), "withdrawing home goods for trading"), releasedPartner);
                }
                return releasing(moveToward(self.position(), self.homePosition(), AgentMode.SEEKING_PARTNER,
                        "returning home to withdraw goods for trading"), releasedPartner);
            }
        }

        if (!self.carrying().isEmpty() && !self.isAtHome()) {
            return releasing(moveToward(self.position(), self.homePosition(), AgentMode.FORAGING,
                    "carrying goods with no targets - returning home to deposit"), releasedPartner);
        }

        if (releasedPartner != null) {
            return AgentAction.unpair(releasedPartner, world.agent(releasedPartner).isPresent()
                    ? "partner out of perception range" : "partner no longer exists");
        }
        return AgentAction.idle("no opportunities");
    }

    private boolean isInRange(AgentState self, AgentState partner) {
        return self.position().manhattanDistance(partner.position()) <= params.perceptionRadius();
    }

    private static AgentAction releasing(AgentAction action, Integer partnerId) {
        return partnerId == null ? action : action.releasingPartner(partnerId);
    }

    private AgentAction continuePartnership(AgentState self, AgentState partner) {
        int partnerId = partner.id();
        if (partner.partnerId() == null || partner.partnerId() != self.id()) {
            return AgentAction.unpair(partnerId, "partner not linked back");
        }
        if (!params.tradeEnabled()) {
            return AgentAction.unpair(partnerId, "trading disabled");
        }
        if (self.carrying().isEmpty()) {
            return AgentAction.unpair(partnerId, "no goods to trade");
        }
        if (self.position().equals(partner.position())) {
            return tradeEvaluator.bestExecutableSwap(self, partner)
                    .map(swap -> AgentAction.trade(partnerId, swap.agentGives(), swap.agentReceives(), "executing beneficial trade"))
                    .orElseGet(() -> AgentAction.unpair(partnerId, "no beneficial trade"));
        }
        Direction direction = Movement.stepToward(self.position(), partner.position()).orElseThrow();
        return AgentAction.moveTowardPartner(direction, partnerId, partner.position(), "moving toward partner");
    }

    private Optional<AgentAction> forage(AgentState self, IWorldReader world) {
        Bundle total = self.totalBundle();
        ResourceCell best = null;
        double bestScore = 0.0;
        for (ResourceCell cell : world.resourcesWithin(self.position(), params.perceptionRadius())) {
            int distance = self.position().manhattanDistance(cell.position());
            double score = self.utility().marginalUtility(total, cell.good()) * Math.exp(-params.distanceDiscount() * distance);
            // strict comparison keeps the first cell in row-major order on ties
            if (score > bestScore) {
                bestScore = score;
                best = cell;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        if (best.position().equals(self.position())) {
            return Optional.of(AgentAction.collect(best.position(), "collecting " + best.good()));
        }
        return Optional.of(moveToward(self.position(), best.position(), AgentMode.FORAGING, "foraging " + best.good()));
    }

    private Optional<AgentAction> seekPartner(AgentState self, IWorldReader world) {
        if (self.carrying().isEmpty()) {
            return Optional.empty();
        }
        List<AgentState> candidates = new ArrayList<>();
        DoubleArrayList gains = new DoubleArrayList();
        double bestGain = Double.NEGATIVE_INFINITY;
        for (int candidateId : world.agentsWithin(self.position(), params.perceptionRadius())) {
            if (candidateId == self.id()) continue;
            AgentState candidate = world.agent(candidateId).orElse(null);
            if (candidate == null || candidate.isPaired() || candidate.carrying().isEmpty()) continue;
            Optional<SwapProposal> swap = tradeEvaluator.bestSpeculativeSwap(self, candidate);
            if (swap.isPresent()) {
                candidates.add(candidate);
                gains.add(swap.get().agentGain());
                bestGain = Math.max(bestGain, swap.get().agentGain());
            }
        }
        // ids arrive ascending, so the first candidate within tolerance of the best gain has the lowest id
        AgentState bestPartner = null;
        for (int i = 0; i < candidates.size(); i++) {
            if (Math.abs(gains.getDouble(i) - bestGain) < GAIN_TIE_TOLERANCE) {
                bestPartner = candidates.get(i);
                break;
            }
        }
        if (bestPartner == null) {
            return Optional.empty();
        }
        return Optional.of(AgentAction.proposePair(bestPartner.id(), bestPartner.position(),
                "proposing trade partnership"));
    }

    // Leaves one unit of room so a withdrawal never triggers the full-carrying deposit branch.
    private static Bundle withdrawal(AgentState self) {
        int free = self.carryingCapacity() - self.carrying().total() - 1;
        int q1 = Math.min(self.home().get(Good.GOOD1), free);
        int q2 = Math.min(self.home().get(Good.GOOD2), free - q1);
        return new Bundle(q1, q2);
    }

    private static AgentAction moveToward(Position from, Position to, AgentMode mode, String reason) {
        Direction direction = Movement.stepToward(from, to).orElseThrow();
        return AgentAction.move(direction, to, mode, reason);
    }

    public DecisionParameters getParameters() {
        return params;
    }

    public TradeEvaluator getTradeEvaluator() {
        return tradeEvaluator;
    }
}
