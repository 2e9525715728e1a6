package org.econsim.runtime.decision;

import org.econsim.runtime.model.AgentMode;
import org.econsim.runtime.model.Bundle;
import org.econsim.runtime.model.Direction;
import org.econsim.runtime.model.Good;
import org.econsim.runtime.model.Position;

import java.util.Objects;

/**
 * An action planned by the {@link DecisionEngine} during Phase 1 and applied by the step executor in Phase 2.
 * Only the payload fields relevant to the {@link Type} are set; the others are {@code null}.
 *
 * @param type The kind of action.
 * @param direction The step direction for {@link Type#MOVE}.
 * @param target The cell the agent is heading for (move target, resource cell, home).
 * @param partnerId The other agent for partner-related actions and partner-directed moves.
 * @param goodGiven The good handed over in a {@link Type#TRADE}.
 * @param goodReceived The good received in a {@link Type#TRADE}.
 * @param withdrawal The planned quantities for a {@link Type#WITHDRAW}.
 * @param resultingMode The mode the agent enters when the action executes.
 * @param reason A short human-readable explanation for traces.
 * @param releasedPartnerId A partner whose link is dissolved before the action is applied, or {@code null}.
 */
public record AgentAction(Type type,
                          Direction direction,
                          Position target,
                          Integer partnerId,
                          Good goodGiven,
                          Good goodReceived,
                          Bundle withdrawal,
                          AgentMode resultingMode,
                          String reason,
                          Integer releasedPartnerId) {

    /**
     * The kinds of action an agent can plan.
     */
    public enum Type {
        MOVE,
        COLLECT,
        DEPOSIT,
        WITHDRAW,
        PROPOSE_PAIR,
        TRADE,
        UNPAIR,
        IDLE
    }

    public AgentAction {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(resultingMode, "resultingMode");
        Objects.requireNonNull(reason, "reason");
    }

    /**
     * A single step toward a cell.
     * @param direction The step direction.
     * @param target The final destination, used as the agent's target.
     * @param mode The mode while moving.
     * @param reason Trace text.
     * @return The action.
     */
    public static AgentAction move(Direction direction, Position target, AgentMode mode, String reason) {
        return new AgentAction(Type.MOVE, Objects.requireNonNull(direction, "direction"), target,
                null, null, null, null, mode, reason, null);
    }

    /**
     * A single step toward the current partner.
     * The executor re-targets the partner's live position, so {@code direction} is only a hint.
     */
    public static AgentAction moveTowardPartner(Direction direction, int partnerId, Position partnerPosition, String reason) {
        return new AgentAction(Type.MOVE, Objects.requireNonNull(direction, "direction"), partnerPosition,
                partnerId, null, null, null, AgentMode.PAIRED, reason, null);
    }

    public static AgentAction collect(Position resource, String reason) {
        return new AgentAction(Type.COLLECT, null, resource, null, null, null, null, AgentMode.FORAGING, reason, null);
    }

    public static AgentAction deposit(Position home, String reason) {
        return new AgentAction(Type.DEPOSIT, null, home, null, null, null, null, AgentMode.IDLE, reason, null);
    }

    public static AgentAction withdraw(Bundle withdrawal, String reason) {
        return new AgentAction(Type.WITHDRAW, null, null, null, null, null,
                Objects.requireNonNull(withdrawal, "withdrawal"), AgentMode.SEEKING_PARTNER, reason, null);
    }

    public static AgentAction proposePair(int partnerId, Position partnerPosition, String reason) {
        return new AgentAction(Type.PROPOSE_PAIR, null, partnerPosition, partnerId, null, null, null,
                AgentMode.SEEKING_PARTNER, reason, null);
    }

    public static AgentAction trade(int partnerId, Good gives, Good receives, String reason) {
        return new AgentAction(Type.TRADE, null, null, partnerId,
                Objects.requireNonNull(gives, "gives"), Objects.requireNonNull(receives, "receives"), null,
                AgentMode.TRADING, reason, null);
    }

    public static AgentAction unpair(int partnerId, String reason) {
        return new AgentAction(Type.UNPAIR, null, null, partnerId, null, null, null, AgentMode.IDLE, reason, null);
    }

    public static AgentAction idle(String reason) {
        return new AgentAction(Type.IDLE, null, null, null, null, null, null, AgentMode.IDLE, reason, null);
    }

    /**
     * Returns a copy that also dissolves the link to {@code partnerId} before it is applied.
     * @param partnerId The partner being dropped.
     * @return The combined action.
     */
    public AgentAction releasingPartner(int partnerId) {
        return new AgentAction(type, direction, target, this.partnerId, goodGiven, goodReceived, withdrawal,
                resultingMode, reason, partnerId);
    }

    public boolean isPartnerDirected() {
        return partnerId != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name());
        if (direction != null) sb.append(' ').append(direction);
        if (partnerId != null) sb.append(" partner=").append(partnerId);
        if (goodGiven != null) sb.append(" gives=").append(goodGiven).append(" receives=").append(goodReceived);
        if (withdrawal != null) sb.append(" withdraw=").append(withdrawal);
        if (target != null) sb.append(" target=").append(target);
        if (releasedPartnerId != null) sb.append(" releases=").append(releasedPartnerId);
        return sb.append(" (").append(reason).append(')').toString();
    }
}
