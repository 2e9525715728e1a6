package org.econsim.runtime.decision;

import org.econsim.runtime.model.Good;

/**
 * The evaluated outcome of a 1-for-1 swap between two agents.
 *
 * @param agentId The agent giving {@code agentGives}.
 * @param partnerId The agent giving {@code agentGives.other()}.
 * @param agentGives The good the first agent hands over.
 * @param agentGain Utility change of the first agent, on its total bundle.
 * @param partnerGain Utility change of the partner, on its total bundle.
 * @param executable Whether both sides carry the unit they would give.
 * @param pareto Whether both gains exceed the minimum trade gain.
 */
public record SwapProposal(int agentId,
                           int partnerId,
                           Good agentGives,
                           double agentGain,
                           double partnerGain,
                           boolean executable,
                           boolean pareto) {

    public Good agentReceives() {
        return agentGives.other();
    }

    public double jointGain() {
        return agentGain + partnerGain;
    }
}
