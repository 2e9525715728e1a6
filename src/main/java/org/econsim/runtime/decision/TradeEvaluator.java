package org.econsim.runtime.decision;

import org.econsim.runtime.model.Bundle;
import org.econsim.runtime.model.Good;
import org.econsim.runtime.utility.UtilityFunction;

import java.util.Optional;

/**
 * Evaluates 1-for-1 swaps. Utility is always measured on total bundles (carrying plus home);
 * executability depends on carrying inventories only.
 */
public class TradeEvaluator {

    private static final Good[] GIVE_ORDER = {Good.GOOD1, Good.GOOD2};

    private final double minTradeGain;

    /**
     * @param minTradeGain The gain each side must strictly exceed for a swap to be a Pareto improvement.
     */
    public TradeEvaluator(double minTradeGain) {
        if (minTradeGain < 0.0 || Double.isNaN(minTradeGain)) {
            throw new IllegalArgumentException("Minimum trade gain must be non-negative, got " + minTradeGain);
        }
        this.minTradeGain = minTradeGain;
    }

    /**
     * Utility change from giving one unit and receiving one unit.
     *
     * @param utility The preferences.
     * @param total The total bundle; must hold at least one unit of {@code gives}.
     * @param gives The good handed over.
     * @param receives The good taken in.
     * @return {@code U(total - gives + receives) - U(total)}.
     */
    public static double gain(UtilityFunction utility, Bundle total, Good gives, Good receives) {
        return utility.value(total.swap(gives, receives)) - utility.value(total);
    }

    /**
     * Evaluates the swap in which {@code a} gives one unit of {@code aGives} to {@code b} and receives one unit
     * of the other good.
     *
     * @return The proposal, or empty when either total bundle cannot support the swap.
     */
    public Optional<SwapProposal> evaluate(AgentState a, AgentState b, Good aGives) {
        Good bGives = aGives.other();
        Bundle aTotal = a.totalBundle();
        Bundle bTotal = b.totalBundle();
        if (aTotal.get(aGives) < 1 || bTotal.get(bGives) < 1) {
            return Optional.empty();
        }
        double aGain = gain(a.utility(), aTotal, aGives, bGives);
        double bGain = gain(b.utility(), bTotal, bGives, aGives);
        boolean executable = a.carrying().get(aGives) >= 1 && b.carrying().get(bGives) >= 1;
        boolean pareto = aGain > minTradeGain && bGain > minTradeGain;
        return Optional.of(new SwapProposal(a.id(), b.id(), aGives, aGain, bGain, executable, pareto));
    }

    /**
     * Finds the executable Pareto-improving swap with the largest joint gain.
     * On equal joint gain the swap in which {@code a} gives Good 1 wins.
     *
     * @return The best swap, or empty if no executable swap improves both sides.
     */
    public Optional<SwapProposal> bestExecutableSwap(AgentState a, AgentState b) {
        return best(a, b, true);
    }

    /**
     * Like {@link #bestExecutableSwap} but ignores whether the goods are carried.
     * Used to judge whether pairing up is worthwhile at all.
     */
    public Optional<SwapProposal> bestSpeculativeSwap(AgentState a, AgentState b) {
        return best(a, b, false);
    }

    private Optional<SwapProposal> best(AgentState a, AgentState b, boolean requireExecutable) {
        SwapProposal best = null;
        for (Good gives : GIVE_ORDER) {
            Optional<SwapProposal> candidate = evaluate(a, b, gives);
            if (candidate.isEmpty()) continue;
            SwapProposal proposal = candidate.get();
            if (!proposal.pareto() || (requireExecutable && !proposal.executable())) continue;
            if (best == null || proposal.jointGain() > best.jointGain()) {
                best = proposal;
            }
        }
        return Optional.ofNullable(best);
    }

    public double getMinTradeGain() {
        return minTradeGain;
    }
}
