package org.econsim.runtime.decision;

import org.econsim.runtime.Config;

/**
 * Immutable parameters that steer agent decisions, fixed for the lifetime of a simulation.
 *
 * @param perceptionRadius Manhattan radius for seeing resources and agents.
 * @param distanceDiscount Discount factor {@code k} in {@code exp(-k * d)}.
 * @param minTradeGain Minimum per-side utility gain for a swap to count.
 * @param forageEnabled Whether agents forage.
 * @param tradeEnabled Whether agents pair up and trade.
 */
public record DecisionParameters(int perceptionRadius,
                                 double distanceDiscount,
                                 double minTradeGain,
                                 boolean forageEnabled,
                                 boolean tradeEnabled) {

    public static final DecisionParameters DEFAULTS = new DecisionParameters(
            Config.PERCEPTION_RADIUS,
            Config.DISTANCE_DISCOUNT_FACTOR,
            Config.MIN_TRADE_UTILITY_GAIN,
            true,
            true);

    public DecisionParameters {
        if (perceptionRadius < 0) {
            throw new IllegalArgumentException("Perception radius must be non-negative, got " + perceptionRadius);
        }
        if (!(distanceDiscount >= 0.0)) {
            throw new IllegalArgumentException("Distance discount must be non-negative, got " + distanceDiscount);
        }
        if (!(minTradeGain >= 0.0)) {
            throw new IllegalArgumentException("Minimum trade gain must be non-negative, got " + minTradeGain);
        }
    }

    public DecisionParameters withFeatures(boolean forage, boolean trade) {
        return new DecisionParameters(perceptionRadius, distanceDiscount, minTradeGain, forage, trade);
    }
}
