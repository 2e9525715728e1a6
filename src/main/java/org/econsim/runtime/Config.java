package org.econsim.runtime;

/**
 * Default engine constants. Every value here can be overridden through the {@code econsim}
 * configuration block; these are the values used when nothing else is specified.
 */
public final class Config {

    private Config() {}

    /**
     * Small additive constant that keeps Cobb-Douglas utility finite and positive at zero quantities.
     */
    public static final double UTILITY_EPSILON = 0.01;

    /**
     * Exponential distance discount {@code k} applied to forage scores: {@code MU * exp(-k * d)}.
     */
    public static final double DISTANCE_DISCOUNT_FACTOR = 0.15;

    /**
     * Minimum utility gain each side must see for a swap to count as a Pareto improvement.
     */
    public static final double MIN_TRADE_UTILITY_GAIN = 1e-5;

    /**
     * Manhattan radius within which agents see resources and other agents.
     */
    public static final int PERCEPTION_RADIUS = 8;
}
