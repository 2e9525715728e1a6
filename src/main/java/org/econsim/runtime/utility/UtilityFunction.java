package org.econsim.runtime.utility;

import org.econsim.runtime.Config;
import org.econsim.runtime.model.Bundle;
import org.econsim.runtime.model.Good;

import java.util.Objects;

/**
 * An agent's preferences over two-good bundles: a {@link UtilityKind} plus its parameters.
 * Instances are immutable and validated on construction; evaluation never throws.
 *
 * @param kind The preference family.
 * @param alpha Weight of Good 1.
 * @param beta Weight of Good 2.
 * @param epsilon Bootstrap constant keeping Cobb-Douglas utility positive at zero quantities.
 */
public record UtilityFunction(UtilityKind kind, double alpha, double beta, double epsilon) {

    /** Default bootstrap constant. */
    public static final double DEFAULT_EPSILON = Config.UTILITY_EPSILON;

    public UtilityFunction {
        Objects.requireNonNull(kind, "kind");
        if (!(epsilon > 0.0)) {
            throw new IllegalArgumentException("epsilon must be positive, got " + epsilon);
        }
        kind.validate(alpha, beta);
    }

    public static UtilityFunction cobbDouglas(double alpha, double beta) {
        return new UtilityFunction(UtilityKind.COBB_DOUGLAS, alpha, beta, DEFAULT_EPSILON);
    }

    public static UtilityFunction perfectSubstitutes(double alpha, double beta) {
        return new UtilityFunction(UtilityKind.PERFECT_SUBSTITUTES, alpha, beta, DEFAULT_EPSILON);
    }

    public static UtilityFunction perfectComplements(double alpha, double beta) {
        return new UtilityFunction(UtilityKind.PERFECT_COMPLEMENTS, alpha, beta, DEFAULT_EPSILON);
    }

    /**
     * Evaluates the utility of a bundle.
     * @param bundle The bundle.
     * @return The utility level.
     */
    public double value(Bundle bundle) {
        return kind.value(alpha, beta, epsilon, bundle.q1(), bundle.q2());
    }

    /**
     * Evaluates the marginal utility of one more unit of {@code good} at {@code bundle}.
     * @param bundle The bundle.
     * @param good The good.
     * @return The marginal utility, never negative.
     */
    public double marginalUtility(Bundle bundle, Good good) {
        return kind.marginalUtility(alpha, beta, epsilon, bundle.q1(), bundle.q2(), good);
    }
}
