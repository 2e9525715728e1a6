package org.econsim.runtime.utility;

import org.econsim.runtime.model.Good;

/**
 * The closed set of preference families. Each constant carries its own value and
 * marginal-utility formulas, so adding a family means adding a constant here.
 */
public enum UtilityKind {

    /**
     * {@code U = (q1+e)^a * (q2+e)^b}. Marginal utility is the analytic partial derivative,
     * strictly positive and diminishing in the good's own quantity.
     */
    COBB_DOUGLAS("cobb-douglas") {
        @Override
        double value(double alpha, double beta, double epsilon, int q1, int q2) {
            return Math.pow(q1 + epsilon, alpha) * Math.pow(q2 + epsilon, beta);
        }

        @Override
        double marginalUtility(double alpha, double beta, double epsilon, int q1, int q2, Good good) {
            double u = value(alpha, beta, epsilon, q1, q2);
            return good == Good.GOOD1 ? alpha * u / (q1 + epsilon) : beta * u / (q2 + epsilon);
        }

        @Override
        void validate(double alpha, double beta) {
            if (!(alpha > 0.0 && alpha < 1.0) || !(beta > 0.0 && beta < 1.0)) {
                throw new IllegalArgumentException("Cobb-Douglas weights must lie in (0, 1), got alpha=" + alpha + ", beta=" + beta);
            }
            if (Math.abs(alpha + beta - 1.0) > WEIGHT_SUM_TOLERANCE) {
                throw new IllegalArgumentException("Cobb-Douglas weights must sum to 1, got " + (alpha + beta));
            }
        }
    },

    /**
     * {@code U = a*q1 + b*q2}. Constant marginal utility equal to the good's weight.
     */
    PERFECT_SUBSTITUTES("perfect-substitutes") {
        @Override
        double value(double alpha, double beta, double epsilon, int q1, int q2) {
            return alpha * q1 + beta * q2;
        }

        @Override
        double marginalUtility(double alpha, double beta, double epsilon, int q1, int q2, Good good) {
            return good == Good.GOOD1 ? alpha : beta;
        }
    },

    /**
     * {@code U = min(a*q1, b*q2)}. Only the binding good has positive marginal utility;
     * when both sides are equal both goods are binding.
     */
    PERFECT_COMPLEMENTS("perfect-complements") {
        @Override
        double value(double alpha, double beta, double epsilon, int q1, int q2) {
            return Math.min(alpha * q1, beta * q2);
        }

        @Override
        double marginalUtility(double alpha, double beta, double epsilon, int q1, int q2, Good good) {
            double side1 = alpha * q1;
            double side2 = beta * q2;
            if (Math.abs(side1 - side2) <= BINDING_TOLERANCE) {
                return good == Good.GOOD1 ? alpha : beta;
            }
            Good binding = side1 < side2 ? Good.GOOD1 : Good.GOOD2;
            if (good != binding) {
                return 0.0;
            }
            return good == Good.GOOD1 ? alpha : beta;
        }
    };

    static final double WEIGHT_SUM_TOLERANCE = 1e-9;
    static final double BINDING_TOLERANCE = 1e-9;

    private final String configName;

    UtilityKind(String configName) {
        this.configName = configName;
    }

    abstract double value(double alpha, double beta, double epsilon, int q1, int q2);

    abstract double marginalUtility(double alpha, double beta, double epsilon, int q1, int q2, Good good);

    /**
     * Checks the weights of this family. The default accepts any strictly positive pair.
     * @param alpha Weight of Good 1.
     * @param beta Weight of Good 2.
     * @throws IllegalArgumentException if the weights are invalid for this family.
     */
    void validate(double alpha, double beta) {
        if (!(alpha > 0.0) || !(beta > 0.0)) {
            throw new IllegalArgumentException(configName + " weights must be positive, got alpha=" + alpha + ", beta=" + beta);
        }
    }

    /**
     * Returns the name used for this kind in configuration files.
     * @return The configuration name, e.g. {@code cobb-douglas}.
     */
    public String configName() {
        return configName;
    }

    /**
     * Resolves a configuration name. Hyphens and underscores are interchangeable and case is ignored.
     * @param name The configured kind name.
     * @return The matching kind.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static UtilityKind fromConfigName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase().replace('_', '-');
            for (UtilityKind kind : values()) {
                if (kind.configName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown utility function kind: " + name);
    }
}
