package org.econsim.runtime.utility;

import java.util.Map;
import java.util.Objects;

/**
 * Creates {@link UtilityFunction}s from a kind name and a loose parameter map,
 * as read from scenario configuration.
 */
public final class UtilityFunctionFactory {

    private UtilityFunctionFactory() {}

    /**
     * Creates a utility function.
     * <p>
     * Recognized parameters are {@code alpha}, {@code beta} and {@code epsilon}. For Cobb-Douglas
     * {@code alpha} defaults to 0.5 and {@code beta} to {@code 1 - alpha}; the other kinds default both
     * weights to 1.0.
     *
     * @param kindName The kind, e.g. {@code cobb-douglas}.
     * @param params The parameters, may be {@code null}.
     * @return The validated utility function.
     * @throws IllegalArgumentException if the kind is unknown or the parameters are invalid.
     */
    public static UtilityFunction create(String kindName, Map<String, ?> params) {
        Objects.requireNonNull(kindName, "Utility function kind cannot be null.");
        UtilityKind kind = UtilityKind.fromConfigName(kindName);
        Map<String, ?> p = params != null ? params : Map.of();
        double epsilon = number(p, "epsilon", UtilityFunction.DEFAULT_EPSILON);
        return switch (kind) {
            case COBB_DOUGLAS -> {
                double alpha = number(p, "alpha", 0.5);
                double beta = number(p, "beta", 1.0 - alpha);
                yield new UtilityFunction(kind, alpha, beta, epsilon);
            }
            case PERFECT_SUBSTITUTES, PERFECT_COMPLEMENTS ->
                    new UtilityFunction(kind, number(p, "alpha", 1.0), number(p, "beta", 1.0), epsilon);
        };
    }

    private static double number(Map<String, ?> params, String key, double fallback) {
        Object value = params.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("Utility parameter '" + key + "' must be numeric, got " + value);
    }
}
