package org.econsim.runtime.utility;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Contains unit tests for {@link UtilityFunctionFactory}.
 */
@Tag("unit")
public class UtilityFunctionFactoryTest {

    @Test
    void cobbDouglasDefaultsToEqualWeights() {
        UtilityFunction u = UtilityFunctionFactory.create("cobb-douglas", null);
        assertThat(u.kind()).isEqualTo(UtilityKind.COBB_DOUGLAS);
        assertThat(u.alpha()).isEqualTo(0.5);
        assertThat(u.beta()).isEqualTo(0.5);
        assertThat(u.epsilon()).isEqualTo(UtilityFunction.DEFAULT_EPSILON);
    }

    /**
     * Verifies that a Cobb-Douglas beta defaults to {@code 1 - alpha}.
     */
    @Test
    void cobbDouglasBetaDefaultsToComplementOfAlpha() {
        UtilityFunction u = UtilityFunctionFactory.create("cobb_douglas", Map.of("alpha", 0.7));
        assertThat(u.beta()).isCloseTo(0.3, within(1e-12));
    }

    @Test
    void otherKindsDefaultToUnitWeights() {
        UtilityFunction u = UtilityFunctionFactory.create("perfect-complements", Map.of("epsilon", 0.5));
        assertThat(u.alpha()).isEqualTo(1.0);
        assertThat(u.beta()).isEqualTo(1.0);
        assertThat(u.epsilon()).isEqualTo(0.5);
    }

    @Test
    void integerParametersAreAccepted() {
        UtilityFunction u = UtilityFunctionFactory.create("perfect-substitutes", Map.of("alpha", 2, "beta", 1));
        assertThat(u.alpha()).isEqualTo(2.0);
    }

    @Test
    void rejectsUnknownKindAndNonNumericParameters() {
        assertThatThrownBy(() -> UtilityFunctionFactory.create("ces", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> UtilityFunctionFactory.create("perfect-substitutes", Map.of("alpha", "high")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alpha");
        assertThatThrownBy(() -> UtilityFunctionFactory.create("cobb-douglas", Map.of("alpha", 0.4, "beta", 0.4)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
