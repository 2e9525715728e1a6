package org.econsim.runtime.config;

import com.typesafe.config.ConfigException;
import org.econsim.runtime.model.Good;
import org.econsim.runtime.model.Position;
import org.econsim.runtime.model.ResourceCell;
import org.econsim.runtime.utility.UtilityFunction;
import org.econsim.runtime.utility.UtilityKind;
import org.econsim.runtime.worldgen.DensityRespawnStrategy;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for reading and validating {@link SimulationConfig}.
 */
@Tag("unit")
class SimulationConfigTest {

    private static SimulationConfig parse(String hocon) {
        return SimulationConfig.fromConfig(ConfigLoader.parse(hocon));
    }

    @Test
    void referenceDefaultsAreValid() {
        SimulationConfig config = parse("");

        assertThat(config.seed()).isZero();
        assertThat(config.grid().cellCount()).isEqualTo(400);
        assertThat(config.agents().count()).isEqualTo(4);
        assertThat(config.agents().profiles()).containsExactly(UtilityFunction.cobbDouglas(0.5, 0.5));
        assertThat(config.agents().positions()).isEmpty();
        assertThat(config.decision().perceptionRadius()).isEqualTo(8);
        assertThat(config.decision().minTradeGain()).isEqualTo(1e-5);
        assertThat(config.decision().forageEnabled()).isTrue();
        assertThat(config.decision().tradeEnabled()).isTrue();
        assertThat(config.resources().initialDensity()).isEqualTo(0.25);
        assertThat(config.respawn().createStrategy()).get().isInstanceOf(DensityRespawnStrategy.class);
    }

    @Test
    void readsProfilesPositionsAndResources() {
        SimulationConfig config = parse("""
                econsim {
                  grid { width = 6, height = 4 }
                  agents {
                    count = 2
                    profiles = [
                      { kind = "perfect-complements", alpha = 1, beta = 2 }
                      { kind = "perfect_substitutes" }
                    ]
                    positions = [ { x = 0, y = 0 }, { x = 5, y = 3 } ]
                  }
                  resources.initial = [ { x = 2, y = 1, good = "good2" }, { x = 3, y = 1, good = "A" } ]
                  respawn.enabled = false
                }
                """);

        assertThat(config.agents().profileFor(0)).isEqualTo(UtilityFunction.perfectComplements(1.0, 2.0));
        assertThat(config.agents().profileFor(1).kind()).isEqualTo(UtilityKind.PERFECT_SUBSTITUTES);
        assertThat(config.agents().profileFor(2)).isEqualTo(config.agents().profileFor(0));
        assertThat(config.agents().positions()).containsExactly(new Position(0, 0), new Position(5, 3));
        assertThat(config.resources().initial()).containsExactly(
                new ResourceCell(new Position(2, 1), Good.GOOD2),
                new ResourceCell(new Position(3, 1), Good.GOOD1));
        assertThat(config.respawn().createStrategy()).isEmpty();
    }

    @Test
    void parseGoodAcceptsAliases() {
        assertThat(SimulationConfig.parseGood("good_1")).isEqualTo(Good.GOOD1);
        assertThat(SimulationConfig.parseGood(" B ")).isEqualTo(Good.GOOD2);
        assertThatThrownBy(() -> SimulationConfig.parseGood("gold")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonPositiveGrid() {
        assertThatThrownBy(() -> parse("econsim.grid.width = 0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Grid dimensions");
    }

    @Test
    void rejectsGridTooLargeToIndex() {
        assertThatThrownBy(() -> parse("econsim.grid { width = 100000, height = 100000 }"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too many cells");
    }

    @Test
    void rejectsProfileWithoutKind() {
        assertThatThrownBy(() -> parse("econsim.agents.profiles = [ { alpha = 0.3 } ]"))
                .isInstanceOf(ConfigException.Missing.class);
    }

    @Test
    void rejectsUnknownUtilityKind() {
        assertThatThrownBy(() -> parse("econsim.agents.profiles = [ { kind = \"leontief-plus\" } ]"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsPositionCountMismatch() {
        assertThatThrownBy(() -> parse("econsim.agents { count = 2, positions = [ { x = 1, y = 1 } ] }"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("agent positions");
    }

    @Test
    void rejectsCoordinatesOutsideGrid() {
        assertThatThrownBy(() -> parse("econsim.resources.initial = [ { x = 20, y = 0, good = good1 } ]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of bounds");
        assertThatThrownBy(() -> parse("econsim.agents { count = 1, positions = [ { x = 0, y = -1 } ] }"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsInvalidRespawnSettings() {
        assertThatThrownBy(() -> parse("econsim.respawn.target-density = 2"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("econsim.respawn.type = \"geyser\""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown respawn strategy");
    }

    @Test
    void rejectsWrongValueType() {
        assertThatThrownBy(() -> parse("econsim.agents.count = many"))
                .isInstanceOf(ConfigException.WrongType.class);
    }
}
