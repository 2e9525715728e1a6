package org.econsim.runtime.model;

import org.econsim.runtime.utility.UtilityFunction;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link AgentSpatialGrid} neighbor index.
 */
@Tag("unit")
public class AgentSpatialGridTest {

    private static Agent agent(int id, int x, int y) {
        Position p = new Position(x, y);
        return new Agent(id, p, p, UtilityFunction.cobbDouglas(0.5, 0.5), 10);
    }

    /**
     * Verifies that a radius query returns every agent within Manhattan distance, sorted by id,
     * including agents sharing a cell and the agent at the center.
     */
    @Test
    void queryReturnsIdsInRangeSortedAscending() {
        AgentSpatialGrid index = new AgentSpatialGrid(10, 10);
        index.rebuild(List.of(agent(9, 5, 5), agent(3, 5, 7), agent(7, 6, 6), agent(1, 6, 6), agent(4, 8, 8), agent(2, 2, 5)));

        assertThat(index.queryRadius(new Position(5, 5), 2)).containsExactly(1, 3, 7, 9);
        assertThat(index.queryRadius(new Position(5, 5), 3)).containsExactly(1, 2, 3, 7, 9);
        assertThat(index.queryRadius(new Position(0, 0), 1)).isEmpty();
        assertThat(index.size()).isEqualTo(6);
    }

    @Test
    void rebuildReplacesPreviousContents() {
        AgentSpatialGrid index = new AgentSpatialGrid(5, 5);
        Agent a = agent(1, 0, 0);
        index.rebuild(List.of(a));
        a.moveTo(new Position(4, 4));
        index.rebuild(List.of(a));

        assertThat(index.queryRadius(new Position(0, 0), 2)).isEmpty();
        assertThat(index.positionOf(1)).isEqualTo(new Position(4, 4));
    }

    @Test
    void rejectsDuplicateIdsAndOutOfBoundsAgents() {
        AgentSpatialGrid index = new AgentSpatialGrid(5, 5);
        assertThatThrownBy(() -> index.rebuild(List.of(agent(1, 0, 0), agent(1, 1, 1))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> index.rebuild(List.of(agent(2, 5, 0))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void hugeRadiusCoversWholeGrid() {
        AgentSpatialGrid index = new AgentSpatialGrid(10, 10);
        index.rebuild(List.of(agent(1, 0, 0), agent(2, 9, 9), agent(3, 4, 7)));

        assertThat(index.queryRadius(new Position(5, 5), Integer.MAX_VALUE)).containsExactly(1, 2, 3);
        assertThat(index.queryRadius(new Position(9, 9), Integer.MAX_VALUE)).containsExactly(1, 2, 3);
    }

    @Test
    void rejectsGridsWithTooManyCells() {
        assertThatThrownBy(() -> new AgentSpatialGrid(100_000, 100_000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too many cells");
    }
}
