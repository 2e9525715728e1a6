package org.econsim.runtime.decision;

import org.econsim.runtime.model.Direction;
import org.econsim.runtime.model.Position;

import java.util.Optional;

/**
 * Single-step Manhattan movement.
 */
public final class Movement {

    private Movement() {}

    /**
     * Picks the step that reduces the Manhattan distance to {@code to}.
     * The axis with the larger absolute delta moves first; on equal deltas the x axis moves first.
     *
     * @param from The current cell.
     * @param to The destination.
     * @return The direction, or empty if {@code from} equals {@code to}.
     */
    public static Optional<Direction> stepToward(Position from, Position to) {
        int dx = to.x() - from.x();
        int dy = to.y() - from.y();
        if (dx == 0 && dy == 0) {
            return Optional.empty();
        }
        if (Math.abs(dx) >= Math.abs(dy)) {
            return Optional.of(dx > 0 ? Direction.EAST : Direction.WEST);
        }
        return Optional.of(dy > 0 ? Direction.SOUTH : Direction.NORTH);
    }
}
