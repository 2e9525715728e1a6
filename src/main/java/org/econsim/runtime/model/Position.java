package org.econsim.runtime.model;

/**
 * An integer grid cell. The natural order is row-major: by {@code y}, then by {@code x}.
 *
 * @param x Column.
 * @param y Row.
 */
public record Position(int x, int y) implements Comparable<Position> {

    /**
     * Calculates the Manhattan distance {@code |dx| + |dy|} to another cell.
     * @param other The other cell.
     * @return The Manhattan distance.
     */
    public int manhattanDistance(Position other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    public Position translate(Direction direction) {
        return new Position(x + direction.dx(), y + direction.dy());
    }

    @Override
    public int compareTo(Position other) {
        int byRow = Integer.compare(y, other.y);
        return byRow != 0 ? byRow : Integer.compare(x, other.x);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
