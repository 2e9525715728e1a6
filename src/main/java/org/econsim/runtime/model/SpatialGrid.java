package org.econsim.runtime.model;

import it.unimi.dsi.fastutil.ints.IntBidirectionalIterator;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The bounded resource grid. Each cell holds at most one unit of one good.
 * <p>
 * Cells are addressed by a flat row-major index ({@code y * width + x}). Occupied indices are kept in a
 * sorted set so every iteration is in row-major order and therefore reproducible.
 */
public class SpatialGrid {

    private static final byte EMPTY = 0;

    private final int width;
    private final int height;
    private final byte[] cells;
    private final IntSortedSet occupiedIndices;

    /**
     * Creates an empty grid.
     * @param width Number of columns, must be positive.
     * @param height Number of rows, must be positive.
     */
    public SpatialGrid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.cells = new byte[checkedCellCount(width, height)];
        this.occupiedIndices = new IntRBTreeSet();
    }

    private SpatialGrid(SpatialGrid source) {
        this.width = source.width;
        this.height = source.height;
        this.cells = source.cells.clone();
        this.occupiedIndices = new IntRBTreeSet(source.occupiedIndices);
    }

    /**
     * Number of cells of a {@code width x height} grid.
     * @throws IllegalArgumentException if the product does not fit in an {@code int}.
     */
    public static int checkedCellCount(int width, int height) {
        try {
            return Math.multiplyExact(width, height);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Grid " + width + "x" + height + " has too many cells", e);
        }
    }

    /**
     * Creates an independent copy. Later changes to either grid are not visible in the other.
     * @return The copy.
     */
    public SpatialGrid copy() {
        return new SpatialGrid(this);
    }

    public boolean contains(Position pos) {
        return pos.x() >= 0 && pos.x() < width && pos.y() >= 0 && pos.y() < height;
    }

    private int flatIndex(Position pos) {
        if (!contains(pos)) {
            throw new IllegalArgumentException("Coordinate " + pos + " out of bounds for " + width + "x" + height + " grid");
        }
        return pos.y() * width + pos.x();
    }

    private Position positionOf(int flatIndex) {
        return new Position(flatIndex % width, flatIndex / width);
    }

    /**
     * Places a resource, replacing any resource already in the cell.
     * @param pos The cell.
     * @param good The good.
     */
    public void addResource(Position pos, Good good) {
        int index = flatIndex(pos);
        cells[index] = encode(good);
        occupiedIndices.add(index);
    }

    public boolean hasResource(Position pos) {
        return cells[flatIndex(pos)] != EMPTY;
    }

    public Optional<ResourceCell> resourceAt(Position pos) {
        byte code = cells[flatIndex(pos)];
        return code == EMPTY ? Optional.empty() : Optional.of(new ResourceCell(pos, decode(code)));
    }

    /**
     * Removes the resource in a cell.
     * @param pos The cell.
     * @return The good that was removed, or empty if the cell held nothing.
     */
    public Optional<Good> removeResource(Position pos) {
        int index = flatIndex(pos);
        byte code = cells[index];
        if (code == EMPTY) {
            return Optional.empty();
        }
        cells[index] = EMPTY;
        occupiedIndices.remove(index);
        return Optional.of(decode(code));
    }

    /**
     * Returns all resources in row-major order.
     * @return The resource cells.
     */
    public List<ResourceCell> iterateResources() {
        List<ResourceCell> result = new ArrayList<>(occupiedIndices.size());
        IntBidirectionalIterator it = occupiedIndices.iterator();
        while (it.hasNext()) {
            int index = it.nextInt();
            result.add(new ResourceCell(positionOf(index), decode(cells[index])));
        }
        return result;
    }

    /**
     * Returns all resources within a Manhattan radius, in row-major order.
     * Only the cells of the bounded diamond around {@code center} are inspected.
     *
     * @param center The query center; may lie outside the grid.
     * @param radius The maximum Manhattan distance, inclusive.
     * @return The resource cells within range.
     */
    public List<ResourceCell> resourcesWithin(Position center, int radius) {
        List<ResourceCell> result = new ArrayList<>();
        if (radius < 0) {
            return result;
        }
        int yMin = (int) Math.max(0L, (long) center.y() - radius);
        int yMax = (int) Math.min(height - 1L, (long) center.y() + radius);
        for (int y = yMin; y <= yMax; y++) {
            long remaining = radius - Math.abs((long) y - center.y());
            int xMin = (int) Math.max(0L, center.x() - remaining);
            int xMax = (int) Math.min(width - 1L, center.x() + remaining);
            int rowOffset = y * width;
            for (int x = xMin; x <= xMax; x++) {
                byte code = cells[rowOffset + x];
                if (code != EMPTY) {
                    result.add(new ResourceCell(new Position(x, y), decode(code)));
                }
            }
        }
        return result;
    }

    /**
     * Returns all empty cells in row-major order.
     * @return The empty cells.
     */
    public List<Position> emptyCells() {
        List<Position> result = new ArrayList<>(cells.length - occupiedIndices.size());
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == EMPTY) {
                result.add(positionOf(i));
            }
        }
        return result;
    }

    public int resourceCount() {
        return occupiedIndices.size();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int cellCount() {
        return cells.length;
    }

    private static byte encode(Good good) {
        return (byte) (good.ordinal() + 1);
    }

    private static Good decode(byte code) {
        return Good.values()[code - 1];
    }

    @Override
    public String toString() {
        return "SpatialGrid(" + width + "x" + height + ", resources=" + occupiedIndices.size() + ")";
    }
}
