package org.econsim.runtime.model;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;

import java.util.Collection;

/**
 * Bucket index over agent positions for Manhattan-radius queries.
 * <p>
 * The index is rebuilt once per step in O(n). A query visits only the cells of the diamond around
 * the center and returns ids sorted ascending, so callers iterate candidates in a reproducible order.
 */
public class AgentSpatialGrid {

    private final int width;
    private final int height;
    private final Int2ObjectOpenHashMap<IntArrayList> buckets = new Int2ObjectOpenHashMap<>();
    private final Int2ObjectOpenHashMap<Position> positions = new Int2ObjectOpenHashMap<>();

    /**
     * Creates an empty index.
     * @param width Grid width.
     * @param height Grid height.
     */
    public AgentSpatialGrid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive, got " + width + "x" + height);
        }
        SpatialGrid.checkedCellCount(width, height);
        this.width = width;
        this.height = height;
    }

    /**
     * Discards the current contents and indexes the given agents at their current positions.
     * @param agents The agents to index.
     * @throws IllegalArgumentException if an agent is outside the grid or an id occurs twice.
     */
    public void rebuild(Collection<Agent> agents) {
        clear();
        for (Agent agent : agents) {
            place(agent.getId(), agent.getPosition());
        }
    }

    public void clear() {
        buckets.clear();
        positions.clear();
    }

    /**
     * Adds a single agent to the index.
     * @param agentId The agent id.
     * @param pos The agent's cell.
     */
    public void place(int agentId, Position pos) {
        if (pos.x() < 0 || pos.x() >= width || pos.y() < 0 || pos.y() >= height) {
            throw new IllegalArgumentException("Agent " + agentId + " at " + pos + " is outside the " + width + "x" + height + " grid");
        }
        if (positions.put(agentId, pos) != null) {
            throw new IllegalArgumentException("Duplicate agent id " + agentId);
        }
        buckets.computeIfAbsent(pos.y() * width + pos.x(), k -> new IntArrayList(2)).add(agentId);
    }

    /**
     * Finds all indexed agents within a Manhattan radius.
     *
     * @param center The query center.
     * @param radius The maximum Manhattan distance, inclusive.
     * @return The agent ids in range, sorted ascending. Includes an agent standing on {@code center}.
     */
    public int[] queryRadius(Position center, int radius) {
        if (radius < 0 || positions.isEmpty()) {
            return IntArrays.EMPTY_ARRAY;
        }
        IntArrayList found = new IntArrayList();
        int yMin = (int) Math.max(0L, (long) center.y() - radius);
        int yMax = (int) Math.min(height - 1L, (long) center.y() + radius);
        for (int y = yMin; y <= yMax; y++) {
            long remaining = radius - Math.abs((long) y - center.y());
            int xMin = (int) Math.max(0L, center.x() - remaining);
            int xMax = (int) Math.min(width - 1L, center.x() + remaining);
            for (int x = xMin; x <= xMax; x++) {
                IntArrayList bucket = buckets.get(y * width + x);
                if (bucket != null) {
                    found.addAll(bucket);
                }
            }
        }
        int[] ids = found.toIntArray();
        IntArrays.quickSort(ids);
        return ids;
    }

    /**
     * Returns the indexed position of an agent.
     * @param agentId The agent id.
     * @return The position, or {@code null} if the agent is not indexed.
     */
    public Position positionOf(int agentId) {
        return positions.get(agentId);
    }

    public int size() {
        return positions.size();
    }
}
