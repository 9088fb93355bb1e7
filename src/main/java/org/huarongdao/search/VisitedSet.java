package org.huarongdao.search;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;

/**
 * Per-search record of canonical board keys and the best g-cost seen for each.
 *
 * <p>Depth-first search only asks whether a key was seen; A* also compares costs so a cheaper
 * path to a known board can still be expanded.</p>
 *
 * <p><strong>Thread Safety:</strong> This class is NOT thread-safe. It is intended
 * for use within a single search invocation.</p>
 */
public final class VisitedSet {
    private static final int NOT_VISITED = Integer.MAX_VALUE;

    private final Long2IntOpenHashMap bestCostByKey;

    public VisitedSet() {
        this(1 << 10);
    }

    /**
     * @param expectedSize expected number of distinct keys, used to pre-size the table.
     */
    public VisitedSet(int expectedSize) {
        if (expectedSize < 0) {
            throw new IllegalArgumentException("expectedSize must be non-negative");
        }
        this.bestCostByKey = new Long2IntOpenHashMap(expectedSize);
        this.bestCostByKey.defaultReturnValue(NOT_VISITED);
    }

    /**
     * Records a key at a g-cost unless it is already known at that cost or cheaper.
     *
     * @param key canonical board key.
     * @param gCost non-negative cost of the path that reached the board.
     * @return {@code true} if the key was new or its best cost dropped.
     */
    public boolean markVisited(long key, int gCost) {
        if (gCost < 0) {
            throw new IllegalArgumentException("gCost must be non-negative, got " + gCost);
        }
        if (bestCostByKey.get(key) <= gCost) {
            return false;
        }
        bestCostByKey.put(key, gCost);
        return true;
    }

    /**
     * Checks if a key has been recorded at any cost.
     */
    public boolean isVisited(long key) {
        return bestCostByKey.containsKey(key);
    }

    /**
     * Returns whether the key is known at {@code gCost} or cheaper.
     */
    public boolean isVisitedAtOrBelow(long key, int gCost) {
        return bestCostByKey.get(key) <= gCost;
    }

    /**
     * @return best recorded cost, or {@link Integer#MAX_VALUE} when the key is unknown.
     */
    public int bestCost(long key) {
        return bestCostByKey.get(key);
    }

    public int size() {
        return bestCostByKey.size();
    }

    /**
     * Resets the set for reuse.
     */
    public void clear() {
        bestCostByKey.clear();
    }
}
