package org.huarongdao.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables heuristic guidance (uniform-cost behavior for A*, required for DFS).</p>
 * <p>{@code MANHATTAN} estimates the remaining slides of the 2x2 piece alone.</p>
 */
public enum HeuristicType {
    NONE,
    MANHATTAN
}
