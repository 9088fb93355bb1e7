package org.huarongdao.heuristic;

import org.huarongdao.board.Board;

/**
 * Lower-bound estimator of the slides still needed to solve a board.
 *
 * <p>Providers are immutable and thread-safe. Estimates must be admissible (never above the
 * true remaining number of slides) and consistent (dropping by at most one per slide) so that
 * A* returns shortest solutions without reopening settled states.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Estimates remaining slides from a board to the goal.
     *
     * @param board board to estimate.
     * @return non-negative admissible lower bound.
     */
    int estimate(Board board);
}
