package org.huarongdao.heuristic;

import org.huarongdao.board.Board;

import java.util.Objects;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero, so A* driven by it expands boards in plain g-cost order.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    @Override
    public int estimate(Board board) {
        Objects.requireNonNull(board, "board");
        return 0;
    }
}
