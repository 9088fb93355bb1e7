package org.huarongdao.search;

import org.huarongdao.board.Board;
import org.huarongdao.board.Move;

import java.util.List;

/**
 * Ordered solution from the initial board to a goal board.
 *
 * @param boards snapshots from start to goal, both inclusive.
 * @param moves slides between consecutive snapshots; one fewer than {@code boards}.
 */
public record SolutionPath(List<Board> boards, List<Move> moves) {

    public SolutionPath {
        boards = List.copyOf(boards);
        moves = List.copyOf(moves);
        if (boards.isEmpty()) {
            throw new IllegalArgumentException("solution path must contain at least the initial board");
        }
        if (moves.size() != boards.size() - 1) {
            throw new IllegalArgumentException(
                    "expected " + (boards.size() - 1) + " moves for " + boards.size() + " boards, got " + moves.size()
            );
        }
    }

    /**
     * @return number of slides in the solution.
     */
    public int moveCount() {
        return moves.size();
    }
}
