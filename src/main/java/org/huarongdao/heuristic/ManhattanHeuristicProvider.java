package org.huarongdao.heuristic;

import org.huarongdao.board.Board;
import org.huarongdao.board.Piece;

import java.util.Objects;

/**
 * Manhattan distance of the 2x2 piece's anchor to the goal anchor.
 *
 * <p>Every slide moves one piece by one cell, so the 2x2 piece needs at least this many slides
 * of its own; the estimate changes by at most one per slide, which keeps it consistent.</p>
 */
public final class ManhattanHeuristicProvider implements HeuristicProvider {

    @Override
    public HeuristicType type() {
        return HeuristicType.MANHATTAN;
    }

    @Override
    public int estimate(Board board) {
        Objects.requireNonNull(board, "board");
        Piece block = board.blockPiece();
        return Math.abs(block.row() - Board.GOAL_ROW) + Math.abs(block.column() - Board.GOAL_COLUMN);
    }
}
