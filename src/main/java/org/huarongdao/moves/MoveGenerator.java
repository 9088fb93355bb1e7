package org.huarongdao.moves;

import org.huarongdao.board.Board;
import org.huarongdao.board.Direction;
import org.huarongdao.board.Move;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Enumerates the legal one-cell slides of a board.
 *
 * <p>Only pieces orthogonally adjacent to one of the two empty cells can move, so those are
 * the candidates. Enumeration order is fixed: candidate piece id ascending, then
 * {@link Direction} declaration order (UP, DOWN, LEFT, RIGHT). Depth-first exploration order,
 * and therefore which solution it reports, follows from this order.</p>
 *
 * <p>Stateless and safe to share between searches.</p>
 */
public final class MoveGenerator {
    private static final Direction[] DIRECTIONS = Direction.values();

    /**
     * Lists the legal slides in enumeration order.
     *
     * @param board board to expand.
     * @return legal moves, empty when nothing can slide.
     */
    public List<Move> legalMoves(Board board) {
        List<Move> moves = new ArrayList<>();
        SuccessorIterator iterator = new SuccessorIterator(board);
        while (iterator.hasNext()) {
            moves.add(iterator.nextMove());
        }
        return moves;
    }

    /**
     * Lazily produces successor boards in enumeration order.
     *
     * <p>Each successor board is built only when the iterator reaches it.</p>
     *
     * @param board board to expand.
     * @return single-use iterator over legal successors.
     */
    public Iterator<Successor> successors(Board board) {
        return new SuccessorIterator(board);
    }

    /**
     * Returns whether one slide is legal on the given board.
     */
    public boolean isLegal(Board board, Move move) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(move, "move");
        return board.canMove(move.pieceId(), move.direction());
    }

    /**
     * Returns a bit mask of the piece ids orthogonally adjacent to an empty cell.
     */
    static int candidateMask(Board board) {
        int mask = 0;
        for (int cell : board.emptyCells()) {
            int row = cell / Board.COLUMNS;
            int column = cell % Board.COLUMNS;
            for (Direction direction : DIRECTIONS) {
                int neighborRow = row + direction.dRow;
                int neighborColumn = column + direction.dCol;
                if (!Board.isInside(neighborRow, neighborColumn)) {
                    continue;
                }
                int pieceId = board.pieceIdAt(neighborRow, neighborColumn);
                if (pieceId != Board.NO_PIECE) {
                    mask |= 1 << pieceId;
                }
            }
        }
        return mask;
    }

    /**
     * Cursor over (piece id, direction) pairs that advances to the next legal slide on demand.
     */
    private static final class SuccessorIterator implements Iterator<Successor> {
        private final Board board;
        private final int candidates;
        private int pieceId;
        private int directionIndex = -1;
        private boolean ready;

        private SuccessorIterator(Board board) {
            this.board = Objects.requireNonNull(board, "board");
            this.candidates = candidateMask(board);
        }

        @Override
        public boolean hasNext() {
            if (!ready) {
                ready = advance();
            }
            return ready;
        }

        @Override
        public Successor next() {
            Move move = nextMove();
            return new Successor(move, board.applyMove(move));
        }

        Move nextMove() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ready = false;
            return new Move(pieceId, DIRECTIONS[directionIndex]);
        }

        /**
         * Moves the cursor to the next legal pair.
         *
         * @return {@code false} once every pair has been visited.
         */
        private boolean advance() {
            while (pieceId < board.pieceCount()) {
                if ((candidates & (1 << pieceId)) != 0) {
                    while (++directionIndex < DIRECTIONS.length) {
                        if (board.canMove(pieceId, DIRECTIONS[directionIndex])) {
                            return true;
                        }
                    }
                }
                pieceId++;
                directionIndex = -1;
            }
            return false;
        }
    }
}
