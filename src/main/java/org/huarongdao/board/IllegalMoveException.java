package org.huarongdao.board;

import org.huarongdao.PuzzleException;

/**
 * Thrown when a slide would leave the grid, hit another piece, or names no piece at all.
 *
 * <p>The move generator only proposes legal slides, so seeing this during a search means the
 * generator and {@link Board#applyMove(int, Direction)} disagree.</p>
 */
public final class IllegalMoveException extends PuzzleException {
    public static final String REASON_UNKNOWN_PIECE = "HRD_MOVE_UNKNOWN_PIECE";
    public static final String REASON_DIRECTION_REQUIRED = "HRD_MOVE_DIRECTION_REQUIRED";
    public static final String REASON_OUT_OF_BOUNDS = "HRD_MOVE_OUT_OF_BOUNDS";
    public static final String REASON_CELL_OCCUPIED = "HRD_MOVE_CELL_OCCUPIED";

    public IllegalMoveException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
