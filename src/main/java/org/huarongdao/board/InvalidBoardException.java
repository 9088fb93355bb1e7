package org.huarongdao.board;

import org.huarongdao.PuzzleException;

/**
 * Thrown when a board or its text form violates the fixed 4x5 layout contracts.
 */
public final class InvalidBoardException extends PuzzleException {
    public static final String REASON_BOARD_REQUIRED = "HRD_BOARD_REQUIRED";
    public static final String REASON_PIECE_REQUIRED = "HRD_PIECE_REQUIRED";
    public static final String REASON_PIECE_COUNT = "HRD_PIECE_COUNT";
    public static final String REASON_PIECE_MULTISET = "HRD_PIECE_MULTISET";
    public static final String REASON_PIECE_OUT_OF_BOUNDS = "HRD_PIECE_OUT_OF_BOUNDS";
    public static final String REASON_PIECE_OVERLAP = "HRD_PIECE_OVERLAP";
    public static final String REASON_EMPTY_CELL_COUNT = "HRD_EMPTY_CELL_COUNT";
    public static final String REASON_TEXT_REQUIRED = "HRD_TEXT_REQUIRED";
    public static final String REASON_TEXT_SHAPE = "HRD_TEXT_SHAPE";
    public static final String REASON_TEXT_UNKNOWN_SYMBOL = "HRD_TEXT_UNKNOWN_SYMBOL";
    public static final String REASON_TEXT_PIECE_SHAPE = "HRD_TEXT_PIECE_SHAPE";

    public InvalidBoardException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public InvalidBoardException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
