package org.huarongdao.board;

import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Layout contract checks shared by board assembly and the solver entry points.
 *
 * <p>Checks run in a fixed order so a malformed layout always reports the same reason code:
 * piece count, piece multiset, bounds, overlap, empty-cell count.</p>
 */
@UtilityClass
public final class BoardValidator {
    private static final int BLOCK_COUNT = 1;
    private static final int DOMINO_COUNT = 5;
    private static final int SINGLE_COUNT = 4;

    /**
     * Rejects a missing board at solver entry points.
     *
     * <p>A constructed {@link Board} already satisfies every layout invariant, so only presence is checked.</p>
     *
     * @param board board to check.
     * @throws InvalidBoardException when the board is missing.
     */
    public static void validate(Board board) {
        if (board == null) {
            throw new InvalidBoardException(InvalidBoardException.REASON_BOARD_REQUIRED, "board must be provided");
        }
    }

    /**
     * Builds the row-major occupancy grid for a piece table, validating it on the way.
     *
     * @param pieces piece table indexed by piece id.
     * @return cell to piece id, {@link Board#NO_PIECE} for empty cells.
     * @throws InvalidBoardException on the first violated invariant.
     */
    static byte[] occupancyOf(Piece[] pieces) {
        ensurePieceCount(pieces);
        ensureMultiset(pieces);

        byte[] occupancy = new byte[Board.CELL_COUNT];
        Arrays.fill(occupancy, (byte) Board.NO_PIECE);
        for (int id = 0; id < pieces.length; id++) {
            Piece piece = pieces[id];
            ensureInside(id, piece);
            for (int row = piece.row(); row <= piece.lastRow(); row++) {
                for (int column = piece.column(); column <= piece.lastColumn(); column++) {
                    int cell = Board.cellIndex(row, column);
                    if (occupancy[cell] != Board.NO_PIECE) {
                        throw new InvalidBoardException(
                                InvalidBoardException.REASON_PIECE_OVERLAP,
                                "pieces " + occupancy[cell] + " and " + id + " both cover (" + row + ", " + column + ")"
                        );
                    }
                    occupancy[cell] = (byte) id;
                }
            }
        }

        int emptyCells = 0;
        for (byte occupant : occupancy) {
            if (occupant == Board.NO_PIECE) {
                emptyCells++;
            }
        }
        if (emptyCells != Board.EMPTY_CELL_COUNT) {
            throw new InvalidBoardException(
                    InvalidBoardException.REASON_EMPTY_CELL_COUNT,
                    "board must have exactly " + Board.EMPTY_CELL_COUNT + " empty cells, got " + emptyCells
            );
        }
        return occupancy;
    }

    private static void ensurePieceCount(Piece[] pieces) {
        if (pieces.length != Board.PIECE_COUNT) {
            throw new InvalidBoardException(
                    InvalidBoardException.REASON_PIECE_COUNT,
                    "board must have exactly " + Board.PIECE_COUNT + " pieces, got " + pieces.length
            );
        }
        for (int id = 0; id < pieces.length; id++) {
            if (pieces[id] == null) {
                throw new InvalidBoardException(
                        InvalidBoardException.REASON_PIECE_REQUIRED,
                        "piece " + id + " must not be null"
                );
            }
        }
    }

    private static void ensureMultiset(Piece[] pieces) {
        Map<PieceKind, Integer> counts = new EnumMap<>(PieceKind.class);
        for (Piece piece : pieces) {
            counts.merge(piece.kind(), 1, Integer::sum);
        }
        int blocks = counts.getOrDefault(PieceKind.BLOCK, 0);
        int dominoes = counts.getOrDefault(PieceKind.HORIZONTAL, 0) + counts.getOrDefault(PieceKind.VERTICAL, 0);
        int singles = counts.getOrDefault(PieceKind.SINGLE, 0);
        if (blocks != BLOCK_COUNT || dominoes != DOMINO_COUNT || singles != SINGLE_COUNT) {
            throw new InvalidBoardException(
                    InvalidBoardException.REASON_PIECE_MULTISET,
                    "expected " + BLOCK_COUNT + " 2x2, " + DOMINO_COUNT + " 1x2 and " + SINGLE_COUNT
                            + " 1x1 pieces, got " + blocks + ", " + dominoes + " and " + singles
            );
        }
    }

    private static void ensureInside(int id, Piece piece) {
        if (!Board.isInside(piece.row(), piece.column()) || !Board.isInside(piece.lastRow(), piece.lastColumn())) {
            throw new InvalidBoardException(
                    InvalidBoardException.REASON_PIECE_OUT_OF_BOUNDS,
                    "piece " + id + " " + piece + " exceeds the " + Board.ROWS + "x" + Board.COLUMNS + " grid"
            );
        }
    }
}
