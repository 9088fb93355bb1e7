package org.huarongdao.board;

import java.util.List;

/**
 * Immutable Hua Rong Dao configuration on the fixed 5-row by 4-column grid.
 *
 * <p>A board keeps two views of the same layout:</p>
 * <ul>
 * <li>a piece table indexed by piece id, holding each piece's kind and anchor cell;</li>
 * <li>a row-major occupancy grid mapping each cell to the covering piece id, or
 * {@link #NO_PIECE} for the two empty cells.</li>
 * </ul>
 *
 * <p>Equality, hashing and ordering use only {@link #canonicalKey()}, which packs the piece
 * kind of every cell. Two boards with the same shapes in the same places are equal even when
 * their piece ids differ, so a search recognizes one state reached by different move
 * sequences.</p>
 *
 * <p>Boards are created through {@link #of(List)} (validated) or {@link #applyMove(int, Direction)}
 * (derived from a valid board); neither mutates an existing instance.</p>
 */
public final class Board implements Comparable<Board> {
    public static final int ROWS = 5;
    public static final int COLUMNS = 4;
    public static final int CELL_COUNT = ROWS * COLUMNS;
    public static final int PIECE_COUNT = 10;
    public static final int EMPTY_CELL_COUNT = 2;

    /** Anchor row of the 2x2 piece on a solved board. */
    public static final int GOAL_ROW = 3;
    /** Anchor column of the 2x2 piece on a solved board. */
    public static final int GOAL_COLUMN = 1;

    /** Occupancy value of an empty cell. */
    public static final int NO_PIECE = -1;

    private static final int BITS_PER_CELL = 3;

    private final Piece[] pieces;
    private final byte[] occupancy;
    private final int blockPieceId;
    private final long canonicalKey;

    private Board(Piece[] pieces, byte[] occupancy, int blockPieceId) {
        this.pieces = pieces;
        this.occupancy = occupancy;
        this.blockPieceId = blockPieceId;
        this.canonicalKey = computeCanonicalKey(pieces, occupancy);
    }

    /**
     * Assembles a board from piece placements. Piece ids follow list order.
     *
     * @param pieces exactly ten placements of the fixed piece multiset.
     * @return validated board.
     * @throws InvalidBoardException when any layout invariant is violated.
     */
    public static Board of(List<Piece> pieces) {
        if (pieces == null) {
            throw new InvalidBoardException(InvalidBoardException.REASON_BOARD_REQUIRED, "pieces must be provided");
        }
        Piece[] table = pieces.toArray(new Piece[0]);
        byte[] occupancy = BoardValidator.occupancyOf(table);
        int blockPieceId = NO_PIECE;
        for (int id = 0; id < table.length; id++) {
            if (table[id].kind() == PieceKind.BLOCK) {
                blockPieceId = id;
                break;
            }
        }
        return new Board(table, occupancy, blockPieceId);
    }

    /**
     * Returns whether the 2x2 piece sits on the bottom-center exit.
     */
    public boolean isGoal() {
        Piece block = pieces[blockPieceId];
        return block.row() == GOAL_ROW && block.column() == GOAL_COLUMN;
    }

    /**
     * Label-independent state key: 3 bits of {@link PieceKind#code()} per cell, cell 0 in the
     * lowest bits.
     *
     * <p>Dominoes anchor at their first cell in row-major order, so the per-cell kind layout
     * determines the piece partition and two boards share a key exactly when they have the same
     * shapes in the same places.</p>
     */
    public long canonicalKey() {
        return canonicalKey;
    }

    /**
     * Slides one piece by one cell.
     *
     * @param pieceId id of the piece to slide.
     * @param direction slide direction.
     * @return the resulting board; this board is unchanged.
     * @throws IllegalMoveException when the slide leaves the grid or hits another piece.
     */
    public Board applyMove(int pieceId, Direction direction) {
        String violation = moveViolation(pieceId, direction);
        if (violation != null) {
            throw new IllegalMoveException(violation, describeViolation(violation, pieceId, direction));
        }

        Piece current = pieces[pieceId];
        Piece moved = current.shifted(direction);

        Piece[] nextPieces = pieces.clone();
        nextPieces[pieceId] = moved;

        byte[] nextOccupancy = occupancy.clone();
        fill(nextOccupancy, current, NO_PIECE);
        fill(nextOccupancy, moved, pieceId);
        return new Board(nextPieces, nextOccupancy, blockPieceId);
    }

    /**
     * Slides one piece by one cell.
     *
     * @see #applyMove(int, Direction)
     */
    public Board applyMove(Move move) {
        if (move == null) {
            throw new IllegalMoveException(IllegalMoveException.REASON_DIRECTION_REQUIRED, "move must be provided");
        }
        return applyMove(move.pieceId(), move.direction());
    }

    /**
     * Returns whether {@link #applyMove(int, Direction)} would succeed, without allocating.
     */
    public boolean canMove(int pieceId, Direction direction) {
        return moveViolation(pieceId, direction) == null;
    }

    public int pieceCount() {
        return pieces.length;
    }

    /**
     * @param pieceId piece id in {@code [0, pieceCount())}.
     * @return placement of that piece.
     */
    public Piece piece(int pieceId) {
        if (pieceId < 0 || pieceId >= pieces.length) {
            throw new IllegalArgumentException(
                    "pieceId out of bounds: " + pieceId + " [0, " + pieces.length + ")"
            );
        }
        return pieces[pieceId];
    }

    /**
     * @return immutable view of the piece table in id order.
     */
    public List<Piece> pieces() {
        return List.of(pieces);
    }

    public int blockPieceId() {
        return blockPieceId;
    }

    public Piece blockPiece() {
        return pieces[blockPieceId];
    }

    /**
     * @return id of the piece covering the cell, or {@link #NO_PIECE} when it is empty.
     */
    public int pieceIdAt(int row, int column) {
        requireInside(row, column);
        return occupancy[cellIndex(row, column)];
    }

    /**
     * @return kind of the piece covering the cell, or {@code null} when it is empty.
     */
    public PieceKind kindAt(int row, int column) {
        int pieceId = pieceIdAt(row, column);
        return pieceId == NO_PIECE ? null : pieces[pieceId].kind();
    }

    public boolean isEmpty(int row, int column) {
        return pieceIdAt(row, column) == NO_PIECE;
    }

    /**
     * Derives the empty cells from the occupancy grid.
     *
     * @return the two empty cell indices ({@code row * COLUMNS + column}) in ascending order.
     */
    public int[] emptyCells() {
        int[] empty = new int[EMPTY_CELL_COUNT];
        int found = 0;
        for (int cell = 0; cell < CELL_COUNT && found < EMPTY_CELL_COUNT; cell++) {
            if (occupancy[cell] == NO_PIECE) {
                empty[found++] = cell;
            }
        }
        return empty;
    }

    /**
     * Row-major cell index.
     */
    public static int cellIndex(int row, int column) {
        return row * COLUMNS + column;
    }

    public static boolean isInside(int row, int column) {
        return row >= 0 && row < ROWS && column >= 0 && column < COLUMNS;
    }

    @Override
    public int compareTo(Board other) {
        return Long.compare(canonicalKey, other.canonicalKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Board other)) {
            return false;
        }
        return canonicalKey == other.canonicalKey;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(canonicalKey);
    }

    /**
     * Renders the board in the digit-grid text format of {@link BoardText}.
     */
    @Override
    public String toString() {
        return BoardText.format(this);
    }

    /**
     * Returns the reason code that blocks the slide, or {@code null} when the slide is legal.
     */
    private String moveViolation(int pieceId, Direction direction) {
        if (pieceId < 0 || pieceId >= pieces.length) {
            return IllegalMoveException.REASON_UNKNOWN_PIECE;
        }
        if (direction == null) {
            return IllegalMoveException.REASON_DIRECTION_REQUIRED;
        }
        Piece moved = pieces[pieceId].shifted(direction);
        if (!isInside(moved.row(), moved.column()) || !isInside(moved.lastRow(), moved.lastColumn())) {
            return IllegalMoveException.REASON_OUT_OF_BOUNDS;
        }
        for (int row = moved.row(); row <= moved.lastRow(); row++) {
            for (int column = moved.column(); column <= moved.lastColumn(); column++) {
                int occupant = occupancy[cellIndex(row, column)];
                if (occupant != NO_PIECE && occupant != pieceId) {
                    return IllegalMoveException.REASON_CELL_OCCUPIED;
                }
            }
        }
        return null;
    }

    private String describeViolation(String reasonCode, int pieceId, Direction direction) {
        return switch (reasonCode) {
            case IllegalMoveException.REASON_UNKNOWN_PIECE ->
                    "pieceId out of bounds: " + pieceId + " [0, " + pieces.length + ")";
            case IllegalMoveException.REASON_DIRECTION_REQUIRED -> "direction must be provided";
            case IllegalMoveException.REASON_OUT_OF_BOUNDS ->
                    "piece " + pieceId + " " + pieces[pieceId] + " cannot slide " + direction + " off the grid";
            default -> "piece " + pieceId + " " + pieces[pieceId] + " cannot slide " + direction
                    + " into an occupied cell";
        };
    }

    private static void requireInside(int row, int column) {
        if (!isInside(row, column)) {
            throw new IllegalArgumentException(
                    "cell out of bounds: (" + row + ", " + column + ") in " + ROWS + "x" + COLUMNS + " grid"
            );
        }
    }

    private static void fill(byte[] occupancy, Piece piece, int value) {
        for (int row = piece.row(); row <= piece.lastRow(); row++) {
            for (int column = piece.column(); column <= piece.lastColumn(); column++) {
                occupancy[cellIndex(row, column)] = (byte) value;
            }
        }
    }

    private static long computeCanonicalKey(Piece[] pieces, byte[] occupancy) {
        long key = 0L;
        for (int cell = 0; cell < CELL_COUNT; cell++) {
            int occupant = occupancy[cell];
            int code = occupant == NO_PIECE ? PieceKind.EMPTY_CODE : pieces[occupant].kind().code();
            key |= ((long) code) << (BITS_PER_CELL * cell);
        }
        return key;
    }
}
