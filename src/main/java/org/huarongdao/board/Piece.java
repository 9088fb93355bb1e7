package org.huarongdao.board;

import java.util.Objects;

/**
 * Placement of one piece: its kind and its anchor (top-left occupied) cell.
 *
 * <p>Coordinates are not range-checked here; {@link BoardValidator} checks footprints
 * against the grid when a board is assembled.</p>
 *
 * @param kind piece shape.
 * @param row anchor row, 0 at the top.
 * @param column anchor column, 0 at the left.
 */
public record Piece(PieceKind kind, int row, int column) {

    public Piece {
        Objects.requireNonNull(kind, "kind");
    }

    public static Piece block(int row, int column) {
        return new Piece(PieceKind.BLOCK, row, column);
    }

    public static Piece horizontal(int row, int column) {
        return new Piece(PieceKind.HORIZONTAL, row, column);
    }

    public static Piece vertical(int row, int column) {
        return new Piece(PieceKind.VERTICAL, row, column);
    }

    public static Piece single(int row, int column) {
        return new Piece(PieceKind.SINGLE, row, column);
    }

    /**
     * @return bottom-most occupied row.
     */
    public int lastRow() {
        return row + kind.height() - 1;
    }

    /**
     * @return right-most occupied column.
     */
    public int lastColumn() {
        return column + kind.width() - 1;
    }

    /**
     * Returns this piece shifted one cell in {@code direction}, without any bounds check.
     */
    public Piece shifted(Direction direction) {
        return new Piece(kind, row + direction.dRow, column + direction.dCol);
    }
}
