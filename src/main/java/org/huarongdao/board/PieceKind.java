package org.huarongdao.board;

/**
 * The four piece shapes of the puzzle.
 *
 * <p>{@code code} is the 3-bit value packed per cell into {@link Board#canonicalKey()};
 * {@link #EMPTY_CODE} is reserved for empty cells.</p>
 */
public enum PieceKind {
    /** The 2x2 piece that has to reach the exit. */
    BLOCK(2, 2, 4),
    /** 1x2 piece lying on its side (one row, two columns). */
    HORIZONTAL(1, 2, 2),
    /** 1x2 piece standing up (two rows, one column). */
    VERTICAL(2, 1, 3),
    /** 1x1 piece. */
    SINGLE(1, 1, 1);

    public static final int EMPTY_CODE = 0;

    private final int height;
    private final int width;
    private final int code;

    PieceKind(int height, int width, int code) {
        this.height = height;
        this.width = width;
        this.code = code;
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public int code() {
        return code;
    }
}
