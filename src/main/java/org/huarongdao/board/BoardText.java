package org.huarongdao.board;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Digit-grid text codec for boards.
 *
 * <p>A board is five lines of four symbols:</p>
 * <ul>
 * <li>{@code 1}: the 2x2 piece;</li>
 * <li>{@code 2}..{@code 6}: the five 1x2 pieces, one digit per piece, orientation taken from
 * whether the twin cell lies to the right or below;</li>
 * <li>{@code 7}: a 1x1 piece;</li>
 * <li>{@code 0}: an empty cell.</li>
 * </ul>
 *
 * <p>Parsed pieces get ids in row-major order of their anchor cells. Formatting hands out the
 * 1x2 digits in piece-id order, so a piece keeps its digit along a solution path.</p>
 */
@UtilityClass
public final class BoardText {
    public static final char BLOCK_SYMBOL = '1';
    public static final char FIRST_DOMINO_SYMBOL = '2';
    public static final char LAST_DOMINO_SYMBOL = '6';
    public static final char SINGLE_SYMBOL = '7';
    public static final char EMPTY_SYMBOL = '0';

    /**
     * Parses one board from text; blank lines and surrounding whitespace are ignored.
     *
     * @param text five non-blank lines of four symbols.
     * @return validated board.
     * @throws InvalidBoardException when the text is malformed or the layout is illegal.
     */
    public static Board parse(String text) {
        if (text == null) {
            throw new InvalidBoardException(InvalidBoardException.REASON_TEXT_REQUIRED, "board text must be provided");
        }
        return parse(text.lines().toList());
    }

    /**
     * Parses one board from lines; blank lines and surrounding whitespace are ignored.
     *
     * @see #parse(String)
     */
    public static Board parse(List<String> lines) {
        if (lines == null) {
            throw new InvalidBoardException(InvalidBoardException.REASON_TEXT_REQUIRED, "board lines must be provided");
        }
        char[][] grid = toGrid(lines);
        boolean[][] claimed = new boolean[Board.ROWS][Board.COLUMNS];
        boolean[] dominoSymbolUsed = new boolean[LAST_DOMINO_SYMBOL - FIRST_DOMINO_SYMBOL + 1];
        List<Piece> pieces = new ArrayList<>(Board.PIECE_COUNT);

        for (int row = 0; row < Board.ROWS; row++) {
            for (int column = 0; column < Board.COLUMNS; column++) {
                char symbol = grid[row][column];
                if (symbol == EMPTY_SYMBOL || claimed[row][column]) {
                    continue;
                }
                Piece piece;
                if (symbol == BLOCK_SYMBOL) {
                    piece = Piece.block(row, column);
                } else if (symbol == SINGLE_SYMBOL) {
                    piece = Piece.single(row, column);
                } else {
                    int slot = symbol - FIRST_DOMINO_SYMBOL;
                    if (dominoSymbolUsed[slot]) {
                        throw new InvalidBoardException(
                                InvalidBoardException.REASON_TEXT_PIECE_SHAPE,
                                "symbol '" + symbol + "' marks more than one 1x2 piece"
                        );
                    }
                    dominoSymbolUsed[slot] = true;
                    piece = sameSymbol(grid, row, column + 1, symbol)
                            ? Piece.horizontal(row, column)
                            : Piece.vertical(row, column);
                }
                claim(grid, claimed, piece, symbol);
                pieces.add(piece);
            }
        }
        return Board.of(pieces);
    }

    /**
     * Renders a board as five newline-separated lines without a trailing newline.
     */
    public static String format(Board board) {
        Objects.requireNonNull(board, "board");
        char[] symbols = new char[board.pieceCount()];
        char nextDomino = FIRST_DOMINO_SYMBOL;
        for (int id = 0; id < board.pieceCount(); id++) {
            PieceKind kind = board.piece(id).kind();
            symbols[id] = switch (kind) {
                case BLOCK -> BLOCK_SYMBOL;
                case SINGLE -> SINGLE_SYMBOL;
                case HORIZONTAL, VERTICAL -> nextDomino++;
            };
        }

        StringBuilder out = new StringBuilder(Board.ROWS * (Board.COLUMNS + 1));
        for (int row = 0; row < Board.ROWS; row++) {
            if (row > 0) {
                out.append('\n');
            }
            for (int column = 0; column < Board.COLUMNS; column++) {
                int pieceId = board.pieceIdAt(row, column);
                out.append(pieceId == Board.NO_PIECE ? EMPTY_SYMBOL : symbols[pieceId]);
            }
        }
        return out.toString();
    }

    /**
     * Renders a sequence of boards separated by one blank line.
     */
    public static String formatSequence(List<Board> boards) {
        Objects.requireNonNull(boards, "boards");
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < boards.size(); i++) {
            if (i > 0) {
                out.append("\n\n");
            }
            out.append(format(boards.get(i)));
        }
        return out.toString();
    }

    private static char[][] toGrid(List<String> lines) {
        List<String> rows = new ArrayList<>(Board.ROWS);
        for (String line : lines) {
            if (line != null && !line.isBlank()) {
                rows.add(line.strip());
            }
        }
        if (rows.size() != Board.ROWS) {
            throw new InvalidBoardException(
                    InvalidBoardException.REASON_TEXT_SHAPE,
                    "board text must have " + Board.ROWS + " rows, got " + rows.size()
            );
        }

        char[][] grid = new char[Board.ROWS][];
        for (int row = 0; row < Board.ROWS; row++) {
            String line = rows.get(row);
            if (line.length() != Board.COLUMNS) {
                throw new InvalidBoardException(
                        InvalidBoardException.REASON_TEXT_SHAPE,
                        "row " + row + " must have " + Board.COLUMNS + " symbols, got \"" + line + "\""
                );
            }
            grid[row] = line.toCharArray();
            for (int column = 0; column < Board.COLUMNS; column++) {
                char symbol = grid[row][column];
                if (symbol < EMPTY_SYMBOL || symbol > SINGLE_SYMBOL) {
                    throw new InvalidBoardException(
                            InvalidBoardException.REASON_TEXT_UNKNOWN_SYMBOL,
                            "unknown symbol '" + symbol + "' at (" + row + ", " + column + ")"
                    );
                }
            }
        }
        return grid;
    }

    private static boolean sameSymbol(char[][] grid, int row, int column, char symbol) {
        return Board.isInside(row, column) && grid[row][column] == symbol;
    }

    /**
     * Marks the footprint of a parsed piece, requiring every cell to carry the piece's symbol.
     */
    private static void claim(char[][] grid, boolean[][] claimed, Piece piece, char symbol) {
        for (int row = piece.row(); row <= piece.lastRow(); row++) {
            for (int column = piece.column(); column <= piece.lastColumn(); column++) {
                if (!sameSymbol(grid, row, column, symbol) || claimed[row][column]) {
                    throw new InvalidBoardException(
                            InvalidBoardException.REASON_TEXT_PIECE_SHAPE,
                            "symbol '" + symbol + "' at (" + piece.row() + ", " + piece.column()
                                    + ") does not form a " + piece.kind().height() + "x" + piece.kind().width() + " piece"
                    );
                }
                claimed[row][column] = true;
            }
        }
    }
}
