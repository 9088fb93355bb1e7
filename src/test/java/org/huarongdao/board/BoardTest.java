package org.huarongdao.board;

import org.huarongdao.testutil.PuzzleFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Board Model Tests")
class BoardTest {

    private static List<Piece> classicPieces() {
        return new ArrayList<>(List.of(
                Piece.vertical(0, 0),
                Piece.block(0, 1),
                Piece.vertical(0, 3),
                Piece.vertical(2, 0),
                Piece.horizontal(2, 1),
                Piece.vertical(2, 3),
                Piece.single(3, 1),
                Piece.single(3, 2),
                Piece.single(4, 0),
                Piece.single(4, 3)
        ));
    }

    @Nested
    @DisplayName("1. Construction Contracts")
    class ConstructionTests {

        @Test
        @DisplayName("Valid layout keeps piece order as ids and derives empty cells")
        void testValidLayout() {
            Board board = Board.of(classicPieces());

            assertEquals(Board.PIECE_COUNT, board.pieceCount());
            assertEquals(Piece.block(0, 1), board.blockPiece());
            assertEquals(1, board.blockPieceId());
            assertEquals(4, board.pieceIdAt(2, 1));
            assertEquals(4, board.pieceIdAt(2, 2));
            assertEquals(PieceKind.HORIZONTAL, board.kindAt(2, 2));
            assertArrayEquals(new int[]{Board.cellIndex(4, 1), Board.cellIndex(4, 2)}, board.emptyCells());
            assertTrue(board.isEmpty(4, 1));
            assertNull(board.kindAt(4, 2));
            assertEquals(PuzzleFixtures.classic(), board);
        }

        @Test
        @DisplayName("Validation: null list is rejected")
        void testNullPieces() {
            InvalidBoardException ex = assertThrows(InvalidBoardException.class, () -> Board.of((List<Piece>) null));
            assertEquals(InvalidBoardException.REASON_BOARD_REQUIRED, ex.reasonCode());
            assertTrue(ex.getMessage().startsWith("[" + InvalidBoardException.REASON_BOARD_REQUIRED + "]"));
        }

        @Test
        @DisplayName("Validation: null piece is rejected")
        void testNullPiece() {
            List<Piece> pieces = classicPieces();
            pieces.set(3, null);
            InvalidBoardException ex = assertThrows(InvalidBoardException.class, () -> Board.of(pieces));
            assertEquals(InvalidBoardException.REASON_PIECE_REQUIRED, ex.reasonCode());
        }

        @Test
        @DisplayName("Validation: piece count must be exactly ten")
        void testPieceCount() {
            List<Piece> pieces = classicPieces();
            pieces.remove(9);
            InvalidBoardException ex = assertThrows(InvalidBoardException.class, () -> Board.of(pieces));
            assertEquals(InvalidBoardException.REASON_PIECE_COUNT, ex.reasonCode());
        }

        @Test
        @DisplayName("Validation: piece multiset is fixed")
        void testMultiset() {
            List<Piece> pieces = classicPieces();
            // Two 1x1 pieces swapped for a sixth 1x2 piece and a fifth 1x1 piece keeps the count at ten.
            pieces.set(6, Piece.horizontal(3, 1));
            pieces.set(7, Piece.single(4, 1));
            InvalidBoardException ex = assertThrows(InvalidBoardException.class, () -> Board.of(pieces));
            assertEquals(InvalidBoardException.REASON_PIECE_MULTISET, ex.reasonCode());
        }

        @Test
        @DisplayName("Validation: footprint must stay inside the grid")
        void testOutOfBounds() {
            List<Piece> pieces = classicPieces();
            pieces.set(9, Piece.single(5, 3));
            InvalidBoardException ex = assertThrows(InvalidBoardException.class, () -> Board.of(pieces));
            assertEquals(InvalidBoardException.REASON_PIECE_OUT_OF_BOUNDS, ex.reasonCode());

            List<Piece> wide = classicPieces();
            wide.set(4, Piece.horizontal(2, 3));
            InvalidBoardException wideEx = assertThrows(InvalidBoardException.class, () -> Board.of(wide));
            assertEquals(InvalidBoardException.REASON_PIECE_OUT_OF_BOUNDS, wideEx.reasonCode());
        }

        @Test
        @DisplayName("Validation: footprints must not overlap")
        void testOverlap() {
            List<Piece> pieces = classicPieces();
            pieces.set(9, Piece.single(3, 2));
            InvalidBoardException ex = assertThrows(InvalidBoardException.class, () -> Board.of(pieces));
            assertEquals(InvalidBoardException.REASON_PIECE_OVERLAP, ex.reasonCode());
        }

        @Test
        @DisplayName("Validator accepts assembled boards and rejects null")
        void testValidator() {
            assertDoesNotThrow(() -> BoardValidator.validate(PuzzleFixtures.classic()));
            InvalidBoardException ex = assertThrows(InvalidBoardException.class, () -> BoardValidator.validate(null));
            assertEquals(InvalidBoardException.REASON_BOARD_REQUIRED, ex.reasonCode());
        }

        @Test
        @DisplayName("Occupancy grid always matches the piece table after slides")
        void testOccupancyFollowsPieces() {
            Board board = PuzzleFixtures.classic()
                    .applyMove(6, Direction.DOWN)
                    .applyMove(7, Direction.DOWN)
                    .applyMove(4, Direction.DOWN);

            int occupied = 0;
            for (int row = 0; row < Board.ROWS; row++) {
                for (int column = 0; column < Board.COLUMNS; column++) {
                    int pieceId = board.pieceIdAt(row, column);
                    if (pieceId == Board.NO_PIECE) {
                        continue;
                    }
                    Piece piece = board.pieces().get(pieceId);
                    assertTrue(row >= piece.row() && row <= piece.lastRow());
                    assertTrue(column >= piece.column() && column <= piece.lastColumn());
                    occupied++;
                }
            }
            assertEquals(Board.ROWS * Board.COLUMNS - 2, occupied);
        }
    }

    @Nested
    @DisplayName("2. Goal and Canonical Form")
    class CanonicalTests {

        @Test
        @DisplayName("Goal: 2x2 anchor on the bottom-center exit")
        void testGoal() {
            assertTrue(PuzzleFixtures.solved().isGoal());
            assertFalse(PuzzleFixtures.oneMove().isGoal());
            assertFalse(PuzzleFixtures.classic().isGoal());
        }

        @Test
        @DisplayName("Key ignores piece-id numbering")
        void testKeyIgnoresIds() {
            List<Piece> shuffled = classicPieces();
            Collections.reverse(shuffled);
            Board original = Board.of(classicPieces());
            Board relabeled = Board.of(shuffled);

            assertNotEquals(original.pieceIdAt(0, 0), relabeled.pieceIdAt(0, 0));
            assertEquals(original.canonicalKey(), relabeled.canonicalKey());
            assertEquals(original, relabeled);
            assertEquals(original.hashCode(), relabeled.hashCode());
            assertEquals(0, original.compareTo(relabeled));
        }

        @Test
        @DisplayName("Key distinguishes orientation on the same cells")
        void testKeySeesOrientation() {
            // Rows 2-3, columns 1-2 hold two 1x2 pieces: stacked horizontals versus side-by-side verticals.
            Board horizontals = BoardText.parse("2113\n2113\n4557\n4667\n7007");
            Board verticals = BoardText.parse("2113\n2113\n4567\n4567\n7007");

            assertEquals(PieceKind.HORIZONTAL, horizontals.kindAt(2, 1));
            assertEquals(PieceKind.VERTICAL, verticals.kindAt(2, 1));
            assertNotEquals(horizontals.canonicalKey(), verticals.canonicalKey());
            assertNotEquals(horizontals, verticals);
            assertNotEquals(0, horizontals.compareTo(verticals));
        }

        @Test
        @DisplayName("Same layout reached by different slide orders is the same state")
        void testTranspositionEquality() {
            Board classic = PuzzleFixtures.classic();
            Board leftFirst = classic.applyMove(6, Direction.DOWN).applyMove(7, Direction.DOWN);
            Board rightFirst = classic.applyMove(7, Direction.DOWN).applyMove(6, Direction.DOWN);

            assertEquals(leftFirst, rightFirst);
            assertEquals(leftFirst.canonicalKey(), rightFirst.canonicalKey());
            assertTrue(leftFirst.isEmpty(3, 1));
            assertTrue(leftFirst.isEmpty(3, 2));
        }
    }

    @Nested
    @DisplayName("3. Applying Moves")
    class ApplyMoveTests {

        @Test
        @DisplayName("Slide produces a new board and leaves the parent untouched")
        void testImmutability() {
            Board classic = PuzzleFixtures.classic();
            long keyBefore = classic.canonicalKey();

            Board next = classic.applyMove(6, Direction.DOWN);

            assertEquals(keyBefore, classic.canonicalKey());
            assertEquals(Piece.single(3, 1), classic.piece(6));
            assertEquals(Piece.single(4, 1), next.piece(6));
            assertTrue(classic.isEmpty(4, 1));
            assertTrue(next.isEmpty(3, 1));
            assertEquals(6, next.pieceIdAt(4, 1));
            assertNotEquals(classic, next);
        }

        @Test
        @DisplayName("Slide followed by its inverse restores the board")
        void testReversibility() {
            Board classic = PuzzleFixtures.classic();
            Move move = new Move(8, Direction.RIGHT);
            Board back = classic.applyMove(move).applyMove(move.inverse());
            assertEquals(classic, back);
            assertEquals(classic.piece(8), back.piece(8));
        }

        @Test
        @DisplayName("2x2 piece needs both empty cells to slide")
        void testBlockNeedsTwoCells() {
            Board oneMove = PuzzleFixtures.oneMove();
            int blockId = oneMove.blockPieceId();
            assertTrue(oneMove.canMove(blockId, Direction.DOWN));
            Board solved = oneMove.applyMove(blockId, Direction.DOWN);
            assertTrue(solved.isGoal());

            Board halfOpen = oneMove.applyMove(9, Direction.LEFT);
            assertFalse(halfOpen.canMove(blockId, Direction.DOWN));
        }

        @Test
        @DisplayName("Illegal: sliding off the grid")
        void testOffGrid() {
            Board classic = PuzzleFixtures.classic();
            IllegalMoveException ex = assertThrows(IllegalMoveException.class,
                    () -> classic.applyMove(0, Direction.LEFT));
            assertEquals(IllegalMoveException.REASON_OUT_OF_BOUNDS, ex.reasonCode());
            assertFalse(classic.canMove(0, Direction.UP));
        }

        @Test
        @DisplayName("Illegal: sliding into another piece")
        void testOccupied() {
            Board classic = PuzzleFixtures.classic();
            IllegalMoveException ex = assertThrows(IllegalMoveException.class,
                    () -> classic.applyMove(1, Direction.DOWN));
            assertEquals(IllegalMoveException.REASON_CELL_OCCUPIED, ex.reasonCode());
        }

        @Test
        @DisplayName("Illegal: unknown piece or missing direction")
        void testUnknownPiece() {
            Board classic = PuzzleFixtures.classic();
            assertEquals(IllegalMoveException.REASON_UNKNOWN_PIECE,
                    assertThrows(IllegalMoveException.class, () -> classic.applyMove(10, Direction.UP)).reasonCode());
            assertEquals(IllegalMoveException.REASON_UNKNOWN_PIECE,
                    assertThrows(IllegalMoveException.class, () -> classic.applyMove(-1, Direction.UP)).reasonCode());
            assertEquals(IllegalMoveException.REASON_DIRECTION_REQUIRED,
                    assertThrows(IllegalMoveException.class, () -> classic.applyMove(6, null)).reasonCode());
        }

        @Test
        @DisplayName("Accessors reject cells and ids outside the grid")
        void testAccessorBounds() {
            Board classic = PuzzleFixtures.classic();
            assertThrows(IllegalArgumentException.class, () -> classic.pieceIdAt(5, 0));
            assertThrows(IllegalArgumentException.class, () -> classic.pieceIdAt(0, -1));
            assertThrows(IllegalArgumentException.class, () -> classic.piece(10));
        }
    }
}
