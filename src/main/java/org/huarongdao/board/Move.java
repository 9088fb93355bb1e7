package org.huarongdao.board;

import java.util.Objects;

/**
 * One slide of one piece by one cell.
 *
 * @param pieceId id of the moved piece on the board the move applies to.
 * @param direction slide direction.
 */
public record Move(int pieceId, Direction direction) {

    public Move {
        Objects.requireNonNull(direction, "direction");
    }

    /**
     * Returns the move that slides the same piece back.
     */
    public Move inverse() {
        return new Move(pieceId, direction.opposite());
    }

    @Override
    public String toString() {
        return pieceId + ":" + direction;
    }
}
