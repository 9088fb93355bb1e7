package org.huarongdao.moves;

import org.huarongdao.board.Board;
import org.huarongdao.board.Move;

/**
 * One legal slide together with the board it produces.
 *
 * @param move slide applied to the parent board.
 * @param board resulting board.
 */
public record Successor(Move move, Board board) {
}
