package org.huarongdao.search;

import lombok.experimental.UtilityClass;
import org.huarongdao.board.Board;
import org.huarongdao.board.Move;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Turns parent links in a {@link SearchNodeArena} into a start-to-goal solution.
 */
@UtilityClass
public final class PathReconstructor {

    /**
     * Walks parent ids from {@code goalNodeId} back to the root and reverses the walk.
     *
     * @param arena search tree of the finished search.
     * @param goalNodeId node holding the goal board.
     * @return boards and moves in start-to-goal order.
     */
    public static SolutionPath reconstruct(SearchNodeArena arena, int goalNodeId) {
        Objects.requireNonNull(arena, "arena");
        List<Board> boards = new ArrayList<>(arena.gCost(goalNodeId) + 1);
        List<Move> moves = new ArrayList<>(arena.gCost(goalNodeId));

        int cursor = goalNodeId;
        while (cursor != SearchNodeArena.NO_PARENT) {
            boards.add(arena.board(cursor));
            Move move = arena.move(cursor);
            if (move != null) {
                moves.add(move);
            }
            cursor = arena.parent(cursor);
        }

        Collections.reverse(boards);
        Collections.reverse(moves);
        return new SolutionPath(boards, moves);
    }
}
