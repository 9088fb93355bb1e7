package org.huarongdao.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.huarongdao.board.Board;
import org.huarongdao.board.Move;
import org.huarongdao.heuristic.HeuristicType;

import java.util.List;

/**
 * Client-facing solve response.
 *
 * <p>Only produced for solved searches; failures are reported through exceptions.</p>
 */
@Value
@Builder
public class SolveResponse {
    /** Search algorithm that produced this response. */
    SearchAlgorithm algorithm;
    /** Heuristic type the search ran with. */
    HeuristicType heuristicType;
    /** Number of boards whose successors were generated. */
    int expandedNodes;
    /** Number of successor nodes created. */
    int generatedNodes;
    /** Largest frontier size observed. */
    int peakFrontierSize;
    /** Boards from the initial board to the goal board, both inclusive. */
    @Singular("pathBoard")
    List<Board> path;
    /** Slides between consecutive boards of {@link #path}. */
    @Singular
    List<Move> moves;

    /**
     * @return number of slides in the solution.
     */
    public int moveCount() {
        return moves.size();
    }
}
