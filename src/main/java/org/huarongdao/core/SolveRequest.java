package org.huarongdao.core;

import lombok.Builder;
import lombok.Value;
import org.huarongdao.board.Board;
import org.huarongdao.heuristic.HeuristicType;

/**
 * Client-facing solve request.
 */
@Value
@Builder
public class SolveRequest {
    /** Board to solve. */
    Board initialBoard;
    /** Search algorithm to execute. */
    SearchAlgorithm algorithm;
    /**
     * Heuristic mode; {@code null} selects the algorithm default
     * ({@code NONE} for DFS, {@code MANHATTAN} for A*).
     */
    HeuristicType heuristicType;
}
