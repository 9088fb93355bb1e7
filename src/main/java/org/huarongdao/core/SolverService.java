package org.huarongdao.core;

import org.huarongdao.board.Board;

/**
 * Public solver contract.
 *
 * <p>Implementations validate the initial board before searching and throw reason-coded
 * runtime exceptions for every failure; no partial solution is ever returned.</p>
 */
public interface SolverService {
    /**
     * Executes one solve request.
     *
     * @param request algorithm, heuristic and initial board.
     * @return solved response.
     */
    SolveResponse solve(SolveRequest request);

    /**
     * Solves with depth-first search.
     */
    default SolveResponse solveDfs(Board initialBoard) {
        return solve(SolveRequest.builder()
                .initialBoard(initialBoard)
                .algorithm(SearchAlgorithm.DFS)
                .build());
    }

    /**
     * Solves with iterative-deepening depth-first search; the path is a shortest solution.
     */
    default SolveResponse solveShortestDfs(Board initialBoard) {
        return solve(SolveRequest.builder()
                .initialBoard(initialBoard)
                .algorithm(SearchAlgorithm.DFS_SHORTEST)
                .build());
    }

    /**
     * Solves with A* and the Manhattan heuristic; the path is a shortest solution.
     */
    default SolveResponse solveAStar(Board initialBoard) {
        return solve(SolveRequest.builder()
                .initialBoard(initialBoard)
                .algorithm(SearchAlgorithm.A_STAR)
                .build());
    }
}
