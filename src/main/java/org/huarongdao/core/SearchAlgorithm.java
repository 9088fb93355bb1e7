package org.huarongdao.core;

/**
 * Search strategy selector used by solver execution.
 */
public enum SearchAlgorithm {
    /**
     * Depth-first search returning the first solution found.
     */
    DFS,
    /**
     * Iterative-deepening depth-first search returning a shortest solution.
     */
    DFS_SHORTEST,
    A_STAR;

    /**
     * @return whether the algorithm is uninformed and rejects heuristic guidance.
     */
    public boolean isDepthFirst() {
        return this == DFS || this == DFS_SHORTEST;
    }
}
