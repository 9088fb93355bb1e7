package org.huarongdao.core;

import org.huarongdao.search.SolutionPath;

/**
 * Internal search output.
 *
 * @param solved whether a goal board was reached.
 * @param path start-to-goal solution ({@code null} when unsolved).
 * @param expandedNodes count of boards whose successors were generated.
 * @param generatedNodes count of successor nodes created.
 * @param peakFrontierSize largest frontier size observed.
 */
record InternalSearchPlan(
        boolean solved,
        SolutionPath path,
        int expandedNodes,
        int generatedNodes,
        int peakFrontierSize
) {
    static InternalSearchPlan solvedWith(SolutionPath path, int expandedNodes, int generatedNodes, int peakFrontierSize) {
        return new InternalSearchPlan(true, path, expandedNodes, generatedNodes, peakFrontierSize);
    }

    /**
     * Creates a canonical exhausted-frontier result.
     */
    static InternalSearchPlan unsolved(int expandedNodes, int generatedNodes, int peakFrontierSize) {
        return new InternalSearchPlan(false, null, expandedNodes, generatedNodes, peakFrontierSize);
    }
}
