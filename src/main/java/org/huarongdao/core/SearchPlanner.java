package org.huarongdao.core;

import org.huarongdao.board.Board;
import org.huarongdao.heuristic.HeuristicProvider;
import org.huarongdao.moves.MoveGenerator;

/**
 * Internal planner abstraction for solver orchestration.
 */
interface SearchPlanner {
    /**
     * Searches from one validated initial board.
     *
     * @param initialBoard board to solve.
     * @param moveGenerator successor source.
     * @param heuristic remaining-cost estimator (ignored by uninformed planners).
     * @param budget work bounds for this search.
     * @return solved plan with its path, or an unsolved plan once the frontier is exhausted.
     * @throws SearchBudget.BudgetExceededException when a bound is crossed.
     */
    InternalSearchPlan compute(
            Board initialBoard,
            MoveGenerator moveGenerator,
            HeuristicProvider heuristic,
            SearchBudget budget
    );
}
