package org.huarongdao.core;

import lombok.Builder;
import org.huarongdao.board.Board;
import org.huarongdao.board.BoardValidator;
import org.huarongdao.heuristic.HeuristicFactory;
import org.huarongdao.heuristic.HeuristicProvider;
import org.huarongdao.heuristic.HeuristicType;
import org.huarongdao.moves.MoveGenerator;
import org.huarongdao.search.SolutionPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main solver entry point.
 *
 * <p>Validates requests before any search starts. Execution flow:</p>
 * <ul>
 * <li>Validate the request and the presence of the initial board.</li>
 * <li>Resolve algorithm/heuristic compatibility and defaults.</li>
 * <li>Delegate to the depth-first, iterative-deepening or A* planner.</li>
 * <li>Wrap planner budget failures into {@link SearchAbortedException}.</li>
 * <li>Map the internal plan to a {@link SolveResponse}, or throw {@link NoSolutionException}.</li>
 * </ul>
 *
 * <p>Instances are immutable; every call owns its own search state, so one core can serve
 * concurrent callers.</p>
 */
public final class SolverCore implements SolverService {
    public static final String REASON_REQUEST_REQUIRED = "HRD_REQUEST_REQUIRED";
    public static final String REASON_ALGORITHM_REQUIRED = "HRD_ALGORITHM_REQUIRED";
    public static final String REASON_DFS_HEURISTIC_MISMATCH = "HRD_DFS_HEURISTIC_MISMATCH";

    private static final Logger LOGGER = LoggerFactory.getLogger(SolverCore.class);

    private final MoveGenerator moveGenerator;
    private final SearchBudget searchBudget;
    private final SearchPlanner dfsPlanner;
    private final SearchPlanner shortestDfsPlanner;
    private final SearchPlanner aStarPlanner;

    /**
     * Creates the solver facade; every argument is optional.
     *
     * @param moveGenerator successor source (default: {@link MoveGenerator}).
     * @param searchBudget work bounds (default: {@link SearchBudget#defaults()}).
     */
    @Builder
    public SolverCore(MoveGenerator moveGenerator, SearchBudget searchBudget) {
        this(moveGenerator, searchBudget, null, null, null);
    }

    SolverCore(
            MoveGenerator moveGenerator,
            SearchBudget searchBudget,
            SearchPlanner dfsPlanner,
            SearchPlanner shortestDfsPlanner,
            SearchPlanner aStarPlanner
    ) {
        this.moveGenerator = moveGenerator == null ? new MoveGenerator() : moveGenerator;
        this.searchBudget = searchBudget == null ? SearchBudget.defaults() : searchBudget;
        this.dfsPlanner = dfsPlanner == null ? new DepthFirstPlanner() : dfsPlanner;
        this.shortestDfsPlanner = shortestDfsPlanner == null ? new IterativeDeepeningPlanner() : shortestDfsPlanner;
        this.aStarPlanner = aStarPlanner == null ? new AStarPlanner() : aStarPlanner;
    }

    /**
     * Executes one solve request.
     *
     * @param request algorithm, heuristic and initial board.
     * @return solved response with the start-to-goal path.
     * @throws SolverCoreException when request contracts fail.
     * @throws org.huarongdao.board.InvalidBoardException when the initial board is malformed.
     * @throws NoSolutionException when no goal board is reachable.
     * @throws SearchAbortedException when a search budget bound is crossed.
     */
    @Override
    public SolveResponse solve(SolveRequest request) {
        if (request == null) {
            throw new SolverCoreException(REASON_REQUEST_REQUIRED, "solve request must be provided");
        }
        Board initialBoard = request.getInitialBoard();
        BoardValidator.validate(initialBoard);

        SearchAlgorithm algorithm = request.getAlgorithm();
        if (algorithm == null) {
            throw new SolverCoreException(REASON_ALGORITHM_REQUIRED, "algorithm must be provided (DFS, DFS_SHORTEST, A_STAR)");
        }
        HeuristicType heuristicType = resolveHeuristicType(algorithm, request.getHeuristicType());
        HeuristicProvider heuristic = HeuristicFactory.create(heuristicType);
        SearchPlanner planner = switch (algorithm) {
            case DFS -> dfsPlanner;
            case DFS_SHORTEST -> shortestDfsPlanner;
            case A_STAR -> aStarPlanner;
        };

        LOGGER.debug("Starting {} search ({} heuristic) from\n{}", algorithm, heuristicType, initialBoard);
        InternalSearchPlan plan;
        try {
            plan = planner.compute(initialBoard, moveGenerator, heuristic, searchBudget);
        } catch (SearchBudget.BudgetExceededException ex) {
            LOGGER.warn("{} search aborted after {} expansions: {}", algorithm, ex.expandedNodes(), ex.getMessage());
            throw new SearchAbortedException(ex.reasonCode(), ex.getMessage(), ex.expandedNodes(), ex);
        }

        if (!plan.solved()) {
            LOGGER.warn("{} search found no solution after {} expansions", algorithm, plan.expandedNodes());
            throw new NoSolutionException(algorithm, plan.expandedNodes());
        }

        SolutionPath path = plan.path();
        LOGGER.debug(
                "{} search solved in {} moves ({} expanded, {} generated, peak frontier {})",
                algorithm,
                path.moveCount(),
                plan.expandedNodes(),
                plan.generatedNodes(),
                plan.peakFrontierSize()
        );
        return SolveResponse.builder()
                .algorithm(algorithm)
                .heuristicType(heuristicType)
                .expandedNodes(plan.expandedNodes())
                .generatedNodes(plan.generatedNodes())
                .peakFrontierSize(plan.peakFrontierSize())
                .path(path.boards())
                .moves(path.moves())
                .build();
    }

    /**
     * Applies per-algorithm heuristic defaults and rejects guided depth-first search.
     */
    private static HeuristicType resolveHeuristicType(SearchAlgorithm algorithm, HeuristicType requested) {
        if (algorithm.isDepthFirst()) {
            if (requested != null && requested != HeuristicType.NONE) {
                throw new SolverCoreException(
                        REASON_DFS_HEURISTIC_MISMATCH,
                        algorithm + " does not use a heuristic; requested " + requested
                );
            }
            return HeuristicType.NONE;
        }
        return requested == null ? HeuristicType.MANHATTAN : requested;
    }
}
