package org.huarongdao.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.huarongdao.board.Board;
import org.huarongdao.heuristic.HeuristicProvider;
import org.huarongdao.moves.MoveGenerator;
import org.huarongdao.moves.Successor;
import org.huarongdao.search.PathReconstructor;
import org.huarongdao.search.SearchNodeArena;
import org.huarongdao.search.VisitedSet;

import java.util.Iterator;

/**
 * Iterative-deepening depth-first planner returning a shortest solution.
 *
 * <p>Each iteration runs a depth-limited DFS with limits 0, 1, 2, ... over a fresh arena. Within
 * an iteration a board is re-expanded only when reached at a strictly smaller depth than before,
 * so every board within the limit is seen at its true distance. The first goal popped therefore
 * lies exactly at the limit. The search is exhausted when raising the limit adds no new board.</p>
 *
 * <p>Expanded, generated and peak-frontier counts accumulate over all iterations.</p>
 */
final class IterativeDeepeningPlanner implements SearchPlanner {

    @Override
    public InternalSearchPlan compute(
            Board initialBoard,
            MoveGenerator moveGenerator,
            HeuristicProvider heuristic,
            SearchBudget budget
    ) {
        VisitedSet depths = new VisitedSet();
        IntArrayList stack = new IntArrayList();
        IntArrayList children = new IntArrayList();

        int expandedNodes = 0;
        int generatedNodes = 0;
        int peakFrontierSize = 1;
        int previousReached = -1;

        for (int limit = 0; ; limit++) {
            SearchNodeArena arena = new SearchNodeArena();
            depths.clear();
            stack.clear();
            stack.push(arena.addRoot(initialBoard));

            while (!stack.isEmpty()) {
                int nodeId = stack.popInt();
                Board board = arena.board(nodeId);
                int depth = arena.gCost(nodeId);
                if (board.isGoal()) {
                    return InternalSearchPlan.solvedWith(
                            PathReconstructor.reconstruct(arena, nodeId),
                            expandedNodes,
                            generatedNodes + arena.size() - 1,
                            peakFrontierSize
                    );
                }

                if (!depths.markVisited(board.canonicalKey(), depth) || depth == limit) {
                    continue;
                }
                expandedNodes++;
                budget.checkExpandedNodes(expandedNodes);

                children.clear();
                Iterator<Successor> successors = moveGenerator.successors(board);
                while (successors.hasNext()) {
                    Successor successor = successors.next();
                    if (depths.isVisitedAtOrBelow(successor.board().canonicalKey(), depth + 1)) {
                        continue;
                    }
                    children.add(arena.addChild(successor.board(), successor.move(), nodeId));
                }
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.getInt(i));
                }

                peakFrontierSize = Math.max(peakFrontierSize, stack.size());
                budget.checkFrontierSize(stack.size(), expandedNodes);
            }

            generatedNodes += arena.size() - 1;
            if (depths.size() == previousReached) {
                return InternalSearchPlan.unsolved(expandedNodes, generatedNodes, peakFrontierSize);
            }
            previousReached = depths.size();
        }
    }
}
