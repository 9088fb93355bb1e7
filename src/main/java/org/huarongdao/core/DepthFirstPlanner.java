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
 * Depth-first planner over a LIFO stack of arena node ids.
 *
 * <p>Boards are marked visited when popped. Successors already visited are not pushed, and the
 * rest are pushed in reverse enumeration order so the first legal slide is explored first.
 * The first goal popped is returned; it is generally not a shortest solution.</p>
 */
final class DepthFirstPlanner implements SearchPlanner {

    @Override
    public InternalSearchPlan compute(
            Board initialBoard,
            MoveGenerator moveGenerator,
            HeuristicProvider heuristic,
            SearchBudget budget
    ) {
        SearchNodeArena arena = new SearchNodeArena();
        VisitedSet visited = new VisitedSet();
        IntArrayList stack = new IntArrayList();
        IntArrayList children = new IntArrayList();

        stack.push(arena.addRoot(initialBoard));
        int expandedNodes = 0;
        int peakFrontierSize = stack.size();

        while (!stack.isEmpty()) {
            int nodeId = stack.popInt();
            Board board = arena.board(nodeId);
            if (board.isGoal()) {
                return InternalSearchPlan.solvedWith(
                        PathReconstructor.reconstruct(arena, nodeId),
                        expandedNodes,
                        arena.size() - 1,
                        peakFrontierSize
                );
            }

            long key = board.canonicalKey();
            if (visited.isVisited(key)) {
                continue;
            }
            visited.markVisited(key, arena.gCost(nodeId));
            expandedNodes++;
            budget.checkExpandedNodes(expandedNodes);

            children.clear();
            Iterator<Successor> successors = moveGenerator.successors(board);
            while (successors.hasNext()) {
                Successor successor = successors.next();
                if (visited.isVisited(successor.board().canonicalKey())) {
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
        return InternalSearchPlan.unsolved(expandedNodes, arena.size() - 1, peakFrontierSize);
    }
}
