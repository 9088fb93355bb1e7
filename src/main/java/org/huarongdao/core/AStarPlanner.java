package org.huarongdao.core;

import org.huarongdao.board.Board;
import org.huarongdao.heuristic.HeuristicProvider;
import org.huarongdao.moves.MoveGenerator;
import org.huarongdao.moves.Successor;
import org.huarongdao.search.PathReconstructor;
import org.huarongdao.search.SearchNodeArena;
import org.huarongdao.search.VisitedSet;

import java.util.Iterator;
import java.util.PriorityQueue;

/**
 * Best-first planner ordered by {@code f = g + h}.
 *
 * <p>Decrease-key is replaced by lazy invalidation: a cheaper path to a known board pushes a
 * new frontier entry, and entries whose board is already closed at an equal or lower g are
 * skipped when popped. Two key sets drive this:</p>
 * <ul>
 * <li>{@code closed}: boards expanded so far with the g they were expanded at;</li>
 * <li>{@code discovered}: best g pushed so far, to suppress pushes that cannot improve.</li>
 * </ul>
 *
 * <p>With a consistent heuristic the first goal popped is a shortest solution. With the null
 * heuristic the planner is a uniform-cost search.</p>
 */
final class AStarPlanner implements SearchPlanner {

    @Override
    public InternalSearchPlan compute(
            Board initialBoard,
            MoveGenerator moveGenerator,
            HeuristicProvider heuristic,
            SearchBudget budget
    ) {
        SearchNodeArena arena = new SearchNodeArena();
        VisitedSet closed = new VisitedSet();
        VisitedSet discovered = new VisitedSet();
        PriorityQueue<FrontierEntry> frontier = new PriorityQueue<>();

        int rootId = arena.addRoot(initialBoard);
        discovered.markVisited(initialBoard.canonicalKey(), 0);
        frontier.add(new FrontierEntry(rootId, 0, estimate(heuristic, initialBoard)));

        int expandedNodes = 0;
        int peakFrontierSize = frontier.size();

        while (!frontier.isEmpty()) {
            FrontierEntry entry = frontier.poll();
            int nodeId = entry.nodeId();
            int gCost = entry.gCost();
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
            if (closed.isVisitedAtOrBelow(key, gCost)) {
                continue;
            }
            closed.markVisited(key, gCost);
            expandedNodes++;
            budget.checkExpandedNodes(expandedNodes);

            int nextG = gCost + 1;
            Iterator<Successor> successors = moveGenerator.successors(board);
            while (successors.hasNext()) {
                Successor successor = successors.next();
                Board next = successor.board();
                long nextKey = next.canonicalKey();
                if (closed.isVisitedAtOrBelow(nextKey, nextG) || !discovered.markVisited(nextKey, nextG)) {
                    continue;
                }
                int childId = arena.addChild(next, successor.move(), nodeId);
                frontier.add(new FrontierEntry(childId, nextG, nextG + estimate(heuristic, next)));
            }

            peakFrontierSize = Math.max(peakFrontierSize, frontier.size());
            budget.checkFrontierSize(frontier.size(), expandedNodes);
        }
        return InternalSearchPlan.unsolved(expandedNodes, arena.size() - 1, peakFrontierSize);
    }

    /**
     * Heuristic estimate clamped at zero so frontier ordering stays well-defined.
     */
    private static int estimate(HeuristicProvider heuristic, Board board) {
        return Math.max(0, heuristic.estimate(board));
    }

    /**
     * Frontier entry; {@code nodeId} doubles as insertion order since arena ids grow.
     */
    private record FrontierEntry(int nodeId, int gCost, int fCost) implements Comparable<FrontierEntry> {
        /**
         * Orders by f ascending, then deeper g first, then node id for stability.
         */
        @Override
        public int compareTo(FrontierEntry other) {
            int byF = Integer.compare(this.fCost, other.fCost);
            if (byF != 0) {
                return byF;
            }
            int byG = Integer.compare(other.gCost, this.gCost);
            if (byG != 0) {
                return byG;
            }
            return Integer.compare(this.nodeId, other.nodeId);
        }
    }
}
