package org.huarongdao.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.huarongdao.board.Board;
import org.huarongdao.board.Move;

import java.util.Objects;

/**
 * Append-only storage for the search tree of one solve call.
 *
 * <p>Structure-of-arrays layout: node id is the index into every column, and the parent is
 * stored as a node id rather than a reference. Ids are assigned in discovery order, so a
 * parent id is always smaller than its children's ids and parent chains cannot cycle.</p>
 *
 * <p><strong>Thread Safety:</strong> not thread-safe; owned by a single search invocation.</p>
 */
public final class SearchNodeArena {
    /** Parent id of the root node. */
    public static final int NO_PARENT = -1;

    private final ObjectArrayList<Board> boardByNode = new ObjectArrayList<>();
    private final ObjectArrayList<Move> moveByNode = new ObjectArrayList<>();
    private final IntArrayList parentByNode = new IntArrayList();
    private final IntArrayList gCostByNode = new IntArrayList();

    /**
     * Adds the root node for the initial board.
     *
     * @return root node id (always {@code 0} on a fresh arena).
     */
    public int addRoot(Board board) {
        if (!boardByNode.isEmpty()) {
            throw new IllegalStateException("root already added");
        }
        return append(Objects.requireNonNull(board, "board"), null, NO_PARENT, 0);
    }

    /**
     * Appends a child discovered by sliding {@code move} on the parent's board.
     *
     * @param board child board.
     * @param move slide that produced the child.
     * @param parentId id of an existing node.
     * @return child node id; its g-cost is the parent's plus one.
     */
    public int addChild(Board board, Move move, int parentId) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(move, "move");
        requireNode(parentId);
        return append(board, move, parentId, gCostByNode.getInt(parentId) + 1);
    }

    public Board board(int nodeId) {
        requireNode(nodeId);
        return boardByNode.get(nodeId);
    }

    /**
     * @return slide that produced the node, {@code null} for the root.
     */
    public Move move(int nodeId) {
        requireNode(nodeId);
        return moveByNode.get(nodeId);
    }

    /**
     * @return parent node id, {@link #NO_PARENT} for the root.
     */
    public int parent(int nodeId) {
        requireNode(nodeId);
        return parentByNode.getInt(nodeId);
    }

    /**
     * @return number of slides from the root.
     */
    public int gCost(int nodeId) {
        requireNode(nodeId);
        return gCostByNode.getInt(nodeId);
    }

    /**
     * @return number of nodes created so far.
     */
    public int size() {
        return boardByNode.size();
    }

    private int append(Board board, Move move, int parentId, int gCost) {
        int nodeId = boardByNode.size();
        boardByNode.add(board);
        moveByNode.add(move);
        parentByNode.add(parentId);
        gCostByNode.add(gCost);
        return nodeId;
    }

    private void requireNode(int nodeId) {
        if (nodeId < 0 || nodeId >= boardByNode.size()) {
            throw new IllegalArgumentException(
                    "nodeId out of bounds: " + nodeId + " [0, " + boardByNode.size() + ")"
            );
        }
    }
}
