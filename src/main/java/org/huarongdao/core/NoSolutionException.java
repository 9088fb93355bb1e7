package org.huarongdao.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.huarongdao.PuzzleException;

/**
 * Thrown when a search exhausts its frontier without reaching a goal board.
 */
@Getter
@Accessors(fluent = true)
public final class NoSolutionException extends PuzzleException {
    public static final String REASON_NO_SOLUTION = "HRD_NO_SOLUTION";

    private final SearchAlgorithm algorithm;

    /** Number of expansions performed before the search ran dry. */
    private final int expandedNodes;

    public NoSolutionException(SearchAlgorithm algorithm, int expandedNodes) {
        super(
                REASON_NO_SOLUTION,
                algorithm + " search reached no goal board after " + expandedNodes + " expansions"
        );
        this.algorithm = algorithm;
        this.expandedNodes = expandedNodes;
    }
}
