package org.huarongdao.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.huarongdao.PuzzleException;

/**
 * Thrown when a search crosses a configured work bound before finishing.
 *
 * <p>The reason code names the bound that was crossed.</p>
 */
@Getter
@Accessors(fluent = true)
public final class SearchAbortedException extends PuzzleException {
    /** Number of boards expanded when the search was stopped. */
    private final int expandedNodes;

    public SearchAbortedException(String reasonCode, String message, int expandedNodes, Throwable cause) {
        super(reasonCode, message, cause);
        this.expandedNodes = expandedNodes;
    }
}
