package org.huarongdao.heuristic;

import org.huarongdao.PuzzleException;

/**
 * Thrown when a heuristic provider cannot be created for the requested mode.
 */
public final class HeuristicConfigurationException extends PuzzleException {

    public HeuristicConfigurationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
