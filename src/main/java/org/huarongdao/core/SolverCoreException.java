package org.huarongdao.core;

import org.huarongdao.PuzzleException;

/**
 * Solver request contract failure with deterministic reason codes.
 */
public final class SolverCoreException extends PuzzleException {

    public SolverCoreException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public SolverCoreException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
