package com.dfsoptimizer.domain.enums;

/**
 * Lifecycle of one optimizer batch run.
 * INITIALIZING -> SOLVING -> EMITTED -> SOLVING ... -> COMPLETE, or FAILED / CANCELLED.
 */
public enum BatchStatus {
    INITIALIZING,
    SOLVING,
    EMITTED,
    COMPLETE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == CANCELLED;
    }
}
