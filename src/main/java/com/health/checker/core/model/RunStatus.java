package com.health.checker.core.model;

/**
 * Outcome of a single {@link CheckerRun}.
 */
public enum RunStatus {
    IN_PROGRESS,
    SUCCEEDED,
    FAILED,
    ERRORED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
