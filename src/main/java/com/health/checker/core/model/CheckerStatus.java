package com.health.checker.core.model;

/**
 * Aggregate status of a {@link Checker}.
 *
 * <p>The status is kept on the checker rather than derived from its latest run so that
 * changes can be acted on as edges, and so that {@link #IGNORED} can stick across runs.</p>
 */
public enum CheckerStatus {
    NEW,
    IGNORED,
    SUCCEEDING,
    FAILING,
    ERRORED;

    /**
     * Maps a terminal run outcome to the checker status it implies.
     *
     * @throws IllegalArgumentException for {@link RunStatus#IN_PROGRESS}
     */
    public static CheckerStatus fromRunStatus(RunStatus runStatus) {
        return switch (runStatus) {
            case SUCCEEDED -> SUCCEEDING;
            case FAILED -> FAILING;
            case ERRORED -> ERRORED;
            case IN_PROGRESS -> throw new IllegalArgumentException("Run is still in progress");
        };
    }
}
