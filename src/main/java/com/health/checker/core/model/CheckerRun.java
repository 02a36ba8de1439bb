package com.health.checker.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one execution of a checker.
 *
 * <p>A persisted run starts {@link RunStatus#IN_PROGRESS} and is completed exactly once.
 * Dry runs produce a transient run with a null id and checker id.</p>
 *
 * @param id             store id, null for transient runs
 * @param checkerId      owning checker id, null for transient runs
 * @param status         current status
 * @param creationDate   when the run started
 * @param completionDate when the run reached a terminal status, null while in progress
 * @param data           optional payload; holds the stack trace under {@link #EXCEPTION_KEY} on error
 */
public record CheckerRun(
        String id,
        String checkerId,
        RunStatus status,
        Instant creationDate,
        Instant completionDate,
        Map<String, Object> data
) {
    public static final String EXCEPTION_KEY = "exception";

    public CheckerRun {
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(creationDate, "creationDate is required");
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    /**
     * Creates a new in-progress run for the given checker; the store assigns the id.
     */
    public static CheckerRun start(String checkerId, Instant now) {
        Objects.requireNonNull(checkerId, "checkerId is required");
        return new CheckerRun(null, checkerId, RunStatus.IN_PROGRESS, now, null, null);
    }

    /**
     * Creates an unsaved run carrying only a computed status, as returned by dry runs.
     */
    public static CheckerRun transientRun(RunStatus status, Instant now) {
        return new CheckerRun(null, null, status, now, now, null);
    }

    public CheckerRun withId(String newId) {
        return new CheckerRun(newId, checkerId, status, creationDate, completionDate, data);
    }

    /**
     * Returns the completed form of this run.
     *
     * @throws IllegalStateException if this run was already completed
     */
    public CheckerRun complete(RunStatus finalStatus, Instant completedAt, Map<String, Object> payload) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run " + id + " already completed as " + status);
        }
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("Cannot complete a run as " + finalStatus);
        }
        return new CheckerRun(id, checkerId, finalStatus, creationDate, completedAt, payload);
    }

    public boolean isTransient() {
        return id == null;
    }

    public boolean isCompleted() {
        return status.isTerminal();
    }

    /**
     * Returns the captured stack trace of an errored run, or null.
     */
    public String exceptionTrace() {
        Object trace = data.get(EXCEPTION_KEY);
        return trace != null ? trace.toString() : null;
    }
}
