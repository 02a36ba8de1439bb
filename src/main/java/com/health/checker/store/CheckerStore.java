package com.health.checker.store;

import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerFailure;
import com.health.checker.core.model.CheckerOverride;
import com.health.checker.core.model.CheckerRun;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.StatusTransition;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for checkers, runs, failures, overrides and status transitions.
 *
 * <p>Every method is a separate write or read; the engine never relies on a transaction
 * spanning several calls. Implementations return detached copies: mutating a returned
 * {@link Checker} has no effect until it is passed to {@link #updateChecker(Checker)}.</p>
 */
public interface CheckerStore {

    // ── Checkers ─────────────────────────────────────────────

    /**
     * Returns the checker with the given name, creating it with status NEW if absent.
     */
    Checker getOrCreateChecker(String name, String section);

    Optional<Checker> findChecker(String name);

    /**
     * Returns all checkers ordered by name.
     */
    List<Checker> findAllCheckers();

    List<Checker> findCheckersByStatus(CheckerStatus status);

    /**
     * Writes all mutable fields of the given checker.
     *
     * @throws IllegalArgumentException if the checker was never persisted
     */
    void updateChecker(Checker checker);

    // ── Runs ─────────────────────────────────────────────────

    /**
     * Persists a new run and returns it with its assigned id.
     */
    CheckerRun createRun(CheckerRun run);

    void updateRun(CheckerRun run);

    Optional<CheckerRun> findRun(String runId);

    /**
     * Returns the most recently created run of the checker other than {@code excludedRunId}.
     */
    Optional<CheckerRun> findLatestRunExcluding(String checkerId, String excludedRunId);

    /**
     * Returns up to {@code limit} runs of the checker, newest first.
     */
    List<CheckerRun> findRecentRuns(String checkerId, int limit);

    /**
     * Returns all runs of the checker, newest first.
     */
    List<CheckerRun> findRuns(String checkerId);

    // ── Failures ─────────────────────────────────────────────

    /**
     * Persists the failures of a run in one operation, preserving their order.
     *
     * @return the persisted failures with ids and run id assigned
     */
    List<CheckerFailure> bulkCreateFailures(String runId, List<CheckerFailure> failures);

    /**
     * Returns the failures of a run in insertion order.
     */
    List<CheckerFailure> findFailures(String runId);

    // ── Overrides ────────────────────────────────────────────

    CheckerOverride saveOverride(CheckerOverride override);

    boolean deleteOverride(String overrideId);

    List<CheckerOverride> findOverridesForChecker(String checkerId);

    List<CheckerOverride> findGlobalOverrides();

    // ── Status transitions ───────────────────────────────────

    StatusTransition appendTransition(StatusTransition transition);

    /**
     * Returns the transitions of a checker, oldest first.
     */
    List<StatusTransition> findTransitions(String checkerId);
}
