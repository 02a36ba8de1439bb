package com.health.checker.runner;

import com.health.checker.config.CheckerEngineConfig;
import com.health.checker.core.model.CheckResult;
import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerFailure;
import com.health.checker.core.model.CheckerRun;
import com.health.checker.core.model.RegisteredChecker;
import com.health.checker.core.model.RunStatus;
import com.health.checker.lock.LockAcquisitionException;
import com.health.checker.lock.RunLock;
import com.health.checker.logging.LogContext;
import com.health.checker.metrics.CheckerMetrics;
import com.health.checker.notification.NotificationEscalator;
import com.health.checker.override.OverrideMatcher;
import com.health.checker.store.CheckerStore;
import com.health.checker.transition.StatusTransitionEngine;
import com.health.checker.transition.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Executes one registered checker once.
 *
 * <p>A run proceeds as follows:</p>
 * <ol>
 *   <li>The persistent checker is resolved (or created) and its description, severity and
 *       cadence are synchronized from the registration.</li>
 *   <li>An IN_PROGRESS run is stored before the function is invoked.</li>
 *   <li>The function is invoked up to {@code tries} times. Success ends the loop; a failure
 *       stream is consumed lazily, skipping suppressed failures and stopping at the failure
 *       cap. Only the last attempt's failures are kept.</li>
 *   <li>The run is completed as FAILED (with its failures persisted), SUCCEEDED or, if the
 *       function threw, ERRORED with the stack trace. Exceptions, assertion and linkage
 *       errors and stack overflows thrown by the function never leave this class.</li>
 *   <li>The status transition is applied and, if the status changed, escalated.</li>
 * </ol>
 *
 * <p>A dry run performs the same evaluation without writing anything and returns a transient
 * run carrying the computed status.</p>
 */
public class CheckerRunner {
    private static final Logger log = LoggerFactory.getLogger(CheckerRunner.class);

    private final CheckerStore store;
    private final OverrideMatcher overrideMatcher;
    private final StatusTransitionEngine transitionEngine;
    private final NotificationEscalator escalator;
    private final RunLock runLock;
    private final CheckerMetrics metrics;
    private final Clock clock;
    private final int maxFailuresPerRun;

    public CheckerRunner(CheckerStore store,
                         OverrideMatcher overrideMatcher,
                         StatusTransitionEngine transitionEngine,
                         NotificationEscalator escalator,
                         RunLock runLock,
                         CheckerMetrics metrics,
                         CheckerEngineConfig config,
                         Clock clock) {
        this.store = store;
        this.overrideMatcher = overrideMatcher;
        this.transitionEngine = transitionEngine;
        this.escalator = escalator;
        this.runLock = runLock;
        this.metrics = metrics;
        this.clock = clock;
        this.maxFailuresPerRun = config.getMaxFailuresPerRun();
    }

    /**
     * Runs the checker and records the outcome.
     *
     * @throws LockAcquisitionException if another run of the same checker holds the lock
     */
    public CheckerRun run(RegisteredChecker registered) {
        return run(registered, false);
    }

    /**
     * Runs the checker, recording the outcome unless {@code dryRun} is set.
     *
     * @throws LockAcquisitionException if a non-dry run cannot acquire the checker's lock;
     *                                  nothing has been written in that case
     */
    public CheckerRun run(RegisteredChecker registered, boolean dryRun) {
        if (dryRun) {
            return preview(registered);
        }
        runLock.lock(registered.name());
        try (LogContext ctx = LogContext.forRun(registered.name())) {
            return execute(registered, ctx);
        } finally {
            runLock.unlock(registered.name());
        }
    }

    private CheckerRun execute(RegisteredChecker registered, LogContext ctx) {
        String name = registered.name();
        log.info("checker.started name={}", name);
        long startNanos = System.nanoTime();

        Checker checker = store.getOrCreateChecker(name, registered.section());
        synchronizeMetadata(checker, registered);

        CheckerRun run = store.createRun(CheckerRun.start(checker.getId(), clock.instant()));
        ctx.with("runId", run.id());

        Evaluation evaluation = evaluate(registered, checker);
        CheckerRun completed;
        if (evaluation.error() != null) {
            completed = run.complete(RunStatus.ERRORED, clock.instant(),
                    Map.of(CheckerRun.EXCEPTION_KEY, stackTrace(evaluation.error())));
            store.updateRun(completed);
        } else if (!evaluation.failures().isEmpty()) {
            completed = run.complete(RunStatus.FAILED, clock.instant(), null);
            store.updateRun(completed);
            store.bulkCreateFailures(completed.id(), evaluation.failures());
            metrics.recordFailuresCollected(name, evaluation.failures().size());
        } else {
            completed = run.complete(RunStatus.SUCCEEDED, clock.instant(), null);
            store.updateRun(completed);
        }
        metrics.recordRun(name, completed.status(), Duration.ofNanos(System.nanoTime() - startNanos));
        log.info("checker.completed name={} runId={} status={} failures={}",
                name, completed.id(), completed.status(), evaluation.failures().size());

        TransitionResult transition = transitionEngine.apply(checker, completed);
        if (transition.changed()) {
            metrics.incrementTransition(transition.newStatus());
            escalator.escalate(checker, completed, transition);
        }
        return completed;
    }

    private CheckerRun preview(RegisteredChecker registered) {
        try (LogContext ignored = LogContext.forPreview(registered.name())) {
            Checker checker = store.findChecker(registered.name())
                    .orElseGet(() -> Checker.builder()
                            .name(registered.name())
                            .section(registered.section())
                            .build());
            Evaluation evaluation = evaluate(registered, checker);
            RunStatus status = evaluation.error() != null ? RunStatus.ERRORED
                    : evaluation.failures().isEmpty() ? RunStatus.SUCCEEDED
                    : RunStatus.FAILED;
            log.info("checker.previewed name={} status={}", registered.name(), status);
            return CheckerRun.transientRun(status, clock.instant());
        }
    }

    private Evaluation evaluate(RegisteredChecker registered, Checker checker) {
        List<CheckerFailure> collected = List.of();
        try {
            for (int attempt = 1; attempt <= registered.tries(); attempt++) {
                CheckResult result = registered.function().check();
                if (!(result instanceof CheckResult.Failures failures)) {
                    collected = List.of();
                    break;
                }
                collected = collect(failures.stream(), checker);
                if (collected.isEmpty()) {
                    break;
                }
                log.debug("checker.attempt_failed name={} attempt={}/{} failures={}",
                        registered.name(), attempt, registered.tries(), collected.size());
            }
            return new Evaluation(collected, null);
        } catch (Exception | StackOverflowError | AssertionError | LinkageError e) {
            // Other VirtualMachineErrors (out of memory, internal errors) leave the JVM unusable and propagate.
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("checker.errored name={}: {}", registered.name(), e.toString(), e);
            return new Evaluation(List.of(), e);
        }
    }

    private List<CheckerFailure> collect(Stream<CheckerFailure> failures, Checker checker) {
        List<CheckerFailure> collected = new ArrayList<>();
        try (Stream<CheckerFailure> stream = failures) {
            Iterator<CheckerFailure> iterator = stream.iterator();
            while (collected.size() < maxFailuresPerRun && iterator.hasNext()) {
                CheckerFailure failure = iterator.next();
                if (overrideMatcher.isSuppressed(failure, checker)) {
                    metrics.incrementFailureSuppressed(checker.getName());
                    continue;
                }
                collected.add(failure);
            }
        }
        return collected;
    }

    private void synchronizeMetadata(Checker checker, RegisteredChecker registered) {
        boolean changed = false;
        String description = registered.description().strip();
        if (!description.equals(checker.getDescription())) {
            checker.setDescription(description);
            changed = true;
        }
        if (checker.getSeverity() != registered.severity()) {
            checker.setSeverity(registered.severity());
            changed = true;
        }
        if (checker.getCadence() != registered.cadence()) {
            checker.setCadence(registered.cadence());
            changed = true;
        }
        if (changed) {
            store.updateChecker(checker);
            log.debug("checker.metadata_updated name={} severity={} cadence={}",
                    checker.getName(), checker.getSeverity(), checker.getCadence());
        }
    }

    private static String stackTrace(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    private record Evaluation(List<CheckerFailure> failures, Throwable error) {
    }
}
