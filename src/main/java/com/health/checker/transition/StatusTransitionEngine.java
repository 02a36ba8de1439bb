package com.health.checker.transition;

import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerRun;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.StatusTransition;
import com.health.checker.store.CheckerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * State machine updating a checker's status from the outcome of a completed run.
 *
 * <ul>
 *   <li>Ignored checkers are left untouched.</li>
 *   <li>On the first run of a checker, or while it is NEW, the status is taken directly
 *       from the run outcome.</li>
 *   <li>Otherwise the status only moves when the outcome disagrees with it, so repeated
 *       failures produce a single FAILING transition.</li>
 * </ul>
 *
 * <p>The latest run date is written on every processed run; the latest status change and
 * one {@link StatusTransition} row only on an actual change.</p>
 */
public class StatusTransitionEngine {
    private static final Logger log = LoggerFactory.getLogger(StatusTransitionEngine.class);

    private final CheckerStore store;
    private final Clock clock;

    public StatusTransitionEngine(CheckerStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Applies the run to the checker, persisting the checker and, on change, a transition.
     *
     * <p>Operator-owned fields (status and owner) are refreshed from the store first, so an
     * ignore or owner change made while the run was executing is kept. The given checker
     * instance is updated in place.</p>
     *
     * @throws IllegalArgumentException if the run has not completed
     */
    public TransitionResult apply(Checker checker, CheckerRun run) {
        if (!run.isCompleted()) {
            throw new IllegalArgumentException("Cannot apply run " + run.id() + " while " + run.status());
        }
        refreshOperatorFields(checker);
        CheckerStatus previous = checker.getStatus();
        if (previous == CheckerStatus.IGNORED) {
            log.debug("transition.skipped checker={} reason=ignored", checker.getName());
            return TransitionResult.unchanged(previous);
        }

        // A first run is always NEW, so both it and NEW land on the outcome; an established
        // status moves only on disagreement.
        CheckerStatus outcome = CheckerStatus.fromRunStatus(run.status());
        boolean changed = previous != outcome;

        Instant now = clock.instant();
        checker.setLatestRunDate(now);
        if (changed) {
            checker.setStatus(outcome);
            checker.setLatestStatusChange(now);
        }
        store.updateChecker(checker);

        if (!changed) {
            return TransitionResult.unchanged(previous);
        }
        store.appendTransition(StatusTransition.of(checker.getId(), previous, outcome, now));
        log.info("checker.status_changed name={} from={} to={}", checker.getName(), previous, outcome);
        return new TransitionResult(previous, outcome, true);
    }

    private void refreshOperatorFields(Checker checker) {
        store.findChecker(checker.getName()).ifPresent(stored -> {
            if (stored.getStatus() != checker.getStatus()) {
                log.debug("transition.status_refreshed checker={} held={} stored={}",
                        checker.getName(), checker.getStatus(), stored.getStatus());
            }
            checker.setStatus(stored.getStatus());
            checker.setOwner(stored.getOwner());
        });
    }
}
