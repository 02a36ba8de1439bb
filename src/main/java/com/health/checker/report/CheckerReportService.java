package com.health.checker.report;

import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerFailure;
import com.health.checker.core.model.CheckerRun;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.RunStatus;
import com.health.checker.store.CheckerStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries backing the checker overview, checker detail and run detail pages.
 */
public class CheckerReportService {

    /**
     * Display order of status groups: the ones needing attention first.
     */
    static final List<CheckerStatus> GROUP_ORDER = List.of(
            CheckerStatus.FAILING,
            CheckerStatus.ERRORED,
            CheckerStatus.IGNORED,
            CheckerStatus.SUCCEEDING,
            CheckerStatus.NEW);

    private static final Comparator<Checker> MOST_RECENTLY_CHANGED = Comparator
            .comparing((Checker c) -> c.getLatestStatusChange() != null
                    ? c.getLatestStatusChange() : c.getCreationDate())
            .reversed();

    private final CheckerStore store;
    private final Clock clock;

    public CheckerReportService(CheckerStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Returns the non-empty status groups in display order.
     */
    public List<CheckerGroup> groupedCheckers() {
        List<Checker> all = store.findAllCheckers();
        List<CheckerGroup> groups = new ArrayList<>();
        for (CheckerStatus status : GROUP_ORDER) {
            List<Checker> members = all.stream()
                    .filter(c -> c.getStatus() == status)
                    .sorted(MOST_RECENTLY_CHANGED)
                    .toList();
            if (!members.isEmpty()) {
                groups.add(new CheckerGroup(status, members));
            }
        }
        return groups;
    }

    /**
     * Returns every FAILING checker with the failures of its latest run.
     */
    public List<FailingChecker> currentFailures() {
        List<FailingChecker> result = new ArrayList<>();
        for (Checker checker : store.findCheckersByStatus(CheckerStatus.FAILING)) {
            store.findRecentRuns(checker.getId(), 1).stream().findFirst().ifPresent(run ->
                    result.add(new FailingChecker(checker, run, store.findFailures(run.id()))));
        }
        return result;
    }

    public List<CheckerRun> recentRuns(String checkerName, int limit) {
        return store.findRecentRuns(require(checkerName).getId(), limit);
    }

    /**
     * Computes statistics over the checker's completed runs. A checker without completed runs
     * reports zero runtime and a zero success rate.
     */
    public CheckerStats stats(String checkerName) {
        Checker checker = require(checkerName);
        List<CheckerRun> completed = store.findRuns(checker.getId()).stream()
                .filter(CheckerRun::isCompleted)
                .toList();
        long ageInDays = Duration.between(checker.getCreationDate(), clock.instant()).toDays();
        if (completed.isEmpty()) {
            return new CheckerStats(Duration.ZERO, 0.0, ageInDays, 0);
        }
        Duration total = Duration.ZERO;
        int succeeded = 0;
        for (CheckerRun run : completed) {
            if (run.completionDate() != null) {
                total = total.plus(Duration.between(run.creationDate(), run.completionDate()));
            }
            if (run.status() == RunStatus.SUCCEEDED) {
                succeeded++;
            }
        }
        return new CheckerStats(
                total.dividedBy(completed.size()),
                succeeded * 100.0 / completed.size(),
                ageInDays,
                completed.size());
    }

    /**
     * Returns a run of the named checker with its failures.
     *
     * @throws IllegalArgumentException if the run does not exist or belongs to another checker
     */
    public RunDetail runDetail(String checkerName, String runId) {
        Checker checker = require(checkerName);
        CheckerRun run = store.findRun(runId)
                .filter(r -> checker.getId().equals(r.checkerId()))
                .orElseThrow(() -> new IllegalArgumentException(
                        "Run " + runId + " not found for checker " + checkerName));
        List<CheckerFailure> failures = store.findFailures(runId);
        List<String> keys = failures.isEmpty() || !failures.get(0).hasData()
                ? List.of()
                : List.copyOf(failures.get(0).data().keySet());
        return new RunDetail(checker, run, failures, keys);
    }

    /**
     * Returns how long the checker had been in its current status at its latest run, if it
     * has ever changed status.
     */
    public static Optional<Duration> timeInStatus(Checker checker) {
        Instant changed = checker.getLatestStatusChange();
        Instant lastRun = checker.getLatestRunDate();
        if (changed == null || lastRun == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(changed, lastRun));
    }

    /**
     * Renders a duration in the largest whole unit, e.g. "3 hours" or "a moment".
     */
    public static String humanize(Duration duration) {
        long seconds = Math.abs(duration.getSeconds());
        if (seconds < 1) {
            return "a moment";
        }
        if (seconds < 60) {
            return plural(seconds, "second");
        }
        if (seconds < 3600) {
            return plural(seconds / 60, "minute");
        }
        if (seconds < 86_400) {
            return plural(seconds / 3600, "hour");
        }
        return plural(seconds / 86_400, "day");
    }

    private static String plural(long amount, String unit) {
        if (amount == 1) {
            return (unit.equals("hour") ? "an " : "a ") + unit;
        }
        return amount + " " + unit + "s";
    }

    private Checker require(String checkerName) {
        return store.findChecker(checkerName)
                .orElseThrow(() -> new IllegalArgumentException("Checker not found: " + checkerName));
    }
}
