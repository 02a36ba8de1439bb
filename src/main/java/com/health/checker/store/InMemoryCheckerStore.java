package com.health.checker.store;

import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerFailure;
import com.health.checker.core.model.CheckerOverride;
import com.health.checker.core.model.CheckerRun;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.StatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link CheckerStore}.
 * Suitable for testing and single-JVM deployments. Thread-safe; checkers are stored and
 * returned as copies.
 */
public class InMemoryCheckerStore implements CheckerStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCheckerStore.class);

    private final ConcurrentMap<String, Checker> checkersByName = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CheckerRun> runs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<String>> runIdsByChecker = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<CheckerFailure>> failuresByRun = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CheckerOverride> overrides = new ConcurrentHashMap<>();
    private final List<StatusTransition> transitions = new CopyOnWriteArrayList<>();

    @Override
    public Checker getOrCreateChecker(String name, String section) {
        Checker stored = checkersByName.computeIfAbsent(name, n -> {
            log.debug("Creating checker {} in section {}", n, section);
            return Checker.builder()
                    .id(UUID.randomUUID().toString())
                    .name(n)
                    .section(section)
                    .creationDate(Instant.now())
                    .build();
        });
        return stored.copy();
    }

    @Override
    public Optional<Checker> findChecker(String name) {
        return Optional.ofNullable(checkersByName.get(name)).map(Checker::copy);
    }

    @Override
    public List<Checker> findAllCheckers() {
        return checkersByName.values().stream()
                .sorted(Comparator.comparing(Checker::getName))
                .map(Checker::copy)
                .toList();
    }

    @Override
    public List<Checker> findCheckersByStatus(CheckerStatus status) {
        return checkersByName.values().stream()
                .filter(c -> c.getStatus() == status)
                .sorted(Comparator.comparing(Checker::getName))
                .map(Checker::copy)
                .toList();
    }

    @Override
    public void updateChecker(Checker checker) {
        if (!checker.isPersisted()) {
            throw new IllegalArgumentException("Checker was never persisted: " + checker.getName());
        }
        Checker previous = checkersByName.replace(checker.getName(), checker.copy());
        if (previous == null) {
            throw new IllegalArgumentException("Checker not found: " + checker.getName());
        }
    }

    @Override
    public CheckerRun createRun(CheckerRun run) {
        CheckerRun stored = run.withId(UUID.randomUUID().toString());
        runs.put(stored.id(), stored);
        runIdsByChecker.computeIfAbsent(stored.checkerId(), k -> new CopyOnWriteArrayList<>()).add(stored.id());
        return stored;
    }

    @Override
    public void updateRun(CheckerRun run) {
        if (run.isTransient() || runs.replace(run.id(), run) == null) {
            throw new IllegalArgumentException("Run not found: " + run.id());
        }
    }

    @Override
    public Optional<CheckerRun> findRun(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public Optional<CheckerRun> findLatestRunExcluding(String checkerId, String excludedRunId) {
        List<String> ids = runIdsByChecker.getOrDefault(checkerId, List.of());
        for (int i = ids.size() - 1; i >= 0; i--) {
            String id = ids.get(i);
            if (!id.equals(excludedRunId)) {
                return Optional.ofNullable(runs.get(id));
            }
        }
        return Optional.empty();
    }

    @Override
    public List<CheckerRun> findRecentRuns(String checkerId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        List<CheckerRun> all = findRuns(checkerId);
        return all.size() <= limit ? all : all.subList(0, limit);
    }

    @Override
    public List<CheckerRun> findRuns(String checkerId) {
        List<String> ids = runIdsByChecker.getOrDefault(checkerId, List.of());
        List<CheckerRun> result = new ArrayList<>(ids.size());
        for (int i = ids.size() - 1; i >= 0; i--) {
            CheckerRun run = runs.get(ids.get(i));
            if (run != null) {
                result.add(run);
            }
        }
        return List.copyOf(result);
    }

    @Override
    public List<CheckerFailure> bulkCreateFailures(String runId, List<CheckerFailure> failures) {
        if (!runs.containsKey(runId)) {
            throw new IllegalArgumentException("Run not found: " + runId);
        }
        List<CheckerFailure> persisted = failures.stream()
                .map(f -> f.attach(UUID.randomUUID().toString(), runId))
                .toList();
        failuresByRun.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).addAll(persisted);
        log.debug("Persisted {} failures for run {}", persisted.size(), runId);
        return persisted;
    }

    @Override
    public List<CheckerFailure> findFailures(String runId) {
        return List.copyOf(failuresByRun.getOrDefault(runId, List.of()));
    }

    @Override
    public CheckerOverride saveOverride(CheckerOverride override) {
        overrides.put(override.id(), override);
        return override;
    }

    @Override
    public boolean deleteOverride(String overrideId) {
        return overrides.remove(overrideId) != null;
    }

    @Override
    public List<CheckerOverride> findOverridesForChecker(String checkerId) {
        return overrides.values().stream()
                .filter(o -> checkerId.equals(o.checkerId()))
                .sorted(Comparator.comparing(CheckerOverride::creationDate).reversed())
                .toList();
    }

    @Override
    public List<CheckerOverride> findGlobalOverrides() {
        return overrides.values().stream()
                .filter(CheckerOverride::applyToAllCheckers)
                .sorted(Comparator.comparing(CheckerOverride::creationDate).reversed())
                .toList();
    }

    @Override
    public StatusTransition appendTransition(StatusTransition transition) {
        transitions.add(transition);
        return transition;
    }

    @Override
    public List<StatusTransition> findTransitions(String checkerId) {
        return transitions.stream()
                .filter(t -> checkerId.equals(t.checkerId()))
                .toList();
    }
}
