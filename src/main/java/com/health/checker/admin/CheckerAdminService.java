package com.health.checker.admin;

import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerOverride;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.RegisteredChecker;
import com.health.checker.dispatch.CheckerQueue;
import com.health.checker.dispatch.LatencyClass;
import com.health.checker.registry.CheckerRegistry;
import com.health.checker.store.CheckerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Operator actions on stored checkers and overrides.
 *
 * <p>Ignoring and un-ignoring write the status directly, without a transition row, so they
 * never cause notifications. An ignored checker keeps running but its status stays put
 * until it is un-ignored, which resets it to NEW so the next run sets it from scratch.</p>
 */
public class CheckerAdminService {
    private static final Logger log = LoggerFactory.getLogger(CheckerAdminService.class);

    private final CheckerStore store;
    private final CheckerRegistry registry;
    private final CheckerQueue queue;

    public CheckerAdminService(CheckerStore store, CheckerRegistry registry, CheckerQueue queue) {
        this.store = store;
        this.registry = registry;
        this.queue = queue;
    }

    /**
     * Marks the checker IGNORED.
     *
     * @throws IllegalArgumentException if no checker with that name is stored
     */
    public Checker ignore(String checkerName) {
        Checker checker = require(checkerName);
        checker.setStatus(CheckerStatus.IGNORED);
        store.updateChecker(checker);
        log.info("admin.ignored checker={}", checkerName);
        return checker;
    }

    /**
     * Resets an ignored checker to NEW. Checkers that are not ignored are left unchanged.
     *
     * @throws IllegalArgumentException if no checker with that name is stored
     */
    public Checker unignore(String checkerName) {
        Checker checker = require(checkerName);
        if (!checker.isIgnored()) {
            log.debug("admin.unignore_skipped checker={} status={}", checkerName, checker.getStatus());
            return checker;
        }
        checker.setStatus(CheckerStatus.NEW);
        store.updateChecker(checker);
        log.info("admin.unignored checker={}", checkerName);
        return checker;
    }

    /**
     * Sets the responsible operator's e-mail address; null clears it.
     */
    public Checker assignOwner(String checkerName, String ownerEmail) {
        Checker checker = require(checkerName);
        checker.setOwner(ownerEmail);
        store.updateChecker(checker);
        log.info("admin.owner_assigned checker={} owner={}", checkerName, ownerEmail);
        return checker;
    }

    /**
     * Queues one run of a registered checker on the queue of its cadence.
     *
     * @throws IllegalArgumentException if the name is not registered
     */
    public void enqueueRun(String checkerName) {
        RegisteredChecker registered = registry.get(checkerName)
                .orElseThrow(() -> new IllegalArgumentException("Checker not registered: " + checkerName));
        queue.enqueue(LatencyClass.forCadence(registered.cadence()), registered);
        log.info("admin.run_enqueued checker={}", checkerName);
    }

    /**
     * Creates an override suppressing failures of one checker whose data contains {@code data}.
     */
    public CheckerOverride createOverride(String checkerName, Map<String, Object> data, String note, String user) {
        Checker checker = require(checkerName);
        CheckerOverride saved = store.saveOverride(
                CheckerOverride.forChecker(checker.getId(), data, note, user));
        warnIfMatchesEverything(saved);
        log.info("admin.override_created overrideId={} checker={} user={}", saved.id(), checkerName, user);
        return saved;
    }

    /**
     * Creates an override applying to failures of every checker.
     */
    public CheckerOverride createGlobalOverride(Map<String, Object> data, String note, String user) {
        CheckerOverride saved = store.saveOverride(CheckerOverride.global(data, note, user));
        warnIfMatchesEverything(saved);
        log.info("admin.override_created overrideId={} scope=global user={}", saved.id(), user);
        return saved;
    }

    public boolean deleteOverride(String overrideId) {
        boolean deleted = store.deleteOverride(overrideId);
        log.info("admin.override_deleted overrideId={} found={}", overrideId, deleted);
        return deleted;
    }

    /**
     * Returns the overrides scoped to the checker followed by all global overrides.
     */
    public List<CheckerOverride> overridesFor(String checkerName) {
        Checker checker = require(checkerName);
        List<CheckerOverride> scoped = store.findOverridesForChecker(checker.getId());
        List<CheckerOverride> global = store.findGlobalOverrides();
        return Stream.concat(scoped.stream(), global.stream()).toList();
    }

    private void warnIfMatchesEverything(CheckerOverride override) {
        if (override.data().isEmpty()) {
            log.warn("admin.override_matches_all overrideId={} global={}: empty data suppresses every failure carrying data",
                    override.id(), override.applyToAllCheckers());
        }
    }

    private Checker require(String checkerName) {
        return store.findChecker(checkerName)
                .orElseThrow(() -> new IllegalArgumentException("Checker not found: " + checkerName));
    }
}
