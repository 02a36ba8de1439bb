package com.health.checker.api;

import com.health.checker.admin.CheckerAdminService;
import com.health.checker.config.CheckerEngineConfig;
import com.health.checker.core.model.Cadence;
import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerRun;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.RegisteredChecker;
import com.health.checker.dispatch.CadenceDispatcher;
import com.health.checker.dispatch.CadenceScheduler;
import com.health.checker.dispatch.CheckerQueue;
import com.health.checker.dispatch.ExecutorCheckerQueue;
import com.health.checker.lock.LocalRunLock;
import com.health.checker.lock.LockConfig;
import com.health.checker.lock.RunLock;
import com.health.checker.metrics.CheckerMetrics;
import com.health.checker.metrics.NoOpCheckerMetrics;
import com.health.checker.notification.LoggingNotificationTransport;
import com.health.checker.notification.NotificationEscalator;
import com.health.checker.notification.NotificationSettings;
import com.health.checker.notification.NotificationTransport;
import com.health.checker.override.OverrideMatcher;
import com.health.checker.registry.CheckerRegistry;
import com.health.checker.report.CheckerReportService;
import com.health.checker.runner.CheckerRunner;
import com.health.checker.store.CheckerStore;
import com.health.checker.store.InMemoryCheckerStore;
import com.health.checker.transition.StatusTransitionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point of the checker engine. Wires the runner, queues, dispatcher, scheduler,
 * operator actions and reports around one store and one registry.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * CheckerRegistry registry = CheckerRegistry.of(
 *     RegisteredChecker.builder("no_orphaned_records", () -&gt; findOrphans())
 *         .severity(Severity.HIGH)
 *         .cadence(Cadence.EVERY_TEN_MINUTES)
 *         .build());
 *
 * try (CheckerEngine engine = CheckerEngine.builder()
 *         .registry(registry)
 *         .transport(mailAndChatTransport)
 *         .config(CheckerEngineConfig.builder().schedulerEnabled(true).build())
 *         .build()) {
 *     CheckerRun run = engine.run("no_orphaned_records");
 * }
 * </pre>
 */
public class CheckerEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CheckerEngine.class);

    private final CheckerRegistry registry;
    private final CheckerStore store;
    private final CheckerEngineConfig config;
    private final CheckerMetrics metrics;
    private final CheckerRunner runner;
    private final CheckerQueue queue;
    private final CadenceDispatcher dispatcher;
    private final CadenceScheduler scheduler;
    private final CheckerAdminService adminService;
    private final CheckerReportService reportService;

    private CheckerEngine(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry is required");
        this.config = builder.config != null ? builder.config : CheckerEngineConfig.defaults();
        this.store = builder.store != null ? builder.store : new InMemoryCheckerStore();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpCheckerMetrics();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        NotificationTransport transport = builder.transport != null
                ? builder.transport : new LoggingNotificationTransport();
        NotificationSettings settings = builder.notificationSettings != null
                ? builder.notificationSettings : NotificationSettings.defaults();
        RunLock runLock = builder.runLock != null
                ? builder.runLock : new LocalRunLock(new LockConfig(config.getLockTimeout()));

        NotificationEscalator escalator = new NotificationEscalator(store, transport, settings, metrics);
        this.runner = new CheckerRunner(store, new OverrideMatcher(store),
                new StatusTransitionEngine(store, clock), escalator, runLock, metrics, config, clock);

        this.queue = builder.queue != null ? builder.queue : new ExecutorCheckerQueue(runner, config, metrics);
        this.dispatcher = new CadenceDispatcher(registry, queue, config, metrics);
        this.adminService = new CheckerAdminService(store, registry, queue);
        this.reportService = new CheckerReportService(store, clock);

        this.scheduler = new CadenceScheduler(dispatcher, config.getDailyRunTime(), config.getZone(), clock);
        if (config.isSchedulerEnabled()) {
            scheduler.start();
        }

        log.info("CheckerEngine initialized: checkers={} scheduler={} disableAll={}",
                registry.size(), config.isSchedulerEnabled(), config.isDisableAll());
    }

    // ========== Runs ==========

    /**
     * Runs a registered checker synchronously and records the outcome.
     *
     * @throws IllegalArgumentException if the name is not registered
     */
    public CheckerRun run(String checkerName) {
        return runner.run(require(checkerName));
    }

    /**
     * Evaluates a registered checker without recording anything.
     */
    public CheckerRun preview(String checkerName) {
        return runner.run(require(checkerName), true);
    }

    /**
     * Re-runs every stored FAILING checker that is still registered.
     */
    public List<CheckerRun> runFailing() {
        List<CheckerRun> runs = new ArrayList<>();
        for (Checker checker : store.findCheckersByStatus(CheckerStatus.FAILING)) {
            Optional<RegisteredChecker> registered = registry.get(checker.getName());
            if (registered.isEmpty()) {
                log.warn("checker.unregistered name={} status={}", checker.getName(), checker.getStatus());
                continue;
            }
            runs.add(runner.run(registered.get()));
        }
        return runs;
    }

    /**
     * Enqueues every enabled checker of the cadence, as the scheduler does.
     */
    public List<String> dispatch(Cadence cadence) {
        return dispatcher.dispatch(cadence);
    }

    public Optional<Checker> findChecker(String checkerName) {
        return store.findChecker(checkerName);
    }

    // ========== Accessors ==========

    public CheckerRegistry getRegistry() {
        return registry;
    }

    public CheckerStore getStore() {
        return store;
    }

    public CheckerEngineConfig getConfig() {
        return config;
    }

    public CheckerMetrics getMetrics() {
        return metrics;
    }

    public CheckerRunner getRunner() {
        return runner;
    }

    public CadenceScheduler getScheduler() {
        return scheduler;
    }

    public CheckerAdminService admin() {
        return adminService;
    }

    public CheckerReportService reports() {
        return reportService;
    }

    @Override
    public void close() {
        scheduler.close();
        queue.close();
        log.info("CheckerEngine closed");
    }

    private RegisteredChecker require(String checkerName) {
        return registry.get(checkerName)
                .orElseThrow(() -> new IllegalArgumentException("Checker not registered: " + checkerName));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CheckerRegistry registry;
        private CheckerStore store;
        private CheckerEngineConfig config;
        private NotificationTransport transport;
        private NotificationSettings notificationSettings;
        private RunLock runLock;
        private CheckerMetrics metrics;
        private CheckerQueue queue;
        private Clock clock;

        public Builder registry(CheckerRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder store(CheckerStore store) {
            this.store = store;
            return this;
        }

        public Builder config(CheckerEngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder transport(NotificationTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder notificationSettings(NotificationSettings notificationSettings) {
            this.notificationSettings = notificationSettings;
            return this;
        }

        /**
         * Sets the lock serializing runs of one checker. Defaults to an in-process lock.
         */
        public Builder runLock(RunLock runLock) {
            this.runLock = runLock;
            return this;
        }

        public Builder metrics(CheckerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Replaces the default thread-pool queue, e.g. with an external job queue.
         */
        public Builder queue(CheckerQueue queue) {
            this.queue = queue;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CheckerEngine build() {
            return new CheckerEngine(this);
        }
    }
}
