package com.health.checker.dispatch;

import com.health.checker.config.CheckerEngineConfig;
import com.health.checker.core.model.CheckerRun;
import com.health.checker.core.model.RegisteredChecker;
import com.health.checker.lock.LockAcquisitionException;
import com.health.checker.metrics.CheckerMetrics;
import com.health.checker.runner.CheckerRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link CheckerQueue} backed by one fixed thread pool per latency class.
 *
 * <p>A watchdog interrupts any run still executing after the configured run timeout. The
 * interrupted run is not retried. Runs that cannot acquire their checker's lock are skipped
 * and logged.</p>
 */
public class ExecutorCheckerQueue implements CheckerQueue {
    private static final Logger log = LoggerFactory.getLogger(ExecutorCheckerQueue.class);

    private final CheckerRunner runner;
    private final CheckerMetrics metrics;
    private final Duration runTimeout;
    private final Map<LatencyClass, ExecutorService> pools = new EnumMap<>(LatencyClass.class);
    private final ScheduledExecutorService watchdog;

    public ExecutorCheckerQueue(CheckerRunner runner, CheckerEngineConfig config, CheckerMetrics metrics) {
        this.runner = runner;
        this.metrics = metrics;
        this.runTimeout = config.getRunTimeout();
        pools.put(LatencyClass.SHORT, Executors.newFixedThreadPool(config.getShortPoolSize(), threadFactory("short")));
        pools.put(LatencyClass.MEDIUM, Executors.newFixedThreadPool(config.getMediumPoolSize(), threadFactory("medium")));
        pools.put(LatencyClass.LONG, Executors.newFixedThreadPool(config.getLongPoolSize(), threadFactory("long")));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(threadFactory("watchdog"));
    }

    @Override
    public void enqueue(LatencyClass latencyClass, RegisteredChecker checker) {
        submit(latencyClass, checker);
    }

    /**
     * Schedules one run and returns its future. The future completes with null when the run
     * was skipped or failed outside the check function.
     *
     * <p>The run timeout starts when a pool thread picks the run up, so time spent waiting in
     * the queue does not count against it.</p>
     */
    public Future<CheckerRun> submit(LatencyClass latencyClass, RegisteredChecker checker) {
        AtomicReference<Future<CheckerRun>> self = new AtomicReference<>();
        FutureTask<CheckerRun> task = new FutureTask<>(() -> {
            ScheduledFuture<?> timer = watchdog.schedule(
                    () -> timeOut(self.get(), latencyClass, checker), runTimeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                return execute(checker);
            } finally {
                timer.cancel(false);
            }
        });
        self.set(task);
        pools.get(latencyClass).execute(task);
        log.debug("checker.enqueued name={} queue={}", checker.name(), latencyClass);
        return task;
    }

    private void timeOut(Future<CheckerRun> future, LatencyClass latencyClass, RegisteredChecker checker) {
        if (!future.isDone()) {
            metrics.incrementSkipped("timeout");
            log.warn("checker.timed_out name={} queue={} timeout={}ms",
                    checker.name(), latencyClass, runTimeout.toMillis());
            future.cancel(true);
        }
    }

    private CheckerRun execute(RegisteredChecker checker) {
        try {
            return runner.run(checker);
        } catch (LockAcquisitionException e) {
            metrics.incrementSkipped("locked");
            log.info("checker.skipped name={} reason=locked: {}", checker.name(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("checker.run_failed name={}: {}", checker.name(), e.getMessage(), e);
            return null;
        } catch (Error e) {
            log.error("checker.run_aborted name={}: {}", checker.name(), e.toString(), e);
            throw e;
        }
    }

    @Override
    public void close() {
        pools.values().forEach(ExecutorService::shutdown);
        try {
            for (ExecutorService pool : pools.values()) {
                if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                    pool.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            pools.values().forEach(ExecutorService::shutdownNow);
            Thread.currentThread().interrupt();
        } finally {
            // Runs draining from the pools still arm their timers.
            watchdog.shutdownNow();
        }
    }

    private static ThreadFactory threadFactory(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "checker-" + name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
