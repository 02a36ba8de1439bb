package com.health.checker.dispatch;

import com.health.checker.core.model.Cadence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic trigger calling the dispatcher every ten minutes, every hour and once a day at
 * the configured time of day.
 *
 * <p>Every tick catches and logs its own exceptions so that one failed dispatch never
 * cancels the schedule.</p>
 */
public class CadenceScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CadenceScheduler.class);

    private final CadenceDispatcher dispatcher;
    private final LocalTime dailyRunTime;
    private final ZoneId zone;
    private final Clock clock;
    private final ScheduledExecutorService executor;
    private volatile boolean started;

    public CadenceScheduler(CadenceDispatcher dispatcher, LocalTime dailyRunTime, ZoneId zone, Clock clock) {
        this.dispatcher = dispatcher;
        this.dailyRunTime = dailyRunTime;
        this.zone = zone;
        this.clock = clock;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "checker-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        executor.scheduleAtFixedRate(() -> tick(Cadence.EVERY_TEN_MINUTES),
                delayUntilNextMultiple(now, Duration.ofMinutes(10)).toMillis(),
                Duration.ofMinutes(10).toMillis(), TimeUnit.MILLISECONDS);
        executor.scheduleAtFixedRate(() -> tick(Cadence.HOURLY),
                delayUntilNextMultiple(now, Duration.ofHours(1)).toMillis(),
                Duration.ofHours(1).toMillis(), TimeUnit.MILLISECONDS);
        executor.scheduleAtFixedRate(() -> tick(Cadence.DAILY),
                delayUntilDailyRun(now, dailyRunTime).toMillis(),
                Duration.ofDays(1).toMillis(), TimeUnit.MILLISECONDS);
        log.info("scheduler.started dailyRunTime={} zone={}", dailyRunTime, zone);
    }

    public boolean isStarted() {
        return started;
    }

    void tick(Cadence cadence) {
        try {
            dispatcher.dispatch(cadence);
        } catch (Exception e) {
            log.error("scheduler.dispatch_failed cadence={}: {}", cadence, e.getMessage(), e);
        }
    }

    /**
     * Returns the time from {@code now} to the next wall-clock boundary of {@code period}
     * (e.g. the next full ten minutes), counted from midnight.
     */
    static Duration delayUntilNextMultiple(ZonedDateTime now, Duration period) {
        ZonedDateTime midnight = now.toLocalDate().atStartOfDay(now.getZone());
        long elapsed = Duration.between(midnight, now).toMillis();
        long periodMillis = period.toMillis();
        long remainder = elapsed % periodMillis;
        return Duration.ofMillis(remainder == 0 ? 0 : periodMillis - remainder);
    }

    /**
     * Returns the time from {@code now} to the next occurrence of {@code runTime}.
     */
    static Duration delayUntilDailyRun(ZonedDateTime now, LocalTime runTime) {
        ZonedDateTime next = now.with(runTime);
        if (next.isBefore(now)) {
            next = next.plusDays(1);
        }
        return Duration.between(now, next);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        started = false;
        log.info("scheduler.stopped");
    }
}
