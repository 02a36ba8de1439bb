package com.health.checker.metrics;

import com.health.checker.core.model.Cadence;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link CheckerMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code checker.run.duration} (Timer, tags: checker, status)</li>
 *   <li>{@code checker.failures.collected} (Counter, tag: checker)</li>
 *   <li>{@code checker.failures.suppressed} (Counter, tag: checker)</li>
 *   <li>{@code checker.transitions} (Counter, tag: status)</li>
 *   <li>{@code checker.notifications} (Counter, tag: kind)</li>
 *   <li>{@code checker.dispatched} (Counter, tag: cadence)</li>
 *   <li>{@code checker.skipped} (Counter, tag: reason)</li>
 * </ul>
 */
public class MicrometerCheckerMetrics implements CheckerMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerCheckerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRun(String checkerName, RunStatus status, Duration duration) {
        String key = checkerName + ":" + status.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("checker.run.duration")
                        .description("Duration of checker runs")
                        .tag("checker", checkerName)
                        .tag("status", status.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordFailuresCollected(String checkerName, int count) {
        counter("checker.failures.collected", "Relevant failures collected on final attempts",
                "checker", checkerName).increment(count);
    }

    @Override
    public void incrementFailureSuppressed(String checkerName) {
        counter("checker.failures.suppressed", "Failures dropped by an override",
                "checker", checkerName).increment();
    }

    @Override
    public void incrementTransition(CheckerStatus newStatus) {
        counter("checker.transitions", "Checker status changes",
                "status", newStatus.name()).increment();
    }

    @Override
    public void incrementNotification(String kind) {
        counter("checker.notifications", "Messages handed to the notification transport",
                "kind", kind).increment();
    }

    @Override
    public void incrementDispatched(Cadence cadence) {
        counter("checker.dispatched", "Checker runs enqueued by cadence",
                "cadence", cadence.name()).increment();
    }

    @Override
    public void incrementSkipped(String reason) {
        counter("checker.skipped", "Checker runs not executed",
                "reason", reason).increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
