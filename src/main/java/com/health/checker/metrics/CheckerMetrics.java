package com.health.checker.metrics;

import com.health.checker.core.model.Cadence;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.RunStatus;

import java.time.Duration;

/**
 * Interface for recording checker engine metrics.
 * The default {@link NoOpCheckerMetrics} does nothing, so the engine works without any
 * metrics library on the classpath.
 */
public interface CheckerMetrics {

    void recordRun(String checkerName, RunStatus status, Duration duration);

    void recordFailuresCollected(String checkerName, int count);

    void incrementFailureSuppressed(String checkerName);

    void incrementTransition(CheckerStatus newStatus);

    void incrementNotification(String kind);

    void incrementDispatched(Cadence cadence);

    void incrementSkipped(String reason);
}
