package com.health.checker.metrics;

import com.health.checker.core.model.Cadence;
import com.health.checker.core.model.CheckerStatus;
import com.health.checker.core.model.RunStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link CheckerMetrics}.
 */
public class NoOpCheckerMetrics implements CheckerMetrics {

    @Override
    public void recordRun(String checkerName, RunStatus status, Duration duration) {
    }

    @Override
    public void recordFailuresCollected(String checkerName, int count) {
    }

    @Override
    public void incrementFailureSuppressed(String checkerName) {
    }

    @Override
    public void incrementTransition(CheckerStatus newStatus) {
    }

    @Override
    public void incrementNotification(String kind) {
    }

    @Override
    public void incrementDispatched(Cadence cadence) {
    }

    @Override
    public void incrementSkipped(String reason) {
    }
}
