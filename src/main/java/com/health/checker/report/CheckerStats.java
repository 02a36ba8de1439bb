package com.health.checker.report;

import java.time.Duration;

/**
 * Summary statistics of a checker's completed runs.
 *
 * @param averageRuntime mean of completion minus creation over completed runs
 * @param successRate    percentage (0-100) of completed runs that succeeded
 * @param ageInDays      whole days since the checker was first stored
 * @param completedRuns  number of runs the averages are computed over
 */
public record CheckerStats(Duration averageRuntime, double successRate, long ageInDays, int completedRuns) {
}
