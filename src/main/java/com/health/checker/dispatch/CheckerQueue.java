package com.health.checker.dispatch;

import com.health.checker.core.model.RegisteredChecker;

/**
 * Work queue executing checker runs asynchronously.
 */
public interface CheckerQueue extends AutoCloseable {

    /**
     * Schedules one run of the checker on the queue of the given latency class.
     * Returns without waiting for the run.
     */
    void enqueue(LatencyClass latencyClass, RegisteredChecker checker);

    @Override
    void close();
}
