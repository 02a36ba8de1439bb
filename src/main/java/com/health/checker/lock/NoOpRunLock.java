package com.health.checker.lock;

/**
 * Run lock that never blocks, allowing overlapping runs of the same checker.
 */
public class NoOpRunLock implements RunLock {

    @Override
    public void lock(String checkerName) {
    }

    @Override
    public void unlock(String checkerName) {
    }
}
