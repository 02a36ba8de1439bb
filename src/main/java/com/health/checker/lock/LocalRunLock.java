package com.health.checker.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process run lock backed by one {@link ReentrantLock} per checker name.
 * Suitable for single-JVM deployments. This is the default lock implementation.
 */
public class LocalRunLock implements RunLock {
    private static final Logger log = LoggerFactory.getLogger(LocalRunLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalRunLock() {
        this(LockConfig.defaults());
    }

    public LocalRunLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(String checkerName) {
        ReentrantLock lock = locks.computeIfAbsent(checkerName, k -> new ReentrantLock());
        try {
            if (!lock.tryLock(config.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException("Checker '" + checkerName
                        + "' is already running; gave up after " + config.timeout().toMillis() + "ms");
            }
            log.debug("Run lock acquired: {}", checkerName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while waiting for run lock of " + checkerName, e);
        }
    }

    @Override
    public void unlock(String checkerName) {
        ReentrantLock lock = locks.get(checkerName);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Run lock released: {}", checkerName);
        }
    }

    /**
     * Returns whether some thread currently runs the given checker.
     */
    public boolean isLocked(String checkerName) {
        ReentrantLock lock = locks.get(checkerName);
        return lock != null && lock.isLocked();
    }
}
