package com.health.checker.lock;

/**
 * Advisory lock keyed by checker name, held for the duration of one run so that two
 * invocations of the same checker never overlap.
 */
public interface RunLock {

    /**
     * Acquires the lock for the given checker name, waiting up to the configured timeout.
     *
     * @param checkerName the checker whose runs are serialized
     * @throws LockAcquisitionException if the lock is not acquired in time
     */
    void lock(String checkerName);

    /**
     * Releases the lock for the given checker name. Releasing a lock not held by the
     * current thread does nothing.
     */
    void unlock(String checkerName);
}
