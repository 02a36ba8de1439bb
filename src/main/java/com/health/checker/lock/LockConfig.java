package com.health.checker.lock;

import java.time.Duration;

/**
 * Configuration for {@link RunLock} implementations.
 *
 * @param timeout maximum time an invocation waits for a concurrent run of the same checker
 */
public record LockConfig(Duration timeout) {

    public LockConfig {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
    }

    /**
     * Default configuration: 5s wait.
     */
    public static LockConfig defaults() {
        return new LockConfig(Duration.ofSeconds(5));
    }
}
