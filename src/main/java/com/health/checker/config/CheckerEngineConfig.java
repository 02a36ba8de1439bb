package com.health.checker.config;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Options for the checker engine: kill switches, run limits, queue sizing and the
 * schedule of the periodic trigger.
 */
public class CheckerEngineConfig {

    private static final int DEFAULT_MAX_FAILURES_PER_RUN = 100;
    private static final Duration DEFAULT_RUN_TIMEOUT = Duration.ofSeconds(3600);
    private static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);
    private static final LocalTime DEFAULT_DAILY_RUN_TIME = LocalTime.of(9, 30);

    private final boolean disableAll;
    private final Set<String> disabledCheckers;
    private final int maxFailuresPerRun;
    private final Duration runTimeout;
    private final Duration lockTimeout;
    private final int shortPoolSize;
    private final int mediumPoolSize;
    private final int longPoolSize;
    private final boolean schedulerEnabled;
    private final LocalTime dailyRunTime;
    private final ZoneId zone;

    private CheckerEngineConfig(Builder builder) {
        this.disableAll = builder.disableAll;
        this.disabledCheckers = Set.copyOf(builder.disabledCheckers);
        this.maxFailuresPerRun = builder.maxFailuresPerRun;
        this.runTimeout = builder.runTimeout;
        this.lockTimeout = builder.lockTimeout;
        this.shortPoolSize = builder.shortPoolSize;
        this.mediumPoolSize = builder.mediumPoolSize;
        this.longPoolSize = builder.longPoolSize;
        this.schedulerEnabled = builder.schedulerEnabled;
        this.dailyRunTime = builder.dailyRunTime;
        this.zone = builder.zone;
    }

    /**
     * Returns true when every scheduled dispatch is suppressed.
     */
    public boolean isDisableAll() {
        return disableAll;
    }

    public Set<String> getDisabledCheckers() {
        return disabledCheckers;
    }

    public boolean isDisabled(String checkerName) {
        return disabledCheckers.contains(checkerName);
    }

    /**
     * Maximum number of relevant failures collected from one attempt; the rest are discarded.
     */
    public int getMaxFailuresPerRun() {
        return maxFailuresPerRun;
    }

    public Duration getRunTimeout() {
        return runTimeout;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public int getShortPoolSize() {
        return shortPoolSize;
    }

    public int getMediumPoolSize() {
        return mediumPoolSize;
    }

    public int getLongPoolSize() {
        return longPoolSize;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public LocalTime getDailyRunTime() {
        return dailyRunTime;
    }

    public ZoneId getZone() {
        return zone;
    }

    public static CheckerEngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean disableAll = false;
        private Set<String> disabledCheckers = new LinkedHashSet<>();
        private int maxFailuresPerRun = DEFAULT_MAX_FAILURES_PER_RUN;
        private Duration runTimeout = DEFAULT_RUN_TIMEOUT;
        private Duration lockTimeout = DEFAULT_LOCK_TIMEOUT;
        private int shortPoolSize = 2;
        private int mediumPoolSize = 2;
        private int longPoolSize = 1;
        private boolean schedulerEnabled = false;
        private LocalTime dailyRunTime = DEFAULT_DAILY_RUN_TIME;
        private ZoneId zone = ZoneOffset.UTC;

        public Builder disableAll(boolean disableAll) {
            this.disableAll = disableAll;
            return this;
        }

        public Builder disabledCheckers(Collection<String> names) {
            this.disabledCheckers = new LinkedHashSet<>(names);
            return this;
        }

        public Builder disableChecker(String name) {
            this.disabledCheckers.add(name);
            return this;
        }

        public Builder maxFailuresPerRun(int maxFailuresPerRun) {
            if (maxFailuresPerRun <= 0) {
                throw new IllegalArgumentException("maxFailuresPerRun must be positive");
            }
            this.maxFailuresPerRun = maxFailuresPerRun;
            return this;
        }

        public Builder runTimeout(Duration runTimeout) {
            this.runTimeout = requirePositive(runTimeout, "runTimeout");
            return this;
        }

        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = requirePositive(lockTimeout, "lockTimeout");
            return this;
        }

        public Builder shortPoolSize(int size) {
            this.shortPoolSize = requirePositive(size, "shortPoolSize");
            return this;
        }

        public Builder mediumPoolSize(int size) {
            this.mediumPoolSize = requirePositive(size, "mediumPoolSize");
            return this;
        }

        public Builder longPoolSize(int size) {
            this.longPoolSize = requirePositive(size, "longPoolSize");
            return this;
        }

        public Builder schedulerEnabled(boolean schedulerEnabled) {
            this.schedulerEnabled = schedulerEnabled;
            return this;
        }

        public Builder dailyRunTime(LocalTime dailyRunTime) {
            this.dailyRunTime = Objects.requireNonNull(dailyRunTime, "dailyRunTime is required");
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone is required");
            return this;
        }

        public CheckerEngineConfig build() {
            return new CheckerEngineConfig(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
            return value;
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
