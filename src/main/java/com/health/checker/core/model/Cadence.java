package com.health.checker.core.model;

/**
 * Execution frequency class of a checker.
 */
public enum Cadence {
    EVERY_TEN_MINUTES,
    HOURLY,
    DAILY
}
