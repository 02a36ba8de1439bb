package com.health.checker.core.model;

/**
 * Escalation tier of a checker. {@link #HIGH} checkers page the on-call address
 * in addition to the regular notifications.
 */
public enum Severity {
    LOW,
    HIGH
}
