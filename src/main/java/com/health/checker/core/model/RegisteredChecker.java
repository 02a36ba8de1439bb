package com.health.checker.core.model;

import java.util.Objects;

/**
 * Configuration of one check as registered at process start. Not persisted.
 *
 * @param name        unique identifier
 * @param section     grouping label
 * @param description free-form description, copied to the persistent checker on each run
 * @param tries       retry budget per invocation, at least 1
 * @param severity    escalation tier
 * @param cadence     execution frequency class
 * @param function    the check itself
 */
public record RegisteredChecker(
        String name,
        String section,
        String description,
        int tries,
        Severity severity,
        Cadence cadence,
        CheckFunction function
) {
    public RegisteredChecker {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (tries < 1) {
            throw new IllegalArgumentException("tries must be >= 1, got " + tries + " for " + name);
        }
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(cadence, "cadence is required");
        Objects.requireNonNull(function, "function is required");
        section = section != null ? section : "";
        description = description != null ? description : "";
    }

    public static Builder builder(String name, CheckFunction function) {
        return new Builder(name, function);
    }

    public static class Builder {
        private final String name;
        private final CheckFunction function;
        private String section = "";
        private String description = "";
        private int tries = 1;
        private Severity severity = Severity.LOW;
        private Cadence cadence = Cadence.HOURLY;

        private Builder(String name, CheckFunction function) {
            this.name = name;
            this.function = function;
        }

        public Builder section(String section) {
            this.section = section;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tries(int tries) {
            this.tries = tries;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder cadence(Cadence cadence) {
            this.cadence = cadence;
            return this;
        }

        public RegisteredChecker build() {
            return new RegisteredChecker(name, section, description, tries, severity, cadence, function);
        }
    }
}
