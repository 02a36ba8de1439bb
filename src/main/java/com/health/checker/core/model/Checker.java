package com.health.checker.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Persistent monitoring entity aggregating the run history of one registered check.
 * Created lazily the first time a registered name runs.
 *
 * <p>Instances are mutable working copies: changes become visible to other readers only
 * once handed back to the store.</p>
 */
public class Checker {

    private final String id;
    private final String name;
    private final String section;
    private final Instant creationDate;
    private String description;
    private String owner;
    private Severity severity;
    private Cadence cadence;
    private CheckerStatus status;
    private Instant latestStatusChange;
    private Instant latestRunDate;

    private Checker(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.section = builder.section != null ? builder.section : "";
        this.creationDate = builder.creationDate != null ? builder.creationDate : Instant.now();
        this.description = builder.description != null ? builder.description : "";
        this.owner = builder.owner;
        this.severity = builder.severity != null ? builder.severity : Severity.LOW;
        this.cadence = builder.cadence != null ? builder.cadence : Cadence.HOURLY;
        this.status = builder.status != null ? builder.status : CheckerStatus.NEW;
        this.latestStatusChange = builder.latestStatusChange;
        this.latestRunDate = builder.latestRunDate;
    }

    /**
     * Returns the store-assigned id, or null for a checker that has never been persisted.
     */
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getSection() {
        return section;
    }

    public Instant getCreationDate() {
        return creationDate;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /**
     * Returns the e-mail address of the operator responsible for this checker, if any.
     */
    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = Objects.requireNonNull(severity, "severity is required");
    }

    public Cadence getCadence() {
        return cadence;
    }

    public void setCadence(Cadence cadence) {
        this.cadence = Objects.requireNonNull(cadence, "cadence is required");
    }

    public CheckerStatus getStatus() {
        return status;
    }

    public void setStatus(CheckerStatus status) {
        this.status = Objects.requireNonNull(status, "status is required");
    }

    public Instant getLatestStatusChange() {
        return latestStatusChange;
    }

    public void setLatestStatusChange(Instant latestStatusChange) {
        this.latestStatusChange = latestStatusChange;
    }

    public Instant getLatestRunDate() {
        return latestRunDate;
    }

    public void setLatestRunDate(Instant latestRunDate) {
        this.latestRunDate = latestRunDate;
    }

    public boolean isPersisted() {
        return id != null;
    }

    public boolean isIgnored() {
        return status == CheckerStatus.IGNORED;
    }

    /**
     * Returns an independent copy carrying the given id.
     */
    public Checker withId(String id) {
        return toBuilder().id(id).build();
    }

    public Checker copy() {
        return toBuilder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .section(section)
                .creationDate(creationDate)
                .description(description)
                .owner(owner)
                .severity(severity)
                .cadence(cadence)
                .status(status)
                .latestStatusChange(latestStatusChange)
                .latestRunDate(latestRunDate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Checker that = (Checker) o;
        return Objects.equals(id, that.id) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "Checker{" +
                "name='" + name + '\'' +
                ", section='" + section + '\'' +
                ", severity=" + severity +
                ", cadence=" + cadence +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String section;
        private Instant creationDate;
        private String description;
        private String owner;
        private Severity severity;
        private Cadence cadence;
        private CheckerStatus status;
        private Instant latestStatusChange;
        private Instant latestRunDate;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder section(String section) {
            this.section = section;
            return this;
        }

        public Builder creationDate(Instant creationDate) {
            this.creationDate = creationDate;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
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

        public Builder status(CheckerStatus status) {
            this.status = status;
            return this;
        }

        public Builder latestStatusChange(Instant latestStatusChange) {
            this.latestStatusChange = latestStatusChange;
            return this;
        }

        public Builder latestRunDate(Instant latestRunDate) {
            this.latestRunDate = latestRunDate;
            return this;
        }

        public Checker build() {
            return new Checker(this);
        }
    }
}
