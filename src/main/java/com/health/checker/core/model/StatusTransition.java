package com.health.checker.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only log row recording one actual change of a checker's status.
 */
public record StatusTransition(
        String id,
        String checkerId,
        CheckerStatus oldValue,
        CheckerStatus newValue,
        Instant creationDate
) {
    public StatusTransition {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(checkerId, "checkerId is required");
        Objects.requireNonNull(newValue, "newValue is required");
        Objects.requireNonNull(creationDate, "creationDate is required");
        if (oldValue == newValue) {
            throw new IllegalArgumentException("A transition must change the status, got " + newValue);
        }
    }

    public static StatusTransition of(String checkerId, CheckerStatus oldValue, CheckerStatus newValue, Instant at) {
        return new StatusTransition(UUID.randomUUID().toString(), checkerId, oldValue, newValue, at);
    }

    @Override
    public String toString() {
        return id + ": " + oldValue + " -> " + newValue;
    }
}
