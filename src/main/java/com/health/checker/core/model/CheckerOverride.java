package com.health.checker.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Operator-defined suppression rule. A failure whose data contains every key/value of
 * {@code data} is dropped instead of being reported.
 *
 * <p>Either scoped to one checker or global ({@code applyToAllCheckers}). Overrides never
 * expire; they are deleted manually.</p>
 */
public record CheckerOverride(
        String id,
        String checkerId,
        boolean applyToAllCheckers,
        Map<String, Object> data,
        String note,
        String user,
        Instant creationDate
) {
    public CheckerOverride {
        Objects.requireNonNull(id, "id is required");
        if (!applyToAllCheckers && checkerId == null) {
            throw new IllegalArgumentException("checkerId is required unless applyToAllCheckers is set");
        }
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
        note = note != null ? note : "";
        creationDate = creationDate != null ? creationDate : Instant.now();
    }

    public static CheckerOverride forChecker(String checkerId, Map<String, Object> data, String note, String user) {
        return new CheckerOverride(UUID.randomUUID().toString(), checkerId, false, data, note, user, null);
    }

    public static CheckerOverride global(Map<String, Object> data, String note, String user) {
        return new CheckerOverride(UUID.randomUUID().toString(), null, true, data, note, user, null);
    }
}
