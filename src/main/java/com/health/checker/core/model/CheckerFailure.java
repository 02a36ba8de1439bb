package com.health.checker.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One violation reported by a check.
 *
 * <p>Check functions create failures with {@link #of(String)} or
 * {@link #of(String, String, Map)}; the store assigns {@code id} and {@code checkerRunId}
 * when the failures of a {@link RunStatus#FAILED} run are persisted.</p>
 *
 * @param data flat attribute map used for override matching; null when the failure carries none
 */
public record CheckerFailure(
        String id,
        String checkerRunId,
        String text,
        String subtext,
        Map<String, Object> data,
        Instant creationDate
) {
    public CheckerFailure {
        Objects.requireNonNull(text, "text is required");
        subtext = subtext != null ? subtext : "";
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : null;
        creationDate = creationDate != null ? creationDate : Instant.now();
    }

    public static CheckerFailure of(String text) {
        return new CheckerFailure(null, null, text, "", null, null);
    }

    public static CheckerFailure of(String text, String subtext) {
        return new CheckerFailure(null, null, text, subtext, null, null);
    }

    public static CheckerFailure of(String text, String subtext, Map<String, Object> data) {
        return new CheckerFailure(null, null, text, subtext, data, null);
    }

    /**
     * Returns the persisted form of this failure, bound to the given run.
     */
    public CheckerFailure attach(String id, String runId) {
        return new CheckerFailure(id, runId, text, subtext, data, creationDate);
    }

    public boolean hasData() {
        return data != null && !data.isEmpty();
    }
}
