package com.health.checker.override;

import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerFailure;
import com.health.checker.core.model.CheckerOverride;
import com.health.checker.store.CheckerStore;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides whether a failure is suppressed by an operator override.
 *
 * <p>A failure is suppressed when the data of an override scoped to its checker, or of a
 * global override, is a subset of the failure's data: every override key is present in the
 * failure with an equal value. Extra failure keys are ignored.</p>
 *
 * <p>Failures without data are never suppressed. Override data is not validated, so an
 * override with empty data suppresses every failure that carries any data; keeping such
 * overrides out of the store is the caller's job.</p>
 */
public class OverrideMatcher {

    private final CheckerStore store;

    public OverrideMatcher(CheckerStore store) {
        this.store = store;
    }

    /**
     * Returns true if the failure matches a scoped or global override for the checker.
     * Scoped overrides are consulted first.
     */
    public boolean isSuppressed(CheckerFailure failure, Checker checker) {
        if (!failure.hasData()) {
            return false;
        }
        if (checker.isPersisted() && anyMatches(store.findOverridesForChecker(checker.getId()), failure)) {
            return true;
        }
        return anyMatches(store.findGlobalOverrides(), failure);
    }

    /**
     * Returns true if every entry of {@code overrideData} appears with an equal value in
     * {@code failureData}.
     */
    public static boolean matches(Map<String, Object> overrideData, Map<String, Object> failureData) {
        for (Map.Entry<String, Object> entry : overrideData.entrySet()) {
            if (!failureData.containsKey(entry.getKey())
                    || !Objects.equals(entry.getValue(), failureData.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean anyMatches(List<CheckerOverride> overrides, CheckerFailure failure) {
        for (CheckerOverride override : overrides) {
            if (matches(override.data(), failure.data())) {
                return true;
            }
        }
        return false;
    }
}
