package com.health.checker.registry;

import com.health.checker.core.model.RegisteredChecker;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when two registrations share a name. Raised once at registry build time,
 * listing every duplicate found.
 */
public class DuplicateCheckerException extends RuntimeException {

    private final List<RegisteredChecker> duplicates;

    public DuplicateCheckerException(List<RegisteredChecker> duplicates) {
        super(duplicates.stream()
                .map(d -> "Duplicate checker '" + d.name() + "' found in " + d.section())
                .collect(Collectors.joining("; ")));
        this.duplicates = List.copyOf(duplicates);
    }

    public List<RegisteredChecker> getDuplicates() {
        return duplicates;
    }
}
