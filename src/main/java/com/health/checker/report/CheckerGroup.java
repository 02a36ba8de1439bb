package com.health.checker.report;

import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerStatus;

import java.util.List;

/**
 * Checkers sharing one status, most recently changed first.
 */
public record CheckerGroup(CheckerStatus status, List<Checker> checkers) {

    public CheckerGroup {
        checkers = List.copyOf(checkers);
    }
}
