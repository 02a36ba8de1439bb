package com.health.checker.report;

import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerFailure;
import com.health.checker.core.model.CheckerRun;

import java.util.List;

/**
 * A FAILING checker together with the failures of its latest run.
 */
public record FailingChecker(Checker checker, CheckerRun latestRun, List<CheckerFailure> failures) {

    public FailingChecker {
        failures = List.copyOf(failures);
    }
}
