package com.health.checker.report;

import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerFailure;
import com.health.checker.core.model.CheckerRun;

import java.util.List;

/**
 * One run with its checker and failures.
 *
 * @param dataKeys keys of the first failure's data, used as table columns; empty when it has none
 */
public record RunDetail(Checker checker, CheckerRun run, List<CheckerFailure> failures, List<String> dataKeys) {

    public RunDetail {
        failures = List.copyOf(failures);
        dataKeys = List.copyOf(dataKeys);
    }
}
