package com.health.checker.core.model;

/**
 * The predicate behind a registered checker.
 *
 * <p>Returning {@code null} is equivalent to {@link CheckResult#success()}. Any exception
 * thrown ends the run as {@link RunStatus#ERRORED} without further retries.</p>
 */
@FunctionalInterface
public interface CheckFunction {

    CheckResult check() throws Exception;
}
