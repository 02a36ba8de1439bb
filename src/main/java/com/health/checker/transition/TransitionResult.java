package com.health.checker.transition;

import com.health.checker.core.model.CheckerStatus;

/**
 * Outcome of applying a run to a checker's status.
 *
 * @param previousStatus status before the run was applied
 * @param newStatus      status after the run was applied; equal to previous when unchanged
 * @param changed        whether a status change, and therefore a transition row, happened
 */
public record TransitionResult(CheckerStatus previousStatus, CheckerStatus newStatus, boolean changed) {

    public static TransitionResult unchanged(CheckerStatus status) {
        return new TransitionResult(status, status, false);
    }
}
