package com.bazinga.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a TaskGroup.
 *
 * Transitions:
 *   PENDING                → IN_PROGRESS             (dispatch)
 *   IN_PROGRESS            → APPROVED_PENDING_MERGE  (approved, no blocking issues)
 *   IN_PROGRESS            → FAILED                  (escalation halt)
 *   APPROVED_PENDING_MERGE → MERGING                 (merge accepted for integration)
 *   MERGING                → COMPLETED               (merged, post-merge checks pass)
 *   MERGING                → IN_PROGRESS             (conflict / test failure)
 *   MERGING                → FAILED                  (escalation halt)
 *   COMPLETED              → IN_PROGRESS             (validator reopened the group)
 *
 * FAILED is terminal.
 */
public enum TaskGroupStatus {
    PENDING,
    IN_PROGRESS,
    APPROVED_PENDING_MERGE,
    MERGING,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(TaskGroupStatus next) {
        return switch (this) {
            case PENDING                -> next == IN_PROGRESS;
            case IN_PROGRESS            -> next == APPROVED_PENDING_MERGE || next == FAILED;
            case APPROVED_PENDING_MERGE -> next == MERGING;
            case MERGING                -> next == COMPLETED || next == IN_PROGRESS || next == FAILED;
            case COMPLETED              -> next == IN_PROGRESS;
            case FAILED                 -> false;
        };
    }

    /** Stages a group may hold while in this status. */
    public Set<Stage> admittedStages() {
        return switch (this) {
            case IN_PROGRESS -> Stage.inProgressStages();
            case MERGING     -> EnumSet.of(Stage.MERGE);
            default          -> EnumSet.of(Stage.NONE);
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
