package com.bazinga.orchestrator.model;

/**
 * Types of facts recorded in the append-only orchestration event log.
 */
public enum EventType {
    // Session lifecycle
    SESSION_CREATED,
    SESSION_COMPLETED,
    SESSION_FAILED,

    // Task group lifecycle
    STATUS_CHANGED,
    STAGE_ADVANCED,
    FEEDBACK_UPDATED,

    // Review loop
    REVIEW_CYCLE_RECORDED,
    VERIFICATION_FAILED,
    ISSUE_REGRESSION,
    ESCALATED,
    HALTED,

    // Worker dispatch
    WORKER_TIMEOUT,
    WORKER_PROTOCOL_ERROR,
    WORKER_FAILED,
    DISPATCH_ORPHANED,

    // Merge
    MERGE_ATTEMPTED,
    MERGE_ABORT_FAILED,
    CI_POLL_TIMEOUT,

    // Completion
    READY_FOR_VALIDATION,
    VALIDATION_ACCEPTED,
    VALIDATION_REJECTED,
    VALIDATION_DEFERRED,
    TASK_GROUP_REOPENED
}
