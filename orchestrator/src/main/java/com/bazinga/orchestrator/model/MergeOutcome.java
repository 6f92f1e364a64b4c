package com.bazinga.orchestrator.model;

/**
 * Closed set of merge worker outcomes.
 *
 * CONFLICT and TEST_FAILURE are content failures and count toward the
 * merge escalation counter. BLOCKED is environmental and does not.
 */
public enum MergeOutcome {
    SUCCESS,
    CONFLICT,
    TEST_FAILURE,
    BLOCKED
}
