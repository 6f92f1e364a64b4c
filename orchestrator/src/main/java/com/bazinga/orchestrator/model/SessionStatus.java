package com.bazinga.orchestrator.model;

/**
 * Lifecycle of a Session.
 *
 * Transitions:
 *   ACTIVE → COMPLETED  (only with a recorded ACCEPT verdict)
 *   ACTIVE → FAILED     (every group terminal, at least one halted)
 */
public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    FAILED
}
