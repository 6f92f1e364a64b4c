package com.bazinga.orchestrator.model;

/**
 * How much independent verification a session asks for.
 *
 * FULL runs the verify stage between implement and review.
 * MINIMAL and DISABLED go straight from implement to review.
 */
public enum TestingMode {
    FULL,
    MINIMAL,
    DISABLED;

    public boolean runsVerification() {
        return this == FULL;
    }
}
