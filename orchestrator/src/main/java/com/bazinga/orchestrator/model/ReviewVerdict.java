package com.bazinga.orchestrator.model;

/** Closed set of review worker verdicts. */
public enum ReviewVerdict {
    APPROVED,
    CHANGES_REQUESTED
}
