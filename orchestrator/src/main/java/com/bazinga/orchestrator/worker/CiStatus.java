package com.bazinga.orchestrator.worker;

/** Status of the external CI check for an integrated branch. */
public enum CiStatus {
    PENDING,
    SUCCESS,
    FAILURE
}
