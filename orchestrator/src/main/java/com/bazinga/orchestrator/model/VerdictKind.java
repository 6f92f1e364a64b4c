package com.bazinga.orchestrator.model;

public enum VerdictKind {
    ACCEPT,
    REJECT
}
