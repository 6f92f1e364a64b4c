package com.bazinga.orchestrator.model;

public enum CriterionStatus {
    PENDING,
    MET,
    UNMET
}
