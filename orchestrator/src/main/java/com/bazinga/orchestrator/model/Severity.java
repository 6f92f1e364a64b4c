package com.bazinga.orchestrator.model;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
