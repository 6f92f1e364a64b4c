package com.bazinga.orchestrator.worker;

import java.util.List;

/**
 * Structured result of a verify dispatch. failures is empty when PASSED.
 */
public record VerifyResult(Status status, List<IssueReport> failures) {

    public enum Status { PASSED, FAILED }

    public VerifyResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static VerifyResult passed() {
        return new VerifyResult(Status.PASSED, List.of());
    }
}
