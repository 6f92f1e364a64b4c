package com.bazinga.orchestrator.worker;

import java.util.List;

/**
 * Result of the verification run right after a successful integration.
 *
 * CHANGE_FAILURE: failures attributable to the merged change.
 * UNRELATED_FAILURE: failures in pre-existing state; the merge stands.
 */
public record PostMergeResult(Status status, List<String> failingTests) {

    public enum Status { PASSED, CHANGE_FAILURE, UNRELATED_FAILURE }

    public PostMergeResult {
        failingTests = failingTests == null ? List.of() : List.copyOf(failingTests);
    }

    public static PostMergeResult passed() {
        return new PostMergeResult(Status.PASSED, List.of());
    }
}
