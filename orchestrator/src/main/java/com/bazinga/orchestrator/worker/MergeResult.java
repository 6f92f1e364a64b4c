package com.bazinga.orchestrator.worker;

import com.bazinga.orchestrator.model.MergeOutcome;

import java.util.List;

/**
 * Structured result of a merge dispatch.
 *
 * conflictingFiles is filled for CONFLICT, failingTests for TEST_FAILURE.
 */
public record MergeResult(
        MergeOutcome outcome,
        List<String> conflictingFiles,
        List<String> failingTests,
        String       detail
) {
    public MergeResult {
        conflictingFiles = conflictingFiles == null ? List.of() : List.copyOf(conflictingFiles);
        failingTests     = failingTests     == null ? List.of() : List.copyOf(failingTests);
    }

    public static MergeResult success() {
        return new MergeResult(MergeOutcome.SUCCESS, List.of(), List.of(), null);
    }

    public static MergeResult conflict(List<String> files) {
        return new MergeResult(MergeOutcome.CONFLICT, files, List.of(), null);
    }

    public static MergeResult testFailure(List<String> tests) {
        return new MergeResult(MergeOutcome.TEST_FAILURE, List.of(), tests, null);
    }

    public static MergeResult blocked(String detail) {
        return new MergeResult(MergeOutcome.BLOCKED, List.of(), List.of(), detail);
    }
}
