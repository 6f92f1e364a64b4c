package com.bazinga.orchestrator.worker;

import java.util.List;

/**
 * Structured result of an implement dispatch.
 */
public record ImplementResult(
        Status       status,
        List<String> filesChanged,
        int          testsRun,
        int          testsPassed,
        String       detail
) {
    public enum Status { COMPLETE, BLOCKED }

    public ImplementResult {
        filesChanged = filesChanged == null ? List.of() : List.copyOf(filesChanged);
    }

    public static ImplementResult complete(List<String> filesChanged, int testsRun, int testsPassed) {
        return new ImplementResult(Status.COMPLETE, filesChanged, testsRun, testsPassed, null);
    }
}
