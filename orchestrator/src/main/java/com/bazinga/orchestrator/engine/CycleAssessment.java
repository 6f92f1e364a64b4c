package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.worker.IssueReport;

import java.util.List;

/**
 * What one recorded review cycle means for the feedback loop.
 *
 * @param outstanding every issue the reviewer still reports, regressions included
 * @param regressions reported issues whose root cause was resolved in an earlier cycle
 * @param approved    APPROVED verdict with no blocking issue outstanding
 */
public record CycleAssessment(
        int               iteration,
        int               issuesFixed,
        List<IssueReport> outstanding,
        int               blockingCount,
        List<IssueReport> regressions,
        boolean           approved,
        int               noProgressCount) {

    public CycleAssessment {
        outstanding = List.copyOf(outstanding);
        regressions = List.copyOf(regressions);
    }

    public boolean hasRegressions() {
        return !regressions.isEmpty();
    }
}
