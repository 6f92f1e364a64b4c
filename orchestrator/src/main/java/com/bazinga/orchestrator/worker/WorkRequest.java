package com.bazinga.orchestrator.worker;

import com.bazinga.orchestrator.model.Stage;
import com.bazinga.orchestrator.model.WorkerTier;

import java.util.List;
import java.util.UUID;

/**
 * Request body sent to every task-group worker (implement, verify,
 * review, merge).
 */
public record WorkRequest(
        UUID              taskGroupId,
        Stage             stage,
        WorkerTier        tier,
        String            description,
        String            branchRef,
        List<IssueReport> priorIssues,
        List<ContextItem> contextBundle
) {
    public WorkRequest {
        priorIssues   = priorIssues   == null ? List.of() : List.copyOf(priorIssues);
        contextBundle = contextBundle == null ? List.of() : List.copyOf(contextBundle);
    }
}
