package com.bazinga.orchestrator.api.dto;

import com.bazinga.orchestrator.engine.SessionPlan;
import com.bazinga.orchestrator.model.TestingMode;

import java.util.List;

/**
 * Request body for POST /sessions.
 *
 * Required: taskGroups (at least one, each with a description)
 * Optional: initialBranchRef (default "main"), testingMode (default FULL),
 *           per-group successCriteria, session-wide sessionCriteria
 */
public record CreateSessionRequest(
        String                  request,
        String                  initialBranchRef,
        TestingMode             testingMode,
        List<TaskGroupSpec>     taskGroups,
        List<String>            sessionCriteria
) {
    public record TaskGroupSpec(String description, String branchRef, List<String> successCriteria) {}

    public SessionPlan toPlan() {
        List<SessionPlan.TaskGroupPlan> groups = taskGroups == null ? List.of() : taskGroups.stream()
                .map(g -> new SessionPlan.TaskGroupPlan(g.description(), g.branchRef(), g.successCriteria()))
                .toList();
        return new SessionPlan(request, initialBranchRef, testingMode, groups, sessionCriteria);
    }
}
