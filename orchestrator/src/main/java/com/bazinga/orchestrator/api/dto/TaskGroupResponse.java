package com.bazinga.orchestrator.api.dto;

import com.bazinga.orchestrator.model.Stage;
import com.bazinga.orchestrator.model.TaskGroup;
import com.bazinga.orchestrator.model.TaskGroupStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a task group returned by GET /sessions/{id}/task-groups
 * and GET /task-groups/{id}.
 */
public record TaskGroupResponse(
        UUID            id,
        UUID            sessionId,
        String          description,
        TaskGroupStatus status,
        Stage           currentStage,
        String          assignedWorkerId,
        String          branchRef,
        int             reviewIteration,
        int             noProgressCount,
        int             blockingIssueCount,
        int             escalationTier,
        int             mergeAttemptCount,
        String          haltReason,
        Instant         createdAt,
        Instant         updatedAt
) {
    public static TaskGroupResponse from(TaskGroup g) {
        return new TaskGroupResponse(
                g.getId(),
                g.getSessionId(),
                g.getDescription(),
                g.getStatus(),
                g.getCurrentStage(),
                g.getAssignedWorkerId(),
                g.getBranchRef(),
                g.getReviewIteration(),
                g.getNoProgressCount(),
                g.getBlockingIssueCount(),
                g.getEscalationTier(),
                g.getMergeAttemptCount(),
                g.getHaltReason(),
                g.getCreatedAt(),
                g.getUpdatedAt()
        );
    }
}
