package com.bazinga.orchestrator.api.dto;

import com.bazinga.orchestrator.model.Session;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /sessions.
 */
public record SessionResponse(
        UUID    id,
        String  status,
        String  testingMode,
        String  initialBranchRef,
        int     completionAttempt,
        Instant startedAt,
        Instant endedAt
) {
    public static SessionResponse from(Session s) {
        return new SessionResponse(
                s.getId(),
                s.getStatus().name(),
                s.getTestingMode().name(),
                s.getInitialBranchRef(),
                s.getCompletionAttempt(),
                s.getStartedAt(),
                s.getEndedAt()
        );
    }
}
