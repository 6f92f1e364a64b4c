package com.bazinga.orchestrator.api.dto;

import com.bazinga.orchestrator.model.MergeAttempt;
import com.bazinga.orchestrator.model.MergeOutcome;

import java.time.Instant;

public record MergeAttemptResponse(
        int          attemptNumber,
        MergeOutcome outcome,
        int          ciPollCount,
        boolean      ciWarning,
        long         durationMs,
        String       detail,
        Instant      createdAt
) {
    public static MergeAttemptResponse from(MergeAttempt a) {
        return new MergeAttemptResponse(a.getAttemptNumber(), a.getOutcome(), a.getCiPollCount(),
                a.isCiWarning(), a.getDurationMs(), a.getDetail(), a.getCreatedAt());
    }
}
