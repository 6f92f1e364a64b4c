package com.bazinga.orchestrator.worker;

import java.util.List;
import java.util.UUID;

/**
 * Request sent to the validator: re-check these criteria from scratch.
 */
public record ValidationRequest(UUID sessionId, int attempt, List<Criterion> criteria) {

    /** taskGroupId is null for session-wide criteria. */
    public record Criterion(UUID criterionId, UUID taskGroupId, String description) {}

    public ValidationRequest {
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
    }
}
