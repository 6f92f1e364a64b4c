package com.bazinga.orchestrator.api.dto;

import com.bazinga.orchestrator.model.EventType;
import com.bazinga.orchestrator.model.OrchestrationEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of GET /sessions/{id}/events. detail is the raw JSON recorded
 * with the event.
 */
public record EventResponse(UUID id, UUID taskGroupId, EventType type, String detail, Instant createdAt) {

    public static EventResponse from(OrchestrationEvent e) {
        return new EventResponse(e.getId(), e.getTaskGroupId(), e.getType(), e.getDetail(), e.getCreatedAt());
    }
}
