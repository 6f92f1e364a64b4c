package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.model.EventType;
import com.bazinga.orchestrator.model.OrchestrationEvent;
import com.bazinga.orchestrator.repository.OrchestrationEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit trail of everything the engine decides.
 *
 * Joins the caller's transaction, so an event is committed together with
 * the state change it describes.
 */
@Component
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final OrchestrationEventRepository eventRepo;
    private final ObjectMapper                 objectMapper;

    public EventLog(OrchestrationEventRepository eventRepo, ObjectMapper objectMapper) {
        this.eventRepo    = eventRepo;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public OrchestrationEvent record(EventType type, UUID sessionId, UUID taskGroupId, Map<String, ?> detail) {
        OrchestrationEvent event = eventRepo.save(
                new OrchestrationEvent(sessionId, taskGroupId, type, encode(detail)));
        log.debug("Event {} session={} group={} {}", type, sessionId, taskGroupId, detail);
        return event;
    }

    @Transactional(readOnly = true)
    public List<OrchestrationEvent> forSession(UUID sessionId) {
        return eventRepo.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }

    private String encode(Map<String, ?> detail) {
        if (detail == null || detail.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(detail);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event detail is not serialisable: " + detail, e);
        }
    }
}
