package com.bazinga.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable fact in the orchestration audit log.
 *
 * DB table: orchestration_events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "orchestration_events")
public class OrchestrationEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "task_group_id", updatable = false)
    private UUID taskGroupId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private EventType type;

    // JSON object with event-specific fields.
    @Column(columnDefinition = "TEXT", updatable = false)
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected OrchestrationEvent() {}   // required by JPA

    public OrchestrationEvent(UUID sessionId, UUID taskGroupId, EventType type, String detail) {
        this.sessionId   = sessionId;
        this.taskGroupId = taskGroupId;
        this.type        = type;
        this.detail      = detail;
    }

    public UUID      getId()          { return id; }
    public UUID      getSessionId()   { return sessionId; }
    public UUID      getTaskGroupId() { return taskGroupId; }
    public EventType getType()        { return type; }
    public String    getDetail()      { return detail; }
    public Instant   getCreatedAt()   { return createdAt; }
}
