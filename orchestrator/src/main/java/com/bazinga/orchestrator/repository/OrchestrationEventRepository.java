package com.bazinga.orchestrator.repository;

import com.bazinga.orchestrator.model.EventType;
import com.bazinga.orchestrator.model.OrchestrationEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface OrchestrationEventRepository extends JpaRepository<OrchestrationEvent, UUID> {

    List<OrchestrationEvent> findBySessionIdOrderByCreatedAtAsc(UUID sessionId);

    List<OrchestrationEvent> findByTaskGroupIdAndType(UUID taskGroupId, EventType type);
}
