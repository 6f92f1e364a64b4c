package com.bazinga.orchestrator.repository;

import com.bazinga.orchestrator.model.SuccessCriterion;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SuccessCriterionRepository extends JpaRepository<SuccessCriterion, UUID> {

    List<SuccessCriterion> findBySessionId(UUID sessionId);

    List<SuccessCriterion> findByTaskGroupId(UUID taskGroupId);
}
