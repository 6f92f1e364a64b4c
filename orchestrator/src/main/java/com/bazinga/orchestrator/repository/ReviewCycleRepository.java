package com.bazinga.orchestrator.repository;

import com.bazinga.orchestrator.model.ReviewCycle;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReviewCycleRepository extends JpaRepository<ReviewCycle, UUID> {

    Optional<ReviewCycle> findFirstByTaskGroupIdOrderByIterationDesc(UUID taskGroupId);

    List<ReviewCycle> findByTaskGroupIdOrderByIterationAsc(UUID taskGroupId);
}
