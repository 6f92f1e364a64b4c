package com.bazinga.orchestrator.repository;

import com.bazinga.orchestrator.model.MergeAttempt;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface MergeAttemptRepository extends JpaRepository<MergeAttempt, UUID> {

    long countByTaskGroupId(UUID taskGroupId);

    List<MergeAttempt> findByTaskGroupIdOrderByAttemptNumberAsc(UUID taskGroupId);
}
