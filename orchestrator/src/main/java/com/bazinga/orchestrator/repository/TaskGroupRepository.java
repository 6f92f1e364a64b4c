package com.bazinga.orchestrator.repository;

import com.bazinga.orchestrator.model.TaskGroup;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + per-key locking for the task_groups table.
 */
public interface TaskGroupRepository extends JpaRepository<TaskGroup, UUID> {

    /**
     * Load one task group with SELECT FOR UPDATE.
     *
     * Every state transition goes through this inside a transaction, so two
     * transitions on the same group serialise while different groups never
     * contend. Must be called from a @Transactional method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM TaskGroup g WHERE g.id = :id")
    Optional<TaskGroup> lockById(@Param("id") UUID id);

    List<TaskGroup> findBySessionIdOrderByCreatedAtAsc(UUID sessionId);

    /** Groups whose dispatch hold survived a crash of the owning process. */
    List<TaskGroup> findByDispatchHolderIsNotNull();
}
