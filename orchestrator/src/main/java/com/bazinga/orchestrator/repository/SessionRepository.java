package com.bazinga.orchestrator.repository;

import com.bazinga.orchestrator.model.Session;
import com.bazinga.orchestrator.model.SessionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + recovery queries for the sessions table.
 */
public interface SessionRepository extends JpaRepository<Session, UUID> {

    /** Sessions in a given status (recovery after restart). */
    List<Session> findByStatus(SessionStatus status);

    /**
     * Load a session row with SELECT FOR UPDATE.
     * Serialises completion claims so only one validation runs per attempt.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Session s WHERE s.id = :id")
    Optional<Session> lockById(@Param("id") UUID id);
}
