package com.bazinga.orchestrator.repository;

import com.bazinga.orchestrator.model.ValidatorVerdict;
import com.bazinga.orchestrator.model.VerdictKind;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ValidatorVerdictRepository extends JpaRepository<ValidatorVerdict, UUID> {

    List<ValidatorVerdict> findBySessionIdOrderByCheckedAtAsc(UUID sessionId);

    Optional<ValidatorVerdict> findFirstBySessionIdOrderByAttemptDesc(UUID sessionId);

    boolean existsBySessionIdAndVerdict(UUID sessionId, VerdictKind verdict);
}
