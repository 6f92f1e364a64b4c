package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.config.EngineProperties;
import com.bazinga.orchestrator.model.CriterionStatus;
import com.bazinga.orchestrator.model.EventType;
import com.bazinga.orchestrator.model.Session;
import com.bazinga.orchestrator.model.SuccessCriterion;
import com.bazinga.orchestrator.model.TaskGroup;
import com.bazinga.orchestrator.model.TaskGroupStatus;
import com.bazinga.orchestrator.model.ValidatorVerdict;
import com.bazinga.orchestrator.model.VerdictKind;
import com.bazinga.orchestrator.repository.SessionRepository;
import com.bazinga.orchestrator.repository.SuccessCriterionRepository;
import com.bazinga.orchestrator.repository.TaskGroupRepository;
import com.bazinga.orchestrator.repository.ValidatorVerdictRepository;
import com.bazinga.orchestrator.worker.IssueReport;
import com.bazinga.orchestrator.worker.ValidationRequest;
import com.bazinga.orchestrator.worker.ValidationResult;
import com.bazinga.orchestrator.worker.WorkerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Independent final check of a session that claims completion.
 *
 * Every success criterion is re-checked by the validator from scratch;
 * statuses recorded earlier are not trusted. ACCEPT closes the session,
 * REJECT reopens the task groups whose criteria failed, with the
 * validator's findings as their next issue set.
 *
 * Only {@link SessionManager} calls this, after it has started a
 * completion attempt.
 */
@Service
public class ValidatorGate {

    private static final Logger log = LoggerFactory.getLogger(ValidatorGate.class);

    private final SessionRepository          sessionRepo;
    private final TaskGroupRepository        groupRepo;
    private final SuccessCriterionRepository criterionRepo;
    private final ValidatorVerdictRepository verdictRepo;
    private final TaskGroupStateMachine      stateMachine;
    private final WorkerDispatcher           dispatcher;
    private final WorkerGateway              gateway;
    private final EventLog                   eventLog;
    private final TransactionTemplate        tx;
    private final EngineProperties           properties;

    public ValidatorGate(SessionRepository sessionRepo,
                         TaskGroupRepository groupRepo,
                         SuccessCriterionRepository criterionRepo,
                         ValidatorVerdictRepository verdictRepo,
                         TaskGroupStateMachine stateMachine,
                         WorkerDispatcher dispatcher,
                         WorkerGateway gateway,
                         EventLog eventLog,
                         PlatformTransactionManager transactionManager,
                         EngineProperties properties) {
        this.sessionRepo   = sessionRepo;
        this.groupRepo     = groupRepo;
        this.criterionRepo = criterionRepo;
        this.verdictRepo   = verdictRepo;
        this.stateMachine  = stateMachine;
        this.dispatcher    = dispatcher;
        this.gateway       = gateway;
        this.eventLog      = eventLog;
        this.tx            = new TransactionTemplate(transactionManager);
        this.properties    = properties;
    }

    /**
     * Validate completion attempt {@code attempt} of a session.
     *
     * @throws IllegalStateException if any task group is not COMPLETED
     */
    public GateResult validate(UUID sessionId, int attempt) {
        List<TaskGroup> groups = groupRepo.findBySessionIdOrderByCreatedAtAsc(sessionId);
        List<TaskGroup> notDone = groups.stream()
                .filter(g -> g.getStatus() != TaskGroupStatus.COMPLETED)
                .toList();
        if (!notDone.isEmpty()) {
            throw new IllegalStateException("Session " + sessionId + " has " + notDone.size()
                    + " task group(s) not completed; validation refused");
        }

        List<SuccessCriterion> criteria = criterionRepo.findBySessionId(sessionId);
        ValidationRequest request = new ValidationRequest(sessionId, attempt, criteria.stream()
                .map(c -> new ValidationRequest.Criterion(c.getId(), c.getTaskGroupId(), c.getCriterion()))
                .toList());

        log.info("Validating session {} attempt {} against {} criteria", sessionId, attempt, criteria.size());
        DispatchResult<ValidationResult> result = dispatcher.await("validate",
                properties.dispatch().validatorTimeout(), () -> gateway.validate(request));

        if (!result.completed()) {
            tx.executeWithoutResult(status -> {
                sessionRepo.lockById(sessionId).ifPresent(Session::endValidation);
                eventLog.record(EventType.VALIDATION_DEFERRED, sessionId, null, Map.of(
                        "attempt", attempt,
                        "reason", String.valueOf(result.detail())));
            });
            log.warn("Validator unavailable for session {} attempt {}: {}", sessionId, attempt, result.detail());
            return GateResult.deferred();
        }

        List<SuccessCriterion> failing = tx.execute(status -> recordChecks(sessionId, result.value()));
        if (failing.isEmpty()) {
            boolean accepted = Boolean.TRUE.equals(tx.execute(status -> accept(sessionId, attempt, criteria.size())));
            return accepted ? new GateResult(VerdictKind.ACCEPT, List.of()) : GateResult.deferred();
        }
        return reject(sessionId, attempt, groups, failing);
    }

    /** Store each criterion's fresh status. Returns the required criteria that are not met. */
    private List<SuccessCriterion> recordChecks(UUID sessionId, ValidationResult result) {
        Map<UUID, ValidationResult.CriterionCheck> checks = result.checks().stream()
                .collect(Collectors.toMap(ValidationResult.CriterionCheck::criterionId,
                        Function.identity(), (a, b) -> b));

        List<SuccessCriterion> failing = new ArrayList<>();
        for (SuccessCriterion criterion : criterionRepo.findBySessionId(sessionId)) {
            ValidationResult.CriterionCheck check = checks.get(criterion.getId());
            if (check == null) {
                criterion.recordCheck(CriterionStatus.UNMET, "not checked by validator");
            } else {
                criterion.recordCheck(check.status(), check.evidence());
            }
            if (criterion.isRequiredForCompletion() && criterion.getStatus() != CriterionStatus.MET) {
                failing.add(criterion);
            }
        }
        return failing;
    }

    /**
     * Record ACCEPT and close the session, unless a task group left COMPLETED
     * while the validator was running. Group statuses are re-read under the
     * session lock, which a reject holds while it reopens groups.
     */
    private boolean accept(UUID sessionId, int attempt, int criteriaChecked) {
        Session session = sessionRepo.lockById(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Session not found: " + sessionId));
        List<UUID> reopenedMeanwhile = groupRepo.findBySessionIdOrderByCreatedAtAsc(sessionId).stream()
                .filter(g -> g.getStatus() != TaskGroupStatus.COMPLETED)
                .map(TaskGroup::getId)
                .toList();
        if (!reopenedMeanwhile.isEmpty()) {
            session.endValidation();
            eventLog.record(EventType.VALIDATION_DEFERRED, sessionId, null, Map.of(
                    "attempt", attempt,
                    "reason", "task group(s) no longer completed",
                    "taskGroups", reopenedMeanwhile.stream().map(UUID::toString).toList()));
            log.warn("Session {} attempt {} passed validation but {} task group(s) are no longer completed; not accepting",
                    sessionId, attempt, reopenedMeanwhile.size());
            return false;
        }
        ValidatorVerdict verdict = verdictRepo.save(new ValidatorVerdict(sessionId, attempt, VerdictKind.ACCEPT,
                "all " + criteriaChecked + " criteria met"));
        session.complete(verdict);
        eventLog.record(EventType.VALIDATION_ACCEPTED, sessionId, null, Map.of("attempt", attempt));
        eventLog.record(EventType.SESSION_COMPLETED, sessionId, null, Map.of("attempt", attempt));
        log.info("Session {} accepted by validator on attempt {}", sessionId, attempt);
        return true;
    }

    private GateResult reject(UUID sessionId, int attempt, List<TaskGroup> groups, List<SuccessCriterion> failing) {
        String reason = failing.stream()
                .map(c -> c.getCriterion() + (c.getEvidence() != null ? " (" + c.getEvidence() + ")" : ""))
                .collect(Collectors.joining("; "));

        // Findings grouped by the task group that owns them. A session-wide
        // criterion sends its finding to every group.
        Map<UUID, List<IssueReport>> findings = new LinkedHashMap<>();
        for (SuccessCriterion criterion : failing) {
            IssueReport finding = IssueReport.blocking("Validator: criterion not met: " + criterion.getCriterion()
                    + (criterion.getEvidence() != null ? " (" + criterion.getEvidence() + ")" : ""));
            if (criterion.getTaskGroupId() != null) {
                findings.computeIfAbsent(criterion.getTaskGroupId(), id -> new ArrayList<>()).add(finding);
            } else {
                for (TaskGroup group : groups) {
                    findings.computeIfAbsent(group.getId(), id -> new ArrayList<>()).add(finding);
                }
            }
        }

        // The verdict and the reopens commit together, so a REJECT is never
        // stored with every group still COMPLETED.
        List<UUID> reopened = new ArrayList<>();
        tx.executeWithoutResult(status -> {
            Session session = sessionRepo.lockById(sessionId)
                    .orElseThrow(() -> new IllegalArgumentException("Session not found: " + sessionId));
            verdictRepo.save(new ValidatorVerdict(sessionId, attempt, VerdictKind.REJECT, reason));
            for (Map.Entry<UUID, List<IssueReport>> entry : findings.entrySet()) {
                stateMachine.reopen(entry.getKey(), entry.getValue());
                reopened.add(entry.getKey());
            }
            session.endValidation();
            eventLog.record(EventType.VALIDATION_REJECTED, sessionId, null, Map.of(
                    "attempt", attempt,
                    "reason", reason,
                    "reopen", reopened.stream().map(UUID::toString).toList()));
        });

        log.warn("Session {} rejected by validator on attempt {}: {}; reopened {} task group(s)",
                sessionId, attempt, reason, reopened.size());
        return new GateResult(VerdictKind.REJECT, reopened);
    }
}
