package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.config.EngineProperties;
import com.bazinga.orchestrator.model.EventType;
import com.bazinga.orchestrator.model.Session;
import com.bazinga.orchestrator.model.SessionStatus;
import com.bazinga.orchestrator.model.SuccessCriterion;
import com.bazinga.orchestrator.model.TaskGroup;
import com.bazinga.orchestrator.model.TaskGroupStatus;
import com.bazinga.orchestrator.repository.SessionRepository;
import com.bazinga.orchestrator.repository.SuccessCriterionRepository;
import com.bazinga.orchestrator.repository.TaskGroupRepository;
import com.bazinga.orchestrator.repository.ValidatorVerdictRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns sessions: creates their task groups from a plan, reports progress,
 * and is the only caller of the {@link ValidatorGate}.
 *
 * Readiness for validation is always recomputed from persisted task group
 * status, never from what this process remembers, so a restart resumes
 * from the State Store alone.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final SessionRepository          sessionRepo;
    private final TaskGroupRepository        groupRepo;
    private final SuccessCriterionRepository criterionRepo;
    private final ValidatorVerdictRepository verdictRepo;
    private final TaskGroupStateMachine      stateMachine;
    private final ValidatorGate              validatorGate;
    private final EventLog                   eventLog;
    private final TransactionTemplate        tx;
    private final List<String>               securityKeywords;

    public SessionManager(SessionRepository sessionRepo,
                          TaskGroupRepository groupRepo,
                          SuccessCriterionRepository criterionRepo,
                          ValidatorVerdictRepository verdictRepo,
                          TaskGroupStateMachine stateMachine,
                          ValidatorGate validatorGate,
                          EventLog eventLog,
                          PlatformTransactionManager transactionManager,
                          EngineProperties properties) {
        this.sessionRepo      = sessionRepo;
        this.groupRepo        = groupRepo;
        this.criterionRepo    = criterionRepo;
        this.verdictRepo      = verdictRepo;
        this.stateMachine     = stateMachine;
        this.validatorGate    = validatorGate;
        this.eventLog         = eventLog;
        this.tx               = new TransactionTemplate(transactionManager);
        this.securityKeywords = properties.securityKeywords().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Persist a session and its task groups (all PENDING).
     *
     * Security-sensitive groups start one tier up.
     */
    @Transactional
    public Session createSession(SessionPlan plan) {
        Session session = sessionRepo.save(
                new Session(plan.request(), plan.initialBranchRef(), plan.testingMode()));

        for (SessionPlan.TaskGroupPlan groupPlan : plan.taskGroups()) {
            int tier = isSecuritySensitive(groupPlan.description()) ? 1 : 0;
            TaskGroup group = groupRepo.save(new TaskGroup(
                    session.getId(), groupPlan.description(), groupPlan.branchRef(), tier));
            for (String criterion : groupPlan.successCriteria()) {
                criterionRepo.save(new SuccessCriterion(session.getId(), group.getId(), criterion, true));
            }
        }
        for (String criterion : plan.sessionCriteria()) {
            criterionRepo.save(new SuccessCriterion(session.getId(), null, criterion, true));
        }

        eventLog.record(EventType.SESSION_CREATED, session.getId(), null, Map.of(
                "taskGroups", plan.taskGroups().size(),
                "testingMode", session.getTestingMode().name()));
        log.info("Session {} created with {} task group(s), testing mode {}",
                session.getId(), plan.taskGroups().size(), session.getTestingMode());
        return session;
    }

    boolean isSecuritySensitive(String description) {
        String text = description.toLowerCase(Locale.ROOT);
        return securityKeywords.stream().anyMatch(text::contains);
    }

    // ------------------------------------------------------------------
    // Progress
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Session> findSession(UUID sessionId) {
        return sessionRepo.findById(sessionId);
    }

    @Transactional(readOnly = true)
    public Session getSession(UUID sessionId) {
        return findSession(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Session not found: " + sessionId));
    }

    @Transactional(readOnly = true)
    public Optional<TaskGroup> findTaskGroup(UUID groupId) {
        return groupRepo.findById(groupId);
    }

    @Transactional(readOnly = true)
    public List<TaskGroup> taskGroups(UUID sessionId) {
        return groupRepo.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }

    /** Share of task groups COMPLETED, 0-100. */
    @Transactional(readOnly = true)
    public int completionPercentage(UUID sessionId) {
        return percentage(groupRepo.findBySessionIdOrderByCreatedAtAsc(sessionId));
    }

    @Transactional(readOnly = true)
    public SessionReport report(UUID sessionId) {
        Session session = getSession(sessionId);
        List<TaskGroup> groups = groupRepo.findBySessionIdOrderByCreatedAtAsc(sessionId);
        List<SessionReport.BlockedGroup> blocked = groups.stream()
                .filter(g -> g.getStatus() == TaskGroupStatus.FAILED)
                .map(g -> new SessionReport.BlockedGroup(g, g.getHaltReason()))
                .toList();
        return new SessionReport(
                session,
                groups,
                percentage(groups),
                allCompleted(groups),
                blocked,
                verdictRepo.findFirstBySessionIdOrderByAttemptDesc(sessionId).orElse(null));
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    /**
     * Called whenever a task group reaches COMPLETED or FAILED.
     *
     * If every group of the session is now COMPLETED, starts a completion
     * attempt and runs the validator. If every group is settled and at
     * least one FAILED, the session fails with the halted groups as reason.
     *
     * @return task groups the validator reopened (empty otherwise)
     */
    public List<UUID> onTaskGroupSettled(UUID groupId) {
        UUID sessionId = stateMachine.get(groupId).getSessionId();

        Integer attempt = tx.execute(status -> {
            Session session = sessionRepo.lockById(sessionId)
                    .orElseThrow(() -> new IllegalArgumentException("Session not found: " + sessionId));
            if (session.getStatus() != SessionStatus.ACTIVE || session.isValidationInFlight()) {
                return null;
            }
            List<TaskGroup> groups = groupRepo.findBySessionIdOrderByCreatedAtAsc(sessionId);
            if (allCompleted(groups)) {
                int next = session.beginValidation();
                eventLog.record(EventType.READY_FOR_VALIDATION, sessionId, null, Map.of("attempt", next));
                log.info("Session {} ready for validation (attempt {})", sessionId, next);
                return next;
            }
            if (groups.stream().allMatch(g -> g.getStatus().isTerminal())) {
                failSession(session, groups);
            }
            return null;
        });

        if (attempt == null) {
            return List.of();
        }
        try {
            return validatorGate.validate(sessionId, attempt).reopened();
        } catch (RuntimeException e) {
            tx.executeWithoutResult(status ->
                    sessionRepo.lockById(sessionId).ifPresent(Session::endValidation));
            throw e;
        }
    }

    private void failSession(Session session, List<TaskGroup> groups) {
        Map<String, Object> halted = new LinkedHashMap<>();
        for (TaskGroup group : groups) {
            if (group.getStatus() == TaskGroupStatus.FAILED) {
                halted.put(group.getId().toString(), String.valueOf(group.getHaltReason()));
            }
        }
        session.fail();
        eventLog.record(EventType.SESSION_FAILED, session.getId(), null, Map.of("halted", halted));
        log.warn("Session {} failed: {} task group(s) halted", session.getId(), halted.size());
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    /**
     * Startup recovery: clear dispatch holds and validation flags left by a
     * process that died mid-call. Returns the number of orphaned dispatches.
     */
    public int recoverInterruptedWork() {
        int orphans = stateMachine.clearOrphanedDispatches();
        Integer interrupted = tx.execute(status -> {
            int count = 0;
            for (Session session : sessionRepo.findByStatus(SessionStatus.ACTIVE)) {
                if (session.isValidationInFlight()) {
                    session.endValidation();
                    count++;
                }
            }
            return count;
        });
        if (orphans > 0 || (interrupted != null && interrupted > 0)) {
            log.warn("Recovered {} orphaned dispatch(es) and {} interrupted validation(s)", orphans, interrupted);
        }
        return orphans;
    }

    /**
     * Task groups that need driving: every unsettled group of an active
     * session, plus one settled group for an active session whose groups
     * are all settled (so its completion is re-evaluated).
     */
    @Transactional(readOnly = true)
    public List<UUID> resumableTaskGroups() {
        List<UUID> ids = new ArrayList<>();
        for (Session session : sessionRepo.findByStatus(SessionStatus.ACTIVE)) {
            if (session.isValidationInFlight()) continue;
            List<TaskGroup> groups = groupRepo.findBySessionIdOrderByCreatedAtAsc(session.getId());
            List<UUID> unsettled = groups.stream()
                    .filter(g -> !g.getStatus().isTerminal())
                    .map(TaskGroup::getId)
                    .toList();
            if (!unsettled.isEmpty()) {
                ids.addAll(unsettled);
            } else if (!groups.isEmpty()) {
                ids.add(groups.get(0).getId());
            }
        }
        return ids;
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    private static boolean allCompleted(List<TaskGroup> groups) {
        return !groups.isEmpty()
                && groups.stream().allMatch(g -> g.getStatus() == TaskGroupStatus.COMPLETED);
    }

    private static int percentage(List<TaskGroup> groups) {
        if (groups.isEmpty()) return 0;
        long done = groups.stream().filter(g -> g.getStatus() == TaskGroupStatus.COMPLETED).count();
        return (int) (done * 100 / groups.size());
    }
}
