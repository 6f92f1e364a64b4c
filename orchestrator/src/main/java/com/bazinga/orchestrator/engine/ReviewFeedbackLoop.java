package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.model.EventType;
import com.bazinga.orchestrator.model.Session;
import com.bazinga.orchestrator.model.Stage;
import com.bazinga.orchestrator.model.TaskGroup;
import com.bazinga.orchestrator.model.TaskGroupStatus;
import com.bazinga.orchestrator.repository.SessionRepository;
import com.bazinga.orchestrator.worker.ImplementResult;
import com.bazinga.orchestrator.worker.IssueReport;
import com.bazinga.orchestrator.worker.ReviewResult;
import com.bazinga.orchestrator.worker.VerifyResult;
import com.bazinga.orchestrator.worker.WorkerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Drives implement → verify → review while a task group is IN_PROGRESS.
 *
 * Each pass:
 *  1. implement with the outstanding issues as input
 *  2. verify (only when the session's testing mode runs verification);
 *     a failure loops back to implement without counting a review iteration
 *  3. review, recorded as a new cycle by {@link ReviewLedger}
 *  4. approved → APPROVED_PENDING_MERGE; otherwise consult
 *     {@link EscalationPolicy} and loop, or halt
 *
 * Not transactional as a whole: every step is its own transition, and the
 * loop re-reads the group after each one, so a restart resumes from
 * whatever was last persisted.
 */
@Service
public class ReviewFeedbackLoop {

    private static final Logger log = LoggerFactory.getLogger(ReviewFeedbackLoop.class);

    private final TaskGroupStateMachine stateMachine;
    private final WorkerDispatcher      dispatcher;
    private final WorkerGateway         gateway;
    private final ContextAssembler      contextAssembler;
    private final ReviewLedger          ledger;
    private final EscalationPolicy      policy;
    private final SessionRepository     sessionRepo;
    private final EventLog              eventLog;

    public ReviewFeedbackLoop(TaskGroupStateMachine stateMachine,
                              WorkerDispatcher dispatcher,
                              WorkerGateway gateway,
                              ContextAssembler contextAssembler,
                              ReviewLedger ledger,
                              EscalationPolicy policy,
                              SessionRepository sessionRepo,
                              EventLog eventLog) {
        this.stateMachine     = stateMachine;
        this.dispatcher       = dispatcher;
        this.gateway          = gateway;
        this.contextAssembler = contextAssembler;
        this.ledger           = ledger;
        this.policy           = policy;
        this.sessionRepo      = sessionRepo;
        this.eventLog         = eventLog;
    }

    /**
     * Run until the group leaves IN_PROGRESS (approved or halted).
     */
    public void run(UUID groupId) {
        while (stateMachine.get(groupId).getStatus() == TaskGroupStatus.IN_PROGRESS) {
            if (!implement(groupId)) continue;
            if (!verify(groupId)) continue;
            review(groupId);
        }
        log.info("Task group {} left the review loop as {}", groupId, stateMachine.get(groupId).getStatus());
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    private boolean implement(UUID groupId) {
        stateMachine.advanceStage(groupId, Stage.IMPLEMENT);
        DispatchResult<ImplementResult> result = dispatcher.dispatch(groupId, Stage.IMPLEMENT,
                () -> gateway.implement(contextAssembler.build(stateMachine.get(groupId), Stage.IMPLEMENT)));

        if (!result.completed()) {
            environmentFailure(groupId, result.failureKind());
            return false;
        }
        ImplementResult implemented = result.value();
        if (implemented.status() == ImplementResult.Status.BLOCKED) {
            log.warn("Implementer blocked on task group {}: {}", groupId, implemented.detail());
            environmentFailure(groupId, FailureKind.BLOCKED);
            return false;
        }
        log.info("Task group {} implemented: {} file(s) changed, {}/{} tests passing",
                groupId, implemented.filesChanged().size(), implemented.testsPassed(), implemented.testsRun());
        return true;
    }

    private boolean verify(UUID groupId) {
        TaskGroup group = stateMachine.get(groupId);
        Session session = sessionRepo.findById(group.getSessionId())
                .orElseThrow(() -> new IllegalStateException("Session not found: " + group.getSessionId()));
        if (!session.getTestingMode().runsVerification()) {
            return true;
        }

        stateMachine.advanceStage(groupId, Stage.VERIFY);
        DispatchResult<VerifyResult> result = dispatcher.dispatch(groupId, Stage.VERIFY,
                () -> gateway.verify(contextAssembler.build(stateMachine.get(groupId), Stage.VERIFY)));

        if (!result.completed()) {
            environmentFailure(groupId, result.failureKind());
            return false;
        }
        VerifyResult verified = result.value();
        if (verified.status() == VerifyResult.Status.PASSED) {
            stateMachine.update(groupId, TaskGroup::resetConsecutiveVerifyFailures);
            return true;
        }

        TaskGroup failed = stateMachine.update(groupId, TaskGroup::incrementConsecutiveVerifyFailures);
        eventLog.record(EventType.VERIFICATION_FAILED, failed.getSessionId(), groupId, Map.of(
                "consecutive", failed.getConsecutiveVerifyFailures(),
                "failures", verified.failures().stream().map(IssueReport::title).toList()));

        int tierBefore = failed.getEscalationTier();
        EscalationDecision decision = policy.decide(FailureKind.VERIFY_FAILURE,
                failed.getConsecutiveVerifyFailures(), failed.getNoProgressCount(), tierBefore);
        stateMachine.applyEscalation(groupId, FailureKind.VERIFY_FAILURE, decision);
        if (!decision.isHalt()) {
            if (decision.tier() > tierBefore) {
                // a new tier gets a fresh verification budget
                stateMachine.update(groupId, TaskGroup::resetConsecutiveVerifyFailures);
            }
            stateMachine.setFeedback(groupId, verified.failures());
        }
        return false;
    }

    private void review(UUID groupId) {
        stateMachine.advanceStage(groupId, Stage.REVIEW);
        DispatchResult<ReviewResult> result = dispatcher.dispatch(groupId, Stage.REVIEW,
                () -> gateway.review(contextAssembler.build(stateMachine.get(groupId), Stage.REVIEW)));

        if (!result.completed()) {
            environmentFailure(groupId, result.failureKind());
            return;
        }

        CycleAssessment cycle = ledger.recordCycle(groupId, result.value());
        if (cycle.approved()) {
            stateMachine.approve(groupId);
            return;
        }

        TaskGroup group = stateMachine.get(groupId);
        FailureKind kind = cycle.hasRegressions() ? FailureKind.REGRESSION : FailureKind.REVIEW_REJECTION;
        EscalationDecision decision = policy.decide(kind, cycle.iteration(),
                cycle.noProgressCount(), group.getEscalationTier());
        stateMachine.applyEscalation(groupId, kind, decision);
        if (!decision.isHalt()) {
            stateMachine.setFeedback(groupId, cycle.outstanding());
        }
    }

    // ------------------------------------------------------------------
    // Environment failures
    // ------------------------------------------------------------------

    /**
     * Timeout, protocol error or a blocked report. Counted separately from
     * content failures and escalated directly.
     */
    private void environmentFailure(UUID groupId, FailureKind kind) {
        TaskGroup group = stateMachine.update(groupId, TaskGroup::incrementEnvironmentFailureCount);
        EscalationDecision decision = policy.decide(kind, group.getEnvironmentFailureCount(),
                group.getNoProgressCount(), group.getEscalationTier());
        stateMachine.applyEscalation(groupId, kind, decision);
    }
}
