package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.config.EngineProperties;
import com.bazinga.orchestrator.model.EventType;
import com.bazinga.orchestrator.model.MergeAttempt;
import com.bazinga.orchestrator.model.MergeOutcome;
import com.bazinga.orchestrator.model.Severity;
import com.bazinga.orchestrator.model.Stage;
import com.bazinga.orchestrator.model.TaskGroup;
import com.bazinga.orchestrator.model.TaskGroupStatus;
import com.bazinga.orchestrator.repository.MergeAttemptRepository;
import com.bazinga.orchestrator.worker.CiStatus;
import com.bazinga.orchestrator.worker.IssueReport;
import com.bazinga.orchestrator.worker.MergeResult;
import com.bazinga.orchestrator.worker.PostMergeResult;
import com.bazinga.orchestrator.worker.WorkRequest;
import com.bazinga.orchestrator.worker.WorkerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drives an approved task group through integration.
 *
 * <pre>
 *   success      → post-merge check → CI polling → COMPLETED
 *   conflict     → abort, back to IN_PROGRESS with the conflicting files
 *   testFailure  → abort, back to IN_PROGRESS with the failing tests
 *   blocked      → environment failure, retried in place or halted
 * </pre>
 *
 * Conflicts and test failures count toward the consecutive merge failure
 * budget; blocked attempts never do. A CI poll that never settles is
 * accepted with a warning on the attempt row.
 */
@Service
public class MergeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MergeCoordinator.class);

    private final TaskGroupStateMachine  stateMachine;
    private final WorkerDispatcher       dispatcher;
    private final WorkerGateway          gateway;
    private final ContextAssembler       contextAssembler;
    private final EscalationPolicy       policy;
    private final MergeAttemptRepository attemptRepo;
    private final EventLog               eventLog;
    private final EngineProperties       properties;

    public MergeCoordinator(TaskGroupStateMachine stateMachine,
                            WorkerDispatcher dispatcher,
                            WorkerGateway gateway,
                            ContextAssembler contextAssembler,
                            EscalationPolicy policy,
                            MergeAttemptRepository attemptRepo,
                            EventLog eventLog,
                            EngineProperties properties) {
        this.stateMachine     = stateMachine;
        this.dispatcher       = dispatcher;
        this.gateway          = gateway;
        this.contextAssembler = contextAssembler;
        this.policy           = policy;
        this.attemptRepo      = attemptRepo;
        this.eventLog         = eventLog;
        this.properties       = properties;
    }

    /**
     * Run until the group leaves MERGING (completed, returned to the review
     * loop, or halted).
     */
    public void run(UUID groupId) {
        if (stateMachine.get(groupId).getStatus() == TaskGroupStatus.APPROVED_PENDING_MERGE) {
            stateMachine.beginMerge(groupId);
        }
        while (stateMachine.get(groupId).getStatus() == TaskGroupStatus.MERGING) {
            attempt(groupId);
        }
    }

    public List<MergeAttempt> history(UUID groupId) {
        return attemptRepo.findByTaskGroupIdOrderByAttemptNumberAsc(groupId);
    }

    private void attempt(UUID groupId) {
        long started = System.nanoTime();
        DispatchResult<MergeResult> dispatched = dispatcher.dispatch(groupId, Stage.MERGE,
                () -> gateway.merge(request(groupId)));

        if (!dispatched.completed()) {
            recordAttempt(groupId, MergeOutcome.BLOCKED, 0, false, started, dispatched.detail());
            environmentFailure(groupId, dispatched.failureKind());
            return;
        }

        MergeResult merge = dispatched.value();
        switch (merge.outcome()) {
            case SUCCESS -> afterIntegration(groupId, started);
            case CONFLICT -> {
                abort(groupId);
                recordAttempt(groupId, MergeOutcome.CONFLICT, 0, false, started,
                        "conflicts: " + merge.conflictingFiles());
                contentFailure(groupId, FailureKind.MERGE_CONFLICT,
                        issues("Merge conflict in ", merge.conflictingFiles()));
            }
            case TEST_FAILURE -> {
                abort(groupId);
                recordAttempt(groupId, MergeOutcome.TEST_FAILURE, 0, false, started,
                        "failing tests: " + merge.failingTests());
                contentFailure(groupId, FailureKind.MERGE_TEST_FAILURE,
                        issues("Failing test after merge: ", merge.failingTests()));
            }
            case BLOCKED -> {
                recordAttempt(groupId, MergeOutcome.BLOCKED, 0, false, started, merge.detail());
                environmentFailure(groupId, FailureKind.BLOCKED);
            }
        }
    }

    // ------------------------------------------------------------------
    // After a successful integration
    // ------------------------------------------------------------------

    private void afterIntegration(UUID groupId, long started) {
        DispatchResult<PostMergeResult> checked = dispatcher.dispatch(groupId, Stage.MERGE,
                () -> gateway.postMergeCheck(request(groupId)));
        if (!checked.completed()) {
            abort(groupId);
            recordAttempt(groupId, MergeOutcome.BLOCKED, 0, false, started,
                    "post-merge check: " + checked.detail());
            environmentFailure(groupId, checked.failureKind());
            return;
        }

        PostMergeResult post = checked.value();
        if (post.status() == PostMergeResult.Status.CHANGE_FAILURE) {
            abort(groupId);
            recordAttempt(groupId, MergeOutcome.TEST_FAILURE, 0, false, started,
                    "post-merge failures: " + post.failingTests());
            contentFailure(groupId, FailureKind.MERGE_TEST_FAILURE,
                    issues("Failing test after merge: ", post.failingTests()));
            return;
        }
        if (post.status() == PostMergeResult.Status.UNRELATED_FAILURE) {
            log.warn("Task group {} merged with pre-existing failures: {}", groupId, post.failingTests());
        }

        // Poll external CI; a timeout is accepted with a warning.
        EngineProperties.Merge limits = properties.merge();
        int polls = 0;
        CiStatus ci = CiStatus.PENDING;
        while (polls < limits.maxCiPolls()) {
            if (polls > 0) pause(limits.ciPollInterval());
            polls++;
            DispatchResult<CiStatus> status = dispatcher.await("ci-status",
                    properties.dispatch().workerTimeout(), () -> gateway.ciStatus(request(groupId)));
            ci = status.completed() ? status.value() : CiStatus.PENDING;
            if (ci != CiStatus.PENDING) break;
        }

        if (ci == CiStatus.FAILURE) {
            abort(groupId);
            recordAttempt(groupId, MergeOutcome.TEST_FAILURE, polls, false, started, "external CI failed");
            contentFailure(groupId, FailureKind.MERGE_TEST_FAILURE,
                    List.of(IssueReport.blocking("External CI failed after merge")));
            return;
        }

        boolean warning = ci == CiStatus.PENDING;
        if (warning) {
            TaskGroup group = stateMachine.get(groupId);
            eventLog.record(EventType.CI_POLL_TIMEOUT, group.getSessionId(), groupId,
                    Map.of("polls", polls));
            log.warn("CI still pending for task group {} after {} poll(s), accepting with warning", groupId, polls);
        }
        recordAttempt(groupId, MergeOutcome.SUCCESS, polls, warning, started,
                warning ? "CI did not settle" : null);
        stateMachine.completeMerge(groupId);
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    private void contentFailure(UUID groupId, FailureKind kind, List<IssueReport> feedback) {
        TaskGroup group = stateMachine.update(groupId, TaskGroup::incrementConsecutiveMergeFailures);
        EscalationDecision decision = policy.decide(kind, group.getConsecutiveMergeFailures(),
                group.getNoProgressCount(), group.getEscalationTier());
        stateMachine.applyEscalation(groupId, kind, decision);
        if (!decision.isHalt()) {
            stateMachine.returnFromMerge(groupId, feedback);
        }
    }

    private void environmentFailure(UUID groupId, FailureKind kind) {
        TaskGroup group = stateMachine.update(groupId, TaskGroup::incrementEnvironmentFailureCount);
        EscalationDecision decision = policy.decide(kind, group.getEnvironmentFailureCount(),
                group.getNoProgressCount(), group.getEscalationTier());
        stateMachine.applyEscalation(groupId, kind, decision);
    }

    /** Revert the integration. A failed abort is recorded; the group still moves on. */
    private void abort(UUID groupId) {
        DispatchResult<Boolean> aborted = dispatcher.await("merge-abort", properties.dispatch().workerTimeout(),
                () -> gateway.abortMerge(request(groupId)).thenApply(done -> Boolean.TRUE));
        if (!aborted.completed()) {
            TaskGroup group = stateMachine.get(groupId);
            eventLog.record(EventType.MERGE_ABORT_FAILED, group.getSessionId(), groupId,
                    Map.of("detail", String.valueOf(aborted.detail())));
            log.error("Could not abort merge for task group {}: {}", groupId, aborted.detail());
        }
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    private WorkRequest request(UUID groupId) {
        return contextAssembler.build(stateMachine.get(groupId), Stage.MERGE);
    }

    private void recordAttempt(UUID groupId, MergeOutcome outcome, int ciPolls,
                               boolean ciWarning, long startedNanos, String detail) {
        long durationMs = Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
        int number = (int) attemptRepo.countByTaskGroupId(groupId) + 1;
        attemptRepo.save(new MergeAttempt(groupId, number, outcome, ciPolls, ciWarning, durationMs, detail));

        TaskGroup group = stateMachine.get(groupId);
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("attempt", number);
        event.put("outcome", outcome.name());
        event.put("ciPolls", ciPolls);
        event.put("ciWarning", ciWarning);
        event.put("durationMs", durationMs);
        eventLog.record(EventType.MERGE_ATTEMPTED, group.getSessionId(), groupId, event);
        log.info("Merge attempt {} for task group {}: {} ({} ms)", number, groupId, outcome, durationMs);
    }

    private static List<IssueReport> issues(String prefix, List<String> items) {
        if (items.isEmpty()) {
            return List.of(IssueReport.blocking(prefix.trim()));
        }
        return items.stream()
                .map(item -> new IssueReport(Severity.HIGH, true, prefix + item, item))
                .toList();
    }

    private static void pause(Duration interval) {
        if (interval.isZero() || interval.isNegative()) return;
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while polling CI", e);
        }
    }
}
