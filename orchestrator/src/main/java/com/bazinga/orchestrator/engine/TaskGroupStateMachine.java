package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.model.EventType;
import com.bazinga.orchestrator.model.IllegalTransitionException;
import com.bazinga.orchestrator.model.Stage;
import com.bazinga.orchestrator.model.TaskGroup;
import com.bazinga.orchestrator.model.TaskGroupStatus;
import com.bazinga.orchestrator.repository.TaskGroupRepository;
import com.bazinga.orchestrator.worker.IssueReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * The only writer of task group status, stage and dispatch hold.
 *
 * Every public method runs in its own transaction and loads the row with
 * SELECT FOR UPDATE, so transitions on one group are serialised and a
 * rejected transition leaves the row untouched.
 */
@Service
public class TaskGroupStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TaskGroupStateMachine.class);

    private final TaskGroupRepository groupRepo;
    private final FeedbackCodec       feedbackCodec;
    private final EventLog            eventLog;

    public TaskGroupStateMachine(TaskGroupRepository groupRepo,
                                 FeedbackCodec feedbackCodec,
                                 EventLog eventLog) {
        this.groupRepo     = groupRepo;
        this.feedbackCodec = feedbackCodec;
        this.eventLog      = eventLog;
    }

    @Transactional(readOnly = true)
    public TaskGroup get(UUID groupId) {
        return groupRepo.findById(groupId)
                .orElseThrow(() -> new IllegalArgumentException("Task group not found: " + groupId));
    }

    // ------------------------------------------------------------------
    // Status transitions
    // ------------------------------------------------------------------

    /** PENDING → IN_PROGRESS/IMPLEMENT, assigned to {@code workerId}. */
    @Transactional
    public TaskGroup dispatch(UUID groupId, String workerId) {
        TaskGroup group = lock(groupId);
        TaskGroupStatus from = group.getStatus();
        group.transition(TaskGroupStatus.IN_PROGRESS, Stage.IMPLEMENT);
        group.assignWorker(workerId);
        recordStatusChange(group, from, Map.of("workerId", workerId));
        log.info("Task group {} dispatched to {}", groupId, workerId);
        return group;
    }

    /** Stage move inside IN_PROGRESS. Re-entering the current stage is a no-op. */
    @Transactional
    public TaskGroup advanceStage(UUID groupId, Stage stage) {
        TaskGroup group = lock(groupId);
        if (group.getCurrentStage() == stage && group.getStatus() == TaskGroupStatus.IN_PROGRESS) {
            return group;
        }
        Stage from = group.getCurrentStage();
        group.advanceStage(stage);
        eventLog.record(EventType.STAGE_ADVANCED, group.getSessionId(), groupId,
                Map.of("from", from.name(), "to", stage.name()));
        return group;
    }

    /** IN_PROGRESS → APPROVED_PENDING_MERGE, clearing the feedback that got it there. */
    @Transactional
    public TaskGroup approve(UUID groupId) {
        TaskGroup group = lock(groupId);
        TaskGroupStatus from = group.getStatus();
        group.transition(TaskGroupStatus.APPROVED_PENDING_MERGE, Stage.NONE);
        group.setFeedbackJson(null);
        recordStatusChange(group, from, Map.of());
        log.info("Task group {} approved after {} review iteration(s)", groupId, group.getReviewIteration());
        return group;
    }

    /** Move to FAILED with a human-readable reason. */
    @Transactional
    public TaskGroup halt(UUID groupId, String reason) {
        TaskGroup group = lock(groupId);
        TaskGroupStatus from = group.getStatus();
        group.transition(TaskGroupStatus.FAILED, Stage.NONE);
        group.setHaltReason(reason);
        recordStatusChange(group, from, Map.of("reason", reason));
        eventLog.record(EventType.HALTED, group.getSessionId(), groupId, Map.of("reason", reason));
        log.warn("Task group {} halted: {}", groupId, reason);
        return group;
    }

    /** APPROVED_PENDING_MERGE → MERGING/MERGE. */
    @Transactional
    public TaskGroup beginMerge(UUID groupId) {
        TaskGroup group = lock(groupId);
        TaskGroupStatus from = group.getStatus();
        group.transition(TaskGroupStatus.MERGING, Stage.MERGE);
        recordStatusChange(group, from, Map.of());
        return group;
    }

    /** MERGING → COMPLETED. */
    @Transactional
    public TaskGroup completeMerge(UUID groupId) {
        TaskGroup group = lock(groupId);
        TaskGroupStatus from = group.getStatus();
        group.transition(TaskGroupStatus.COMPLETED, Stage.NONE);
        group.resetConsecutiveMergeFailures();
        recordStatusChange(group, from, Map.of());
        log.info("Task group {} merged", groupId);
        return group;
    }

    /**
     * MERGING → IN_PROGRESS/IMPLEMENT after a conflict or a change-caused
     * test failure. The feedback becomes the next implement input.
     */
    @Transactional
    public TaskGroup returnFromMerge(UUID groupId, List<IssueReport> feedback) {
        TaskGroup group = lock(groupId);
        TaskGroupStatus from = group.getStatus();
        group.transition(TaskGroupStatus.IN_PROGRESS, Stage.IMPLEMENT);
        group.incrementMergeAttemptCount();
        group.setFeedbackJson(feedbackCodec.encode(feedback));
        recordStatusChange(group, from, Map.of("feedbackItems", feedback.size()));
        return group;
    }

    /** COMPLETED → IN_PROGRESS/IMPLEMENT after the validator rejected the session. */
    @Transactional
    public TaskGroup reopen(UUID groupId, List<IssueReport> feedback) {
        TaskGroup group = lock(groupId);
        TaskGroupStatus from = group.getStatus();
        group.transition(TaskGroupStatus.IN_PROGRESS, Stage.IMPLEMENT);
        group.setFeedbackJson(feedbackCodec.encode(feedback));
        recordStatusChange(group, from, Map.of());
        eventLog.record(EventType.TASK_GROUP_REOPENED, group.getSessionId(), groupId,
                Map.of("findings", feedback.stream().map(IssueReport::title).toList()));
        log.info("Task group {} reopened with {} validator finding(s)", groupId, feedback.size());
        return group;
    }

    /**
     * Apply an escalation decision: HALT fails the group, RETRY raises the
     * tier (never lowers it).
     */
    @Transactional
    public TaskGroup applyEscalation(UUID groupId, FailureKind kind, EscalationDecision decision) {
        TaskGroup group = lock(groupId);
        if (decision.isHalt()) {
            TaskGroupStatus from = group.getStatus();
            group.transition(TaskGroupStatus.FAILED, Stage.NONE);
            group.setHaltReason(decision.reason());
            recordStatusChange(group, from, Map.of("reason", decision.reason()));
            eventLog.record(EventType.HALTED, group.getSessionId(), groupId,
                    Map.of("failure", kind.name(), "reason", decision.reason()));
            log.warn("Task group {} halted on {}: {}", groupId, kind, decision.reason());
            return group;
        }
        int before = group.getEscalationTier();
        if (group.escalateTo(decision.tier())) {
            eventLog.record(EventType.ESCALATED, group.getSessionId(), groupId, Map.of(
                    "failure", kind.name(),
                    "fromTier", before,
                    "toTier", decision.tier(),
                    "reason", decision.reason()));
            log.info("Task group {} escalated tier {} → {} ({})", groupId, before, decision.tier(), kind);
        }
        return group;
    }

    // ------------------------------------------------------------------
    // Counters and feedback
    // ------------------------------------------------------------------

    /** Locked read-modify-write for counters that do not change status. */
    @Transactional
    public TaskGroup update(UUID groupId, Consumer<TaskGroup> mutation) {
        TaskGroup group = lock(groupId);
        mutation.accept(group);
        return group;
    }

    @Transactional
    public TaskGroup setFeedback(UUID groupId, List<IssueReport> feedback) {
        TaskGroup group = lock(groupId);
        group.setFeedbackJson(feedbackCodec.encode(feedback));
        eventLog.record(EventType.FEEDBACK_UPDATED, group.getSessionId(), groupId,
                Map.of("items", feedback.size()));
        return group;
    }

    @Transactional(readOnly = true)
    public List<IssueReport> feedback(UUID groupId) {
        return feedbackCodec.decode(get(groupId).getFeedbackJson());
    }

    // ------------------------------------------------------------------
    // Dispatch hold
    // ------------------------------------------------------------------

    /**
     * Take the single-owner dispatch hold for a worker call at the given
     * stage. Returns the holder token to release with.
     *
     * @throws DispatchConflictException  a previous dispatch has not returned
     * @throws IllegalTransitionException the group is not at that stage
     */
    @Transactional
    public String acquireDispatch(UUID groupId, Stage stage) {
        TaskGroup group = lock(groupId);
        if (group.isDispatchOutstanding()) {
            throw new DispatchConflictException(groupId, group.getDispatchHolder());
        }
        if (group.getCurrentStage() != stage) {
            throw new IllegalTransitionException(groupId,
                    "dispatch for " + stage + " while at " + group.getCurrentStage());
        }
        String holder = stage.name().toLowerCase(Locale.ROOT) + "-" + UUID.randomUUID().toString().substring(0, 8);
        group.holdDispatch(holder);
        return holder;
    }

    /** Release the hold if this holder still owns it. */
    @Transactional
    public void releaseDispatch(UUID groupId, String holder) {
        TaskGroup group = lock(groupId);
        if (holder.equals(group.getDispatchHolder())) {
            group.releaseDispatch();
        }
    }

    /**
     * Startup recovery: any hold still set belongs to a dispatch whose
     * process died. Clears it so the group can be re-dispatched.
     */
    @Transactional
    public int clearOrphanedDispatches() {
        List<TaskGroup> orphaned = groupRepo.findByDispatchHolderIsNotNull();
        for (TaskGroup group : orphaned) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("holder", group.getDispatchHolder());
            detail.put("stage", group.getCurrentStage().name());
            group.releaseDispatch();
            eventLog.record(EventType.DISPATCH_ORPHANED, group.getSessionId(), group.getId(), detail);
            log.warn("Cleared orphaned dispatch {} on task group {}", detail.get("holder"), group.getId());
        }
        return orphaned.size();
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    private TaskGroup lock(UUID groupId) {
        return groupRepo.lockById(groupId)
                .orElseThrow(() -> new IllegalArgumentException("Task group not found: " + groupId));
    }

    private void recordStatusChange(TaskGroup group, TaskGroupStatus from, Map<String, ?> extra) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("from", from.name());
        detail.put("to", group.getStatus().name());
        detail.put("stage", group.getCurrentStage().name());
        detail.putAll(extra);
        eventLog.record(EventType.STATUS_CHANGED, group.getSessionId(), group.getId(), detail);
    }
}
