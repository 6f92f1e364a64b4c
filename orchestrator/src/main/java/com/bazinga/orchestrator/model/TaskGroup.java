package com.bazinga.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One unit of work inside a session, driven through
 * implement → verify → review → merge by the engine.
 *
 * status and currentStage only change together through {@link #transition};
 * within IN_PROGRESS the stage moves through {@link #advanceStage}.
 * Counters are monotonic where the engine relies on it (review iteration,
 * merge attempts, escalation tier).
 *
 * DB table: task_groups  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "task_groups")
public class TaskGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskGroupStatus status = TaskGroupStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_stage", nullable = false)
    private Stage currentStage = Stage.NONE;

    @Column(name = "assigned_worker_id")
    private String assignedWorkerId;

    @Column(name = "branch_ref")
    private String branchRef;

    @Column(name = "review_iteration", nullable = false)
    private int reviewIteration = 0;

    @Column(name = "no_progress_count", nullable = false)
    private int noProgressCount = 0;

    @Column(name = "blocking_issue_count", nullable = false)
    private int blockingIssueCount = 0;

    @Column(name = "escalation_tier", nullable = false)
    private int escalationTier = 0;

    // Content merge failures (conflict / test failure) over the group's lifetime.
    @Column(name = "merge_attempt_count", nullable = false)
    private int mergeAttemptCount = 0;

    // Content merge failures since the last successful merge; drives merge escalation.
    @Column(name = "consecutive_merge_failures", nullable = false)
    private int consecutiveMergeFailures = 0;

    // Timeouts, protocol errors and blocked reports. Never counted against content budgets.
    @Column(name = "environment_failure_count", nullable = false)
    private int environmentFailureCount = 0;

    @Column(name = "consecutive_verify_failures", nullable = false)
    private int consecutiveVerifyFailures = 0;

    // Issue set handed to the next implement dispatch, JSON-encoded.
    @Column(name = "feedback_json", columnDefinition = "TEXT")
    private String feedbackJson;

    @Column(name = "halt_reason", columnDefinition = "TEXT")
    private String haltReason;

    // Single-owner dispatch hold. Non-null while a worker call is outstanding.
    @Column(name = "dispatch_holder")
    private String dispatchHolder;

    @Column(name = "dispatch_started_at")
    private Instant dispatchStartedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected TaskGroup() {}   // required by JPA

    public TaskGroup(UUID sessionId, String description, String branchRef, int initialTier) {
        this.sessionId      = sessionId;
        this.description    = description;
        this.branchRef      = branchRef;
        this.escalationTier = Math.max(0, initialTier);
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /** Move status and stage together. Rejects any pair the lifecycle does not allow. */
    public void transition(TaskGroupStatus next, Stage stage) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalTransitionException(id, status + " → " + next);
        }
        if (!next.admittedStages().contains(stage)) {
            throw new IllegalTransitionException(id, next + " does not admit stage " + stage);
        }
        this.status       = next;
        this.currentStage = stage;
    }

    /** Internal stage move; status is unchanged. */
    public void advanceStage(Stage next) {
        if (status != TaskGroupStatus.IN_PROGRESS || !currentStage.canAdvanceTo(next)) {
            throw new IllegalTransitionException(id,
                    "stage " + currentStage + " → " + next + " while " + status);
        }
        this.currentStage = next;
    }

    public void assignWorker(String workerId) {
        this.assignedWorkerId = workerId;
    }

    public void holdDispatch(String holder) {
        this.dispatchHolder    = holder;
        this.assignedWorkerId  = holder;
        this.dispatchStartedAt = Instant.now();
    }

    public void releaseDispatch() {
        this.dispatchHolder    = null;
        this.dispatchStartedAt = null;
    }

    // ------------------------------------------------------------------
    // Counters
    // ------------------------------------------------------------------

    public void recordReviewIteration(int iteration) {
        if (iteration < reviewIteration) {
            throw new IllegalStateException("reviewIteration may not decrease: "
                    + reviewIteration + " → " + iteration + " for task group " + id);
        }
        this.reviewIteration = iteration;
    }

    /** Raise the tier; a lower value is ignored. */
    public boolean escalateTo(int tier) {
        if (tier <= escalationTier) return false;
        this.escalationTier = tier;
        return true;
    }

    public void incrementMergeAttemptCount()       { this.mergeAttemptCount++; }
    public void incrementConsecutiveMergeFailures() { this.consecutiveMergeFailures++; }
    public void resetConsecutiveMergeFailures()     { this.consecutiveMergeFailures = 0; }
    public void incrementEnvironmentFailureCount()  { this.environmentFailureCount++; }
    public void incrementConsecutiveVerifyFailures() { this.consecutiveVerifyFailures++; }
    public void resetConsecutiveVerifyFailures()    { this.consecutiveVerifyFailures = 0; }

    public void setNoProgressCount(int v)    { this.noProgressCount = v; }
    public void setBlockingIssueCount(int v) { this.blockingIssueCount = v; }
    public void setFeedbackJson(String v)    { this.feedbackJson = v; }
    public void setHaltReason(String v)      { this.haltReason = v; }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID            getId()                        { return id; }
    public UUID            getSessionId()                 { return sessionId; }
    public String          getDescription()               { return description; }
    public TaskGroupStatus getStatus()                    { return status; }
    public Stage           getCurrentStage()              { return currentStage; }
    public String          getAssignedWorkerId()          { return assignedWorkerId; }
    public String          getBranchRef()                 { return branchRef; }
    public int             getReviewIteration()           { return reviewIteration; }
    public int             getNoProgressCount()           { return noProgressCount; }
    public int             getBlockingIssueCount()        { return blockingIssueCount; }
    public int             getEscalationTier()            { return escalationTier; }
    public int             getMergeAttemptCount()         { return mergeAttemptCount; }
    public int             getConsecutiveMergeFailures()  { return consecutiveMergeFailures; }
    public int             getEnvironmentFailureCount()   { return environmentFailureCount; }
    public int             getConsecutiveVerifyFailures() { return consecutiveVerifyFailures; }
    public String          getFeedbackJson()              { return feedbackJson; }
    public String          getHaltReason()                { return haltReason; }
    public String          getDispatchHolder()            { return dispatchHolder; }
    public Instant         getDispatchStartedAt()         { return dispatchStartedAt; }
    public Instant         getCreatedAt()                 { return createdAt; }
    public Instant         getUpdatedAt()                 { return updatedAt; }

    public boolean isDispatchOutstanding() {
        return dispatchHolder != null;
    }
}
