package com.bazinga.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A declared success criterion, re-checked by the validator.
 *
 * taskGroupId is null for session-wide criteria.
 */
@Entity
@Table(name = "success_criteria")
public class SuccessCriterion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "task_group_id", updatable = false)
    private UUID taskGroupId;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String criterion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CriterionStatus status = CriterionStatus.PENDING;

    @Column(columnDefinition = "TEXT")
    private String evidence;

    @Column(name = "required_for_completion", nullable = false, updatable = false)
    private boolean requiredForCompletion = true;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    protected SuccessCriterion() {}   // required by JPA

    public SuccessCriterion(UUID sessionId, UUID taskGroupId, String criterion, boolean requiredForCompletion) {
        this.sessionId             = sessionId;
        this.taskGroupId           = taskGroupId;
        this.criterion             = criterion;
        this.requiredForCompletion = requiredForCompletion;
    }

    public void recordCheck(CriterionStatus status, String evidence) {
        this.status     = status;
        this.evidence   = evidence;
        this.verifiedAt = Instant.now();
    }

    public UUID            getId()                    { return id; }
    public UUID            getSessionId()             { return sessionId; }
    public UUID            getTaskGroupId()           { return taskGroupId; }
    public String          getCriterion()             { return criterion; }
    public CriterionStatus getStatus()                { return status; }
    public String          getEvidence()              { return evidence; }
    public boolean         isRequiredForCompletion()  { return requiredForCompletion; }
    public Instant         getVerifiedAt()            { return verifiedAt; }
}
