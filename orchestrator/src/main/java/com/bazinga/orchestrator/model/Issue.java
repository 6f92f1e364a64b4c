package com.bazinga.orchestrator.model;

import jakarta.persistence.*;
import java.util.UUID;

/**
 * A finding reported by a review cycle.
 *
 * The row is append-only except for resolvedInIteration, which is set
 * exactly once when a later cycle stops reporting the same signature.
 * A signature that comes back after resolution is stored as a new row
 * flagged as a regression; the resolved row is never reopened.
 */
@Entity
@Table(name = "issues")
public class Issue {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "review_cycle_id", nullable = false, updatable = false)
    private UUID reviewCycleId;

    @Column(name = "task_group_id", nullable = false, updatable = false)
    private UUID taskGroupId;

    @Column(name = "reported_in_iteration", nullable = false, updatable = false)
    private int reportedInIteration;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Severity severity;

    @Column(nullable = false, updatable = false)
    private boolean blocking;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String title;

    // Root-cause key used for resolution and regression matching.
    @Column(nullable = false, updatable = false)
    private String signature;

    @Column(nullable = false, updatable = false)
    private boolean regression;

    @Column(name = "resolved_in_iteration")
    private Integer resolvedInIteration;

    protected Issue() {}   // required by JPA

    public Issue(UUID reviewCycleId, UUID taskGroupId, int reportedInIteration,
                 Severity severity, boolean blocking, String title,
                 String signature, boolean regression) {
        this.reviewCycleId       = reviewCycleId;
        this.taskGroupId         = taskGroupId;
        this.reportedInIteration = reportedInIteration;
        this.severity            = severity;
        this.blocking            = blocking;
        this.title               = title;
        this.signature           = signature;
        this.regression          = regression;
    }

    public void resolveIn(int iteration) {
        if (resolvedInIteration != null) {
            throw new IllegalStateException("Issue " + id + " already resolved in iteration " + resolvedInIteration);
        }
        this.resolvedInIteration = iteration;
    }

    public UUID     getId()                  { return id; }
    public UUID     getReviewCycleId()       { return reviewCycleId; }
    public UUID     getTaskGroupId()         { return taskGroupId; }
    public int      getReportedInIteration() { return reportedInIteration; }
    public Severity getSeverity()            { return severity; }
    public boolean  isBlocking()             { return blocking; }
    public String   getTitle()               { return title; }
    public String   getSignature()           { return signature; }
    public boolean  isRegression()           { return regression; }
    public Integer  getResolvedInIteration() { return resolvedInIteration; }

    public boolean isResolved() {
        return resolvedInIteration != null;
    }
}
