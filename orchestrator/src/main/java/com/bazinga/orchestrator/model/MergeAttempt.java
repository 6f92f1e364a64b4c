package com.bazinga.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit row for one integration attempt. Append-only.
 */
@Entity
@Table(name = "merge_attempts")
public class MergeAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_group_id", nullable = false, updatable = false)
    private UUID taskGroupId;

    @Column(name = "attempt_number", nullable = false, updatable = false)
    private int attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private MergeOutcome outcome;

    @Column(name = "ci_poll_count", nullable = false, updatable = false)
    private int ciPollCount;

    // Set when CI never settled within the poll budget and the merge was accepted anyway.
    @Column(name = "ci_warning", nullable = false, updatable = false)
    private boolean ciWarning;

    @Column(name = "duration_ms", nullable = false, updatable = false)
    private long durationMs;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected MergeAttempt() {}   // required by JPA

    public MergeAttempt(UUID taskGroupId, int attemptNumber, MergeOutcome outcome,
                        int ciPollCount, boolean ciWarning, long durationMs, String detail) {
        this.taskGroupId   = taskGroupId;
        this.attemptNumber = attemptNumber;
        this.outcome       = outcome;
        this.ciPollCount   = ciPollCount;
        this.ciWarning     = ciWarning;
        this.durationMs    = durationMs;
        this.detail        = detail;
    }

    public UUID         getId()            { return id; }
    public UUID         getTaskGroupId()   { return taskGroupId; }
    public int          getAttemptNumber() { return attemptNumber; }
    public MergeOutcome getOutcome()       { return outcome; }
    public int          getCiPollCount()   { return ciPollCount; }
    public boolean      isCiWarning()      { return ciWarning; }
    public long         getDurationMs()    { return durationMs; }
    public String       getDetail()        { return detail; }
    public Instant      getCreatedAt()     { return createdAt; }
}
