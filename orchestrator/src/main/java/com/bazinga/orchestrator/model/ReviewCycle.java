package com.bazinga.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One review pass over a task group. Append-only; iteration is monotonic
 * per task group (unique constraint in the schema).
 */
@Entity
@Table(name = "review_cycles")
public class ReviewCycle {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_group_id", nullable = false, updatable = false)
    private UUID taskGroupId;

    @Column(nullable = false, updatable = false)
    private int iteration;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ReviewVerdict verdict;

    // Issues from the previous cycle that this cycle no longer reports.
    @Column(name = "issues_fixed", nullable = false, updatable = false)
    private int issuesFixed;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ReviewCycle() {}   // required by JPA

    public ReviewCycle(UUID taskGroupId, int iteration, ReviewVerdict verdict, int issuesFixed) {
        this.taskGroupId = taskGroupId;
        this.iteration   = iteration;
        this.verdict     = verdict;
        this.issuesFixed = issuesFixed;
    }

    public UUID          getId()          { return id; }
    public UUID          getTaskGroupId() { return taskGroupId; }
    public int           getIteration()   { return iteration; }
    public ReviewVerdict getVerdict()     { return verdict; }
    public int           getIssuesFixed() { return issuesFixed; }
    public Instant       getCreatedAt()   { return createdAt; }
}
