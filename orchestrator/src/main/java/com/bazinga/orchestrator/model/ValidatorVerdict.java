package com.bazinga.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * The validator's judgement on one completion attempt of a session.
 * At most one row per (session, attempt); append-only.
 */
@Entity
@Table(name = "validator_verdicts")
public class ValidatorVerdict {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(nullable = false, updatable = false)
    private int attempt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private VerdictKind verdict;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Column(name = "checked_at", nullable = false, updatable = false)
    private Instant checkedAt = Instant.now();

    protected ValidatorVerdict() {}   // required by JPA

    public ValidatorVerdict(UUID sessionId, int attempt, VerdictKind verdict, String reason) {
        this.sessionId = sessionId;
        this.attempt   = attempt;
        this.verdict   = verdict;
        this.reason    = reason;
    }

    public UUID        getId()        { return id; }
    public UUID        getSessionId() { return sessionId; }
    public int         getAttempt()   { return attempt; }
    public VerdictKind getVerdict()   { return verdict; }
    public String      getReason()    { return reason; }
    public Instant     getCheckedAt() { return checkedAt; }
}
