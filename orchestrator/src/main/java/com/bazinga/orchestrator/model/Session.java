package com.bazinga.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One top-level request: a set of task groups that must all be delivered
 * and independently validated before the session may close.
 *
 * DB table: sessions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "sessions")
public class Session {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Original request text as submitted.
    @Column(name = "request", columnDefinition = "TEXT")
    private String request;

    @Column(name = "initial_branch_ref", nullable = false)
    private String initialBranchRef = "main";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SessionStatus status = SessionStatus.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(name = "testing_mode", nullable = false)
    private TestingMode testingMode = TestingMode.FULL;

    // Incremented each time the session claims completion and asks the validator.
    @Column(name = "completion_attempt", nullable = false)
    private int completionAttempt = 0;

    // True between the READY_FOR_VALIDATION event and the recorded verdict.
    @Column(name = "validation_in_flight", nullable = false)
    private boolean validationInFlight = false;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt = Instant.now();

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Session() {}   // required by JPA

    public Session(String request, String initialBranchRef, TestingMode testingMode) {
        this.request = request;
        if (initialBranchRef != null && !initialBranchRef.isBlank()) {
            this.initialBranchRef = initialBranchRef;
        }
        if (testingMode != null) {
            this.testingMode = testingMode;
        }
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Start a completion attempt. Returns the attempt number the verdict
     * must carry.
     */
    public int beginValidation() {
        if (status != SessionStatus.ACTIVE) {
            throw new IllegalStateException("Session " + id + " is " + status + ", cannot validate");
        }
        if (validationInFlight) {
            throw new IllegalStateException("Session " + id + " already has a validation in flight");
        }
        validationInFlight = true;
        return ++completionAttempt;
    }

    public void endValidation() {
        validationInFlight = false;
    }

    /**
     * Close the session. The only way into COMPLETED, and only with an
     * ACCEPT verdict for this session's current completion attempt.
     */
    public void complete(ValidatorVerdict verdict) {
        if (verdict == null
                || verdict.getVerdict() != VerdictKind.ACCEPT
                || !id.equals(verdict.getSessionId())
                || verdict.getAttempt() != completionAttempt) {
            throw new IllegalStateException(
                    "Session " + id + " cannot complete without an ACCEPT verdict for attempt " + completionAttempt);
        }
        if (status != SessionStatus.ACTIVE) {
            throw new IllegalStateException("Session " + id + " is " + status + ", cannot complete");
        }
        status = SessionStatus.COMPLETED;
        validationInFlight = false;
        endedAt = Instant.now();
    }

    public void fail() {
        if (status != SessionStatus.ACTIVE) {
            throw new IllegalStateException("Session " + id + " is " + status + ", cannot fail");
        }
        status = SessionStatus.FAILED;
        endedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID          getId()                 { return id; }
    public String        getRequest()            { return request; }
    public String        getInitialBranchRef()   { return initialBranchRef; }
    public SessionStatus getStatus()             { return status; }
    public TestingMode   getTestingMode()        { return testingMode; }
    public int           getCompletionAttempt()  { return completionAttempt; }
    public boolean       isValidationInFlight()  { return validationInFlight; }
    public Instant       getStartedAt()          { return startedAt; }
    public Instant       getEndedAt()            { return endedAt; }
    public Instant       getUpdatedAt()          { return updatedAt; }
}
