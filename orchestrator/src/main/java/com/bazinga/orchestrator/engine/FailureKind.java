package com.bazinga.orchestrator.engine;

/**
 * Why a task group needs an escalation decision.
 */
public enum FailureKind {
    // content failures: recoverable by another implement pass
    REVIEW_REJECTION(Category.CONTENT),
    VERIFY_FAILURE(Category.CONTENT),
    MERGE_CONFLICT(Category.CONTENT),
    MERGE_TEST_FAILURE(Category.CONTENT),

    // progress failure: an issue resolved earlier came back
    REGRESSION(Category.PROGRESS),

    // environment failures: never counted against content budgets
    BLOCKED(Category.ENVIRONMENT),
    WORKER_TIMEOUT(Category.ENVIRONMENT),
    PROTOCOL_ERROR(Category.ENVIRONMENT);

    public enum Category { CONTENT, PROGRESS, ENVIRONMENT }

    private final Category category;

    FailureKind(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
