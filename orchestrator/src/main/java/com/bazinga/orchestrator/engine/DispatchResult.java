package com.bazinga.orchestrator.engine;

/**
 * Outcome of one awaited worker call. value is set only when COMPLETED.
 */
public record DispatchResult<T>(Kind kind, T value, String detail) {

    public enum Kind { COMPLETED, TIMED_OUT, PROTOCOL_ERROR, FAILED }

    static <T> DispatchResult<T> completed(T value) {
        return new DispatchResult<>(Kind.COMPLETED, value, null);
    }

    static <T> DispatchResult<T> failure(Kind kind, String detail) {
        return new DispatchResult<>(kind, null, detail);
    }

    public boolean completed() {
        return kind == Kind.COMPLETED;
    }

    /** Environment failure kind to hand the escalation policy when not completed. */
    public FailureKind failureKind() {
        return switch (kind) {
            case TIMED_OUT      -> FailureKind.WORKER_TIMEOUT;
            case PROTOCOL_ERROR -> FailureKind.PROTOCOL_ERROR;
            case FAILED         -> FailureKind.BLOCKED;
            case COMPLETED      -> throw new IllegalStateException("dispatch completed");
        };
    }
}
