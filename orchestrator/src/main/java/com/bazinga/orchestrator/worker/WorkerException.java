package com.bazinga.orchestrator.worker;

/**
 * Thrown when the worker service returns an error or is unreachable.
 */
public class WorkerException extends RuntimeException {

    public WorkerException(String message) {
        super(message);
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
