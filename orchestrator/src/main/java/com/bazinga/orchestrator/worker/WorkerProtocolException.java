package com.bazinga.orchestrator.worker;

/**
 * Thrown when a worker response falls outside the closed set of statuses
 * for its stage, or is missing required fields.
 */
public class WorkerProtocolException extends RuntimeException {

    public WorkerProtocolException(String message) {
        super(message);
    }
}
