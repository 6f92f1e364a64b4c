package com.bazinga.orchestrator.engine;

import java.util.UUID;

/**
 * Thrown when a worker dispatch is requested for a task group whose
 * previous dispatch has not returned yet.
 */
public class DispatchConflictException extends IllegalStateException {

    public DispatchConflictException(UUID taskGroupId, String holder) {
        super("Task group " + taskGroupId + " is still held by " + holder);
    }
}
