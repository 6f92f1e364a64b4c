package com.bazinga.orchestrator.model;

import java.util.UUID;

/**
 * Thrown when a caller asks a task group for a status or stage move its
 * lifecycle does not allow.
 */
public class IllegalTransitionException extends IllegalStateException {

    private final UUID taskGroupId;

    public IllegalTransitionException(UUID taskGroupId, String detail) {
        super("Illegal transition for task group " + taskGroupId + ": " + detail);
        this.taskGroupId = taskGroupId;
    }

    public UUID getTaskGroupId() { return taskGroupId; }
}
