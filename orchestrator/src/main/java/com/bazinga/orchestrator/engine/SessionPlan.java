package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.model.TestingMode;

import java.util.List;

/**
 * Input to {@link SessionManager#createSession}: the request and the task
 * groups it was broken into.
 *
 * @param sessionCriteria criteria that span the whole session rather than one group
 */
public record SessionPlan(
        String              request,
        String              initialBranchRef,
        TestingMode         testingMode,
        List<TaskGroupPlan> taskGroups,
        List<String>        sessionCriteria) {

    public record TaskGroupPlan(String description, String branchRef, List<String> successCriteria) {
        public TaskGroupPlan {
            if (description == null || description.isBlank()) {
                throw new IllegalArgumentException("task group description must not be blank");
            }
            successCriteria = successCriteria == null ? List.of() : List.copyOf(successCriteria);
        }
    }

    public SessionPlan {
        if (taskGroups == null || taskGroups.isEmpty()) {
            throw new IllegalArgumentException("a session needs at least one task group");
        }
        taskGroups      = List.copyOf(taskGroups);
        sessionCriteria = sessionCriteria == null ? List.of() : List.copyOf(sessionCriteria);
    }
}
