package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.model.TaskGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Drives one task group from wherever the State Store says it is until it
 * settles (COMPLETED or FAILED), then hands it to the Session Manager.
 *
 * Runs on a scheduler worker thread; everything within one group is
 * strictly sequential.
 */
@Component
public class TaskGroupRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskGroupRunner.class);

    private final TaskGroupStateMachine stateMachine;
    private final ReviewFeedbackLoop    feedbackLoop;
    private final MergeCoordinator      mergeCoordinator;
    private final SessionManager        sessionManager;

    public TaskGroupRunner(TaskGroupStateMachine stateMachine,
                           ReviewFeedbackLoop feedbackLoop,
                           MergeCoordinator mergeCoordinator,
                           SessionManager sessionManager) {
        this.stateMachine     = stateMachine;
        this.feedbackLoop     = feedbackLoop;
        this.mergeCoordinator = mergeCoordinator;
        this.sessionManager   = sessionManager;
    }

    /**
     * @return task groups reopened by the validator as a result of this
     *         group settling; the caller schedules them
     */
    public List<UUID> drive(UUID groupId) {
        TaskGroup group = stateMachine.get(groupId);
        // Every log line of this run carries the session and group.
        MDC.put("sessionId",   group.getSessionId().toString());
        MDC.put("taskGroupId", groupId.toString());
        try {
            while (true) {
                group = stateMachine.get(groupId);
                switch (group.getStatus()) {
                    case PENDING -> stateMachine.dispatch(groupId,
                            "worker-" + UUID.randomUUID().toString().substring(0, 8));
                    case IN_PROGRESS -> feedbackLoop.run(groupId);
                    case APPROVED_PENDING_MERGE, MERGING -> mergeCoordinator.run(groupId);
                    case COMPLETED, FAILED -> {
                        log.info("Task group {} settled as {}", groupId, group.getStatus());
                        return sessionManager.onTaskGroupSettled(groupId);
                    }
                }
            }
        } finally {
            MDC.clear();
        }
    }
}
