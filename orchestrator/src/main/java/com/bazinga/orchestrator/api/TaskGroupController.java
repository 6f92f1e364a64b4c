package com.bazinga.orchestrator.api;

import com.bazinga.orchestrator.api.dto.MergeAttemptResponse;
import com.bazinga.orchestrator.api.dto.ReviewCycleResponse;
import com.bazinga.orchestrator.api.dto.TaskGroupResponse;
import com.bazinga.orchestrator.engine.MergeCoordinator;
import com.bazinga.orchestrator.engine.ReviewLedger;
import com.bazinga.orchestrator.engine.SessionManager;
import com.bazinga.orchestrator.model.Issue;
import com.bazinga.orchestrator.model.TaskGroup;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * Read-only history of a single task group.
 *
 * GET /task-groups/{id}                   current state
 * GET /task-groups/{id}/review-cycles     every review cycle with its issues
 * GET /task-groups/{id}/merge-attempts    every integration attempt
 */
@RestController
@RequestMapping("/task-groups")
public class TaskGroupController {

    private final SessionManager   sessionManager;
    private final ReviewLedger     ledger;
    private final MergeCoordinator mergeCoordinator;

    public TaskGroupController(SessionManager sessionManager,
                               ReviewLedger ledger,
                               MergeCoordinator mergeCoordinator) {
        this.sessionManager   = sessionManager;
        this.ledger           = ledger;
        this.mergeCoordinator = mergeCoordinator;
    }

    @GetMapping("/{id}")
    public TaskGroupResponse getTaskGroup(@PathVariable UUID id) {
        return TaskGroupResponse.from(requireGroup(id));
    }

    @GetMapping("/{id}/review-cycles")
    public List<ReviewCycleResponse> getReviewCycles(@PathVariable UUID id) {
        requireGroup(id);
        List<Issue> issues = ledger.issues(id);
        return ledger.history(id).stream()
                .map(cycle -> ReviewCycleResponse.from(cycle, issues))
                .toList();
    }

    @GetMapping("/{id}/merge-attempts")
    public List<MergeAttemptResponse> getMergeAttempts(@PathVariable UUID id) {
        requireGroup(id);
        return mergeCoordinator.history(id).stream()
                .map(MergeAttemptResponse::from)
                .toList();
    }

    private TaskGroup requireGroup(UUID id) {
        return sessionManager.findTaskGroup(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Task group not found: " + id));
    }
}
