package com.bazinga.orchestrator.api;

import com.bazinga.orchestrator.api.dto.CreateSessionRequest;
import com.bazinga.orchestrator.api.dto.EventResponse;
import com.bazinga.orchestrator.api.dto.SessionReportResponse;
import com.bazinga.orchestrator.api.dto.SessionResponse;
import com.bazinga.orchestrator.api.dto.TaskGroupResponse;
import com.bazinga.orchestrator.engine.EventLog;
import com.bazinga.orchestrator.engine.SessionManager;
import com.bazinga.orchestrator.engine.TaskGroupScheduler;
import com.bazinga.orchestrator.model.Session;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for session lifecycle.
 *
 * POST /sessions                     create a session from a plan and start its task groups
 * GET  /sessions/{id}                progress, blocked groups and latest validator verdict
 * GET  /sessions/{id}/task-groups    every task group with its counters
 * GET  /sessions/{id}/events         the audit trail, oldest first
 */
@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final SessionManager     sessionManager;
    private final TaskGroupScheduler scheduler;
    private final EventLog           eventLog;

    public SessionController(SessionManager sessionManager,
                             TaskGroupScheduler scheduler,
                             EventLog eventLog) {
        this.sessionManager = sessionManager;
        this.scheduler      = scheduler;
        this.eventLog       = eventLog;
    }

    /**
     * Create a session. Its task groups are queued immediately.
     *
     * Example:
     *   curl -X POST http://localhost:8080/sessions \
     *     -H "Content-Type: application/json" \
     *     -d '{"request":"Add login","taskGroups":[{"description":"Login form","successCriteria":["form renders"]}]}'
     */
    @PostMapping
    public ResponseEntity<SessionResponse> create(@RequestBody CreateSessionRequest req) {
        Session session = sessionManager.createSession(req.toPlan());
        scheduler.submitSession(session.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session));
    }

    @GetMapping("/{id}")
    public SessionReportResponse getSession(@PathVariable UUID id) {
        requireSession(id);
        return SessionReportResponse.from(sessionManager.report(id));
    }

    @GetMapping("/{id}/task-groups")
    public List<TaskGroupResponse> getTaskGroups(@PathVariable UUID id) {
        requireSession(id);
        return sessionManager.taskGroups(id).stream()
                .map(TaskGroupResponse::from)
                .toList();
    }

    @GetMapping("/{id}/events")
    public List<EventResponse> getEvents(@PathVariable UUID id) {
        requireSession(id);
        return eventLog.forSession(id).stream()
                .map(EventResponse::from)
                .toList();
    }

    private void requireSession(UUID id) {
        sessionManager.findSession(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + id));
    }
}
