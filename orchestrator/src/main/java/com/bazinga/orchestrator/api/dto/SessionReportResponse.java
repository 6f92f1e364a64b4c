package com.bazinga.orchestrator.api.dto;

import com.bazinga.orchestrator.engine.SessionReport;
import com.bazinga.orchestrator.model.ValidatorVerdict;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for GET /sessions/{id}: progress, blocked groups with
 * their halt reasons, and the latest validator verdict (null before the
 * first completion attempt).
 */
public record SessionReportResponse(
        SessionResponse         session,
        int                     completionPercentage,
        boolean                 readyForValidation,
        List<TaskGroupResponse> taskGroups,
        List<Blocked>           blocked,
        Verdict                 latestVerdict
) {
    public record Blocked(UUID taskGroupId, String description, String reason) {}

    public record Verdict(int attempt, String verdict, String reason, Instant checkedAt) {
        static Verdict from(ValidatorVerdict v) {
            return v == null ? null
                    : new Verdict(v.getAttempt(), v.getVerdict().name(), v.getReason(), v.getCheckedAt());
        }
    }

    public static SessionReportResponse from(SessionReport report) {
        return new SessionReportResponse(
                SessionResponse.from(report.session()),
                report.completionPercentage(),
                report.readyForValidation(),
                report.taskGroups().stream().map(TaskGroupResponse::from).toList(),
                report.blocked().stream()
                        .map(b -> new Blocked(b.taskGroup().getId(), b.taskGroup().getDescription(), b.reason()))
                        .toList(),
                Verdict.from(report.latestVerdict())
        );
    }
}
