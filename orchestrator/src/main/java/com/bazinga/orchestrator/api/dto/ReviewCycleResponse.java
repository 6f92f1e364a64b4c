package com.bazinga.orchestrator.api.dto;

import com.bazinga.orchestrator.model.Issue;
import com.bazinga.orchestrator.model.ReviewCycle;
import com.bazinga.orchestrator.model.ReviewVerdict;
import com.bazinga.orchestrator.model.Severity;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One review cycle with the issues it reported, for
 * GET /task-groups/{id}/review-cycles.
 */
public record ReviewCycleResponse(
        UUID                id,
        int                 iteration,
        ReviewVerdict       verdict,
        int                 issuesFixed,
        Instant             createdAt,
        List<IssueResponse> issues
) {
    public record IssueResponse(
            UUID     id,
            Severity severity,
            boolean  blocking,
            String   title,
            boolean  regression,
            Integer  resolvedInIteration) {

        static IssueResponse from(Issue i) {
            return new IssueResponse(i.getId(), i.getSeverity(), i.isBlocking(), i.getTitle(),
                    i.isRegression(), i.getResolvedInIteration());
        }
    }

    public static ReviewCycleResponse from(ReviewCycle cycle, List<Issue> allIssues) {
        return new ReviewCycleResponse(
                cycle.getId(),
                cycle.getIteration(),
                cycle.getVerdict(),
                cycle.getIssuesFixed(),
                cycle.getCreatedAt(),
                allIssues.stream()
                        .filter(i -> i.getReviewCycleId().equals(cycle.getId()))
                        .map(IssueResponse::from)
                        .toList()
        );
    }
}
