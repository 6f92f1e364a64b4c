package com.bazinga.orchestrator.worker;

import com.bazinga.orchestrator.model.ReviewVerdict;

import java.util.List;

/**
 * Structured result of a review dispatch.
 */
public record ReviewResult(ReviewVerdict verdict, List<IssueReport> issues) {

    public ReviewResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static ReviewResult approved() {
        return new ReviewResult(ReviewVerdict.APPROVED, List.of());
    }

    public static ReviewResult changesRequested(List<IssueReport> issues) {
        return new ReviewResult(ReviewVerdict.CHANGES_REQUESTED, issues);
    }
}
