package com.bazinga.orchestrator.worker;

import com.bazinga.orchestrator.model.CriterionStatus;
import com.bazinga.orchestrator.model.MergeOutcome;
import com.bazinga.orchestrator.model.ReviewVerdict;
import com.bazinga.orchestrator.model.Severity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.UUID;

/**
 * JSON shapes returned by the worker service, and their conversion into
 * the typed results the engine works with.
 *
 * Status fields arrive as free text and are checked against the closed
 * set for each call here, so the engine never sees an unknown token.
 */
final class WorkerPayloads {

    private WorkerPayloads() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IssuePayload(String severity, Boolean blocking, String title, String signature) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ImplementPayload(String status, List<String> filesChanged, int testsRun, int testsPassed, String detail) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record VerifyPayload(String status, List<IssuePayload> failures) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ReviewPayload(String status, List<IssuePayload> issues) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MergePayload(String status, List<String> conflictingFiles, List<String> failingTests, String detail) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PostMergePayload(String status, List<String> failingTests) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CiPayload(String status) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CheckPayload(UUID criterionId, String status, String evidence) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ValidationPayload(List<CheckPayload> checks) {}

    // ------------------------------------------------------------------
    // Conversion
    // ------------------------------------------------------------------

    static ImplementResult toImplementResult(ImplementPayload p) {
        ImplementResult.Status status = StatusTokens.parse(ImplementResult.Status.class, p.status(), "implement");
        return new ImplementResult(status, p.filesChanged(), p.testsRun(), p.testsPassed(), p.detail());
    }

    static VerifyResult toVerifyResult(VerifyPayload p) {
        VerifyResult.Status status = StatusTokens.parse(VerifyResult.Status.class, p.status(), "verify");
        return new VerifyResult(status, toIssues(p.failures(), "verify"));
    }

    static ReviewResult toReviewResult(ReviewPayload p) {
        ReviewVerdict verdict = StatusTokens.parse(ReviewVerdict.class, p.status(), "review");
        return new ReviewResult(verdict, toIssues(p.issues(), "review"));
    }

    static MergeResult toMergeResult(MergePayload p) {
        MergeOutcome outcome = StatusTokens.parse(MergeOutcome.class, p.status(), "merge");
        return new MergeResult(outcome, p.conflictingFiles(), p.failingTests(), p.detail());
    }

    static PostMergeResult toPostMergeResult(PostMergePayload p) {
        PostMergeResult.Status status = StatusTokens.parse(PostMergeResult.Status.class, p.status(), "post-merge-check");
        return new PostMergeResult(status, p.failingTests());
    }

    static CiStatus toCiStatus(CiPayload p) {
        return StatusTokens.parse(CiStatus.class, p.status(), "ci-status");
    }

    static ValidationResult toValidationResult(ValidationPayload p) {
        if (p.checks() == null) {
            throw new WorkerProtocolException("validate: missing checks");
        }
        List<ValidationResult.CriterionCheck> checks = p.checks().stream()
                .map(c -> {
                    CriterionStatus status = StatusTokens.parse(CriterionStatus.class, c.status(), "validate");
                    if (status == CriterionStatus.PENDING) {
                        throw new WorkerProtocolException("validate: criterion " + c.criterionId() + " left PENDING");
                    }
                    return new ValidationResult.CriterionCheck(c.criterionId(), status, c.evidence());
                })
                .toList();
        return new ValidationResult(checks);
    }

    private static List<IssueReport> toIssues(List<IssuePayload> payloads, String call) {
        if (payloads == null) return List.of();
        return payloads.stream()
                .map(p -> {
                    if (p.title() == null || p.title().isBlank()) {
                        throw new WorkerProtocolException(call + ": issue without title");
                    }
                    Severity severity = p.severity() == null
                            ? Severity.MEDIUM
                            : StatusTokens.parse(Severity.class, p.severity(), call);
                    boolean blocking = p.blocking() != null
                            ? p.blocking()
                            : (severity == Severity.CRITICAL || severity == Severity.HIGH);
                    return new IssueReport(severity, blocking, p.title(), p.signature());
                })
                .toList();
    }
}
