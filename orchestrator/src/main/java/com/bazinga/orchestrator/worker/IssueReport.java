package com.bazinga.orchestrator.worker;

import com.bazinga.orchestrator.model.Severity;

import java.util.Locale;

/**
 * One issue as it travels between the engine and the workers: review
 * findings, verification failures, merge conflicts, failing tests and
 * validator findings all use this shape.
 *
 * signature is the worker's root-cause key; when absent the normalised
 * title stands in for it.
 */
public record IssueReport(Severity severity, boolean blocking, String title, String signature) {

    public IssueReport {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("issue title must not be blank");
        }
        if (severity == null) severity = Severity.MEDIUM;
    }

    public IssueReport(Severity severity, boolean blocking, String title) {
        this(severity, blocking, title, null);
    }

    /** Blocking HIGH issue, the shape used for engine-generated findings. */
    public static IssueReport blocking(String title) {
        return new IssueReport(Severity.HIGH, true, title, null);
    }

    /** Key used to decide "same root cause" across review cycles. */
    public String rootCause() {
        String source = (signature != null && !signature.isBlank()) ? signature : title;
        return normalize(source);
    }

    static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", " ")
                .trim();
    }
}
