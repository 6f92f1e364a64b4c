package com.bazinga.orchestrator.worker;

import com.bazinga.orchestrator.worker.WorkerPayloads.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP client for the worker service.
 *
 * Each worker call is a JSON POST to {@code <base-url>/workers/<call>}.
 * Uses java.net.http.HttpClient.sendAsync so the engine can await the
 * result with its own timeout and cancel it on expiry.
 *
 * Transport failures surface as {@link WorkerException}; responses that
 * parse but carry an unknown status surface as {@link WorkerProtocolException}.
 */
@Component
public class HttpWorkerGateway implements WorkerGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkerGateway.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public HttpWorkerGateway(
            @Value("${bazinga.workers.base-url}") String baseUrl,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Task-group workers
    // ------------------------------------------------------------------

    @Override
    public CompletableFuture<ImplementResult> implement(WorkRequest request) {
        return post("/workers/implement", request, "implement")
                .thenApply(body -> WorkerPayloads.toImplementResult(read(body, ImplementPayload.class, "implement")));
    }

    @Override
    public CompletableFuture<VerifyResult> verify(WorkRequest request) {
        return post("/workers/verify", request, "verify")
                .thenApply(body -> WorkerPayloads.toVerifyResult(read(body, VerifyPayload.class, "verify")));
    }

    @Override
    public CompletableFuture<ReviewResult> review(WorkRequest request) {
        return post("/workers/review", request, "review")
                .thenApply(body -> WorkerPayloads.toReviewResult(read(body, ReviewPayload.class, "review")));
    }

    // ------------------------------------------------------------------
    // Integration
    // ------------------------------------------------------------------

    @Override
    public CompletableFuture<MergeResult> merge(WorkRequest request) {
        return post("/workers/merge", request, "merge")
                .thenApply(body -> WorkerPayloads.toMergeResult(read(body, MergePayload.class, "merge")));
    }

    @Override
    public CompletableFuture<Void> abortMerge(WorkRequest request) {
        return post("/workers/merge/abort", request, "abort-merge")
                .thenApply(body -> null);
    }

    @Override
    public CompletableFuture<PostMergeResult> postMergeCheck(WorkRequest request) {
        return post("/workers/merge/post-check", request, "post-merge-check")
                .thenApply(body -> WorkerPayloads.toPostMergeResult(read(body, PostMergePayload.class, "post-merge-check")));
    }

    @Override
    public CompletableFuture<CiStatus> ciStatus(WorkRequest request) {
        return post("/workers/merge/ci-status", request, "ci-status")
                .thenApply(body -> WorkerPayloads.toCiStatus(read(body, CiPayload.class, "ci-status")));
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    @Override
    public CompletableFuture<ValidationResult> validate(ValidationRequest request) {
        return post("/workers/validate", request, "validate")
                .thenApply(body -> WorkerPayloads.toValidationResult(read(body, ValidationPayload.class, "validate")));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private CompletableFuture<String> post(String path, Object body, String call) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();
        log.debug("POST {} ({})", path, call);
        return http.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .thenApply(resp -> {
                    if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                        throw new WorkerException(
                                call + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
                    }
                    return resp.body();
                });
    }

    private <T> T read(String body, Class<T> type, String call) {
        try {
            T value = json.readValue(body, type);
            if (value == null) {
                throw new WorkerProtocolException(call + ": empty response");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new WorkerProtocolException(call + ": unreadable response: " + e.getOriginalMessage());
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new WorkerException("JSON serialization failed", e);
        }
    }
}
