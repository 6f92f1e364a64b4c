package com.bazinga.orchestrator.worker;

import com.bazinga.orchestrator.model.ReviewVerdict;
import com.bazinga.orchestrator.model.Severity;
import com.bazinga.orchestrator.model.Stage;
import com.bazinga.orchestrator.model.WorkerTier;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Runs HttpWorkerGateway against an in-process HTTP server that answers
 * each worker path with a canned JSON body.
 */
class HttpWorkerGatewayTest {

    private final Map<String, String> bodies   = new ConcurrentHashMap<>();
    private final Map<String, String> received = new ConcurrentHashMap<>();

    private HttpServer        server;
    private HttpWorkerGateway gateway;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/workers", exchange -> {
            String path = exchange.getRequestURI().getPath();
            received.put(path, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String body = bodies.get(path);
            byte[] bytes = (body == null ? "no script" : body).getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(body == null ? 500 : 200, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        gateway = new HttpWorkerGateway("http://127.0.0.1:" + server.getAddress().getPort(),
                new ObjectMapper().findAndRegisterModules());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void review_parsesVerdictAndIssues() throws Exception {
        bodies.put("/workers/review", """
                {"status":"changesRequested","issues":[
                  {"severity":"high","title":"SQL built by string concatenation"},
                  {"severity":"low","title":"typo in log line","blocking":false}]}
                """);

        ReviewResult result = gateway.review(request()).get(5, TimeUnit.SECONDS);

        assertThat(result.verdict()).isEqualTo(ReviewVerdict.CHANGES_REQUESTED);
        assertThat(result.issues()).extracting(IssueReport::severity, IssueReport::blocking)
                .containsExactly(
                        tuple(Severity.HIGH, true),
                        tuple(Severity.LOW, false));
        assertThat(received.get("/workers/review")).contains("\"stage\":\"REVIEW\"", "\"tier\":\"SENIOR_ENGINEER\"");
    }

    @Test
    void unknownStatus_failsWithProtocolException() {
        bodies.put("/workers/merge", """
                {"status":"maybe"}
                """);

        assertThatThrownBy(() -> gateway.merge(request()).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(WorkerProtocolException.class);
    }

    @Test
    void unreadableBody_failsWithProtocolException() {
        bodies.put("/workers/ci-status", "not json");

        assertThatThrownBy(() -> gateway.ciStatus(request()).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(WorkerProtocolException.class);
    }

    @Test
    void httpError_failsWithWorkerException() {
        assertThatThrownBy(() -> gateway.implement(request()).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(WorkerException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void validate_leavingACriterionPending_isAProtocolError() {
        UUID criterion = UUID.randomUUID();
        bodies.put("/workers/validate", """
                {"checks":[{"criterionId":"%s","status":"pending"}]}
                """.formatted(criterion));

        assertThatThrownBy(() -> gateway.validate(new ValidationRequest(UUID.randomUUID(), 1,
                        List.of(new ValidationRequest.Criterion(criterion, null, "search returns results"))))
                .get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(WorkerProtocolException.class);
    }

    private static WorkRequest request() {
        return new WorkRequest(UUID.randomUUID(), Stage.REVIEW, WorkerTier.SENIOR_ENGINEER,
                "Add search endpoint", "feature/search", List.of(), List.of());
    }
}
