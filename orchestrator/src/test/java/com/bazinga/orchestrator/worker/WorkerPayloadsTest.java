package com.bazinga.orchestrator.worker;

import com.bazinga.orchestrator.model.CriterionStatus;
import com.bazinga.orchestrator.model.ReviewVerdict;
import com.bazinga.orchestrator.model.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Wire payload parsing as HttpWorkerGateway does it: Jackson first,
 * then the closed-set conversion.
 */
class WorkerPayloadsTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void review_parsesIssuesAndDefaultsBlockingFromSeverity() throws Exception {
        WorkerPayloads.ReviewPayload payload = json.readValue("""
                {"status":"changesRequested","issues":[
                  {"severity":"critical","title":"SQL injection in login"},
                  {"severity":"low","title":"Rename variable"},
                  {"title":"Missing test","blocking":true,"signature":"missing-test-login"}
                ],"reviewer":"ignored"}
                """, WorkerPayloads.ReviewPayload.class);

        ReviewResult result = WorkerPayloads.toReviewResult(payload);

        assertThat(result.verdict()).isEqualTo(ReviewVerdict.CHANGES_REQUESTED);
        assertThat(result.issues()).hasSize(3);
        assertThat(result.issues().get(0).blocking()).isTrue();
        assertThat(result.issues().get(1).blocking()).isFalse();
        assertThat(result.issues().get(2).severity()).isEqualTo(Severity.MEDIUM);
        assertThat(result.issues().get(2).rootCause()).isEqualTo("missing test login");
    }

    @Test
    void review_issueWithoutTitle_isProtocolError() throws Exception {
        WorkerPayloads.ReviewPayload payload = json.readValue("""
                {"status":"changesRequested","issues":[{"severity":"high"}]}
                """, WorkerPayloads.ReviewPayload.class);

        assertThatThrownBy(() -> WorkerPayloads.toReviewResult(payload))
                .isInstanceOf(WorkerProtocolException.class);
    }

    @Test
    void merge_statusOutsideClosedSet_isProtocolError() throws Exception {
        WorkerPayloads.MergePayload payload = json.readValue("""
                {"status":"merged-ish"}
                """, WorkerPayloads.MergePayload.class);

        assertThatThrownBy(() -> WorkerPayloads.toMergeResult(payload))
                .isInstanceOf(WorkerProtocolException.class)
                .hasMessageContaining("merged-ish");
    }

    @Test
    void implement_blocked_keepsDetail() throws Exception {
        WorkerPayloads.ImplementPayload payload = json.readValue("""
                {"status":"blocked","detail":"missing credentials"}
                """, WorkerPayloads.ImplementPayload.class);

        ImplementResult result = WorkerPayloads.toImplementResult(payload);

        assertThat(result.status()).isEqualTo(ImplementResult.Status.BLOCKED);
        assertThat(result.detail()).isEqualTo("missing credentials");
        assertThat(result.filesChanged()).isEmpty();
    }

    @Test
    void validation_pendingCriterion_isProtocolError() {
        UUID id = UUID.randomUUID();
        WorkerPayloads.ValidationPayload payload = new WorkerPayloads.ValidationPayload(
                List.of(new WorkerPayloads.CheckPayload(id, "pending", null)));

        assertThatThrownBy(() -> WorkerPayloads.toValidationResult(payload))
                .isInstanceOf(WorkerProtocolException.class);
    }

    @Test
    void validation_mapsChecks() {
        UUID id = UUID.randomUUID();
        WorkerPayloads.ValidationPayload payload = new WorkerPayloads.ValidationPayload(
                List.of(new WorkerPayloads.CheckPayload(id, "unmet", "test suite red")));

        ValidationResult result = WorkerPayloads.toValidationResult(payload);

        assertThat(result.checks()).singleElement().satisfies(c -> {
            assertThat(c.criterionId()).isEqualTo(id);
            assertThat(c.status()).isEqualTo(CriterionStatus.UNMET);
            assertThat(c.evidence()).isEqualTo("test suite red");
        });
    }
}
