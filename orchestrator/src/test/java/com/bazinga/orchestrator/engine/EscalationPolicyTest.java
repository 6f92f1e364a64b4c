package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.config.EngineProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Pure-function tests for EscalationPolicy. No Spring, no mocks.
 */
class EscalationPolicyTest {

    private final EscalationPolicy policy = new EscalationPolicy(EngineProperties.defaults());

    // ------------------------------------------------------------------
    // Review rejections
    // ------------------------------------------------------------------

    @Test
    void reviewRejection_raisesTierByOne() {
        EscalationDecision d = policy.decide(FailureKind.REVIEW_REJECTION, 1, 0, 0);

        assertThat(d.isHalt()).isFalse();
        assertThat(d.tier()).isEqualTo(1);
    }

    @Test
    void reviewRejection_atHighestTier_staysThere() {
        EscalationDecision d = policy.decide(FailureKind.REVIEW_REJECTION, 4, 0, 3);

        assertThat(d.isHalt()).isFalse();
        assertThat(d.tier()).isEqualTo(3);
    }

    @Test
    void reviewRejection_pastIterationCap_halts() {
        EscalationDecision d = policy.decide(FailureKind.REVIEW_REJECTION, 10, 0, 3);

        assertThat(d.isHalt()).isTrue();
    }

    @Test
    void stagnation_haltsWhateverTheFailure() {
        for (FailureKind kind : FailureKind.values()) {
            EscalationDecision d = policy.decide(kind, 1, 2, 0);
            assertThat(d.isHalt()).as(kind.name()).isTrue();
        }
    }

    @Test
    void oneStagnantCycle_stillRetries() {
        EscalationDecision d = policy.decide(FailureKind.REVIEW_REJECTION, 2, 1, 1);

        assertThat(d.isHalt()).isFalse();
        assertThat(d.tier()).isEqualTo(2);
    }

    @Test
    void regression_jumpsToHighestTier() {
        EscalationDecision d = policy.decide(FailureKind.REGRESSION, 3, 0, 1);

        assertThat(d.isHalt()).isFalse();
        assertThat(d.tier()).isEqualTo(3);
    }

    @Test
    void regression_atHighestTier_halts() {
        assertThat(policy.decide(FailureKind.REGRESSION, 3, 0, 3).isHalt()).isTrue();
    }

    // ------------------------------------------------------------------
    // Merge failures
    // ------------------------------------------------------------------

    @Test
    void mergeFailures_escalateOnSecond_highestOnThird_haltOnFourth() {
        EscalationDecision first  = policy.decide(FailureKind.MERGE_TEST_FAILURE, 1, 0, 0);
        EscalationDecision second = policy.decide(FailureKind.MERGE_TEST_FAILURE, 2, 0, first.tier());
        EscalationDecision third  = policy.decide(FailureKind.MERGE_CONFLICT, 3, 0, second.tier());
        EscalationDecision fourth = policy.decide(FailureKind.MERGE_CONFLICT, 4, 0, third.tier());

        assertThat(first.tier()).isEqualTo(0);
        assertThat(second.tier()).isEqualTo(1);
        assertThat(third.tier()).isEqualTo(3);
        assertThat(fourth.isHalt()).isTrue();
    }

    // ------------------------------------------------------------------
    // Verification and environment failures
    // ------------------------------------------------------------------

    @Test
    void verifyFailure_belowLimit_retriesAtSameTier() {
        EscalationDecision d = policy.decide(FailureKind.VERIFY_FAILURE, 2, 0, 1);

        assertThat(d.isHalt()).isFalse();
        assertThat(d.tier()).isEqualTo(1);
    }

    @Test
    void verifyFailure_atLimit_escalates() {
        assertThat(policy.decide(FailureKind.VERIFY_FAILURE, 3, 0, 1).tier()).isEqualTo(2);
        assertThat(policy.decide(FailureKind.VERIFY_FAILURE, 3, 0, 3).isHalt()).isTrue();
    }

    @Test
    void environmentFailure_escalatesThenHaltsAtHighest() {
        assertThat(policy.decide(FailureKind.WORKER_TIMEOUT, 1, 0, 0).tier()).isEqualTo(1);
        assertThat(policy.decide(FailureKind.PROTOCOL_ERROR, 1, 0, 2).tier()).isEqualTo(3);
        assertThat(policy.decide(FailureKind.BLOCKED, 1, 0, 3).isHalt()).isTrue();
    }

    @Test
    void environmentFailure_afterContentFailuresReachedHighest_haltsOnFirstOccurrence() {
        int tier = 0;
        for (int iteration = 1; iteration <= 3; iteration++) {
            tier = policy.decide(FailureKind.REVIEW_REJECTION, iteration, 0, tier).tier();
        }
        assertThat(tier).isEqualTo(3);

        EscalationDecision timeout = policy.decide(FailureKind.WORKER_TIMEOUT, 1, 0, tier);

        assertThat(timeout.isHalt()).isTrue();
        assertThat(timeout.reason()).contains("WORKER_TIMEOUT at highest tier");
    }

    @Test
    void tierNeverDecreases() {
        for (FailureKind kind : FailureKind.values()) {
            for (int tier = 0; tier <= 3; tier++) {
                for (int attempt = 1; attempt <= 5; attempt++) {
                    EscalationDecision d = policy.decide(kind, attempt, 0, tier);
                    assertThat(d.tier()).as("%s attempt=%d tier=%d", kind, attempt, tier)
                            .isGreaterThanOrEqualTo(tier);
                }
            }
        }
    }
}
