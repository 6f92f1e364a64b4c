package com.bazinga.orchestrator.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionTest {

    Session session;

    @BeforeEach
    void setUp() {
        session = new Session("Build the search page", null, null);
        setId(session, UUID.randomUUID());
    }

    @Test
    void defaults_applyWhenBranchAndModeAreMissing() {
        assertThat(session.getInitialBranchRef()).isEqualTo("main");
        assertThat(session.getTestingMode()).isEqualTo(TestingMode.FULL);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void complete_withAcceptForCurrentAttempt_closesSession() {
        int attempt = session.beginValidation();

        session.complete(new ValidatorVerdict(session.getId(), attempt, VerdictKind.ACCEPT, "all met"));

        assertThat(session.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(session.isValidationInFlight()).isFalse();
        assertThat(session.getEndedAt()).isNotNull();
    }

    @Test
    void complete_withoutVerdict_isRefused() {
        session.beginValidation();

        assertThatThrownBy(() -> session.complete(null)).isInstanceOf(IllegalStateException.class);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void complete_withRejectVerdict_isRefused() {
        int attempt = session.beginValidation();

        assertThatThrownBy(() -> session.complete(
                new ValidatorVerdict(session.getId(), attempt, VerdictKind.REJECT, "criterion unmet")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void complete_withVerdictFromEarlierAttempt_isRefused() {
        int first = session.beginValidation();
        session.endValidation();
        session.beginValidation();

        assertThatThrownBy(() -> session.complete(
                new ValidatorVerdict(session.getId(), first, VerdictKind.ACCEPT, "stale")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void complete_withAnotherSessionsVerdict_isRefused() {
        int attempt = session.beginValidation();

        assertThatThrownBy(() -> session.complete(
                new ValidatorVerdict(UUID.randomUUID(), attempt, VerdictKind.ACCEPT, "wrong session")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void beginValidation_whileInFlight_isRefused() {
        session.beginValidation();

        assertThatThrownBy(session::beginValidation).isInstanceOf(IllegalStateException.class);
        assertThat(session.getCompletionAttempt()).isEqualTo(1);
    }

    @Test
    void failedSession_cannotValidate() {
        session.fail();

        assertThatThrownBy(session::beginValidation).isInstanceOf(IllegalStateException.class);
        assertThat(session.getEndedAt()).isNotNull();
    }

    private static void setId(Session s, UUID id) {
        try {
            var f = s.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(s, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
