package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.config.EngineProperties;
import com.bazinga.orchestrator.model.CriterionStatus;
import com.bazinga.orchestrator.model.Session;
import com.bazinga.orchestrator.model.SuccessCriterion;
import com.bazinga.orchestrator.model.TaskGroup;
import com.bazinga.orchestrator.model.TaskGroupStatus;
import com.bazinga.orchestrator.model.TestingMode;
import com.bazinga.orchestrator.model.ValidatorVerdict;
import com.bazinga.orchestrator.model.VerdictKind;
import com.bazinga.orchestrator.repository.SessionRepository;
import com.bazinga.orchestrator.repository.SuccessCriterionRepository;
import com.bazinga.orchestrator.repository.TaskGroupRepository;
import com.bazinga.orchestrator.repository.ValidatorVerdictRepository;
import com.bazinga.orchestrator.worker.ValidationResult;
import com.bazinga.orchestrator.worker.WorkerGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Transaction boundaries of a REJECT verdict. Repositories, the state
 * machine and the transaction manager are mocked so the order of
 * commits against reopens is visible.
 */
@ExtendWith(MockitoExtension.class)
class ValidatorGateTest {

    @Mock SessionRepository          sessionRepo;
    @Mock TaskGroupRepository        groupRepo;
    @Mock SuccessCriterionRepository criterionRepo;
    @Mock ValidatorVerdictRepository verdictRepo;
    @Mock TaskGroupStateMachine      stateMachine;
    @Mock WorkerDispatcher           dispatcher;
    @Mock WorkerGateway              gateway;
    @Mock EventLog                   eventLog;
    @Mock PlatformTransactionManager transactionManager;

    ValidatorGate gate;

    UUID      sessionId;
    TaskGroup failingGroup;
    TaskGroup passingGroup;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties(1,
                new EngineProperties.Dispatch(Duration.ofMillis(100), Duration.ofMillis(100)),
                null, null, null, null);
        gate = new ValidatorGate(sessionRepo, groupRepo, criterionRepo, verdictRepo, stateMachine,
                dispatcher, gateway, eventLog, transactionManager, properties);

        Session session = new Session("Ship search", "main", TestingMode.MINIMAL);
        sessionId = UUID.randomUUID();
        setField(session, "id", sessionId);

        failingGroup = completedGroup("Search endpoint");
        passingGroup = completedGroup("Search page");
        SuccessCriterion failing = criterion(failingGroup, "search returns results");
        SuccessCriterion passing = criterion(passingGroup, "page renders");

        when(groupRepo.findBySessionIdOrderByCreatedAtAsc(sessionId))
                .thenReturn(List.of(failingGroup, passingGroup));
        when(criterionRepo.findBySessionId(sessionId)).thenReturn(List.of(failing, passing));
        when(dispatcher.<ValidationResult>await(eq("validate"), any(Duration.class), any()))
                .thenReturn(DispatchResult.completed(new ValidationResult(List.of(
                        new ValidationResult.CriterionCheck(failing.getId(), CriterionStatus.UNMET, "HTTP 500"),
                        new ValidationResult.CriterionCheck(passing.getId(), CriterionStatus.MET, "ok")))));
        when(sessionRepo.lockById(sessionId)).thenReturn(Optional.of(session));
        when(verdictRepo.save(any(ValidatorVerdict.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void reject_reopensFailingGroupBeforeTheVerdictCommits() {
        GateResult result = gate.validate(sessionId, 1);

        assertThat(result.verdict()).isEqualTo(VerdictKind.REJECT);
        assertThat(result.reopened()).containsExactly(failingGroup.getId());

        InOrder inOrder = inOrder(verdictRepo, stateMachine, transactionManager);
        inOrder.verify(verdictRepo).save(argThat((ValidatorVerdict v) -> v.getVerdict() == VerdictKind.REJECT));
        inOrder.verify(stateMachine).reopen(eq(failingGroup.getId()), anyList());
        inOrder.verify(transactionManager).commit(any());
        verify(stateMachine, never()).reopen(eq(passingGroup.getId()), anyList());
    }

    @Test
    void reject_reopenFailure_rollsBackTheVerdict() {
        when(stateMachine.reopen(eq(failingGroup.getId()), anyList()))
                .thenThrow(new IllegalStateException("Task group is IN_PROGRESS"));

        assertThatThrownBy(() -> gate.validate(sessionId, 1))
                .isInstanceOf(IllegalStateException.class);

        InOrder inOrder = inOrder(verdictRepo, transactionManager);
        inOrder.verify(verdictRepo).save(argThat((ValidatorVerdict v) -> v.getVerdict() == VerdictKind.REJECT));
        inOrder.verify(transactionManager).rollback(any());
        verify(transactionManager, times(1)).commit(any());   // the criterion checks only
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TaskGroup completedGroup(String description) {
        TaskGroup g = new TaskGroup(UUID.randomUUID(), description, null, 0);
        setField(g, "id", UUID.randomUUID());
        setField(g, "status", TaskGroupStatus.COMPLETED);
        return g;
    }

    private SuccessCriterion criterion(TaskGroup group, String text) {
        SuccessCriterion c = new SuccessCriterion(sessionId, group.getId(), text, true);
        setField(c, "id", UUID.randomUUID());
        return c;
    }

    private static void setField(Object target, String name, Object value) {
        try {
            var f = target.getClass().getDeclaredField(name);
            f.setAccessible(true);
            f.set(target, value);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
