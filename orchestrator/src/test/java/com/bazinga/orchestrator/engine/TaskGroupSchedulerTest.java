package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.config.EngineProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TaskGroupScheduler with the runner and session manager
 * mocked.
 */
@ExtendWith(MockitoExtension.class)
class TaskGroupSchedulerTest {

    @Mock TaskGroupRunner runner;
    @Mock SessionManager  sessionManager;

    TaskGroupScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TaskGroupScheduler(runner, sessionManager,
                new EngineProperties(2, null, null, null, null, null));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        scheduler.shutdown();
    }

    @Test
    void submit_whileGroupIsRunning_isIgnored() throws Exception {
        UUID groupId = UUID.randomUUID();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(runner.drive(groupId)).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });

        assertThat(scheduler.submit(groupId)).isTrue();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.submit(groupId)).isFalse();
        assertThat(scheduler.isActive(groupId)).isTrue();

        release.countDown();
        verify(runner, timeout(5000).times(1)).drive(groupId);
    }

    @Test
    void reopenedGroups_areResubmitted() {
        UUID settled  = UUID.randomUUID();
        UUID reopened = UUID.randomUUID();
        when(runner.drive(settled)).thenReturn(List.of(reopened));
        when(runner.drive(reopened)).thenReturn(List.of());

        scheduler.submit(settled);

        verify(runner, timeout(5000)).drive(reopened);
    }

    @Test
    void runnerError_releasesGroupForTheNextSweep() {
        UUID groupId = UUID.randomUUID();
        when(runner.drive(groupId)).thenThrow(new IllegalStateException("db went away"));

        scheduler.submit(groupId);

        verify(runner, timeout(5000)).drive(groupId);
        await(() -> !scheduler.isActive(groupId));
        assertThat(scheduler.submit(groupId)).isTrue();
    }

    @Test
    void recover_clearsInterruptedWorkThenSubmitsResumableGroups() {
        UUID groupId = UUID.randomUUID();
        when(sessionManager.resumableTaskGroups()).thenReturn(List.of(groupId));
        when(runner.drive(groupId)).thenReturn(List.of());

        scheduler.recover();

        var order = inOrder(sessionManager);
        order.verify(sessionManager).recoverInterruptedWork();
        order.verify(sessionManager).resumableTaskGroups();
        verify(runner, timeout(5000)).drive(groupId);
    }

    private static void await(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.onSpinWait();
        }
        assertThat(condition.getAsBoolean()).isTrue();
    }
}
