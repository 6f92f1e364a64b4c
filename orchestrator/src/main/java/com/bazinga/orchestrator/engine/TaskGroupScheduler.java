package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.config.EngineProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Bounded pool that runs task groups concurrently.
 *
 * Pool size is bazinga.engine.max-parallel-groups. A group is never queued
 * twice: while it is running or waiting, further submissions are ignored.
 *
 * The DB is the source of truth. On startup, and then on a fixed sweep,
 * every group the Session Manager reports as resumable is submitted, so
 * work survives a restart without any in-memory queue.
 */
@Component
@EnableScheduling
public class TaskGroupScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskGroupScheduler.class);

    private final ExecutorService workers;
    private final Set<UUID>       active = ConcurrentHashMap.newKeySet();

    private final TaskGroupRunner runner;
    private final SessionManager  sessionManager;

    public TaskGroupScheduler(TaskGroupRunner runner,
                              SessionManager sessionManager,
                              EngineProperties properties) {
        this.runner         = runner;
        this.sessionManager = sessionManager;
        this.workers        = Executors.newFixedThreadPool(properties.maxParallelGroups());
    }

    /** Queue a task group unless it is already queued or running. */
    public boolean submit(UUID groupId) {
        if (!active.add(groupId)) {
            return false;
        }
        workers.submit(() -> {
            List<UUID> reopened = List.of();
            try {
                reopened = runner.drive(groupId);
            } catch (Exception e) {
                log.error("Unhandled error driving task group {}: {}", groupId, e.getMessage(), e);
            } finally {
                active.remove(groupId);
            }
            reopened.forEach(this::submit);
        });
        return true;
    }

    public void submitSession(UUID sessionId) {
        sessionManager.taskGroups(sessionId).forEach(group -> submit(group.getId()));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recover() {
        sessionManager.recoverInterruptedWork();
        sweep();
    }

    /**
     * Re-submit whatever the State Store says still needs driving. Picks up
     * groups whose runner died on an unexpected error.
     */
    @Scheduled(fixedDelayString = "${bazinga.engine.sweep-interval-ms:60000}",
               initialDelayString = "${bazinga.engine.sweep-interval-ms:60000}")
    public void sweep() {
        int submitted = 0;
        for (UUID groupId : sessionManager.resumableTaskGroups()) {
            if (submit(groupId)) submitted++;
        }
        if (submitted > 0) {
            log.info("Sweep submitted {} task group(s)", submitted);
        }
    }

    public boolean isActive(UUID groupId) {
        return active.contains(groupId);
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        workers.shutdownNow();
        if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
            log.warn("Task group workers did not stop within 10 s");
        }
    }
}
