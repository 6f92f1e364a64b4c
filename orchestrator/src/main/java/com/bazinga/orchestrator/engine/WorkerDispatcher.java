package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.config.EngineProperties;
import com.bazinga.orchestrator.model.EventType;
import com.bazinga.orchestrator.model.Stage;
import com.bazinga.orchestrator.model.TaskGroup;
import com.bazinga.orchestrator.worker.WorkerProtocolException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one worker call under the task group's dispatch hold and a
 * wall-clock timeout.
 *
 * A timed-out call is cancelled and its late result, if any, is never
 * read. Timeouts, protocol errors and transport failures are returned as
 * a {@link DispatchResult} rather than thrown; the caller decides how
 * they count.
 */
@Component
public class WorkerDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WorkerDispatcher.class);

    private final TaskGroupStateMachine stateMachine;
    private final EventLog              eventLog;
    private final MeterRegistry         meterRegistry;
    private final Duration              workerTimeout;

    public WorkerDispatcher(TaskGroupStateMachine stateMachine,
                            EventLog eventLog,
                            MeterRegistry meterRegistry,
                            EngineProperties properties) {
        this.stateMachine  = stateMachine;
        this.eventLog      = eventLog;
        this.meterRegistry = meterRegistry;
        this.workerTimeout = properties.dispatch().workerTimeout();
    }

    /**
     * Dispatch a stage call for a task group. Takes the dispatch hold
     * first; the hold is released whatever the outcome.
     *
     * @throws DispatchConflictException if a previous call for the group has not returned
     */
    public <T> DispatchResult<T> dispatch(UUID groupId, Stage stage, Supplier<CompletableFuture<T>> call) {
        String holder = stateMachine.acquireDispatch(groupId, stage);
        try {
            DispatchResult<T> result = await(stage.name().toLowerCase(Locale.ROOT), workerTimeout, call);
            if (!result.completed()) {
                recordFailure(stateMachine.get(groupId), stage, result);
            }
            return result;
        } finally {
            stateMachine.releaseDispatch(groupId, holder);
        }
    }

    /**
     * Await a worker call without a dispatch hold (validator, CI polling,
     * merge abort).
     */
    public <T> DispatchResult<T> await(String call, Duration timeout, Supplier<CompletableFuture<T>> supplier) {
        Timer.Sample sample = Timer.start(meterRegistry);
        DispatchResult<T> result;
        CompletableFuture<T> future = null;
        try {
            future = supplier.get();
            T value = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            result = value == null
                    ? DispatchResult.failure(DispatchResult.Kind.PROTOCOL_ERROR, call + " returned no result")
                    : DispatchResult.completed(value);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Worker call '{}' timed out after {}", call, timeout);
            result = DispatchResult.failure(DispatchResult.Kind.TIMED_OUT, call + " timed out after " + timeout);
        } catch (ExecutionException | CompletionException e) {
            result = classify(call, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) future.cancel(true);
            result = DispatchResult.failure(DispatchResult.Kind.FAILED, call + " interrupted");
        } catch (RuntimeException e) {
            result = classify(call, e);
        }
        sample.stop(meterRegistry.timer("bazinga.worker.dispatch", "call", call));
        meterRegistry.counter("bazinga.worker.calls",
                "call", call, "outcome", result.kind().name().toLowerCase(Locale.ROOT)).increment();
        return result;
    }

    private <T> DispatchResult<T> classify(String call, Throwable cause) {
        if (cause instanceof WorkerProtocolException) {
            log.warn("Worker call '{}' answered outside its protocol: {}", call, cause.getMessage());
            return DispatchResult.failure(DispatchResult.Kind.PROTOCOL_ERROR, cause.getMessage());
        }
        log.error("Worker call '{}' failed: {}", call, cause.getMessage(), cause);
        return DispatchResult.failure(DispatchResult.Kind.FAILED, cause.getMessage());
    }

    private void recordFailure(TaskGroup group, Stage stage, DispatchResult<?> result) {
        EventType type = switch (result.kind()) {
            case TIMED_OUT      -> EventType.WORKER_TIMEOUT;
            case PROTOCOL_ERROR -> EventType.WORKER_PROTOCOL_ERROR;
            default             -> EventType.WORKER_FAILED;
        };
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("stage", stage.name());
        detail.put("tier", group.getEscalationTier());
        detail.put("detail", String.valueOf(result.detail()));
        eventLog.record(type, group.getSessionId(), group.getId(), detail);
    }
}
