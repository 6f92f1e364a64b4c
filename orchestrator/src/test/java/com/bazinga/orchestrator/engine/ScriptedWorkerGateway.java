package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.model.CriterionStatus;
import com.bazinga.orchestrator.worker.CiStatus;
import com.bazinga.orchestrator.worker.ImplementResult;
import com.bazinga.orchestrator.worker.MergeResult;
import com.bazinga.orchestrator.worker.PostMergeResult;
import com.bazinga.orchestrator.worker.ReviewResult;
import com.bazinga.orchestrator.worker.ValidationRequest;
import com.bazinga.orchestrator.worker.ValidationResult;
import com.bazinga.orchestrator.worker.VerifyResult;
import com.bazinga.orchestrator.worker.WorkRequest;
import com.bazinga.orchestrator.worker.WorkerGateway;
import com.bazinga.orchestrator.worker.WorkerProtocolException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * In-memory WorkerGateway for engine tests.
 *
 * Each call pops the next scripted answer for that call; when nothing is
 * scripted it answers with the happy path (complete, passed, approved,
 * success, every criterion met). Every request is kept for assertions.
 */
class ScriptedWorkerGateway implements WorkerGateway {

    enum Call { IMPLEMENT, VERIFY, REVIEW, MERGE, ABORT_MERGE, POST_MERGE, CI_STATUS, VALIDATE }

    private final Map<Call, Deque<Function<Object, CompletableFuture<?>>>> scripts = new EnumMap<>(Call.class);
    private final Map<Call, List<Object>>                                  requests = new EnumMap<>(Call.class);

    ScriptedWorkerGateway() {
        for (Call call : Call.values()) {
            scripts.put(call, new ArrayDeque<>());
            requests.put(call, new ArrayList<>());
        }
    }

    // ------------------------------------------------------------------
    // Scripting
    // ------------------------------------------------------------------

    ScriptedWorkerGateway then(Call call, Object... results) {
        for (Object result : results) {
            scripts.get(call).add(request -> CompletableFuture.completedFuture(result));
        }
        return this;
    }

    /** Next call never answers; the dispatcher's timeout has to fire. */
    ScriptedWorkerGateway hang(Call call) {
        scripts.get(call).add(request -> new CompletableFuture<>());
        return this;
    }

    /** Next call answers outside the closed status set. */
    ScriptedWorkerGateway protocolError(Call call) {
        scripts.get(call).add(request ->
                CompletableFuture.failedFuture(new WorkerProtocolException(call + ": status 'maybe' unknown")));
        return this;
    }

    ScriptedWorkerGateway fail(Call call, RuntimeException error) {
        scripts.get(call).add(request -> CompletableFuture.failedFuture(error));
        return this;
    }

    ScriptedWorkerGateway validateWith(Function<ValidationRequest, ValidationResult> validator) {
        scripts.get(Call.VALIDATE).add(request ->
                CompletableFuture.completedFuture(validator.apply((ValidationRequest) request)));
        return this;
    }

    int calls(Call call) {
        return requests.get(call).size();
    }

    List<WorkRequest> workRequests(Call call) {
        return requests.get(call).stream().map(WorkRequest.class::cast).toList();
    }

    List<ValidationRequest> validationRequests() {
        return requests.get(Call.VALIDATE).stream().map(ValidationRequest.class::cast).toList();
    }

    void reset() {
        scripts.values().forEach(Deque::clear);
        requests.values().forEach(List::clear);
    }

    // ------------------------------------------------------------------
    // WorkerGateway
    // ------------------------------------------------------------------

    @Override
    public CompletableFuture<ImplementResult> implement(WorkRequest request) {
        return answer(Call.IMPLEMENT, request, ImplementResult.complete(List.of("src/Main.java"), 10, 10));
    }

    @Override
    public CompletableFuture<VerifyResult> verify(WorkRequest request) {
        return answer(Call.VERIFY, request, VerifyResult.passed());
    }

    @Override
    public CompletableFuture<ReviewResult> review(WorkRequest request) {
        return answer(Call.REVIEW, request, ReviewResult.approved());
    }

    @Override
    public CompletableFuture<MergeResult> merge(WorkRequest request) {
        return answer(Call.MERGE, request, MergeResult.success());
    }

    @Override
    public CompletableFuture<Void> abortMerge(WorkRequest request) {
        requests.get(Call.ABORT_MERGE).add(request);
        Function<Object, CompletableFuture<?>> script = scripts.get(Call.ABORT_MERGE).poll();
        return script == null ? CompletableFuture.completedFuture(null) : cast(script.apply(request));
    }

    @Override
    public CompletableFuture<PostMergeResult> postMergeCheck(WorkRequest request) {
        return answer(Call.POST_MERGE, request, PostMergeResult.passed());
    }

    @Override
    public CompletableFuture<CiStatus> ciStatus(WorkRequest request) {
        return answer(Call.CI_STATUS, request, CiStatus.SUCCESS);
    }

    @Override
    public CompletableFuture<ValidationResult> validate(ValidationRequest request) {
        ValidationResult allMet = new ValidationResult(request.criteria().stream()
                .map(c -> new ValidationResult.CriterionCheck(c.criterionId(), CriterionStatus.MET, "re-checked"))
                .toList());
        return answer(Call.VALIDATE, request, allMet);
    }

    private <T> CompletableFuture<T> answer(Call call, Object request, T fallback) {
        requests.get(call).add(request);
        Function<Object, CompletableFuture<?>> script = scripts.get(call).poll();
        return script == null ? CompletableFuture.completedFuture(fallback) : cast(script.apply(request));
    }

    @SuppressWarnings("unchecked")
    private static <T> CompletableFuture<T> cast(CompletableFuture<?> future) {
        return (CompletableFuture<T>) future;
    }
}
