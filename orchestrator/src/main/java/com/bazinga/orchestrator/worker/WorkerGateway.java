package com.bazinga.orchestrator.worker;

import java.util.concurrent.CompletableFuture;

/**
 * Dispatch contract to the external workers.
 *
 * Every call is asynchronous; the engine awaits each future with a
 * wall-clock timeout and cancels it on expiry. A future that completes
 * exceptionally with {@link WorkerProtocolException} means the worker
 * answered outside the stage's closed status set.
 */
public interface WorkerGateway {

    CompletableFuture<ImplementResult> implement(WorkRequest request);

    CompletableFuture<VerifyResult> verify(WorkRequest request);

    CompletableFuture<ReviewResult> review(WorkRequest request);

    CompletableFuture<MergeResult> merge(WorkRequest request);

    /** Revert an integration attempt so no partial state is left behind. */
    CompletableFuture<Void> abortMerge(WorkRequest request);

    CompletableFuture<PostMergeResult> postMergeCheck(WorkRequest request);

    CompletableFuture<CiStatus> ciStatus(WorkRequest request);

    CompletableFuture<ValidationResult> validate(ValidationRequest request);
}
