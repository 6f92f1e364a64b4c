package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.config.EngineProperties;
import com.bazinga.orchestrator.model.WorkerTier;
import org.springframework.stereotype.Component;

/**
 * Pure decision function: (failure kind, counters, current tier) → (next tier, retry|halt).
 *
 * <ul>
 *   <li>Stagnation guard first: once noProgressCount reaches the threshold
 *       the answer is HALT whatever the failure looks like.</li>
 *   <li>Review rejection: one tier up per rejection, halt after the
 *       iteration cap.</li>
 *   <li>Regression: straight to the highest tier; halt if already there.</li>
 *   <li>Verification failure: same tier until the retry limit, then one up;
 *       halt when the highest tier exhausts its limit.</li>
 *   <li>Merge conflict / test failure: counted on consecutive failures:
 *       2nd raises the tier, 3rd jumps to the highest, 4th halts.</li>
 *   <li>Environment (blocked, timeout, protocol error): one tier up;
 *       halt once the highest tier has failed.</li>
 * </ul>
 *
 * The returned tier is never below the current one.
 *
 * <p>Content and environment failures climb the same tier ladder. A group
 * that review rejections or merge failures already pushed to the highest
 * tier halts on its first environment failure there, however few
 * environment failures it had before; a blocked merge after the merge
 * escalation reached the highest tier halts the group this way. The
 * environment failure count passed as {@code attemptCount} does not gate
 * that halt.
 */
@Component
public class EscalationPolicy {

    private final EngineProperties.Escalation limits;

    public EscalationPolicy(EngineProperties properties) {
        this.limits = properties.escalation();
    }

    public EscalationDecision decide(FailureKind kind, int attemptCount, int noProgressCount, int escalationTier) {
        int current = Math.max(0, escalationTier);
        int highest = WorkerTier.highest();

        if (noProgressCount >= limits.stagnationThreshold()) {
            return EscalationDecision.halt(current,
                    "no issues fixed across " + noProgressCount + " consecutive review cycles");
        }

        return switch (kind) {
            case REVIEW_REJECTION -> attemptCount >= limits.maxReviewIterations()
                    ? EscalationDecision.halt(current,
                            "still rejected after " + attemptCount + " review iterations")
                    : EscalationDecision.retry(oneUp(current), "review rejected (iteration " + attemptCount + ")");

            case REGRESSION -> current >= highest
                    ? EscalationDecision.halt(current, "resolved issue regressed at highest tier")
                    : EscalationDecision.retry(highest, "resolved issue regressed");

            case VERIFY_FAILURE -> {
                if (attemptCount < limits.verifyRetryLimit()) {
                    yield EscalationDecision.retry(current, "verification failed (" + attemptCount + ")");
                }
                yield current >= highest
                        ? EscalationDecision.halt(current,
                                "verification failed " + attemptCount + " times at highest tier")
                        : EscalationDecision.retry(oneUp(current),
                                "verification failed " + attemptCount + " times");
            }

            case MERGE_CONFLICT, MERGE_TEST_FAILURE -> {
                if (attemptCount >= limits.mergeHaltAt()) {
                    yield EscalationDecision.halt(current,
                            attemptCount + " consecutive merge failures");
                }
                if (attemptCount >= limits.mergeHighestAt()) {
                    yield EscalationDecision.retry(Math.max(current, highest),
                            attemptCount + " consecutive merge failures");
                }
                if (attemptCount >= limits.mergeEscalateAt()) {
                    yield EscalationDecision.retry(oneUp(current),
                            attemptCount + " consecutive merge failures");
                }
                yield EscalationDecision.retry(current, "merge failed");
            }

            case BLOCKED, WORKER_TIMEOUT, PROTOCOL_ERROR -> current >= highest
                    ? EscalationDecision.halt(current, kind + " at highest tier")
                    : EscalationDecision.retry(oneUp(current), kind.toString());
        };
    }

    private static int oneUp(int current) {
        return Math.max(current, Math.min(current + 1, WorkerTier.highest()));
    }
}
