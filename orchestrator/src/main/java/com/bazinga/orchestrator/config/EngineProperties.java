package com.bazinga.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Tunables for the orchestration engine, bound from {@code bazinga.engine.*}.
 * Any value left out of configuration falls back to the default below.
 */
@ConfigurationProperties(prefix = "bazinga.engine")
public record EngineProperties(
        int             maxParallelGroups,
        Dispatch        dispatch,
        Escalation      escalation,
        Merge           merge,
        Context         context,
        List<String>    securityKeywords) {

    public EngineProperties {
        if (maxParallelGroups <= 0) maxParallelGroups = 4;
        if (dispatch == null)       dispatch   = new Dispatch(null, null);
        if (escalation == null)     escalation = new Escalation(0, 0, 0, 0, 0, 0);
        if (merge == null)          merge      = new Merge(0, null);
        if (context == null)        context    = new Context(0);
        if (securityKeywords == null || securityKeywords.isEmpty()) {
            securityKeywords = List.of("security", "auth");
        }
    }

    /** Wall-clock limits for a single worker call. */
    public record Dispatch(Duration workerTimeout, Duration validatorTimeout) {
        public Dispatch {
            if (workerTimeout == null)    workerTimeout    = Duration.ofMinutes(10);
            if (validatorTimeout == null) validatorTimeout = Duration.ofMinutes(15);
        }
    }

    /**
     * Escalation thresholds.
     *
     * @param stagnationThreshold consecutive no-progress review cycles that force a halt
     * @param maxReviewIterations review cycles after which a still-rejected group halts
     * @param verifyRetryLimit    consecutive verification failures retried at the same tier
     * @param mergeEscalateAt     consecutive merge failure that raises the tier by one
     * @param mergeHighestAt      consecutive merge failure that jumps to the highest tier
     * @param mergeHaltAt         consecutive merge failure that halts
     */
    public record Escalation(
            int stagnationThreshold,
            int maxReviewIterations,
            int verifyRetryLimit,
            int mergeEscalateAt,
            int mergeHighestAt,
            int mergeHaltAt) {
        public Escalation {
            if (stagnationThreshold <= 0) stagnationThreshold = 2;
            if (maxReviewIterations <= 0) maxReviewIterations = 10;
            if (verifyRetryLimit <= 0)    verifyRetryLimit    = 3;
            if (mergeEscalateAt <= 0)     mergeEscalateAt     = 2;
            if (mergeHighestAt <= 0)      mergeHighestAt      = 3;
            if (mergeHaltAt <= 0)         mergeHaltAt         = 4;
        }
    }

    /** External CI polling after a successful integration. */
    public record Merge(int maxCiPolls, Duration ciPollInterval) {
        public Merge {
            if (maxCiPolls <= 0)        maxCiPolls     = 10;
            if (ciPollInterval == null) ciPollInterval = Duration.ofSeconds(30);
        }
    }

    /** Token budget handed to the context ranker for each worker request. */
    public record Context(int tokenBudget) {
        public Context {
            if (tokenBudget <= 0) tokenBudget = 8000;
        }
    }

    public static EngineProperties defaults() {
        return new EngineProperties(0, null, null, null, null, null);
    }
}
