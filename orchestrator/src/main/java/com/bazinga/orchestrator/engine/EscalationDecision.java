package com.bazinga.orchestrator.engine;

/**
 * Output of {@link EscalationPolicy#decide}: the tier to use next and
 * whether to try again at all.
 */
public record EscalationDecision(int tier, Action action, String reason) {

    public enum Action { RETRY, HALT }

    static EscalationDecision retry(int tier, String reason) {
        return new EscalationDecision(tier, Action.RETRY, reason);
    }

    static EscalationDecision halt(int tier, String reason) {
        return new EscalationDecision(tier, Action.HALT, reason);
    }

    public boolean isHalt() {
        return action == Action.HALT;
    }
}
