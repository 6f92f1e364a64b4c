package com.bazinga.orchestrator.model;

/**
 * Worker seniority ladder used by the escalation policy.
 *
 * A task group's escalationTier is the ordinal of one of these; it only
 * ever moves up during the group's lifetime.
 */
public enum WorkerTier {
    DEVELOPER,          // default implementer
    SENIOR_ENGINEER,    // first escalation, also the start tier for security-sensitive work
    TECH_LEAD,
    PRINCIPAL;          // highest tier; a failure here halts for a human/PM decision

    public int level() {
        return ordinal();
    }

    public static WorkerTier of(int level) {
        WorkerTier[] tiers = values();
        if (level < 0) return tiers[0];
        return tiers[Math.min(level, tiers.length - 1)];
    }

    public static int highest() {
        return values().length - 1;
    }
}
