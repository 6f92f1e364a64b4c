package com.bazinga.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which worker role currently holds a task group.
 *
 * Inside IN_PROGRESS the stage cycles implement → verify → review → implement.
 * VERIFY may be skipped (testing mode) and any stage may fall back to IMPLEMENT.
 */
public enum Stage {
    NONE,
    IMPLEMENT,
    VERIFY,
    REVIEW,
    MERGE;

    /** Stage moves allowed while the status stays IN_PROGRESS. */
    public boolean canAdvanceTo(Stage next) {
        return switch (this) {
            case IMPLEMENT -> next == IMPLEMENT || next == VERIFY || next == REVIEW;
            case VERIFY    -> next == IMPLEMENT || next == REVIEW;
            case REVIEW    -> next == IMPLEMENT;
            case NONE, MERGE -> false;
        };
    }

    static Set<Stage> inProgressStages() {
        return EnumSet.of(IMPLEMENT, VERIFY, REVIEW);
    }
}
