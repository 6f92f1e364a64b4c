package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.model.VerdictKind;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one validator run. verdict is null when the validator could
 * not be reached and no verdict was recorded.
 */
public record GateResult(VerdictKind verdict, List<UUID> reopened) {

    public GateResult {
        reopened = reopened == null ? List.of() : List.copyOf(reopened);
    }

    static GateResult deferred() {
        return new GateResult(null, List.of());
    }

    public boolean accepted() {
        return verdict == VerdictKind.ACCEPT;
    }
}
