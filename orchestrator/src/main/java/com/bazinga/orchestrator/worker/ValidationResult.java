package com.bazinga.orchestrator.worker;

import com.bazinga.orchestrator.model.CriterionStatus;

import java.util.List;
import java.util.UUID;

/**
 * Validator's per-criterion findings. status is MET or UNMET.
 */
public record ValidationResult(List<CriterionCheck> checks) {

    public record CriterionCheck(UUID criterionId, CriterionStatus status, String evidence) {}

    public ValidationResult {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }
}
