package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.model.Session;
import com.bazinga.orchestrator.model.TaskGroup;
import com.bazinga.orchestrator.model.ValidatorVerdict;

import java.util.List;

/**
 * Session status as an operator sees it: how far along it is, which
 * groups are blocked and why, and the latest validator verdict.
 */
public record SessionReport(
        Session            session,
        List<TaskGroup>    taskGroups,
        int                completionPercentage,
        boolean            readyForValidation,
        List<BlockedGroup> blocked,
        ValidatorVerdict   latestVerdict) {

    public record BlockedGroup(TaskGroup taskGroup, String reason) {}
}
