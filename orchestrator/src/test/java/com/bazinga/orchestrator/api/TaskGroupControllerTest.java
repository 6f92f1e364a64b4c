package com.bazinga.orchestrator.api;

import com.bazinga.orchestrator.engine.MergeCoordinator;
import com.bazinga.orchestrator.engine.ReviewLedger;
import com.bazinga.orchestrator.engine.SessionManager;
import com.bazinga.orchestrator.model.Issue;
import com.bazinga.orchestrator.model.MergeAttempt;
import com.bazinga.orchestrator.model.MergeOutcome;
import com.bazinga.orchestrator.model.ReviewCycle;
import com.bazinga.orchestrator.model.ReviewVerdict;
import com.bazinga.orchestrator.model.Severity;
import com.bazinga.orchestrator.model.TaskGroup;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskGroupController.class)
class TaskGroupControllerTest {

    @Autowired MockMvc             mockMvc;
    @MockitoBean SessionManager    sessionManager;
    @MockitoBean ReviewLedger      ledger;
    @MockitoBean MergeCoordinator  mergeCoordinator;

    @Test
    void getReviewCycles_groupsIssuesUnderTheirCycle() throws Exception {
        TaskGroup group = withId(new TaskGroup(UUID.randomUUID(), "Add search endpoint", null, 0));
        ReviewCycle first  = withId(new ReviewCycle(group.getId(), 1, ReviewVerdict.CHANGES_REQUESTED, 0));
        ReviewCycle second = withId(new ReviewCycle(group.getId(), 2, ReviewVerdict.APPROVED, 1));
        Issue issue = withId(new Issue(first.getId(), group.getId(), 1, Severity.CRITICAL, true,
                "SQL injection in search", "sql injection in search", false));
        issue.resolveIn(2);

        when(sessionManager.findTaskGroup(group.getId())).thenReturn(Optional.of(group));
        when(ledger.history(group.getId())).thenReturn(List.of(first, second));
        when(ledger.issues(group.getId())).thenReturn(List.of(issue));

        mockMvc.perform(get("/task-groups/{id}/review-cycles", group.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].verdict").value("CHANGES_REQUESTED"))
                .andExpect(jsonPath("$[0].issues[0].title").value("SQL injection in search"))
                .andExpect(jsonPath("$[0].issues[0].resolvedInIteration").value(2))
                .andExpect(jsonPath("$[1].issuesFixed").value(1))
                .andExpect(jsonPath("$[1].issues").isEmpty());
    }

    @Test
    void getMergeAttempts_listsAttemptsInOrder() throws Exception {
        TaskGroup group = withId(new TaskGroup(UUID.randomUUID(), "Add search endpoint", null, 0));
        when(sessionManager.findTaskGroup(group.getId())).thenReturn(Optional.of(group));
        when(mergeCoordinator.history(group.getId())).thenReturn(List.of(
                new MergeAttempt(group.getId(), 1, MergeOutcome.CONFLICT, 0, false, 120, "src/Search.java"),
                new MergeAttempt(group.getId(), 2, MergeOutcome.SUCCESS, 3, true, 900, null)));

        mockMvc.perform(get("/task-groups/{id}/merge-attempts", group.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].outcome").value("CONFLICT"))
                .andExpect(jsonPath("$[1].attemptNumber").value(2))
                .andExpect(jsonPath("$[1].ciWarning").value(true));
    }

    @Test
    void unknownGroup_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(sessionManager.findTaskGroup(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/task-groups/{id}", unknown))
                .andExpect(status().isNotFound());
    }

    private static <T> T withId(T entity) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return entity;
    }
}
