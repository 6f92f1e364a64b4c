package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.config.EngineProperties;
import com.bazinga.orchestrator.model.SuccessCriterion;
import com.bazinga.orchestrator.model.Stage;
import com.bazinga.orchestrator.model.TaskGroup;
import com.bazinga.orchestrator.model.WorkerTier;
import com.bazinga.orchestrator.repository.SuccessCriterionRepository;
import com.bazinga.orchestrator.worker.ContextItem;
import com.bazinga.orchestrator.worker.ContextRanker;
import com.bazinga.orchestrator.worker.IssueReport;
import com.bazinga.orchestrator.worker.WorkRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link WorkRequest} for a stage dispatch: task description,
 * prior issues and the group's success criteria, trimmed to the token
 * budget by the configured {@link ContextRanker}.
 */
@Component
public class ContextAssembler {

    private final SuccessCriterionRepository criterionRepo;
    private final FeedbackCodec              feedbackCodec;
    private final ContextRanker              ranker;
    private final int                        tokenBudget;

    public ContextAssembler(SuccessCriterionRepository criterionRepo,
                            FeedbackCodec feedbackCodec,
                            ContextRanker ranker,
                            EngineProperties properties) {
        this.criterionRepo = criterionRepo;
        this.feedbackCodec = feedbackCodec;
        this.ranker        = ranker;
        this.tokenBudget   = properties.context().tokenBudget();
    }

    public WorkRequest build(TaskGroup group, Stage stage) {
        List<IssueReport> priorIssues = feedbackCodec.decode(group.getFeedbackJson());

        List<ContextItem> candidates = new ArrayList<>();
        candidates.add(ContextItem.of("task", group.getDescription()));
        for (IssueReport issue : priorIssues) {
            candidates.add(ContextItem.of("issue", "[" + issue.severity() + "] " + issue.title()));
        }
        for (SuccessCriterion criterion : criterionRepo.findByTaskGroupId(group.getId())) {
            candidates.add(ContextItem.of("criterion", criterion.getCriterion()));
        }

        return new WorkRequest(
                group.getId(),
                stage,
                WorkerTier.of(group.getEscalationTier()),
                group.getDescription(),
                group.getBranchRef(),
                priorIssues,
                ranker.rank(candidates, tokenBudget));
    }
}
