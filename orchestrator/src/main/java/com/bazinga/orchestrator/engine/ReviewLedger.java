package com.bazinga.orchestrator.engine;

import com.bazinga.orchestrator.model.EventType;
import com.bazinga.orchestrator.model.Issue;
import com.bazinga.orchestrator.model.ReviewCycle;
import com.bazinga.orchestrator.model.ReviewVerdict;
import com.bazinga.orchestrator.model.TaskGroup;
import com.bazinga.orchestrator.repository.IssueRepository;
import com.bazinga.orchestrator.repository.ReviewCycleRepository;
import com.bazinga.orchestrator.repository.TaskGroupRepository;
import com.bazinga.orchestrator.worker.IssueReport;
import com.bazinga.orchestrator.worker.ReviewResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Persists review cycles and their issues, and works out what changed
 * since the previous cycle.
 *
 * Issues are matched across cycles by root cause ({@link IssueReport#rootCause()}):
 * <ul>
 *   <li>an issue of the previous cycle that is no longer reported is resolved
 *       in this iteration and counts as fixed; every earlier row carrying the
 *       same root cause is resolved with it;</li>
 *   <li>a reported issue whose root cause was resolved earlier, and was not
 *       outstanding in the previous cycle, is a regression.</li>
 * </ul>
 */
@Service
public class ReviewLedger {

    private static final Logger log = LoggerFactory.getLogger(ReviewLedger.class);

    private final TaskGroupRepository   groupRepo;
    private final ReviewCycleRepository cycleRepo;
    private final IssueRepository       issueRepo;
    private final EventLog              eventLog;

    public ReviewLedger(TaskGroupRepository groupRepo,
                        ReviewCycleRepository cycleRepo,
                        IssueRepository issueRepo,
                        EventLog eventLog) {
        this.groupRepo = groupRepo;
        this.cycleRepo = cycleRepo;
        this.issueRepo = issueRepo;
        this.eventLog  = eventLog;
    }

    @Transactional
    public CycleAssessment recordCycle(UUID groupId, ReviewResult result) {
        TaskGroup group = groupRepo.lockById(groupId)
                .orElseThrow(() -> new IllegalArgumentException("Task group not found: " + groupId));

        // Step 1: what the previous cycle left open
        Optional<ReviewCycle> previous = cycleRepo.findFirstByTaskGroupIdOrderByIterationDesc(groupId);
        List<Issue> previousOpen = previous
                .map(prev -> issueRepo.findByReviewCycleId(prev.getId()).stream()
                        .filter(i -> !i.isResolved())
                        .toList())
                .orElse(List.of());
        int lastIteration = previous.map(ReviewCycle::getIteration).orElse(0);
        int iteration = Math.max(lastIteration, group.getReviewIteration()) + 1;

        // Step 2: dedupe the new report by root cause
        Map<String, IssueReport> reported = new LinkedHashMap<>();
        for (IssueReport issue : result.issues()) {
            reported.putIfAbsent(issue.rootCause(), issue);
        }

        // Step 3: resolve what disappeared, including the rows earlier cycles
        // carried forward under the same signature
        int fixed = 0;
        for (Issue open : previousOpen) {
            if (!reported.containsKey(open.getSignature())) {
                issueRepo.findByTaskGroupIdAndSignatureAndResolvedInIterationIsNull(groupId, open.getSignature())
                        .forEach(row -> row.resolveIn(iteration));
                fixed++;
            }
        }

        // Step 4: regressions
        Set<String> previouslyOpen = previousOpen.stream()
                .map(Issue::getSignature)
                .collect(Collectors.toSet());
        Set<String> everResolved = issueRepo.findByTaskGroupIdAndResolvedInIterationIsNotNull(groupId).stream()
                .filter(i -> i.getResolvedInIteration() < iteration)
                .map(Issue::getSignature)
                .collect(Collectors.toSet());

        int blocking = (int) reported.values().stream().filter(IssueReport::blocking).count();
        boolean approved = result.verdict() == ReviewVerdict.APPROVED && blocking == 0;
        ReviewVerdict recorded = approved ? ReviewVerdict.APPROVED : ReviewVerdict.CHANGES_REQUESTED;

        ReviewCycle cycle = cycleRepo.save(new ReviewCycle(groupId, iteration, recorded, fixed));

        List<IssueReport> regressions = new ArrayList<>();
        for (Map.Entry<String, IssueReport> entry : reported.entrySet()) {
            String signature = entry.getKey();
            IssueReport issue = entry.getValue();
            boolean regression = everResolved.contains(signature) && !previouslyOpen.contains(signature);
            if (regression) {
                regressions.add(issue);
                eventLog.record(EventType.ISSUE_REGRESSION, group.getSessionId(), groupId,
                        Map.of("iteration", iteration, "issue", issue.title()));
            }
            issueRepo.save(new Issue(cycle.getId(), groupId, iteration, issue.severity(),
                    issue.blocking(), issue.title(), signature, regression));
        }

        // Step 5: stagnation counter. Only a cycle that had something to fix
        // and fixed nothing counts; any fix resets it.
        int noProgress = (!previousOpen.isEmpty() && fixed == 0) ? group.getNoProgressCount() + 1 : 0;

        group.setNoProgressCount(noProgress);
        group.setBlockingIssueCount(blocking);
        group.recordReviewIteration(iteration);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("iteration", iteration);
        detail.put("verdict", recorded.name());
        detail.put("issuesFixed", fixed);
        detail.put("outstanding", reported.size());
        detail.put("blocking", blocking);
        detail.put("regressions", regressions.size());
        detail.put("noProgressCount", noProgress);
        eventLog.record(EventType.REVIEW_CYCLE_RECORDED, group.getSessionId(), groupId, detail);

        log.info("Review cycle {} for task group {}: {} fixed, {} outstanding ({} blocking), {} regression(s)",
                iteration, groupId, fixed, reported.size(), blocking, regressions.size());

        return new CycleAssessment(iteration, fixed, List.copyOf(reported.values()),
                blocking, regressions, approved, noProgress);
    }

    @Transactional(readOnly = true)
    public List<ReviewCycle> history(UUID groupId) {
        return cycleRepo.findByTaskGroupIdOrderByIterationAsc(groupId);
    }

    @Transactional(readOnly = true)
    public List<Issue> issues(UUID groupId) {
        return issueRepo.findByTaskGroupIdOrderByReportedInIterationAsc(groupId);
    }
}
