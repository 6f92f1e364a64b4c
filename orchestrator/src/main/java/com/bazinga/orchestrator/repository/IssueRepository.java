package com.bazinga.orchestrator.repository;

import com.bazinga.orchestrator.model.Issue;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface IssueRepository extends JpaRepository<Issue, UUID> {

    List<Issue> findByReviewCycleId(UUID reviewCycleId);

    List<Issue> findByTaskGroupIdOrderByReportedInIterationAsc(UUID taskGroupId);

    /** Every issue of the group that a later cycle has already resolved. */
    List<Issue> findByTaskGroupIdAndResolvedInIterationIsNotNull(UUID taskGroupId);

    /** Rows of one root cause still open, one per cycle that reported it. */
    List<Issue> findByTaskGroupIdAndSignatureAndResolvedInIterationIsNull(UUID taskGroupId, String signature);
}
