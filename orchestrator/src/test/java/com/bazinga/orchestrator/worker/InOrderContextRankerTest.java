package com.bazinga.orchestrator.worker;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InOrderContextRankerTest {

    private final InOrderContextRanker ranker = new InOrderContextRanker();

    @Test
    void rank_keepsOrderWithinBudget() {
        List<ContextItem> candidates = List.of(
                new ContextItem("task", "a", 40),
                new ContextItem("issue", "b", 30),
                new ContextItem("issue", "c", 50));

        List<ContextItem> ranked = ranker.rank(candidates, 80);

        assertThat(ranked).extracting(ContextItem::content).containsExactly("a", "b");
        assertThat(ranked.stream().mapToInt(ContextItem::tokens).sum()).isLessThanOrEqualTo(80);
    }

    @Test
    void rank_zeroBudget_returnsNothing() {
        assertThat(ranker.rank(List.of(ContextItem.of("task", "some text")), 0)).isEmpty();
    }
}
