package com.bazinga.orchestrator.worker;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Default ranker: keeps the candidates in the order supplied and stops
 * adding once the next item would exceed the budget.
 */
@Component
public class InOrderContextRanker implements ContextRanker {

    @Override
    public List<ContextItem> rank(List<ContextItem> candidates, int tokenBudget) {
        List<ContextItem> selected = new ArrayList<>();
        int used = 0;
        for (ContextItem item : candidates) {
            if (used + item.tokens() > tokenBudget) {
                break;
            }
            selected.add(item);
            used += item.tokens();
        }
        return selected;
    }
}
