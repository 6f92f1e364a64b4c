package com.bazinga.orchestrator.worker;

import java.util.List;

/**
 * Selects which context candidates go into a worker's input bundle.
 *
 * Implementations return an ordered subset whose total token cost does not
 * exceed tokenBudget. The engine treats this as opaque.
 */
public interface ContextRanker {

    List<ContextItem> rank(List<ContextItem> candidates, int tokenBudget);
}
