package com.bazinga.orchestrator.worker;

/**
 * A candidate piece of context for a worker's input bundle.
 *
 * @param kind   e.g. "task", "issue", "criterion"
 * @param tokens estimated token cost of content
 */
public record ContextItem(String kind, String content, int tokens) {

    /** Rough estimate: four characters per token. */
    public static ContextItem of(String kind, String content) {
        int tokens = Math.max(1, (content == null ? 0 : content.length()) / 4);
        return new ContextItem(kind, content, tokens);
    }
}
