package com.jreinhal.askdocs.generation;

/**
 * Completion capability used by every LLM-backed stage (planning, routing, tools, reranking,
 * answers, follow-ups).
 */
public interface CompletionClient {

    /**
     * @throws CompletionFailedException when the backend errors or the request timeout elapses
     */
    Completion complete(CompletionRequest request);
}
