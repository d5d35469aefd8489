package com.jreinhal.askdocs.generation;

import com.jreinhal.askdocs.tools.ToolOutput;

/**
 * @param toolOutput grounding from a specialized tool, or {@code null}
 */
public record AnswerRequest(String query, String context, ToolOutput toolOutput, int maxTokens, double temperature) {
}
