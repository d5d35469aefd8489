package com.jreinhal.askdocs.tools;

/**
 * @param routedBy {@code rules} or {@code llm}
 */
public record ToolSelection(AnswerTool tool, String routedBy, String reason) {
}
