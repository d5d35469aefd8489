package com.jreinhal.askdocs.tools;

import com.jreinhal.askdocs.generation.Completion;
import com.jreinhal.askdocs.generation.CompletionClient;
import com.jreinhal.askdocs.generation.CompletionFailedException;
import com.jreinhal.askdocs.generation.CompletionRequest;
import com.jreinhal.askdocs.util.LogSanitizer;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Tool whose output is a completion over the context under a task-specific instruction.
 * Instances are declared in {@link ToolsConfig}.
 */
public class PromptedTool implements AnswerTool {
    static final int CONTEXT_PREVIEW_CHARS = 1200;
    private final String name;
    private final String description;
    private final String instruction;
    private final Pattern intentPattern;
    private final CompletionClient completionClient;
    private final int maxTokens;

    public PromptedTool(String name, String description, String instruction, Pattern intentPattern, CompletionClient completionClient, int maxTokens) {
        this.name = name;
        this.description = description;
        this.instruction = instruction;
        this.intentPattern = intentPattern;
        this.completionClient = completionClient;
        this.maxTokens = maxTokens;
    }

    @Override
    public String name() {
        return this.name;
    }

    @Override
    public String description() {
        return this.description;
    }

    @Override
    public boolean documentAware() {
        return false;
    }

    @Override
    public Pattern intentPattern() {
        return this.intentPattern;
    }

    @Override
    public int priority() {
        return 50;
    }

    @Override
    public ToolOutput execute(ToolRequest request) {
        String user = "Context:\n" + LogSanitizer.truncate(request.context(), CONTEXT_PREVIEW_CHARS) + "\n\nQuery: " + request.query();
        Completion completion;
        try {
            completion = this.completionClient.complete(new CompletionRequest(this.instruction, user, this.maxTokens, 0.2, request.timeout()));
        } catch (CompletionFailedException e) {
            throw new ToolExecutionFailedException(this.name, "Tool " + this.name + " failed: " + e.getMessage(), e);
        }
        String text = completion.text() == null ? "" : completion.text().trim();
        if (text.isEmpty()) {
            throw new ToolExecutionFailedException(this.name, "Tool " + this.name + " returned no output", null);
        }
        return new ToolOutput(this.name, text, Map.of("completion_tokens", completion.usage().completionTokens()));
    }
}
