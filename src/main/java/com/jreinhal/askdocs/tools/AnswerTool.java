package com.jreinhal.askdocs.tools;

import java.util.regex.Pattern;

/**
 * A specialized handler that turns the assembled context and the query into grounding for the
 * final answer. Tools are Spring beans; the {@link ToolRegistry} picks up every implementation.
 */
public interface AnswerTool {

    String name();

    String description();

    /**
     * Document-aware tools scan the assembled context for structure (tables, definitions,
     * citation headers) and are only routable while document actions are enabled.
     */
    boolean documentAware();

    /**
     * Query intent that selects this tool under rule-based routing.
     */
    Pattern intentPattern();

    /**
     * Lower values are matched first when several intent patterns match.
     */
    default int priority() {
        return 100;
    }

    /**
     * @throws ToolExecutionFailedException when the tool cannot produce output
     */
    ToolOutput execute(ToolRequest request);
}
