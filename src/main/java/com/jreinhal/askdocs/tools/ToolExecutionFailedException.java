package com.jreinhal.askdocs.tools;

public class ToolExecutionFailedException extends RuntimeException {
    private final String toolName;

    public ToolExecutionFailedException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return this.toolName;
    }
}
