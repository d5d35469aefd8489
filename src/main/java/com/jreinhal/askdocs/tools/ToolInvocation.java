package com.jreinhal.askdocs.tools;

/**
 * What a tool was asked and what it returned, recorded as trace metadata.
 */
public record ToolInvocation(String toolName, String routedBy, int contextChars, int outputChars, boolean succeeded, String error) {
}
