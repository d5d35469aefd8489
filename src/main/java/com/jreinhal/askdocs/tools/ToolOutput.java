package com.jreinhal.askdocs.tools;

import java.util.Map;

/**
 * @param structured small machine-readable summary of the output, kept in the trace
 */
public record ToolOutput(String toolName, String text, Map<String, Object> structured) {

    public ToolOutput {
        structured = structured == null ? Map.of() : Map.copyOf(structured);
    }
}
