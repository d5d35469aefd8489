package com.jreinhal.askdocs.pipeline;

import com.jreinhal.askdocs.generation.TokenUsage;
import java.util.List;

/**
 * @param usedTool name of the tool that grounded the answer, or {@code null}
 * @param degradedStages spans that fell back to a reduced result; empty for a clean run
 */
public record PipelineResult(
        String answer,
        List<Citation> citations,
        List<Citation> relatedCitations,
        List<String> followUps,
        String usedTool,
        String toolOutput,
        List<String> subQueries,
        String traceId,
        List<String> degradedStages,
        TokenUsage usage) {

    public boolean isDegraded() {
        return !this.degradedStages.isEmpty();
    }
}
