package com.jreinhal.askdocs.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.askdocs.pipeline.PipelineResult;
import java.util.List;

public record QueryApiResponse(
        String answer,
        List<CitationView> citations,
        @JsonProperty("related_citations") List<CitationView> relatedCitations,
        List<String> followups,
        @JsonProperty("used_tool") String usedTool,
        @JsonProperty("tool_output") String toolOutput,
        @JsonProperty("sub_queries") List<String> subQueries,
        @JsonProperty("trace_id") String traceId,
        @JsonProperty("degraded_stages") List<String> degradedStages) {

    /**
     * @param includeCitations when false both citation lists are returned empty
     */
    public static QueryApiResponse from(PipelineResult result, boolean includeCitations) {
        return new QueryApiResponse(result.answer(),
                includeCitations ? result.citations().stream().map(CitationView::from).toList() : List.of(),
                includeCitations ? result.relatedCitations().stream().map(CitationView::from).toList() : List.of(),
                result.followUps(), result.usedTool(), result.toolOutput(), result.subQueries(), result.traceId(),
                result.degradedStages());
    }
}
