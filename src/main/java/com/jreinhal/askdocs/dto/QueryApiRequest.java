package com.jreinhal.askdocs.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QueryApiRequest(
        String query,
        Integer k,
        @JsonProperty("max_context_tokens") Integer maxContextTokens,
        @JsonProperty("max_answer_tokens") Integer maxAnswerTokens,
        Double temperature,
        Boolean rerank,
        @JsonProperty("enable_tools") Boolean enableTools,
        @JsonProperty("enable_followups") Boolean enableFollowups,
        @JsonProperty("enable_planning") Boolean enablePlanning,
        @JsonProperty("include_citations") Boolean includeCitations,
        @JsonProperty("doc_id") String docId) {

    public boolean citationsRequested() {
        return this.includeCitations == null || this.includeCitations;
    }
}
