package com.jreinhal.askdocs.pipeline;

/**
 * One query as accepted by the HTTP layer. Nullable fields fall back to the pipeline settings.
 *
 * @param documentId restricts retrieval to one document when set
 * @param identity store key of the caller; retrieval sees its uploads and the shared corpus
 */
public record PipelineRequest(
        String query,
        Integer k,
        Integer maxContextTokens,
        Integer maxAnswerTokens,
        Double temperature,
        Boolean rerank,
        Boolean enableTools,
        Boolean enableFollowups,
        Boolean enablePlanning,
        String documentId,
        String identity) {

    public static PipelineRequest of(String query, int k, String identity) {
        return new PipelineRequest(query, k, null, null, null, null, null, null, null, null, identity);
    }
}
