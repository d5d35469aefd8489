package com.jreinhal.askdocs.pipeline;

import java.time.Duration;

/**
 * Configuration a {@link QueryPipeline} is built with. Pipelines with different settings can
 * coexist in one process.
 *
 * @param candidateMultiplier each retriever fetches {@code k * candidateMultiplier} candidates
 *        per query so fusion and reranking have more than {@code k} to choose from
 * @param requestTimeout deadline for the whole query
 */
public record PipelineSettings(
        PipelineFeatures features,
        int defaultK,
        int maxK,
        int candidateMultiplier,
        int maxContextTokens,
        boolean rerankEnabled,
        int maxAnswerTokens,
        double temperature,
        Duration requestTimeout,
        Duration denseTimeout,
        Duration lexicalTimeout,
        Duration toolTimeout) {

    public static PipelineSettings defaults() {
        return new PipelineSettings(PipelineFeatures.defaults(), 5, 50, 2, 1500, true, 300, 0.2,
                Duration.ofSeconds(45), Duration.ofSeconds(3), Duration.ofSeconds(2), Duration.ofSeconds(10));
    }

    public PipelineSettings withFeatures(PipelineFeatures newFeatures) {
        return new PipelineSettings(newFeatures, this.defaultK, this.maxK, this.candidateMultiplier, this.maxContextTokens,
                this.rerankEnabled, this.maxAnswerTokens, this.temperature, this.requestTimeout, this.denseTimeout,
                this.lexicalTimeout, this.toolTimeout);
    }
}
