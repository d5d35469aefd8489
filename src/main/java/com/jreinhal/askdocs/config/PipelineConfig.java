package com.jreinhal.askdocs.config;

import com.jreinhal.askdocs.pipeline.PipelineFeatures;
import com.jreinhal.askdocs.pipeline.PipelineSettings;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.SimpleVectorStore;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pipeline settings and the vector store. Feature toggles map onto the
 * {@code ENABLE_*} environment variables through {@code application.yaml}.
 */
@Configuration
public class PipelineConfig {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public PipelineFeatures pipelineFeatures(
            @Value("${askdocs.features.tool-router:true}") boolean toolRouter,
            @Value("${askdocs.features.doc-actions:true}") boolean docActions,
            @Value("${askdocs.features.followups:true}") boolean followups,
            @Value("${askdocs.features.planning:false}") boolean planning) {
        PipelineFeatures features = new PipelineFeatures(toolRouter, docActions, followups, planning);
        log.info("Pipeline features: {}", features);
        return features;
    }

    @Bean
    public PipelineSettings pipelineSettings(PipelineFeatures features,
            @Value("${askdocs.retrieval.default-k:5}") int defaultK,
            @Value("${askdocs.retrieval.max-k:50}") int maxK,
            @Value("${askdocs.retrieval.candidate-multiplier:2}") int candidateMultiplier,
            @Value("${askdocs.context.max-tokens:1500}") int maxContextTokens,
            @Value("${askdocs.rerank.enabled:true}") boolean rerankEnabled,
            @Value("${askdocs.generation.max-answer-tokens:300}") int maxAnswerTokens,
            @Value("${askdocs.generation.temperature:0.2}") double temperature,
            @Value("${askdocs.pipeline.request-timeout-ms:45000}") long requestTimeoutMs,
            @Value("${askdocs.retrieval.dense-timeout-ms:3000}") long denseTimeoutMs,
            @Value("${askdocs.retrieval.lexical-timeout-ms:2000}") long lexicalTimeoutMs,
            @Value("${askdocs.tools.timeout-ms:10000}") long toolTimeoutMs) {
        if (defaultK < 1 || defaultK > maxK) {
            throw new IllegalStateException("askdocs.retrieval.default-k must be between 1 and " + maxK);
        }
        PipelineSettings settings = new PipelineSettings(features, defaultK, maxK, candidateMultiplier, maxContextTokens,
                rerankEnabled, maxAnswerTokens, temperature, Duration.ofMillis(requestTimeoutMs),
                Duration.ofMillis(denseTimeoutMs), Duration.ofMillis(lexicalTimeoutMs), Duration.ofMillis(toolTimeoutMs));
        log.info("Pipeline settings: k={} (max {}), context budget {} tokens, rerank={}, request timeout {}ms",
                defaultK, maxK, maxContextTokens, rerankEnabled, requestTimeoutMs);
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean
    public VectorStore vectorStore(EmbeddingModel embeddingModel) {
        return SimpleVectorStore.builder(embeddingModel).build();
    }
}
