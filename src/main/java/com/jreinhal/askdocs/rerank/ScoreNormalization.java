package com.jreinhal.askdocs.rerank;

/**
 * How each retrieval method's scores are mapped onto a shared scale before fusion.
 */
public enum ScoreNormalization {
    /**
     * {@code (s - min) / (max - min)} within the method's list; a list of equal scores maps to 1.0.
     */
    MIN_MAX,
    /**
     * Reciprocal rank {@code 1 / (rrfK + rank)}, scaled so rank 1 maps to 1.0. Ignores raw scores.
     */
    RANK
}
