package com.jreinhal.askdocs.retrieval;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-query pairing of a chunk with how it was found and scored. Retrievers fill the raw score;
 * fusion adds the normalized and fused scores; reranking adds the rerank score. {@code rank} is
 * 1-based within whichever list the candidate currently sits in.
 */
public record Candidate(Chunk chunk, Set<RetrievalMethod> methods, double rawScore, double normalizedScore,
        double fusedScore, Double rerankScore, int rank) {

    public Candidate {
        methods = Collections.unmodifiableSet(EnumSet.copyOf(methods));
    }

    public static Candidate retrieved(Chunk chunk, RetrievalMethod method, double rawScore, int rank) {
        return new Candidate(chunk, EnumSet.of(method), rawScore, 0.0, 0.0, null, rank);
    }

    public String chunkId() {
        return this.chunk.id();
    }

    public boolean foundBy(RetrievalMethod method) {
        return this.methods.contains(method);
    }

    public Candidate withFusion(Set<RetrievalMethod> fusedMethods, double raw, double normalized, double fused, int fusedRank) {
        return new Candidate(this.chunk, fusedMethods, raw, normalized, fused, null, fusedRank);
    }

    public Candidate withRerank(double score, int rerankRank) {
        return new Candidate(this.chunk, this.methods, this.rawScore, this.normalizedScore, this.fusedScore, score, rerankRank);
    }

    public Candidate withRank(int newRank) {
        return new Candidate(this.chunk, this.methods, this.rawScore, this.normalizedScore, this.fusedScore, this.rerankScore, newRank);
    }
}
