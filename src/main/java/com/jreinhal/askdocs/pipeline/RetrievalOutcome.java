package com.jreinhal.askdocs.pipeline;

import com.jreinhal.askdocs.retrieval.Candidate;
import java.util.List;

/**
 * Per-method candidates merged across all retrieved queries, best first.
 */
public record RetrievalOutcome(StageResult<List<Candidate>> dense, StageResult<List<Candidate>> lexical) {

    public boolean allFailed() {
        return this.dense.isFailed() && this.lexical.isFailed();
    }

    public List<Candidate> denseCandidates() {
        return this.dense.isFailed() ? List.of() : this.dense.value();
    }

    public List<Candidate> lexicalCandidates() {
        return this.lexical.isFailed() ? List.of() : this.lexical.value();
    }
}
