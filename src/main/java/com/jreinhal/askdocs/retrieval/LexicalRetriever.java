package com.jreinhal.askdocs.retrieval;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class LexicalRetriever implements Retriever {
    private final LexicalIndex index;

    public LexicalRetriever(LexicalIndex index) {
        this.index = index;
    }

    @Override
    public RetrievalMethod method() {
        return RetrievalMethod.LEXICAL;
    }

    @Override
    public List<Candidate> retrieve(String query, int k, RetrievalScope scope) {
        List<LexicalIndex.ScoredChunk> hits;
        try {
            hits = this.index.snapshot().search(query, k, scope);
        } catch (RuntimeException e) {
            throw new RetrievalUnavailableException(RetrievalMethod.LEXICAL, "Lexical index access failed: " + e.getMessage(), e);
        }
        List<Candidate> candidates = new ArrayList<>(hits.size());
        for (LexicalIndex.ScoredChunk hit : hits) {
            candidates.add(Candidate.retrieved(hit.chunk(), RetrievalMethod.LEXICAL, hit.score(), candidates.size() + 1));
        }
        return candidates;
    }
}
