package com.jreinhal.askdocs.retrieval;

import java.util.List;

public interface Retriever {

    RetrievalMethod method();

    /**
     * @return at most {@code k} candidates visible in {@code scope}, best first
     * @throws RetrievalUnavailableException when the backend cannot answer
     */
    List<Candidate> retrieve(String query, int k, RetrievalScope scope);
}
