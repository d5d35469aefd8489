package com.jreinhal.askdocs.retrieval;

import com.jreinhal.askdocs.util.FilterExpressionBuilder;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Embedding similarity search through the configured {@link VectorStore}. Hits are resolved
 * back to catalog chunks; a hit the catalog does not know is a backend error. The search is
 * filtered to the request scope, and hits are checked against it again after resolution.
 */
@Component
public class DenseRetriever implements Retriever {
    private static final Logger log = LoggerFactory.getLogger(DenseRetriever.class);
    public static final String CHUNK_ID_KEY = "chunk_id";
    private final VectorStore vectorStore;
    private final ChunkCatalog catalog;
    @Value("${askdocs.retrieval.similarity-threshold:0.0}")
    private double similarityThreshold;

    public DenseRetriever(VectorStore vectorStore, ChunkCatalog catalog) {
        this.vectorStore = vectorStore;
        this.catalog = catalog;
    }

    @Override
    public RetrievalMethod method() {
        return RetrievalMethod.DENSE;
    }

    @Override
    public List<Candidate> retrieve(String query, int k, RetrievalScope scope) {
        String filter = FilterExpressionBuilder.forOwnerAndDocument(scope.identity(), RetrievalScope.SHARED_OWNER, scope.documentId());
        List<Document> documents;
        try {
            documents = this.vectorStore.similaritySearch(SearchRequest.builder()
                    .query(query)
                    .topK(k)
                    .similarityThreshold(this.similarityThreshold)
                    .filterExpression(filter)
                    .build());
        } catch (RuntimeException e) {
            throw new RetrievalUnavailableException(RetrievalMethod.DENSE, "Vector search failed: " + e.getMessage(), e);
        }
        if (documents == null) {
            documents = List.of();
        }
        List<Candidate> candidates = new ArrayList<>(documents.size());
        for (Document document : documents) {
            String chunkId = resolveChunkId(document);
            Chunk chunk = this.catalog.findById(chunkId)
                    .orElseThrow(() -> new RetrievalUnavailableException(RetrievalMethod.DENSE,
                            "Vector index returned unknown chunk " + chunkId));
            if (!scope.allows(chunk)) {
                continue;
            }
            double score = document.getScore() != null ? document.getScore() : 0.0;
            candidates.add(Candidate.retrieved(chunk, RetrievalMethod.DENSE, score, 0));
        }
        candidates.sort(Comparator.comparingDouble(Candidate::rawScore).reversed().thenComparing(Candidate::chunkId));
        List<Candidate> ranked = new ArrayList<>(Math.min(k, candidates.size()));
        for (Candidate candidate : candidates) {
            if (ranked.size() >= k) {
                break;
            }
            ranked.add(candidate.withRank(ranked.size() + 1));
        }
        if (log.isDebugEnabled()) {
            log.debug("Dense retrieval returned {} candidates", ranked.size());
        }
        return ranked;
    }

    private static String resolveChunkId(Document document) {
        Object id = document.getMetadata().get(CHUNK_ID_KEY);
        return id != null ? id.toString() : document.getId();
    }
}
