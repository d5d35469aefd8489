package com.jreinhal.askdocs.ingest;

import com.jreinhal.askdocs.retrieval.Chunk;
import com.jreinhal.askdocs.retrieval.ChunkCatalog;
import com.jreinhal.askdocs.retrieval.DenseRetriever;
import com.jreinhal.askdocs.retrieval.LexicalIndex;
import com.jreinhal.askdocs.retrieval.RetrievalScope;
import com.jreinhal.askdocs.retrieval.SourceDocument;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.stereotype.Service;

/**
 * Writes chunks to the catalog, the lexical index and the vector store, in that order, so that
 * every vector hit resolves in the catalog.
 */
@Service
public class CorpusIndexer {
    private static final Logger log = LoggerFactory.getLogger(CorpusIndexer.class);
    private final ChunkCatalog catalog;
    private final LexicalIndex lexicalIndex;
    private final VectorStore vectorStore;

    public CorpusIndexer(ChunkCatalog catalog, LexicalIndex lexicalIndex, VectorStore vectorStore) {
        this.catalog = catalog;
        this.lexicalIndex = lexicalIndex;
        this.vectorStore = vectorStore;
    }

    /**
     * @return the outcome; {@code denseIndexed} is false when embedding failed and the chunks
     *         are searchable lexically only
     */
    public IndexResult index(List<SourceDocument> documents, List<Chunk> chunks) {
        documents.forEach(this.catalog::putDocument);
        this.catalog.putAll(chunks);
        this.lexicalIndex.addAll(chunks);
        boolean denseIndexed = true;
        try {
            this.vectorStore.add(chunks.stream().map(CorpusIndexer::toDocument).toList());
        } catch (RuntimeException e) {
            denseIndexed = false;
            log.error("Embedding {} chunks failed, they are searchable lexically only: {}", chunks.size(), e.getMessage());
        }
        log.info("Indexed {} documents / {} chunks (dense={})", documents.size(), chunks.size(), denseIndexed);
        return new IndexResult(documents.size(), chunks.size(), denseIndexed);
    }

    static Document toDocument(Chunk chunk) {
        Map<String, Object> metadata = new HashMap<>(chunk.metadata());
        metadata.put(DenseRetriever.CHUNK_ID_KEY, chunk.id());
        metadata.put("document_id", chunk.documentId());
        metadata.put("ordinal", chunk.ordinal());
        metadata.put(RetrievalScope.OWNER_KEY, RetrievalScope.ownerOf(chunk));
        if (chunk.section() != null) {
            metadata.put("section", chunk.section());
        }
        return new Document(chunk.id(), chunk.text(), metadata);
    }

    public record IndexResult(int documents, int chunks, boolean denseIndexed) {
    }
}
