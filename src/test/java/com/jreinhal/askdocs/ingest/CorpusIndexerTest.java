package com.jreinhal.askdocs.ingest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.jreinhal.askdocs.retrieval.Chunk;
import com.jreinhal.askdocs.retrieval.DenseRetriever;
import com.jreinhal.askdocs.retrieval.InMemoryChunkCatalog;
import com.jreinhal.askdocs.retrieval.LexicalIndex;
import com.jreinhal.askdocs.retrieval.RetrievalScope;
import com.jreinhal.askdocs.retrieval.SourceDocument;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.VectorStore;

class CorpusIndexerTest {
    private InMemoryChunkCatalog catalog;
    private LexicalIndex lexicalIndex;
    private VectorStore vectorStore;
    private CorpusIndexer indexer;

    @BeforeEach
    void setUp() {
        this.catalog = new InMemoryChunkCatalog();
        this.lexicalIndex = new LexicalIndex();
        this.vectorStore = mock(VectorStore.class);
        this.indexer = new CorpusIndexer(this.catalog, this.lexicalIndex, this.vectorStore);
    }

    @Test
    @SuppressWarnings("unchecked")
    void writesCatalogLexicalIndexAndVectors() {
        List<Chunk> chunks = List.of(Chunk.of("policy", 0, "Refunds within 30 days."), Chunk.of("policy", 1, "Exchanges any time."));

        CorpusIndexer.IndexResult result = this.indexer.index(List.of(new SourceDocument("policy", "policy.md", null, Instant.now())), chunks);

        assertEquals(new CorpusIndexer.IndexResult(1, 2, true), result);
        assertEquals(2, this.catalog.size());
        assertEquals("policy.md", this.catalog.findDocument("policy").orElseThrow().source());
        assertEquals(2, this.lexicalIndex.size());
        ArgumentCaptor<List<Document>> documents = ArgumentCaptor.forClass(List.class);
        verify(this.vectorStore).add(documents.capture());
        assertEquals("policy#0", documents.getValue().get(0).getMetadata().get(DenseRetriever.CHUNK_ID_KEY));
        assertEquals(RetrievalScope.SHARED_OWNER, documents.getValue().get(0).getMetadata().get(RetrievalScope.OWNER_KEY));
    }

    @Test
    @SuppressWarnings("unchecked")
    void uploadedChunksCarryTheirOwnerIntoVectorMetadata() {
        Chunk chunk = new Chunk("notes#0", "notes", 0, "Private notes.", 0, null,
                Map.of("source", "notes.txt", RetrievalScope.OWNER_KEY, "session:alice"));

        this.indexer.index(List.of(new SourceDocument("notes", "notes.txt", "session:alice", Instant.now())), List.of(chunk));

        ArgumentCaptor<List<Document>> documents = ArgumentCaptor.forClass(List.class);
        verify(this.vectorStore).add(documents.capture());
        assertEquals("session:alice", documents.getValue().get(0).getMetadata().get(RetrievalScope.OWNER_KEY));
        assertEquals("notes", documents.getValue().get(0).getMetadata().get("document_id"));
    }

    @Test
    void embeddingFailureLeavesChunksLexicallySearchable() {
        doThrow(new IllegalStateException("embedding model offline")).when(this.vectorStore).add(anyList());

        CorpusIndexer.IndexResult result = this.indexer.index(List.of(), List.of(Chunk.of("faq", 0, "Shipping is free.")));

        assertFalse(result.denseIndexed());
        assertTrue(this.catalog.findById("faq#0").isPresent());
        assertEquals(1, this.lexicalIndex.snapshot().search("shipping", 5).size());
    }
}
