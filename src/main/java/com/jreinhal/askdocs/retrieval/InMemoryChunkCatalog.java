package com.jreinhal.askdocs.retrieval;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class InMemoryChunkCatalog implements ChunkCatalog {
    private final Map<String, Chunk> chunks = new ConcurrentHashMap<>();
    private final Map<String, SourceDocument> documents = new ConcurrentHashMap<>();

    @Override
    public void putDocument(SourceDocument document) {
        this.documents.put(document.id(), document);
    }

    @Override
    public boolean claimDocument(SourceDocument document) {
        SourceDocument held = this.documents.compute(document.id(),
                (id, existing) -> existing == null || existing.owner().equals(document.owner()) ? document : existing);
        return held == document;
    }

    @Override
    public void putAll(Collection<Chunk> newChunks) {
        for (Chunk chunk : newChunks) {
            this.chunks.put(chunk.id(), chunk);
        }
    }

    @Override
    public Optional<Chunk> findById(String chunkId) {
        return Optional.ofNullable(this.chunks.get(chunkId));
    }

    @Override
    public Optional<SourceDocument> findDocument(String documentId) {
        return Optional.ofNullable(this.documents.get(documentId));
    }

    @Override
    public int size() {
        return this.chunks.size();
    }
}
