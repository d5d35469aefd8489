package com.jreinhal.askdocs.retrieval;

import java.util.Collection;
import java.util.Optional;

/**
 * Chunk and document lookup by identifier. Retrievers resolve index hits through it.
 */
public interface ChunkCatalog {

    void putDocument(SourceDocument document);

    /**
     * Registers {@code document} unless its id is already held by a different owner.
     *
     * @return false when another owner holds the id
     */
    boolean claimDocument(SourceDocument document);

    void putAll(Collection<Chunk> chunks);

    Optional<Chunk> findById(String chunkId);

    Optional<SourceDocument> findDocument(String documentId);

    int size();
}
