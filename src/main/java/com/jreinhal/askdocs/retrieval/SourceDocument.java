package com.jreinhal.askdocs.retrieval;

import java.time.Instant;

/**
 * Ingested source unit, referenced by chunks through {@link Chunk#documentId()}.
 *
 * @param owner store key of the uploading identity, or {@link RetrievalScope#SHARED_OWNER}
 */
public record SourceDocument(String id, String source, String owner, Instant ingestedAt) {

    public SourceDocument {
        owner = owner == null || owner.isBlank() ? RetrievalScope.SHARED_OWNER : owner;
    }

    public boolean isOwnedBy(String identity) {
        return this.owner.equals(identity);
    }
}
