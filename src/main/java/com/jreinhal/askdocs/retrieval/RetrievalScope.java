package com.jreinhal.askdocs.retrieval;

/**
 * Visibility of chunks to one request. A chunk is visible when it is shared (loaded from the
 * corpus file) or was uploaded by the requesting identity, and, when {@code documentId} is set,
 * belongs to that document.
 *
 * @param identity store key of the requester; {@code null} sees shared chunks only
 * @param documentId optional document restriction
 */
public record RetrievalScope(String identity, String documentId) {
    public static final String OWNER_KEY = "owner";
    public static final String SHARED_OWNER = "*";

    public static RetrievalScope of(String identity, String documentId) {
        return new RetrievalScope(identity, documentId == null || documentId.isBlank() ? null : documentId);
    }

    public static RetrievalScope shared() {
        return new RetrievalScope(null, null);
    }

    public boolean allows(Chunk chunk) {
        if (this.documentId != null && !this.documentId.equals(chunk.documentId())) {
            return false;
        }
        String owner = ownerOf(chunk);
        return SHARED_OWNER.equals(owner) || owner.equals(this.identity);
    }

    public static String ownerOf(Chunk chunk) {
        return chunk.metadata().getOrDefault(OWNER_KEY, SHARED_OWNER);
    }
}
