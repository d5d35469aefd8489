package com.jreinhal.askdocs.ingest;

/**
 * An upload named a document id that belongs to another identity or to the shared corpus.
 */
public class DocumentOwnershipException extends RuntimeException {

    public DocumentOwnershipException(String documentId) {
        super("Document '" + documentId + "' already exists");
    }
}
