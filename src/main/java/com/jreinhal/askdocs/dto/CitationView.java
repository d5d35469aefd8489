package com.jreinhal.askdocs.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.askdocs.pipeline.Citation;

public record CitationView(
        @JsonProperty("chunk_id") String chunkId,
        @JsonProperty("document_id") String documentId,
        String source) {

    public static CitationView from(Citation citation) {
        return new CitationView(citation.chunkId(), citation.documentId(), citation.source());
    }
}
