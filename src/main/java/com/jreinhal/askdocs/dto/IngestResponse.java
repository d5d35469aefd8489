package com.jreinhal.askdocs.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param denseIndexed false when embedding failed and the document is searchable lexically only
 */
public record IngestResponse(
        @JsonProperty("document_id") String documentId,
        String source,
        int chunks,
        @JsonProperty("dense_indexed") boolean denseIndexed) {
}
