package com.jreinhal.askdocs.pipeline;

public record Citation(String chunkId, String documentId, String source) {
}
