package com.jreinhal.askdocs.retrieval;

import com.jreinhal.askdocs.util.TokenEstimator;
import java.util.Map;
import java.util.Objects;

/**
 * Retrievable unit of text. Identifiers follow {@code <documentId>#<ordinal>}.
 *
 * @param tokenCount token count reported by the chunker; estimated from the text when absent
 * @param section optional section or table label
 */
public record Chunk(String id, String documentId, int ordinal, String text, int tokenCount, String section, Map<String, String> metadata) {

    public Chunk {
        Objects.requireNonNull(id, "chunk id");
        Objects.requireNonNull(documentId, "document id");
        text = text == null ? "" : text;
        tokenCount = tokenCount > 0 ? tokenCount : TokenEstimator.estimate(text);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Chunk of(String documentId, int ordinal, String text) {
        return new Chunk(chunkId(documentId, ordinal), documentId, ordinal, text, 0, null, Map.of());
    }

    public static String chunkId(String documentId, int ordinal) {
        return documentId + "#" + ordinal;
    }
}
