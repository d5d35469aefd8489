package com.jreinhal.askdocs.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.askdocs.retrieval.Chunk;
import com.jreinhal.askdocs.retrieval.RetrievalScope;
import com.jreinhal.askdocs.retrieval.SourceDocument;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Loads a pre-chunked JSONL corpus at startup. Each line is
 * {@code {"document_id", "source", "ordinal", "text", "section", "id"}}; {@code id} defaults to
 * {@code document_id#ordinal}.
 */
@Component
public class CorpusLoader {
    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);
    private final CorpusIndexer indexer;
    private final ObjectMapper objectMapper;
    @Value("${askdocs.corpus.path:}")
    private String corpusPath;

    public CorpusLoader(CorpusIndexer indexer, ObjectMapper objectMapper) {
        this.indexer = indexer;
        this.objectMapper = objectMapper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (this.corpusPath == null || this.corpusPath.isBlank()) {
            log.info("No corpus path configured; starting with an empty index");
            return;
        }
        Path path = Path.of(this.corpusPath);
        if (!Files.isRegularFile(path)) {
            log.warn("Corpus file {} not found; starting with an empty index", path);
            return;
        }
        this.load(path);
    }

    public CorpusIndexer.IndexResult load(Path path) {
        Map<String, SourceDocument> documents = new LinkedHashMap<>();
        List<Chunk> chunks = new ArrayList<>();
        Instant loadedAt = Instant.now();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node = this.objectMapper.readTree(line);
                String documentId = node.path("document_id").asText(null);
                if (documentId == null || !node.hasNonNull("text")) {
                    log.warn("Skipping corpus line {}: document_id and text are required", lineNumber);
                    continue;
                }
                String source = node.path("source").asText(documentId);
                int ordinal = node.path("ordinal").asInt(0);
                String id = node.path("id").asText(Chunk.chunkId(documentId, ordinal));
                String section = node.hasNonNull("section") ? node.get("section").asText() : null;
                documents.putIfAbsent(documentId, new SourceDocument(documentId, source, RetrievalScope.SHARED_OWNER, loadedAt));
                chunks.add(new Chunk(id, documentId, ordinal, node.get("text").asText(), node.path("token_count").asInt(0), section, Map.of("source", source)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read corpus " + path + " at line " + lineNumber, e);
        }
        return this.indexer.index(List.copyOf(documents.values()), chunks);
    }
}
