package com.jreinhal.askdocs.controller;

import com.jreinhal.askdocs.dto.IngestResponse;
import com.jreinhal.askdocs.ingest.CorpusIndexer;
import com.jreinhal.askdocs.ingest.DocumentOwnershipException;
import com.jreinhal.askdocs.ingest.TextChunker;
import com.jreinhal.askdocs.metrics.PipelineMetrics;
import com.jreinhal.askdocs.retrieval.Chunk;
import com.jreinhal.askdocs.retrieval.ChunkCatalog;
import com.jreinhal.askdocs.retrieval.SourceDocument;
import com.jreinhal.askdocs.security.IdentityResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;

/**
 * Plain-text ingestion: the uploaded file is split into word windows and indexed under the
 * uploading identity, which alone can retrieve it. Re-uploading a document id replaces the
 * caller's own document; an id held by anyone else is refused.
 */
@RestController
@RequestMapping(value={"/api/ingest"})
public class IngestController {
    private static final Logger log = LoggerFactory.getLogger(IngestController.class);
    static final Set<String> SUPPORTED_EXTENSIONS = Set.of("txt", "md", "csv");
    private static final Pattern SAFE_DOC_ID = Pattern.compile("^[a-zA-Z0-9\\-_.]{1,128}$");
    private final TextChunker chunker;
    private final CorpusIndexer indexer;
    private final PipelineMetrics metrics;
    private final ChunkCatalog catalog;
    private final IdentityResolver identityResolver;
    @Value("${askdocs.ingest.max-upload-mb:10}")
    private long maxUploadMb = 10;

    public IngestController(TextChunker chunker, CorpusIndexer indexer, PipelineMetrics metrics, ChunkCatalog catalog,
            IdentityResolver identityResolver) {
        this.chunker = chunker;
        this.indexer = indexer;
        this.metrics = metrics;
        this.catalog = catalog;
        this.identityResolver = identityResolver;
    }

    @PostMapping(value={"/file"})
    public ResponseEntity<IngestResponse> ingestFile(@RequestParam(value="file") MultipartFile file,
            @RequestParam(value="doc_id", required=false) String docId, HttpServletRequest request) {
        this.metrics.recordRequest("ingest");
        long maxBytes = this.maxUploadMb * 1024L * 1024L;
        if (file.getSize() > maxBytes) {
            throw new MaxUploadSizeExceededException(maxBytes);
        }
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
        String extension = extension(filename);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new IllegalArgumentException("Unsupported file type '" + extension + "'; expected one of " + SUPPORTED_EXTENSIONS);
        }
        if (docId != null && !SAFE_DOC_ID.matcher(docId).matches()) {
            throw new IllegalArgumentException("doc_id may only contain letters, digits, '-', '_' and '.'");
        }
        String documentId = docId != null ? docId : UUID.randomUUID().toString();
        String text;
        try {
            text = new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read upload " + filename, e);
        }
        String owner = this.identityResolver.resolve(request).key();
        List<Chunk> chunks = this.chunker.chunk(documentId, filename, owner, text);
        if (chunks.isEmpty()) {
            throw new IllegalArgumentException("File contains no text");
        }
        SourceDocument document = new SourceDocument(documentId, filename, owner, Instant.now());
        if (!this.catalog.claimDocument(document)) {
            log.warn("Refused upload of {}: document id held by another owner", documentId);
            throw new DocumentOwnershipException(documentId);
        }
        CorpusIndexer.IndexResult result = this.indexer.index(List.of(document), chunks);
        log.info("Ingested {} as {} ({} chunks)", filename, documentId, result.chunks());
        return ResponseEntity.ok(new IngestResponse(documentId, filename, result.chunks(), result.denseIndexed()));
    }

    static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
