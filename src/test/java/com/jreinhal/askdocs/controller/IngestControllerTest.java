package com.jreinhal.askdocs.controller;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.jreinhal.askdocs.exception.GlobalExceptionHandler;
import com.jreinhal.askdocs.ingest.CorpusIndexer;
import com.jreinhal.askdocs.ingest.TextChunker;
import com.jreinhal.askdocs.metrics.PipelineMetrics;
import com.jreinhal.askdocs.retrieval.Chunk;
import com.jreinhal.askdocs.retrieval.InMemoryChunkCatalog;
import com.jreinhal.askdocs.retrieval.RetrievalScope;
import com.jreinhal.askdocs.retrieval.SourceDocument;
import com.jreinhal.askdocs.security.ClientIdentity;
import com.jreinhal.askdocs.security.IdentityResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class IngestControllerTest {
    private CorpusIndexer indexer;
    private InMemoryChunkCatalog catalog;
    private IdentityResolver identityResolver;
    private IngestController controller;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.indexer = mock(CorpusIndexer.class);
        when(this.indexer.index(anyList(), anyList())).thenAnswer(invocation -> {
            List<?> documents = invocation.getArgument(0);
            List<?> chunks = invocation.getArgument(1);
            return new CorpusIndexer.IndexResult(documents.size(), chunks.size(), true);
        });
        this.catalog = new InMemoryChunkCatalog();
        this.identityResolver = mock(IdentityResolver.class);
        when(this.identityResolver.resolve(any())).thenReturn(new ClientIdentity("alice", ClientIdentity.Source.SESSION_HEADER));
        this.controller = new IngestController(new TextChunker(), this.indexer, new PipelineMetrics(new SimpleMeterRegistry()),
                this.catalog, this.identityResolver);
        this.mockMvc = MockMvcBuilders.standaloneSetup(this.controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static MockMultipartFile file(String name, String content) {
        return new MockMultipartFile("file", name, "text/plain", content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @SuppressWarnings("unchecked")
    void indexesTextFileUnderGivenDocumentId() throws Exception {
        this.mockMvc.perform(multipart("/api/ingest/file").file(file("handbook.md", "Vacation requests need manager approval."))
                        .param("doc_id", "handbook"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.document_id").value("handbook"))
                .andExpect(jsonPath("$.source").value("handbook.md"))
                .andExpect(jsonPath("$.chunks").value(1))
                .andExpect(jsonPath("$.dense_indexed").value(true));

        ArgumentCaptor<List<Chunk>> chunks = ArgumentCaptor.forClass(List.class);
        verify(this.indexer).index(anyList(), chunks.capture());
        assertEquals("handbook#0", chunks.getValue().get(0).id());
        assertEquals("handbook.md", chunks.getValue().get(0).metadata().get("source"));
        assertEquals("session:alice", chunks.getValue().get(0).metadata().get(RetrievalScope.OWNER_KEY));
        assertEquals("session:alice", this.catalog.findDocument("handbook").orElseThrow().owner());
    }

    @Test
    void documentIdHeldByAnotherIdentityIsRefused() throws Exception {
        this.catalog.putDocument(new SourceDocument("salaries", "salaries.txt", "session:bob", Instant.now()));

        this.mockMvc.perform(multipart("/api/ingest/file").file(file("salaries.txt", "Overwritten figures.")).param("doc_id", "salaries"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("ERR-409"));

        verifyNoInteractions(this.indexer);
        assertEquals("session:bob", this.catalog.findDocument("salaries").orElseThrow().owner());
    }

    @Test
    void sharedCorpusDocumentCannotBeReplaced() throws Exception {
        this.catalog.putDocument(new SourceDocument("policy", "policy.md", null, Instant.now()));

        this.mockMvc.perform(multipart("/api/ingest/file").file(file("policy.md", "New policy.")).param("doc_id", "policy"))
                .andExpect(status().isConflict());
        verifyNoInteractions(this.indexer);
    }

    @Test
    void ownerMayReplaceTheirDocument() throws Exception {
        this.catalog.putDocument(new SourceDocument("handbook", "handbook.md", "session:alice", Instant.now()));

        this.mockMvc.perform(multipart("/api/ingest/file").file(file("handbook.md", "Second edition.")).param("doc_id", "handbook"))
                .andExpect(status().isOk());
        verify(this.indexer).index(anyList(), anyList());
    }

    @Test
    void unsupportedExtensionIsRejected() throws Exception {
        this.mockMvc.perform(multipart("/api/ingest/file").file(file("payload.exe", "MZ")))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(this.indexer);
    }

    @Test
    void unsafeDocumentIdIsRejected() throws Exception {
        this.mockMvc.perform(multipart("/api/ingest/file").file(file("notes.txt", "hello world")).param("doc_id", "../etc/passwd"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(this.indexer);
    }

    @Test
    void emptyFileIsRejected() throws Exception {
        this.mockMvc.perform(multipart("/api/ingest/file").file(file("empty.txt", "   \n ")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("File contains no text"));
    }

    @Test
    void oversizedFileIsRejected() throws Exception {
        ReflectionTestUtils.setField(this.controller, "maxUploadMb", 0L);

        this.mockMvc.perform(multipart("/api/ingest/file").file(file("big.txt", "some text")))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.errorCode").value("ERR-413"));
    }

    @Test
    void missingFileIsMalformed() throws Exception {
        this.mockMvc.perform(multipart("/api/ingest/file").param("doc_id", "handbook"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request"));
    }

    @Test
    void extensionIsLowerCasedAndOptional() {
        assertEquals("md", IngestController.extension("README.MD"));
        assertEquals("", IngestController.extension("Makefile"));
    }
}
