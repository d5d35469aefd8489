package com.jreinhal.askdocs.e2e;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import com.jreinhal.askdocs.generation.Completion;
import com.jreinhal.askdocs.generation.CompletionClient;
import com.jreinhal.askdocs.generation.CompletionFailedException;
import com.jreinhal.askdocs.generation.CompletionRequest;
import com.jreinhal.askdocs.generation.TokenUsage;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureMockMvc
class QueryPipelineE2eTest {
    private static final String QUERY = "{\"query\":\"What is the refund policy?\",\"k\":5}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CompletionClient completionClient;

    @MockitoBean
    private VectorStore vectorStore;

    @BeforeEach
    void setup() {
        when(this.completionClient.complete(any(CompletionRequest.class)))
                .thenReturn(new Completion("Refunds are issued within 30 days [refunds#0].", new TokenUsage(80, 12)));
    }

    @Test
    void ingestedDocumentIsCitedInTheAnswer() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "refunds.md", "text/markdown",
                "Refunds are issued within 30 days of purchase with a receipt.".getBytes(StandardCharsets.UTF_8));
        this.mockMvc.perform(multipart("/api/ingest/file").file(file).param("doc_id", "refunds")
                        .header("X-Session-Id", "e2e-ingest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chunks").value(1));

        MvcResult result = this.mockMvc.perform(post("/api/query").header("X-Session-Id", "e2e-ingest")
                        .contentType(MediaType.APPLICATION_JSON).content(QUERY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Refunds are issued within 30 days [refunds#0]."))
                .andExpect(jsonPath("$.citations[0].chunk_id").value("refunds#0"))
                .andExpect(jsonPath("$.citations[0].source").value("refunds.md"))
                .andExpect(header().exists("X-Request-Id"))
                .andReturn();

        String traceId = JsonPath.read(result.getResponse().getContentAsString(), "$.trace_id");
        this.mockMvc.perform(get("/api/traces/{id}", traceId).header("X-Session-Id", "e2e-ingest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trace_id").value(traceId));
        this.mockMvc.perform(get("/api/traces/{id}", traceId).header("X-Session-Id", "e2e-other"))
                .andExpect(status().isNotFound());
    }

    @Test
    void uploadsAreVisibleOnlyToTheUploadingSession() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "salaries.txt", "text/plain",
                "Alice salary is 120000 per year.".getBytes(StandardCharsets.UTF_8));
        this.mockMvc.perform(multipart("/api/ingest/file").file(file).param("doc_id", "alice-private")
                        .header("X-Session-Id", "alice"))
                .andExpect(status().isOk());
        String salaryQuery = "{\"query\":\"Alice salary\",\"k\":5}";

        this.mockMvc.perform(post("/api/query").header("X-Session-Id", "mallory")
                        .contentType(MediaType.APPLICATION_JSON).content(salaryQuery))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.citations[?(@.document_id == 'alice-private')]").isEmpty())
                .andExpect(jsonPath("$.related_citations[?(@.document_id == 'alice-private')]").isEmpty());
        ArgumentCaptor<SearchRequest> search = ArgumentCaptor.forClass(SearchRequest.class);
        verify(this.vectorStore).similaritySearch(search.capture());
        assertTrue(search.getValue().getFilterExpression().toString().contains("session:mallory"));

        this.mockMvc.perform(post("/api/query").header("X-Session-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON).content(salaryQuery))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.citations[0].chunk_id").value("alice-private#0"));

        MockMultipartFile overwrite = new MockMultipartFile("file", "salaries.txt", "text/plain",
                "Alice salary is 1 per year.".getBytes(StandardCharsets.UTF_8));
        this.mockMvc.perform(multipart("/api/ingest/file").file(overwrite).param("doc_id", "alice-private")
                        .header("X-Session-Id", "mallory"))
                .andExpect(status().isConflict());
    }

    @Test
    void eleventhQueryInTheWindowIsDeniedBeforeRetrieval() throws Exception {
        for (int i = 0; i < 10; i++) {
            this.mockMvc.perform(post("/api/query").header("X-Session-Id", "e2e-rate")
                            .contentType(MediaType.APPLICATION_JSON).content(QUERY))
                    .andExpect(status().isOk());
        }
        verify(this.vectorStore, times(10)).similaritySearch(any(SearchRequest.class));
        clearInvocations(this.vectorStore, this.completionClient);

        MvcResult denied = this.mockMvc.perform(post("/api/query").header("X-Session-Id", "e2e-rate")
                        .contentType(MediaType.APPLICATION_JSON).content(QUERY))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.errorCode").value("ERR-429"))
                .andReturn();

        assertTrue(Long.parseLong(denied.getResponse().getHeader("Retry-After")) > 0L);
        verify(this.vectorStore, never()).similaritySearch(any(SearchRequest.class));
        verify(this.completionClient, never()).complete(any());
    }

    @Test
    void generationTimingOutTwiceReturnsServiceUnavailableWithoutAnswer() throws Exception {
        when(this.completionClient.complete(any(CompletionRequest.class)))
                .thenThrow(new CompletionFailedException("timed out", null, true));

        this.mockMvc.perform(post("/api/query").header("X-Session-Id", "e2e-timeout")
                        .contentType(MediaType.APPLICATION_JSON).content(QUERY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("ERR-503"))
                .andExpect(jsonPath("$.answer").doesNotExist());

        verify(this.completionClient, times(2)).complete(any(CompletionRequest.class));
    }
}
