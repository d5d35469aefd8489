package com.jreinhal.askdocs.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.jreinhal.askdocs.exception.GlobalExceptionHandler;
import com.jreinhal.askdocs.generation.GenerationUnavailableException;
import com.jreinhal.askdocs.generation.TokenUsage;
import com.jreinhal.askdocs.pipeline.Citation;
import com.jreinhal.askdocs.pipeline.DeadlineExceededException;
import com.jreinhal.askdocs.pipeline.PipelineRequest;
import com.jreinhal.askdocs.pipeline.PipelineResult;
import com.jreinhal.askdocs.pipeline.PipelineSettings;
import com.jreinhal.askdocs.pipeline.QueryPipeline;
import com.jreinhal.askdocs.security.ClientIdentity;
import com.jreinhal.askdocs.security.IdentityResolver;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class QueryControllerTest {
    private QueryPipeline pipeline;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.pipeline = mock(QueryPipeline.class);
        when(this.pipeline.getSettings()).thenReturn(PipelineSettings.defaults());
        IdentityResolver identityResolver = mock(IdentityResolver.class);
        when(identityResolver.resolve(any())).thenReturn(new ClientIdentity("10.0.0.1", ClientIdentity.Source.CLIENT_IP));
        this.mockMvc = MockMvcBuilders.standaloneSetup(new QueryController(this.pipeline, identityResolver))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void answersWithCitationsAndTraceId() throws Exception {
        when(this.pipeline.execute(any())).thenReturn(new PipelineResult("Refunds take 30 days [policy#0].",
                List.of(new Citation("policy#0", "policy", "policy.md")), List.of(new Citation("policy#3", "policy", "policy.md")),
                List.of("How do I ask for a refund?"), null, null, List.of(), "trace-1", List.of(), TokenUsage.NONE));

        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"  What is the refund window?  \",\"k\":3,\"enable_tools\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Refunds take 30 days [policy#0]."))
                .andExpect(jsonPath("$.citations[0].chunk_id").value("policy#0"))
                .andExpect(jsonPath("$.citations[0].source").value("policy.md"))
                .andExpect(jsonPath("$.related_citations[0].chunk_id").value("policy#3"))
                .andExpect(jsonPath("$.followups[0]").value("How do I ask for a refund?"))
                .andExpect(jsonPath("$.trace_id").value("trace-1"));

        ArgumentCaptor<PipelineRequest> request = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(this.pipeline).execute(request.capture());
        assertEquals("What is the refund window?", request.getValue().query());
        assertEquals(3, request.getValue().k());
        assertEquals(Boolean.FALSE, request.getValue().enableTools());
        assertEquals("ip:10.0.0.1", request.getValue().identity());
    }

    @Test
    void answerOverridesAndDocumentScopeReachThePipeline() throws Exception {
        when(this.pipeline.execute(any())).thenReturn(new PipelineResult("Thirty days.",
                List.of(new Citation("policy#0", "policy", "policy.md")), List.of(), List.of(), null, null, List.of(), "trace-2",
                List.of(), TokenUsage.NONE));

        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"refunds\",\"max_answer_tokens\":120,\"temperature\":0.7,\"doc_id\":\"policy\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.citations[0].chunk_id").value("policy#0"));

        ArgumentCaptor<PipelineRequest> request = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(this.pipeline).execute(request.capture());
        assertEquals(120, request.getValue().maxAnswerTokens());
        assertEquals(0.7, request.getValue().temperature());
        assertEquals("policy", request.getValue().documentId());
    }

    @Test
    void citationsCanBeLeftOut() throws Exception {
        when(this.pipeline.execute(any())).thenReturn(new PipelineResult("Thirty days.",
                List.of(new Citation("policy#0", "policy", "policy.md")), List.of(new Citation("policy#3", "policy", "policy.md")),
                List.of(), null, null, List.of(), "trace-3", List.of(), TokenUsage.NONE));

        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"refunds\",\"include_citations\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Thirty days."))
                .andExpect(jsonPath("$.citations").isEmpty())
                .andExpect(jsonPath("$.related_citations").isEmpty());
    }

    @Test
    void answerParametersOutOfRangeAreRejected() throws Exception {
        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"refunds\",\"max_answer_tokens\":10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("max_answer_tokens must be between 50 and 1000"));
        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"refunds\",\"temperature\":1.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("temperature must be between 0.0 and 1.0"));
        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"refunds\",\"doc_id\":\"../secrets\"}"))
                .andExpect(status().isBadRequest());
        verify(this.pipeline, never()).execute(any());
    }

    @Test
    void blankQueryIsRejected() throws Exception {
        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ERR-400"))
                .andExpect(jsonPath("$.error").value("query must not be blank"));
        verify(this.pipeline, never()).execute(any());
    }

    @Test
    void overlongQueryIsRejected() throws Exception {
        String query = "a".repeat(4001);
        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"" + query + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("query must not exceed 4000 characters"));
    }

    @Test
    void outOfRangeParametersAreRejected() throws Exception {
        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"refunds\",\"k\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("k must be between 1 and 50"));
        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"refunds\",\"max_context_tokens\":100}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("max_context_tokens must be between 200 and 6000"));
        verify(this.pipeline, never()).execute(any());
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON).content("{\"query\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request"));
    }

    @Test
    void generationFailureReturnsServiceUnavailableWithoutAnswer() throws Exception {
        when(this.pipeline.execute(any())).thenThrow(new GenerationUnavailableException("ollama unreachable", null, 2));

        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"refunds\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("ERR-503"))
                .andExpect(jsonPath("$.answer").doesNotExist())
                .andExpect(jsonPath("$.error").value("The answering service is temporarily unavailable. Please try again later."));
    }

    @Test
    void deadlineReturnsServiceUnavailable() throws Exception {
        when(this.pipeline.execute(any())).thenThrow(new DeadlineExceededException("generation"));

        this.mockMvc.perform(post("/api/query").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"refunds\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.answer").doesNotExist());
    }
}
