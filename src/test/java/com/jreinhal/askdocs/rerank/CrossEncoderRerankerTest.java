package com.jreinhal.askdocs.rerank;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.jreinhal.askdocs.generation.Completion;
import com.jreinhal.askdocs.generation.CompletionClient;
import com.jreinhal.askdocs.generation.CompletionRequest;
import com.jreinhal.askdocs.generation.TokenUsage;
import com.jreinhal.askdocs.retrieval.Candidate;
import com.jreinhal.askdocs.retrieval.Chunk;
import com.jreinhal.askdocs.retrieval.RetrievalMethod;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class CrossEncoderRerankerTest {
    private ExecutorService executor;
    private CompletionClient completionClient;

    @BeforeEach
    void setUp() {
        this.executor = Executors.newFixedThreadPool(4);
        this.completionClient = mock(CompletionClient.class);
    }

    @AfterEach
    void tearDown() {
        this.executor.shutdownNow();
    }

    private static Candidate fused(String docId, String text, int rank) {
        return Candidate.retrieved(Chunk.of(docId, 0, text), RetrievalMethod.DENSE, 1.0 / rank, rank).withRank(rank);
    }

    private CrossEncoderReranker reranker(String mode) {
        CrossEncoderReranker reranker = new CrossEncoderReranker(this.completionClient, this.executor, null);
        ReflectionTestUtils.setField(reranker, "rerankerMode", mode);
        reranker.init();
        return reranker;
    }

    @Test
    void llmJudgmentsReorderThePool() {
        when(this.completionClient.complete(any(CompletionRequest.class))).thenAnswer(invocation -> {
            CompletionRequest request = invocation.getArgument(0);
            String score = request.user().contains("Refunds are issued") ? "9" : "2";
            return new Completion(score, TokenUsage.NONE);
        });
        List<Candidate> fused = List.of(fused("pricing", "Plans are billed monthly.", 1),
                fused("refunds", "Refunds are issued within 30 days.", 2));

        List<Candidate> reranked = this.reranker("llm").rerank("refund policy", fused, Duration.ofSeconds(2));

        assertEquals("refunds#0", reranked.get(0).chunkId());
        assertEquals(0.9, reranked.get(0).rerankScore(), 1e-9);
        assertEquals(1, reranked.get(0).rank());
        assertEquals(2, reranked.get(1).rank());
    }

    @Test
    void timeoutRaisesRerankUnavailable() {
        when(this.completionClient.complete(any(CompletionRequest.class))).thenAnswer(invocation -> {
            Thread.sleep(2000L);
            return new Completion("5", TokenUsage.NONE);
        });
        List<Candidate> fused = List.of(fused("a", "alpha", 1), fused("b", "beta", 2));

        assertThrows(RerankUnavailableException.class,
                () -> this.reranker("llm").rerank("q", fused, Duration.ofMillis(100)));
    }

    @Test
    void unparseableJudgmentRaisesRerankUnavailable() {
        when(this.completionClient.complete(any(CompletionRequest.class))).thenReturn(new Completion("very relevant", TokenUsage.NONE));

        assertThrows(RerankUnavailableException.class,
                () -> this.reranker("llm").rerank("q", List.of(fused("a", "alpha", 1)), Duration.ofSeconds(1)));
    }

    @Test
    void keywordModeNeedsNoBackend() {
        List<Candidate> fused = List.of(fused("a", "Shipping takes five days.", 1), fused("b", "Refund requests need a receipt.", 2));

        List<Candidate> reranked = this.reranker("keyword").rerank("refund receipt", fused, Duration.ofSeconds(1));

        assertEquals("b#0", reranked.get(0).chunkId());
        assertEquals(1.0, reranked.get(0).rerankScore(), 1e-9);
        verifyNoInteractions(this.completionClient);
    }

    @Test
    void embeddingModeWithoutModelFallsBackToKeywords() {
        assertEquals(CrossEncoderReranker.RerankerMode.KEYWORD, this.reranker("embedding").getMode());
    }

    @Test
    void candidatesBeyondThePoolKeepFusedOrder() {
        CrossEncoderReranker reranker = this.reranker("keyword");
        ReflectionTestUtils.setField(reranker, "poolSize", 1);
        List<Candidate> fused = List.of(fused("a", "nothing", 1), fused("b", "refund", 2), fused("c", "refund", 3));

        List<Candidate> reranked = reranker.rerank("refund", fused, Duration.ofSeconds(1));

        assertEquals(List.of("a#0", "b#0", "c#0"), reranked.stream().map(Candidate::chunkId).toList());
        assertNull(reranked.get(1).rerankScore());
        assertEquals(3, reranked.get(2).rank());
    }

    @Test
    void parsesScoresOnTheTenPointScale() {
        assertEquals(0.7, CrossEncoderReranker.parseScore("7"), 1e-9);
        assertEquals(1.0, CrossEncoderReranker.parseScore("Score: 10"), 1e-9);
        assertEquals(0.85, CrossEncoderReranker.parseScore("8.5"), 1e-9);
        assertThrows(IllegalStateException.class, () -> CrossEncoderReranker.parseScore(""));
    }
}
