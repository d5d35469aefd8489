package com.jreinhal.askdocs.generation;

import com.jreinhal.askdocs.tools.ToolOutput;
import com.jreinhal.askdocs.util.SimpleCircuitBreaker;
import com.jreinhal.askdocs.util.TimeBudget;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Produces the final answer from the assembled context and, when a tool fired, its output.
 *
 * <p>Each attempt runs under the per-attempt timeout clipped to the request deadline. Failed
 * attempts are retried with exponential backoff up to {@code max-attempts}; a circuit breaker
 * stops calling a backend that keeps failing. Exhaustion surfaces as
 * {@link GenerationUnavailableException}.</p>
 */
@Service
public class AnswerGenerator {
    private static final Logger log = LoggerFactory.getLogger(AnswerGenerator.class);
    static final String SYSTEM_PROMPT = "You are an enterprise document assistant. Answer the question using only the provided context. "
            + "Cite the chunk identifiers you rely on in square brackets, for example [handbook#3]. "
            + "If the context does not contain the answer, say that it does not.";
    private final CompletionClient completionClient;
    private SimpleCircuitBreaker circuitBreaker;
    @Value("${askdocs.generation.max-attempts:2}")
    private int maxAttempts = 2;
    @Value("${askdocs.generation.backoff-ms:250}")
    private long backoffMs = 250L;
    @Value("${askdocs.generation.timeout-ms:20000}")
    private long timeoutMs = 20000L;
    @Value("${askdocs.generation.max-answer-tokens:300}")
    private int defaultMaxTokens = 300;
    @Value("${askdocs.generation.temperature:0.2}")
    private double defaultTemperature = 0.2;
    @Value("${askdocs.generation.circuit-breaker.failure-threshold:5}")
    private int breakerFailureThreshold = 5;
    @Value("${askdocs.generation.circuit-breaker.open-seconds:30}")
    private long breakerOpenSeconds = 30L;

    public AnswerGenerator(CompletionClient completionClient) {
        this.completionClient = completionClient;
        this.circuitBreaker = new SimpleCircuitBreaker("generation", this.breakerFailureThreshold, Duration.ofSeconds(this.breakerOpenSeconds), 1);
    }

    @PostConstruct
    public void init() {
        this.circuitBreaker = new SimpleCircuitBreaker("generation", this.breakerFailureThreshold, Duration.ofSeconds(this.breakerOpenSeconds), 1);
        log.info("Answer generator: maxAttempts={}, backoff={}ms, timeout={}ms, maxTokens={}",
                this.maxAttempts, this.backoffMs, this.timeoutMs, this.defaultMaxTokens);
    }

    public GeneratedAnswer generate(String query, String context, ToolOutput toolOutput) {
        return this.generate(new AnswerRequest(query, context, toolOutput, this.defaultMaxTokens, this.defaultTemperature), TimeBudget.unbounded());
    }

    public GeneratedAnswer generate(AnswerRequest request, TimeBudget budget) {
        String prompt = buildPrompt(request);
        int attempts = Math.max(1, this.maxAttempts);
        CompletionFailedException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (!this.circuitBreaker.allowRequest()) {
                throw new GenerationUnavailableException("Generation backend circuit is open", lastFailure, attempt - 1);
            }
            Duration timeout = budget.bound(Duration.ofMillis(this.timeoutMs));
            if (timeout.isZero()) {
                throw new GenerationUnavailableException("Request deadline reached before generation attempt " + attempt, lastFailure, attempt - 1);
            }
            try {
                Completion completion = this.completionClient.complete(new CompletionRequest(SYSTEM_PROMPT, prompt,
                        request.maxTokens(), request.temperature(), timeout));
                this.circuitBreaker.recordSuccess();
                return new GeneratedAnswer(completion.text().trim(), completion.usage(), attempt);
            } catch (CompletionFailedException e) {
                lastFailure = e;
                this.circuitBreaker.recordFailure(e);
                log.warn("Generation attempt {}/{} failed (timedOut={}): {}", attempt, attempts, e.isTimedOut(), e.getMessage());
                if (attempt < attempts) {
                    this.backoff(attempt, budget);
                }
            }
        }
        throw new GenerationUnavailableException("Generation failed after " + attempts + " attempts", lastFailure, attempts);
    }

    static String buildPrompt(AnswerRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(request.context() == null ? "" : request.context());
        ToolOutput toolOutput = request.toolOutput();
        if (toolOutput != null && toolOutput.text() != null && !toolOutput.text().isBlank()) {
            prompt.append("\n\nTool output (").append(toolOutput.toolName()).append("):\n").append(toolOutput.text()).append('\n');
        }
        prompt.append("\n\nQuestion: ").append(request.query());
        return prompt.toString();
    }

    private void backoff(int attempt, TimeBudget budget) {
        long delay = this.backoffMs * (1L << (attempt - 1));
        long bounded = Math.min(delay, budget.remaining().toMillis());
        if (bounded <= 0L) {
            return;
        }
        try {
            Thread.sleep(bounded);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationUnavailableException("Interrupted while backing off", e, attempt);
        }
    }

    SimpleCircuitBreaker getCircuitBreaker() {
        return this.circuitBreaker;
    }
}
