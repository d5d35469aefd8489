package com.jreinhal.askdocs.pipeline;

import com.jreinhal.askdocs.retrieval.Candidate;
import com.jreinhal.askdocs.retrieval.DenseRetriever;
import com.jreinhal.askdocs.retrieval.LexicalRetriever;
import com.jreinhal.askdocs.retrieval.RetrievalMethod;
import com.jreinhal.askdocs.retrieval.RetrievalScope;
import com.jreinhal.askdocs.retrieval.Retriever;
import com.jreinhal.askdocs.trace.ActiveSpan;
import com.jreinhal.askdocs.trace.QueryTrace;
import com.jreinhal.askdocs.trace.SpanNames;
import com.jreinhal.askdocs.util.TimeBudget;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs dense and lexical retrieval for every query of a plan. Both methods for one query run
 * concurrently; queries are processed in waves of at most {@code max-fan-out}. Each backend call
 * is bounded by its method timeout and by the request deadline; a call that errors or times out
 * is cancelled and counted against its method only.
 */
@Service
public class HybridRetrievalService {
    private static final Logger log = LoggerFactory.getLogger(HybridRetrievalService.class);
    private final Retriever denseRetriever;
    private final Retriever lexicalRetriever;
    private final ExecutorService executor;
    @Value("${askdocs.retrieval.max-fan-out:4}")
    private int maxFanOut = 4;

    public HybridRetrievalService(DenseRetriever denseRetriever, LexicalRetriever lexicalRetriever,
            @Qualifier("retrievalExecutor") ExecutorService executor) {
        this.denseRetriever = denseRetriever;
        this.lexicalRetriever = lexicalRetriever;
        this.executor = executor;
    }

    /**
     * @throws DeadlineExceededException when the request deadline passes while waiting
     */
    public RetrievalOutcome retrieve(List<String> queries, int depth, RetrievalScope scope, Duration denseTimeout,
            Duration lexicalTimeout, QueryTrace trace, TimeBudget budget) {
        ActiveSpan denseSpan = trace.startSpan(SpanNames.DENSE_RETRIEVAL);
        ActiveSpan lexicalSpan = trace.startSpan(SpanNames.LEXICAL_RETRIEVAL);
        MethodResults dense = new MethodResults(RetrievalMethod.DENSE);
        MethodResults lexical = new MethodResults(RetrievalMethod.LEXICAL);
        int waveSize = Math.max(1, this.maxFanOut);
        for (int start = 0; start < queries.size(); start += waveSize) {
            List<String> wave = queries.subList(start, Math.min(queries.size(), start + waveSize));
            this.runWave(wave, depth, scope, denseTimeout, lexicalTimeout, dense, lexical, budget);
        }
        StageResult<List<Candidate>> denseResult = dense.toStageResult();
        StageResult<List<Candidate>> lexicalResult = lexical.toStageResult();
        describe(denseSpan, dense, denseResult).end();
        describe(lexicalSpan, lexical, lexicalResult).end();
        return new RetrievalOutcome(denseResult, lexicalResult);
    }

    private void runWave(List<String> wave, int depth, RetrievalScope scope, Duration denseTimeout, Duration lexicalTimeout,
            MethodResults dense, MethodResults lexical, TimeBudget budget) {
        long waveStart = System.nanoTime();
        List<Future<List<Candidate>>> denseFutures = new ArrayList<>(wave.size());
        List<Future<List<Candidate>>> lexicalFutures = new ArrayList<>(wave.size());
        for (String query : wave) {
            denseFutures.add(this.submit(this.denseRetriever, query, depth, scope, dense));
            lexicalFutures.add(this.submit(this.lexicalRetriever, query, depth, scope, lexical));
        }
        try {
            this.collect(denseFutures, dense, denseTimeout, waveStart, budget);
            this.collect(lexicalFutures, lexical, lexicalTimeout, waveStart, budget);
        } catch (DeadlineExceededException e) {
            denseFutures.forEach(future -> cancel(future));
            lexicalFutures.forEach(future -> cancel(future));
            throw e;
        }
    }

    private Future<List<Candidate>> submit(Retriever retriever, String query, int depth, RetrievalScope scope, MethodResults results) {
        try {
            return this.executor.submit(() -> retriever.retrieve(query, depth, scope));
        } catch (RejectedExecutionException e) {
            results.fail("pool saturated: " + e.getMessage());
            return null;
        }
    }

    private void collect(List<Future<List<Candidate>>> futures, MethodResults results, Duration methodTimeout,
            long waveStart, TimeBudget budget) {
        for (Future<List<Candidate>> future : futures) {
            if (future == null) {
                continue;
            }
            long methodRemaining = methodTimeout.toNanos() - (System.nanoTime() - waveStart);
            long budgetRemaining = budget.remaining().toNanos();
            if (budgetRemaining <= 0L) {
                throw new DeadlineExceededException(results.method.tag() + "-retrieval");
            }
            long waitNanos = Math.max(0L, Math.min(methodRemaining, budgetRemaining));
            try {
                results.add(future.get(waitNanos, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                cancel(future);
                if (budget.isExhausted()) {
                    throw new DeadlineExceededException(results.method.tag() + "-retrieval");
                }
                results.fail("timed out after " + methodTimeout.toMillis() + "ms");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                results.fail(cause.getMessage());
                log.warn("{} retrieval failed: {}", results.method.tag(), cause.getMessage());
            } catch (InterruptedException e) {
                cancel(future);
                Thread.currentThread().interrupt();
                throw new DeadlineExceededException(results.method.tag() + "-retrieval");
            }
        }
    }

    private static ActiveSpan describe(ActiveSpan span, MethodResults results, StageResult<List<Candidate>> result) {
        span.attribute("calls", results.calls).attribute("failures", results.errors.size());
        if (result.isFailed()) {
            return span.fail(result.message());
        }
        span.attribute("chunk_ids", result.value().stream().map(Candidate::chunkId).toList());
        if (result.isDegraded()) {
            span.degraded(result.message());
        }
        return span;
    }

    private static void cancel(Future<?> future) {
        if (future != null) {
            future.cancel(true);
        }
    }

    private static final class MethodResults {
        private final RetrievalMethod method;
        private final Map<String, Candidate> best = new LinkedHashMap<>();
        private final List<String> errors = new ArrayList<>();
        private int calls;

        private MethodResults(RetrievalMethod method) {
            this.method = method;
        }

        private void add(List<Candidate> candidates) {
            this.calls++;
            for (Candidate candidate : candidates) {
                this.best.merge(candidate.chunkId(), candidate, (a, b) -> b.rawScore() > a.rawScore() ? b : a);
            }
        }

        private void fail(String error) {
            this.calls++;
            this.errors.add(error);
        }

        private StageResult<List<Candidate>> toStageResult() {
            if (this.calls > 0 && this.errors.size() == this.calls) {
                return StageResult.failed(this.method.tag() + " retrieval unavailable: " + this.errors.get(0));
            }
            List<Candidate> merged = new ArrayList<>(this.best.values());
            merged.sort(Comparator.comparingDouble(Candidate::rawScore).reversed().thenComparing(Candidate::chunkId));
            List<Candidate> ranked = new ArrayList<>(merged.size());
            for (Candidate candidate : merged) {
                ranked.add(candidate.withRank(ranked.size() + 1));
            }
            if (!this.errors.isEmpty()) {
                return StageResult.degraded(ranked, this.errors.size() + " of " + this.calls + " " + this.method.tag() + " calls failed");
            }
            return StageResult.success(ranked);
        }
    }
}
