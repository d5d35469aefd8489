package com.jreinhal.askdocs.rerank;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.askdocs.constant.StopWords;
import com.jreinhal.askdocs.generation.CompletionClient;
import com.jreinhal.askdocs.generation.CompletionRequest;
import com.jreinhal.askdocs.retrieval.Candidate;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Second-pass relevance scoring of the fused top-N against the raw query.
 *
 * <p>Modes: {@code LLM} asks the completion backend for a 0-10 relevance judgment per
 * query/passage pair; {@code EMBEDDING} uses cosine similarity between query and passage
 * embeddings; {@code KEYWORD} scores query term coverage and never fails. Pair scores are cached.
 * Scoring runs on the reranker pool under one overall timeout; any failure or timeout raises
 * {@link RerankUnavailableException} and the caller keeps the fused order.</p>
 */
@Component
public class CrossEncoderReranker {
    private static final Logger log = LoggerFactory.getLogger(CrossEncoderReranker.class);
    private static final Pattern SCORE_PATTERN = Pattern.compile("(10|\\d(?:\\.\\d+)?)");
    private static final Set<String> STOP_WORDS = StopWords.RERANKER;
    private static final int MAX_PASSAGE_CHARS = 1000;
    private static final Comparator<Candidate> RERANK_ORDER = Comparator.comparingDouble((Candidate c) -> c.rerankScore()).reversed()
            .thenComparingInt(Candidate::rank)
            .thenComparing(Candidate::chunkId);
    private final CompletionClient completionClient;
    private final ExecutorService executor;
    private final EmbeddingModel embeddingModel;
    @Value("${askdocs.rerank.mode:llm}")
    private String rerankerMode = "llm";
    @Value("${askdocs.rerank.pool-size:20}")
    private int poolSize = 20;
    @Value("${askdocs.rerank.timeout-ms:8000}")
    private long timeoutMs = 8000L;
    @Value("${askdocs.rerank.cache-size:2000}")
    private int cacheSize = 2000;
    @Value("${askdocs.rerank.cache-ttl-seconds:900}")
    private long cacheTtlSeconds = 900L;
    private Cache<String, Double> scoreCache;
    private RerankerMode mode = RerankerMode.LLM;

    public CrossEncoderReranker(CompletionClient completionClient, @Qualifier("rerankerExecutor") ExecutorService executor, @Nullable EmbeddingModel embeddingModel) {
        this.completionClient = completionClient;
        this.executor = executor;
        this.embeddingModel = embeddingModel;
    }

    @PostConstruct
    public void init() {
        if (this.cacheSize > 0 && this.cacheTtlSeconds > 0) {
            this.scoreCache = Caffeine.newBuilder()
                    .maximumSize(this.cacheSize)
                    .expireAfterWrite(Duration.ofSeconds(this.cacheTtlSeconds))
                    .build();
        }
        this.mode = RerankerMode.valueOf(this.rerankerMode.trim().toUpperCase(Locale.ROOT));
        if (this.mode == RerankerMode.EMBEDDING && this.embeddingModel == null) {
            log.warn("Embedding reranker requested but no EmbeddingModel is available; using keyword scoring");
            this.mode = RerankerMode.KEYWORD;
        }
        log.info("Cross-encoder reranker initialized (mode={}, poolSize={}, timeout={}ms)", this.mode, this.poolSize, this.timeoutMs);
    }

    public List<Candidate> rerank(String query, List<Candidate> fused) {
        return this.rerank(query, fused, Duration.ofMillis(this.timeoutMs));
    }

    /**
     * Reorders the first {@code pool-size} candidates by rerank score; the rest keep their fused
     * order behind them. Ranks are reassigned from 1.
     *
     * @throws RerankUnavailableException when any pair cannot be scored within {@code timeout}
     */
    public List<Candidate> rerank(String query, List<Candidate> fused, Duration timeout) {
        if (fused.isEmpty()) {
            return List.of();
        }
        int poolEnd = Math.min(this.poolSize, fused.size());
        List<Candidate> pool = fused.subList(0, poolEnd);
        Duration bounded = timeout.compareTo(Duration.ofMillis(this.timeoutMs)) < 0 ? timeout : Duration.ofMillis(this.timeoutMs);
        long startTime = System.currentTimeMillis();
        List<Double> scores = this.mode == RerankerMode.KEYWORD
                ? pool.stream().map(candidate -> this.scoreWithKeywords(query, candidate)).toList()
                : this.scoreConcurrently(query, pool, bounded);
        List<Candidate> rescored = new ArrayList<>(pool.size());
        for (int i = 0; i < pool.size(); i++) {
            rescored.add(pool.get(i).withRerank(scores.get(i), pool.get(i).rank()));
        }
        rescored.sort(RERANK_ORDER);
        List<Candidate> result = new ArrayList<>(fused.size());
        for (Candidate candidate : rescored) {
            result.add(candidate.withRerank(candidate.rerankScore(), result.size() + 1));
        }
        for (Candidate candidate : fused.subList(poolEnd, fused.size())) {
            result.add(candidate.withRank(result.size() + 1));
        }
        if (log.isDebugEnabled()) {
            log.debug("Reranked {} of {} candidates in {}ms (mode={})", pool.size(), fused.size(), System.currentTimeMillis() - startTime, this.mode);
        }
        return result;
    }

    private List<Double> scoreConcurrently(String query, List<Candidate> pool, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<Future<Double>> futures = new ArrayList<>(pool.size());
        try {
            for (Candidate candidate : pool) {
                futures.add(this.executor.submit(() -> this.scorePair(query, candidate, timeout)));
            }
            List<Double> scores = new ArrayList<>(pool.size());
            for (Future<Double> future : futures) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    throw new TimeoutException("rerank deadline reached");
                }
                scores.add(future.get(remaining, TimeUnit.NANOSECONDS));
            }
            return scores;
        } catch (TimeoutException e) {
            cancelAll(futures);
            throw new RerankUnavailableException("Reranking timed out after " + timeout.toMillis() + "ms", e);
        } catch (RejectedExecutionException e) {
            cancelAll(futures);
            throw new RerankUnavailableException("Reranker pool saturated", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new RerankUnavailableException("Reranking failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new RerankUnavailableException("Reranking interrupted", e);
        }
    }

    private double scorePair(String query, Candidate candidate, Duration timeout) {
        String cacheKey = this.mode + "|" + query + "|" + candidate.chunkId() + "|" + candidate.chunk().text().hashCode();
        if (this.scoreCache != null) {
            Double cached = this.scoreCache.getIfPresent(cacheKey);
            if (cached != null) {
                return cached;
            }
        }
        double score = this.mode == RerankerMode.EMBEDDING
                ? this.scoreWithEmbeddings(query, candidate)
                : this.scoreWithLlm(query, candidate, timeout);
        if (this.scoreCache != null) {
            this.scoreCache.put(cacheKey, score);
        }
        return score;
    }

    private double scoreWithLlm(String query, Candidate candidate, Duration timeout) {
        String prompt = "QUERY: " + query + "\n\nPASSAGE:\n" + passage(candidate)
                + "\n\nRate how well the passage answers the query from 0 (irrelevant) to 10 (fully answers it). "
                + "Respond with ONLY the number.";
        String response = this.completionClient.complete(new CompletionRequest("You are a relevance judge for document search.", prompt, 5, 0.0, timeout)).text();
        return parseScore(response);
    }

    private double scoreWithEmbeddings(String query, Candidate candidate) {
        float[] queryEmbedding = this.embeddingModel.embed(query);
        float[] passageEmbedding = this.embeddingModel.embed(passage(candidate));
        double cosine = cosineSimilarity(queryEmbedding, passageEmbedding);
        return Math.max(0.0, Math.min(1.0, (cosine + 1.0) / 2.0));
    }

    double scoreWithKeywords(String query, Candidate candidate) {
        String lowerContent = candidate.chunk().text().toLowerCase(Locale.ROOT);
        int totalTerms = 0;
        int matchedTerms = 0;
        for (String term : query.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (term.length() <= 2 || STOP_WORDS.contains(term)) continue;
            ++totalTerms;
            if (lowerContent.contains(term)) {
                ++matchedTerms;
            }
        }
        return totalTerms > 0 ? (double)matchedTerms / (double)totalTerms : 0.0;
    }

    /**
     * @return the judgment scaled to [0, 1]
     * @throws IllegalStateException when the response holds no number
     */
    static double parseScore(String response) {
        if (response == null || response.isBlank()) {
            throw new IllegalStateException("Empty relevance judgment");
        }
        Matcher matcher = SCORE_PATTERN.matcher(response.trim());
        if (!matcher.find()) {
            throw new IllegalStateException("Unparseable relevance judgment: " + response.trim());
        }
        double score = Double.parseDouble(matcher.group(1));
        return Math.max(0.0, Math.min(10.0, score)) / 10.0;
    }

    private static String passage(Candidate candidate) {
        String content = candidate.chunk().text();
        return content.length() > MAX_PASSAGE_CHARS ? content.substring(0, MAX_PASSAGE_CHARS) + "..." : content;
    }

    private static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            throw new IllegalStateException("Embedding dimensions do not match");
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * (double) b[i];
            normA += (double) a[i] * (double) a[i];
            normB += (double) b[i] * (double) b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static void cancelAll(List<Future<Double>> futures) {
        for (Future<Double> future : futures) {
            future.cancel(true);
        }
    }

    public RerankerMode getMode() {
        return this.mode;
    }

    public enum RerankerMode {
        LLM,
        EMBEDDING,
        KEYWORD
    }
}
