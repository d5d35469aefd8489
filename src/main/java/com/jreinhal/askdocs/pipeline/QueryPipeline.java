package com.jreinhal.askdocs.pipeline;

import com.jreinhal.askdocs.context.AssembledContext;
import com.jreinhal.askdocs.context.ContextAssembler;
import com.jreinhal.askdocs.generation.AnswerGenerator;
import com.jreinhal.askdocs.generation.AnswerRequest;
import com.jreinhal.askdocs.generation.FollowUpGenerator;
import com.jreinhal.askdocs.generation.GeneratedAnswer;
import com.jreinhal.askdocs.generation.GenerationUnavailableException;
import com.jreinhal.askdocs.metrics.PipelineMetrics;
import com.jreinhal.askdocs.planner.QueryPlan;
import com.jreinhal.askdocs.planner.QueryPlanner;
import com.jreinhal.askdocs.rerank.CrossEncoderReranker;
import com.jreinhal.askdocs.rerank.RerankUnavailableException;
import com.jreinhal.askdocs.rerank.ResultFuser;
import com.jreinhal.askdocs.retrieval.Candidate;
import com.jreinhal.askdocs.retrieval.ChunkCatalog;
import com.jreinhal.askdocs.retrieval.RetrievalScope;
import com.jreinhal.askdocs.retrieval.RetrievalUnavailableException;
import com.jreinhal.askdocs.retrieval.SourceDocument;
import com.jreinhal.askdocs.tools.ToolExecutionFailedException;
import com.jreinhal.askdocs.tools.ToolInvocation;
import com.jreinhal.askdocs.tools.ToolOutput;
import com.jreinhal.askdocs.tools.ToolRequest;
import com.jreinhal.askdocs.tools.ToolRouter;
import com.jreinhal.askdocs.tools.ToolSelection;
import com.jreinhal.askdocs.trace.ActiveSpan;
import com.jreinhal.askdocs.trace.QueryTrace;
import com.jreinhal.askdocs.trace.QueryTracer;
import com.jreinhal.askdocs.trace.SpanNames;
import com.jreinhal.askdocs.trace.TraceSpan;
import com.jreinhal.askdocs.trace.TraceStatus;
import com.jreinhal.askdocs.util.LogSanitizer;
import com.jreinhal.askdocs.util.TimeBudget;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Orchestrates one query: plan, retrieve (dense and lexical), fuse, rerank, assemble context,
 * dispatch to a tool, generate, suggest follow-ups.
 *
 * <p>Stages degrade rather than fail wherever a reduced answer is still honest: one retriever
 * down, reranking down, a tool failing, follow-ups missing. Those stages are listed in
 * {@link PipelineResult#degradedStages()} and flagged on their spans. The query fails only when
 * both retrievers are unavailable, generation is exhausted, or the deadline passes; the trace is
 * then flushed as {@link TraceStatus#FAILED} and the exception propagates.</p>
 */
@Service
public class QueryPipeline {
    private static final Logger log = LoggerFactory.getLogger(QueryPipeline.class);
    public static final String MDC_TRACE_ID = "traceId";
    private static final int MAX_RELATED_CITATIONS = 5;
    private final PipelineSettings settings;
    private final QueryPlanner planner;
    private final HybridRetrievalService retrievalService;
    private final ResultFuser fuser;
    private final CrossEncoderReranker reranker;
    private final ContextAssembler contextAssembler;
    private final ToolRouter toolRouter;
    private final AnswerGenerator answerGenerator;
    private final FollowUpGenerator followUpGenerator;
    private final ChunkCatalog catalog;
    private final QueryTracer tracer;
    private final PipelineMetrics metrics;

    public QueryPipeline(PipelineSettings settings, QueryPlanner planner, HybridRetrievalService retrievalService,
            ResultFuser fuser, CrossEncoderReranker reranker, ContextAssembler contextAssembler, ToolRouter toolRouter,
            AnswerGenerator answerGenerator, FollowUpGenerator followUpGenerator, ChunkCatalog catalog,
            QueryTracer tracer, PipelineMetrics metrics) {
        this.settings = settings;
        this.planner = planner;
        this.retrievalService = retrievalService;
        this.fuser = fuser;
        this.reranker = reranker;
        this.contextAssembler = contextAssembler;
        this.toolRouter = toolRouter;
        this.answerGenerator = answerGenerator;
        this.followUpGenerator = followUpGenerator;
        this.catalog = catalog;
        this.tracer = tracer;
        this.metrics = metrics;
    }

    public PipelineResult execute(PipelineRequest request) {
        String query = request.query() == null ? "" : request.query().trim();
        if (query.isEmpty()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        int k = this.resolveK(request.k());
        int maxContextTokens = request.maxContextTokens() != null ? request.maxContextTokens() : this.settings.maxContextTokens();
        PipelineFeatures features = this.settings.features().withOverrides(request.enableTools(), request.enableFollowups(), request.enablePlanning());
        boolean rerankEnabled = request.rerank() != null ? request.rerank() : this.settings.rerankEnabled();
        this.metrics.recordRequest("query");
        this.metrics.recordQueryLength(query.length());
        TimeBudget budget = TimeBudget.of(this.settings.requestTimeout());
        QueryTrace trace = this.tracer.start(query, request.identity());
        MDC.put(MDC_TRACE_ID, trace.getTraceId());
        String stage = SpanNames.RECEPTION;
        try {
            List<String> degraded = new ArrayList<>();
            this.finish(trace.startSpan(SpanNames.RECEPTION)
                    .attribute("k", k)
                    .attribute("max_context_tokens", maxContextTokens)
                    .attribute("features", features.toString())
                    .attribute("document_id", request.documentId() != null ? request.documentId() : "*")
                    .attribute("query_chars", query.length()));

            stage = SpanNames.PLANNING;
            QueryPlan plan = this.plan(query, features, trace, budget);

            stage = "retrieval";
            checkDeadline(budget, stage);
            RetrievalScope scope = RetrievalScope.of(request.identity(), request.documentId());
            RetrievalOutcome retrieval = this.retrievalService.retrieve(plan.queries(), k * Math.max(1, this.settings.candidateMultiplier()),
                    scope, this.settings.denseTimeout(), this.settings.lexicalTimeout(), trace, budget);
            this.recordRetrievalLatency(trace);
            if (retrieval.allFailed()) {
                throw new RetrievalUnavailableException(null, "All retrieval backends unavailable: "
                        + retrieval.dense().message() + "; " + retrieval.lexical().message());
            }
            this.noteDegraded(retrieval.dense(), SpanNames.DENSE_RETRIEVAL, degraded);
            this.noteDegraded(retrieval.lexical(), SpanNames.LEXICAL_RETRIEVAL, degraded);

            stage = SpanNames.FUSION;
            ActiveSpan fusionSpan = trace.startSpan(SpanNames.FUSION);
            List<Candidate> fused = this.fuser.fuse(retrieval.denseCandidates(), retrieval.lexicalCandidates());
            this.metrics.recordCandidates("retrieved", fused.size());
            this.finish(fusionSpan.attribute("normalization", this.fuser.getNormalization().name())
                    .attribute("fused", fused.size())
                    .attribute("chunk_ids", fused.stream().map(Candidate::chunkId).toList()));

            stage = SpanNames.RERANK;
            checkDeadline(budget, stage);
            List<Candidate> reranked = this.rerank(query, fused, rerankEnabled, trace, budget, degraded);
            this.metrics.recordCandidates("reranked", reranked.size());

            stage = SpanNames.CONTEXT_BUILD;
            ActiveSpan contextSpan = trace.startSpan(SpanNames.CONTEXT_BUILD);
            List<Candidate> top = reranked.size() > k ? reranked.subList(0, k) : reranked;
            AssembledContext context = this.contextAssembler.assemble(top, maxContextTokens);
            this.metrics.recordCandidates("used", context.used().size());
            this.metrics.recordContextTokens(context.tokenCount());
            this.finish(contextSpan.attribute("used", context.used().stream().map(Candidate::chunkId).toList())
                    .attribute("skipped", context.skipped().stream().map(Candidate::chunkId).toList())
                    .attribute("tokens", context.tokenCount())
                    .attribute("max_tokens", maxContextTokens));

            stage = SpanNames.TOOL_DISPATCH;
            checkDeadline(budget, stage);
            ToolOutput toolOutput = this.dispatchTool(query, context, features, trace, budget, degraded);

            stage = SpanNames.GENERATION;
            GeneratedAnswer answer = this.generate(request, query, context, toolOutput, trace, budget);

            stage = SpanNames.FOLLOWUPS;
            List<String> followUps = this.followUps(query, answer.text(), context, features, trace, budget, degraded);

            TraceStatus status = degraded.isEmpty() ? TraceStatus.SUCCEEDED : TraceStatus.DEGRADED;
            trace.putMetadata("degraded_stages", List.copyOf(degraded));
            this.tracer.flush(trace, status, null);
            if (!degraded.isEmpty()) {
                log.info("Query {} answered in degraded mode: {}", LogSanitizer.querySummary(query), degraded);
            }
            return new PipelineResult(answer.text(), this.citations(context.used()), this.related(reranked, context.used()),
                    followUps, toolOutput != null ? toolOutput.toolName() : null, toolOutput != null ? toolOutput.text() : null,
                    plan.planned() ? plan.queries() : List.of(), trace.getTraceId(), List.copyOf(degraded), answer.usage());
        } catch (RuntimeException e) {
            this.metrics.recordError(stage);
            log.warn("Query {} failed at {}: {}", LogSanitizer.querySummary(query), stage, e.getMessage());
            if (!trace.isFinished()) {
                this.tracer.flush(trace, TraceStatus.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            throw e;
        } finally {
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private QueryPlan plan(String query, PipelineFeatures features, QueryTrace trace, TimeBudget budget) {
        ActiveSpan span = trace.startSpan(SpanNames.PLANNING).attribute("enabled", features.planning());
        QueryPlan plan = this.planner.plan(query, features.planning(), budget.remaining());
        if (features.planning() && !plan.planned()) {
            span.degraded("planner unavailable, original query used");
        }
        this.finish(span.attribute("queries", plan.queries().size()).attribute("entities", plan.entities()));
        return plan;
    }

    private List<Candidate> rerank(String query, List<Candidate> fused, boolean enabled, QueryTrace trace, TimeBudget budget, List<String> degraded) {
        ActiveSpan span = trace.startSpan(SpanNames.RERANK).attribute("enabled", enabled);
        if (!enabled || fused.isEmpty()) {
            this.finish(span);
            return fused;
        }
        try {
            List<Candidate> reranked = this.reranker.rerank(query, fused, budget.remaining());
            List<String> scores = new ArrayList<>();
            for (Candidate candidate : reranked) {
                if (candidate.rerankScore() != null) {
                    scores.add(candidate.chunkId() + "=" + String.format("%.3f", candidate.rerankScore()));
                }
            }
            this.finish(span.attribute("mode", this.reranker.getMode().name()).attribute("scores", scores));
            return reranked;
        } catch (RerankUnavailableException e) {
            degraded.add(SpanNames.RERANK);
            this.metrics.recordDegraded(SpanNames.RERANK);
            this.finish(span.degraded("fused order kept: " + e.getMessage()).fail(e));
            return fused;
        }
    }

    private ToolOutput dispatchTool(String query, AssembledContext context, PipelineFeatures features, QueryTrace trace,
            TimeBudget budget, List<String> degraded) {
        if (!features.toolRouter() || context.isEmpty()) {
            return null;
        }
        ActiveSpan span = trace.startSpan(SpanNames.TOOL_DISPATCH);
        Duration timeout = budget.bound(this.settings.toolTimeout());
        Optional<ToolSelection> selection = this.toolRouter.route(query, context.text(), features.docActions(), timeout);
        if (selection.isEmpty()) {
            this.finish(span.attribute("tool", "none"));
            return null;
        }
        ToolSelection selected = selection.get();
        span.attribute("tool", selected.tool().name()).attribute("routed_by", selected.routedBy());
        try {
            ToolOutput output = selected.tool().execute(new ToolRequest(query, context.text(), context.used(), budget.bound(this.settings.toolTimeout())));
            trace.putMetadata("tool_invocation", new ToolInvocation(output.toolName(), selected.routedBy(), context.text().length(),
                    output.text().length(), true, null));
            this.finish(span.attribute("output_chars", output.text().length()).attribute("structured", output.structured()));
            return output;
        } catch (ToolExecutionFailedException e) {
            degraded.add(SpanNames.TOOL_DISPATCH);
            this.metrics.recordDegraded(SpanNames.TOOL_DISPATCH);
            trace.putMetadata("tool_invocation", new ToolInvocation(selected.tool().name(), selected.routedBy(), context.text().length(),
                    0, false, e.getMessage()));
            this.finish(span.degraded("generic answer path used").fail(e));
            return null;
        }
    }

    private GeneratedAnswer generate(PipelineRequest request, String query, AssembledContext context, ToolOutput toolOutput,
            QueryTrace trace, TimeBudget budget) {
        ActiveSpan span = trace.startSpan(SpanNames.GENERATION);
        int maxTokens = request.maxAnswerTokens() != null ? request.maxAnswerTokens() : this.settings.maxAnswerTokens();
        double temperature = request.temperature() != null ? request.temperature() : this.settings.temperature();
        try {
            GeneratedAnswer answer = this.answerGenerator.generate(new AnswerRequest(query, context.text(), toolOutput, maxTokens, temperature), budget);
            this.metrics.recordTokens("prompt", answer.usage().promptTokens());
            this.metrics.recordTokens("completion", answer.usage().completionTokens());
            this.finish(span.attribute("attempts", answer.attempts())
                    .attribute("prompt_tokens", answer.usage().promptTokens())
                    .attribute("completion_tokens", answer.usage().completionTokens()));
            return answer;
        } catch (GenerationUnavailableException e) {
            this.finish(span.attribute("attempts", e.getAttempts()).fail(e));
            if (budget.isExhausted()) {
                throw new DeadlineExceededException(SpanNames.GENERATION);
            }
            throw e;
        }
    }

    private List<String> followUps(String query, String answer, AssembledContext context, PipelineFeatures features,
            QueryTrace trace, TimeBudget budget, List<String> degraded) {
        if (!features.followups()) {
            return List.of();
        }
        ActiveSpan span = trace.startSpan(SpanNames.FOLLOWUPS);
        List<String> followUps = this.followUpGenerator.suggest(query, answer, context.text(), budget.remaining());
        if (followUps.isEmpty()) {
            degraded.add(SpanNames.FOLLOWUPS);
            this.metrics.recordDegraded(SpanNames.FOLLOWUPS);
            span.degraded("no follow-ups produced");
        }
        this.finish(span.attribute("count", followUps.size()));
        return followUps;
    }

    private void noteDegraded(StageResult<?> result, String stage, List<String> degraded) {
        if (result.isFailed() || result.isDegraded()) {
            degraded.add(stage);
            this.metrics.recordDegraded(stage);
            log.warn("{} degraded: {}", stage, result.message());
        }
    }

    private void recordRetrievalLatency(QueryTrace trace) {
        for (TraceSpan span : trace.getSpans()) {
            if (SpanNames.DENSE_RETRIEVAL.equals(span.name()) || SpanNames.LEXICAL_RETRIEVAL.equals(span.name())) {
                this.metrics.recordStageLatency(span.name(), Duration.ofMillis(span.durationMs()));
            }
        }
    }

    private List<Citation> citations(List<Candidate> used) {
        List<Citation> citations = new ArrayList<>(used.size());
        for (Candidate candidate : used) {
            citations.add(this.citation(candidate));
        }
        return citations;
    }

    private List<Citation> related(List<Candidate> reranked, List<Candidate> used) {
        Set<String> usedIds = new HashSet<>();
        used.forEach(candidate -> usedIds.add(candidate.chunkId()));
        List<Citation> related = new ArrayList<>();
        for (Candidate candidate : reranked) {
            if (related.size() >= MAX_RELATED_CITATIONS) {
                break;
            }
            if (!usedIds.contains(candidate.chunkId())) {
                related.add(this.citation(candidate));
            }
        }
        return related;
    }

    private Citation citation(Candidate candidate) {
        String documentId = candidate.chunk().documentId();
        String source = this.catalog.findDocument(documentId)
                .map(SourceDocument::source)
                .orElse(candidate.chunk().metadata().getOrDefault("source", documentId));
        return new Citation(candidate.chunkId(), documentId, source);
    }

    private int resolveK(Integer requested) {
        if (requested == null) {
            return this.settings.defaultK();
        }
        if (requested < 1 || requested > this.settings.maxK()) {
            throw new IllegalArgumentException("k must be between 1 and " + this.settings.maxK());
        }
        return requested;
    }

    private void finish(ActiveSpan span) {
        TraceSpan ended = span.end();
        this.metrics.recordStageLatency(ended.name(), Duration.ofMillis(ended.durationMs()));
    }

    private static void checkDeadline(TimeBudget budget, String stage) {
        if (budget.isExhausted()) {
            throw new DeadlineExceededException(stage);
        }
    }

    public PipelineSettings getSettings() {
        return this.settings;
    }
}
