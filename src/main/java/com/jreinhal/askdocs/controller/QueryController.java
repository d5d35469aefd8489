package com.jreinhal.askdocs.controller;

import com.jreinhal.askdocs.dto.QueryApiRequest;
import com.jreinhal.askdocs.dto.QueryApiResponse;
import com.jreinhal.askdocs.pipeline.PipelineRequest;
import com.jreinhal.askdocs.pipeline.PipelineResult;
import com.jreinhal.askdocs.pipeline.QueryPipeline;
import com.jreinhal.askdocs.security.IdentityResolver;
import com.jreinhal.askdocs.util.LogSanitizer;
import jakarta.servlet.http.HttpServletRequest;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api"})
public class QueryController {
    private static final Logger log = LoggerFactory.getLogger(QueryController.class);
    static final int MIN_CONTEXT_TOKENS = 200;
    static final int MAX_CONTEXT_TOKENS = 6000;
    static final int MIN_ANSWER_TOKENS = 50;
    static final int MAX_ANSWER_TOKENS = 1000;
    private static final Pattern SAFE_DOC_ID = Pattern.compile("^[a-zA-Z0-9\\-_.]{1,128}$");
    private final QueryPipeline pipeline;
    private final IdentityResolver identityResolver;
    @Value("${askdocs.query.max-chars:4000}")
    private int maxQueryChars = 4000;

    public QueryController(QueryPipeline pipeline, IdentityResolver identityResolver) {
        this.pipeline = pipeline;
        this.identityResolver = identityResolver;
    }

    @PostMapping(value={"/query"})
    public ResponseEntity<QueryApiResponse> query(@RequestBody QueryApiRequest body, HttpServletRequest request) {
        this.validate(body);
        String identity = this.identityResolver.resolve(request).key();
        PipelineRequest pipelineRequest = new PipelineRequest(body.query().trim(), body.k(), body.maxContextTokens(), body.maxAnswerTokens(),
                body.temperature(), body.rerank(), body.enableTools(), body.enableFollowups(), body.enablePlanning(), body.docId(), identity);
        PipelineResult result = this.pipeline.execute(pipelineRequest);
        if (log.isDebugEnabled()) {
            log.debug("Answered {} with {} citations (trace {})", LogSanitizer.querySummary(body.query()),
                    result.citations().size(), result.traceId());
        }
        return ResponseEntity.ok(QueryApiResponse.from(result, body.citationsRequested()));
    }

    private void validate(QueryApiRequest body) {
        if (body == null || body.query() == null || body.query().isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (body.query().length() > this.maxQueryChars) {
            throw new IllegalArgumentException("query must not exceed " + this.maxQueryChars + " characters");
        }
        int maxK = this.pipeline.getSettings().maxK();
        if (body.k() != null && (body.k() < 1 || body.k() > maxK)) {
            throw new IllegalArgumentException("k must be between 1 and " + maxK);
        }
        Integer contextTokens = body.maxContextTokens();
        if (contextTokens != null && (contextTokens < MIN_CONTEXT_TOKENS || contextTokens > MAX_CONTEXT_TOKENS)) {
            throw new IllegalArgumentException("max_context_tokens must be between " + MIN_CONTEXT_TOKENS + " and " + MAX_CONTEXT_TOKENS);
        }
        Integer answerTokens = body.maxAnswerTokens();
        if (answerTokens != null && (answerTokens < MIN_ANSWER_TOKENS || answerTokens > MAX_ANSWER_TOKENS)) {
            throw new IllegalArgumentException("max_answer_tokens must be between " + MIN_ANSWER_TOKENS + " and " + MAX_ANSWER_TOKENS);
        }
        Double temperature = body.temperature();
        if (temperature != null && (temperature.isNaN() || temperature < 0.0 || temperature > 1.0)) {
            throw new IllegalArgumentException("temperature must be between 0.0 and 1.0");
        }
        if (body.docId() != null && !SAFE_DOC_ID.matcher(body.docId()).matches()) {
            throw new IllegalArgumentException("doc_id may only contain letters, digits, '-', '_' and '.'");
        }
    }
}
