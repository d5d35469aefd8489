package com.jreinhal.askdocs.planner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.askdocs.generation.CompletionClient;
import com.jreinhal.askdocs.generation.CompletionFailedException;
import com.jreinhal.askdocs.generation.CompletionRequest;
import com.jreinhal.askdocs.generation.LlmJson;
import com.jreinhal.askdocs.util.LogSanitizer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Rewrites a query for retrieval and splits compound questions into sub-queries. Planning is
 * optional; when it is off or the backend fails the query is retrieved as given.
 */
@Service
public class QueryPlanner {
    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);
    static final String SYSTEM_PROMPT = "You plan document retrieval. Rewrite the user's question as a precise search query, "
            + "list the named entities it mentions, and split it into independent sub-questions only if it asks several things. "
            + "Return JSON only: {\"rewritten_query\": \"...\", \"entities\": [\"...\"], \"subqueries\": [\"...\"]}";
    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;
    @Value("${askdocs.planner.max-subqueries:3}")
    private int maxSubQueries = 3;
    @Value("${askdocs.planner.timeout-ms:6000}")
    private long timeoutMs = 6000L;

    public QueryPlanner(CompletionClient completionClient, ObjectMapper objectMapper) {
        this.completionClient = completionClient;
        this.objectMapper = objectMapper;
    }

    public QueryPlan plan(String query, boolean enabled) {
        return this.plan(query, enabled, Duration.ofMillis(this.timeoutMs));
    }

    public QueryPlan plan(String query, boolean enabled, Duration timeout) {
        if (!enabled || query == null || query.isBlank()) {
            return QueryPlan.passthrough(query);
        }
        Duration bounded = timeout.compareTo(Duration.ofMillis(this.timeoutMs)) < 0 ? timeout : Duration.ofMillis(this.timeoutMs);
        try {
            String raw = this.completionClient.complete(new CompletionRequest(SYSTEM_PROMPT, "Question: " + query, 250, 0.0, bounded)).text();
            JsonNode json = LlmJson.parseObject(this.objectMapper, raw);
            if (json.isMissingNode()) {
                log.warn("Planner returned no JSON for {}, retrieving original query", LogSanitizer.querySummary(query));
                return QueryPlan.passthrough(query);
            }
            String rewritten = json.path("rewritten_query").asText("").trim();
            if (rewritten.isEmpty()) {
                rewritten = query;
            }
            List<String> subQueries = new ArrayList<>();
            for (String subQuery : LlmJson.textList(json.path("subqueries"))) {
                if (subQueries.size() >= this.maxSubQueries) {
                    break;
                }
                if (!subQuery.equalsIgnoreCase(rewritten) && !subQueries.contains(subQuery)) {
                    subQueries.add(subQuery);
                }
            }
            QueryPlan plan = new QueryPlan(rewritten, LlmJson.textList(json.path("entities")), subQueries, true);
            if (log.isDebugEnabled()) {
                log.debug("Planned {} into {} queries", LogSanitizer.querySummary(query), plan.queries().size());
            }
            return plan;
        } catch (CompletionFailedException e) {
            log.warn("Query planning failed for {}, retrieving original query: {}", LogSanitizer.querySummary(query), e.getMessage());
            return QueryPlan.passthrough(query);
        }
    }
}
