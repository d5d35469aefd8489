package com.jreinhal.askdocs.planner;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Retrieval plan for one query.
 *
 * @param rewrittenQuery retrieval-oriented rewrite; the original query when not planned
 * @param subQueries additional sub-queries, already capped
 * @param planned whether the completion backend produced this plan
 */
public record QueryPlan(String rewrittenQuery, List<String> entities, List<String> subQueries, boolean planned) {

    public QueryPlan {
        entities = entities == null ? List.of() : List.copyOf(entities);
        subQueries = subQueries == null ? List.of() : List.copyOf(subQueries);
    }

    public static QueryPlan passthrough(String query) {
        return new QueryPlan(query, List.of(), List.of(), false);
    }

    /**
     * Queries to retrieve for: the rewrite followed by distinct sub-queries. Never empty.
     */
    public List<String> queries() {
        LinkedHashSet<String> queries = new LinkedHashSet<>();
        queries.add(this.rewrittenQuery);
        queries.addAll(this.subQueries);
        return new ArrayList<>(queries);
    }
}
