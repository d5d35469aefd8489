package com.jreinhal.askdocs.trace;

public final class SpanNames {
    public static final String RECEPTION = "reception";
    public static final String PLANNING = "planning";
    public static final String DENSE_RETRIEVAL = "dense-retrieval";
    public static final String LEXICAL_RETRIEVAL = "lexical-retrieval";
    public static final String FUSION = "fusion";
    public static final String RERANK = "rerank";
    public static final String CONTEXT_BUILD = "context-build";
    public static final String TOOL_DISPATCH = "tool-dispatch";
    public static final String GENERATION = "generation";
    public static final String FOLLOWUPS = "followups";

    private SpanNames() {
    }
}
