package com.jreinhal.askdocs.constant;

import java.util.Set;

public final class StopWords {
    public static final Set<String> LEXICAL = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to",
            "for", "of", "with", "by", "from", "as", "is", "was", "are",
            "were", "been", "be", "have", "has", "had", "what", "where",
            "when", "who", "how", "why", "tell", "me", "about", "describe",
            "find", "show", "give", "also", "it", "its", "this", "that", "do", "does"
    );

    public static final Set<String> RERANKER = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "what", "where",
            "when", "who", "how", "why", "which", "and", "or", "but", "in",
            "on", "at", "to", "for", "of", "with"
    );

    private StopWords() {
    }
}
