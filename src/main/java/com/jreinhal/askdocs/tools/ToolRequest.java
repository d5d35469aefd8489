package com.jreinhal.askdocs.tools;

import com.jreinhal.askdocs.retrieval.Candidate;
import java.time.Duration;
import java.util.List;

/**
 * @param context assembled context text, {@code [chunk_id] text} blocks
 * @param usedCandidates the candidates that made it into the context, in context order
 */
public record ToolRequest(String query, String context, List<Candidate> usedCandidates, Duration timeout) {
}
