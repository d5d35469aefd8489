package com.jreinhal.askdocs.context;

import com.jreinhal.askdocs.retrieval.Candidate;
import com.jreinhal.askdocs.util.TokenEstimator;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Packs ranked candidates into a token-bounded context. Candidates are taken in rank order; one
 * that does not fit the remaining budget is skipped whole and packing continues with the next.
 * A block costs its chunk's token count plus the citation header.
 */
@Component
public class ContextAssembler {
    public static final String SEPARATOR = "\n\n";

    public AssembledContext assemble(List<Candidate> ranked, int maxTokens) {
        StringBuilder text = new StringBuilder();
        List<Candidate> used = new ArrayList<>();
        List<Candidate> skipped = new ArrayList<>();
        int tokens = 0;
        for (Candidate candidate : ranked) {
            String header = header(candidate);
            int cost = TokenEstimator.estimate(header) + candidate.chunk().tokenCount();
            if (tokens + cost > maxTokens) {
                skipped.add(candidate);
                continue;
            }
            if (text.length() > 0) {
                text.append(SEPARATOR);
            }
            text.append(header).append(' ').append(candidate.chunk().text().trim());
            tokens += cost;
            used.add(candidate);
        }
        return new AssembledContext(text.toString(), List.copyOf(used), List.copyOf(skipped), tokens);
    }

    static String header(Candidate candidate) {
        return "[" + candidate.chunkId() + "]";
    }
}
