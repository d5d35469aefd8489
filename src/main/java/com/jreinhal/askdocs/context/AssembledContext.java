package com.jreinhal.askdocs.context;

import com.jreinhal.askdocs.retrieval.Candidate;
import java.util.List;

/**
 * @param text {@code [chunk_id] text} blocks joined by {@link ContextAssembler#SEPARATOR}
 * @param used candidates included, in context order
 * @param skipped candidates passed over because they did not fit the remaining budget
 * @param tokenCount estimated tokens of {@code text}, never above the requested budget
 */
public record AssembledContext(String text, List<Candidate> used, List<Candidate> skipped, int tokenCount) {

    public boolean isEmpty() {
        return this.used.isEmpty();
    }
}
