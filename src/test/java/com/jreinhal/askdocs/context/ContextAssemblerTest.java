package com.jreinhal.askdocs.context;

import static org.junit.jupiter.api.Assertions.*;

import com.jreinhal.askdocs.retrieval.Candidate;
import com.jreinhal.askdocs.retrieval.Chunk;
import com.jreinhal.askdocs.retrieval.RetrievalMethod;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContextAssemblerTest {
    private final ContextAssembler assembler = new ContextAssembler();

    // header "[id]" costs one token on top of the chunk's own count
    private static Candidate candidate(String docId, int tokens) {
        String text = String.join(" ", Collections.nCopies(tokens, "word"));
        Chunk chunk = new Chunk(Chunk.chunkId(docId, 0), docId, 0, text, tokens, null, Map.of());
        return Candidate.retrieved(chunk, RetrievalMethod.DENSE, 1.0, 1);
    }

    @Test
    void skipsACandidateThatDoesNotFitAndContinues() {
        List<Candidate> ranked = List.of(candidate("a", 49), candidate("b", 80), candidate("c", 29));

        AssembledContext context = this.assembler.assemble(ranked, 100);

        assertEquals(List.of("a#0", "c#0"), context.used().stream().map(Candidate::chunkId).toList());
        assertEquals(List.of("b#0"), context.skipped().stream().map(Candidate::chunkId).toList());
        assertEquals(80, context.tokenCount());
    }

    @Test
    void neverExceedsTheBudgetAndNeverCutsAChunk() {
        List<Candidate> ranked = List.of(candidate("a", 30), candidate("b", 30), candidate("c", 30), candidate("d", 30));

        AssembledContext context = this.assembler.assemble(ranked, 95);

        assertTrue(context.tokenCount() <= 95);
        assertEquals(3, context.used().size());
        for (Candidate used : context.used()) {
            assertTrue(context.text().contains("[" + used.chunkId() + "] " + used.chunk().text()));
        }
    }

    @Test
    void preservesChunkIdentifiersAndSeparators() {
        Chunk first = Chunk.of("policy", 0, "Refunds within 30 days.");
        Chunk second = Chunk.of("policy", 1, "Receipts are required.");
        List<Candidate> ranked = List.of(Candidate.retrieved(first, RetrievalMethod.LEXICAL, 2.0, 1),
                Candidate.retrieved(second, RetrievalMethod.LEXICAL, 1.0, 2));

        AssembledContext context = this.assembler.assemble(ranked, 1000);

        assertEquals("[policy#0] Refunds within 30 days.\n\n[policy#1] Receipts are required.", context.text());
    }

    @Test
    void emptyWhenNothingFits() {
        AssembledContext context = this.assembler.assemble(List.of(candidate("huge", 500)), 100);

        assertTrue(context.isEmpty());
        assertEquals("", context.text());
        assertEquals(0, context.tokenCount());
    }
}
