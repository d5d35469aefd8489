package com.jreinhal.askdocs.retrieval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory BM25 term index. Writers publish a new immutable {@link Snapshot}; searches run
 * against whichever snapshot was current when they started, so a search never sees a
 * half-applied batch.
 */
@Component
public class LexicalIndex {
    private static final Logger log = LoggerFactory.getLogger(LexicalIndex.class);
    static final double K1 = 1.2;
    static final double B = 0.75;
    private volatile Snapshot snapshot = Snapshot.build(Map.of());

    public synchronized void addAll(Collection<Chunk> chunks) {
        TreeMap<String, Chunk> merged = new TreeMap<>(this.snapshot.chunks);
        for (Chunk chunk : chunks) {
            merged.put(chunk.id(), chunk);
        }
        this.snapshot = Snapshot.build(merged);
        if (log.isDebugEnabled()) {
            log.debug("Lexical index rebuilt: {} chunks, {} terms", merged.size(), this.snapshot.postings.size());
        }
    }

    public Snapshot snapshot() {
        return this.snapshot;
    }

    public int size() {
        return this.snapshot.chunks.size();
    }

    public record ScoredChunk(Chunk chunk, double score) {
    }

    public static final class Snapshot {
        private final Map<String, Chunk> chunks;
        // term -> (chunk id -> term frequency)
        private final Map<String, Map<String, Integer>> postings;
        private final Map<String, Integer> lengths;
        private final double averageLength;

        private Snapshot(Map<String, Chunk> chunks, Map<String, Map<String, Integer>> postings, Map<String, Integer> lengths, double averageLength) {
            this.chunks = chunks;
            this.postings = postings;
            this.lengths = lengths;
            this.averageLength = averageLength;
        }

        static Snapshot build(Map<String, Chunk> chunks) {
            Map<String, Map<String, Integer>> postings = new HashMap<>();
            Map<String, Integer> lengths = new HashMap<>();
            long totalLength = 0L;
            for (Chunk chunk : chunks.values()) {
                List<String> terms = TermAnalyzer.terms(chunk.text());
                lengths.put(chunk.id(), terms.size());
                totalLength += terms.size();
                for (String term : terms) {
                    postings.computeIfAbsent(term, t -> new HashMap<>()).merge(chunk.id(), 1, Integer::sum);
                }
            }
            double average = chunks.isEmpty() ? 0.0 : (double)totalLength / chunks.size();
            return new Snapshot(Map.copyOf(chunks), postings, lengths, average);
        }

        public List<ScoredChunk> search(String query, int k) {
            return this.search(query, k, null);
        }

        /**
         * Scores every chunk sharing a term with the query and visible in {@code scope} (all
         * chunks when null). Order: score descending, then chunk id ascending. Term statistics
         * cover the whole snapshot.
         */
        public List<ScoredChunk> search(String query, int k, RetrievalScope scope) {
            if (k <= 0 || this.chunks.isEmpty()) {
                return List.of();
            }
            int n = this.chunks.size();
            Map<String, Double> scores = new HashMap<>();
            for (String term : new LinkedHashSet<>(TermAnalyzer.terms(query))) {
                Map<String, Integer> posting = this.postings.get(term);
                if (posting == null) {
                    continue;
                }
                double idf = Math.log(1.0 + (n - posting.size() + 0.5) / (posting.size() + 0.5));
                for (Map.Entry<String, Integer> entry : posting.entrySet()) {
                    int tf = entry.getValue();
                    double lengthRatio = this.averageLength == 0.0 ? 1.0 : this.lengths.get(entry.getKey()) / this.averageLength;
                    double termScore = idf * (tf * (K1 + 1.0)) / (tf + K1 * (1.0 - B + B * lengthRatio));
                    scores.merge(entry.getKey(), termScore, Double::sum);
                }
            }
            List<ScoredChunk> ranked = new ArrayList<>(scores.size());
            scores.forEach((id, score) -> {
                Chunk chunk = this.chunks.get(id);
                if (scope == null || scope.allows(chunk)) {
                    ranked.add(new ScoredChunk(chunk, score));
                }
            });
            ranked.sort(Comparator.comparingDouble(ScoredChunk::score).reversed()
                    .thenComparing(scored -> scored.chunk().id()));
            return ranked.size() > k ? List.copyOf(ranked.subList(0, k)) : List.copyOf(ranked);
        }

        public int size() {
            return this.chunks.size();
        }
    }
}
