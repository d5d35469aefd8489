package com.jreinhal.askdocs.rerank;

import com.jreinhal.askdocs.retrieval.Candidate;
import com.jreinhal.askdocs.retrieval.RetrievalMethod;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Merges dense and lexical candidates into one ranked list.
 *
 * <p>Scores are normalized per method ({@link ScoreNormalization}), then combined as
 * {@code denseWeight * dense + lexicalWeight * lexical}, a method that did not find the chunk
 * contributing zero. A chunk found by both methods appears once, tagged with both, keeping the
 * better of its normalized scores. Order: fused score, then normalized score, both descending,
 * then chunk id ascending. The result depends only on the input lists.</p>
 */
@Component
public class ResultFuser {
    private static final Logger log = LoggerFactory.getLogger(ResultFuser.class);
    private static final Comparator<Candidate> FUSED_ORDER = Comparator.comparingDouble(Candidate::fusedScore).reversed()
            .thenComparing(Comparator.comparingDouble(Candidate::normalizedScore).reversed())
            .thenComparing(Candidate::chunkId);
    @Value("${askdocs.fusion.dense-weight:0.5}")
    private double denseWeight = 0.5;
    @Value("${askdocs.fusion.lexical-weight:0.5}")
    private double lexicalWeight = 0.5;
    @Value("${askdocs.fusion.normalization:min-max}")
    private String normalizationName = "min-max";
    @Value("${askdocs.fusion.rrf-k:60}")
    private int rrfK = 60;
    private ScoreNormalization normalization = ScoreNormalization.MIN_MAX;

    public ResultFuser() {
    }

    public ResultFuser(double denseWeight, double lexicalWeight, ScoreNormalization normalization, int rrfK) {
        this.denseWeight = denseWeight;
        this.lexicalWeight = lexicalWeight;
        this.normalization = normalization;
        this.rrfK = rrfK;
    }

    @PostConstruct
    public void init() {
        this.normalization = ScoreNormalization.valueOf(this.normalizationName.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        if (this.denseWeight < 0.0 || this.lexicalWeight < 0.0 || this.denseWeight + this.lexicalWeight <= 0.0) {
            throw new IllegalStateException("Fusion weights must be non-negative and not both zero");
        }
        log.info("Result fusion: normalization={}, denseWeight={}, lexicalWeight={}", this.normalization, this.denseWeight, this.lexicalWeight);
    }

    public List<Candidate> fuse(List<Candidate> dense, List<Candidate> lexical) {
        Map<String, Double> denseNormalized = this.normalize(dense);
        Map<String, Double> lexicalNormalized = this.normalize(lexical);
        Map<String, Merged> merged = new LinkedHashMap<>();
        this.collect(merged, dense, denseNormalized, RetrievalMethod.DENSE);
        this.collect(merged, lexical, lexicalNormalized, RetrievalMethod.LEXICAL);
        List<Candidate> fused = new ArrayList<>(merged.size());
        for (Merged entry : merged.values()) {
            double fusedScore = this.denseWeight * entry.normalized.getOrDefault(RetrievalMethod.DENSE, 0.0)
                    + this.lexicalWeight * entry.normalized.getOrDefault(RetrievalMethod.LEXICAL, 0.0);
            RetrievalMethod best = entry.bestMethod();
            fused.add(entry.candidate.withFusion(entry.normalized.keySet(), entry.raw.get(best),
                    entry.normalized.get(best), fusedScore, 0));
        }
        fused.sort(FUSED_ORDER);
        List<Candidate> ranked = new ArrayList<>(fused.size());
        for (Candidate candidate : fused) {
            ranked.add(candidate.withRank(ranked.size() + 1));
        }
        return ranked;
    }

    /**
     * Normalized score per chunk id. Duplicate ids within one list keep their best raw score.
     */
    Map<String, Double> normalize(List<Candidate> candidates) {
        Map<String, Double> best = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            best.merge(candidate.chunkId(), candidate.rawScore(), Math::max);
        }
        Map<String, Double> normalized = new LinkedHashMap<>();
        if (best.isEmpty()) {
            return normalized;
        }
        if (this.normalization == ScoreNormalization.RANK) {
            List<Map.Entry<String, Double>> ordered = new ArrayList<>(best.entrySet());
            ordered.sort(Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()));
            double top = 1.0 / (this.rrfK + 1);
            for (int i = 0; i < ordered.size(); i++) {
                normalized.put(ordered.get(i).getKey(), (1.0 / (this.rrfK + i + 1)) / top);
            }
            return normalized;
        }
        double min = best.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = best.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double range = max - min;
        best.forEach((id, score) -> normalized.put(id, range == 0.0 ? 1.0 : (score - min) / range));
        return normalized;
    }

    private void collect(Map<String, Merged> merged, List<Candidate> candidates, Map<String, Double> normalized, RetrievalMethod method) {
        for (Candidate candidate : candidates) {
            Merged entry = merged.computeIfAbsent(candidate.chunkId(), id -> new Merged(candidate));
            entry.raw.merge(method, candidate.rawScore(), Math::max);
            entry.normalized.put(method, normalized.get(candidate.chunkId()));
        }
    }

    public ScoreNormalization getNormalization() {
        return this.normalization;
    }

    private static final class Merged {
        private final Candidate candidate;
        private final Map<RetrievalMethod, Double> raw = new EnumMap<>(RetrievalMethod.class);
        private final Map<RetrievalMethod, Double> normalized = new EnumMap<>(RetrievalMethod.class);

        private Merged(Candidate candidate) {
            this.candidate = candidate;
        }

        // dense wins ties, EnumMap iterates in declaration order
        private RetrievalMethod bestMethod() {
            RetrievalMethod best = null;
            for (Map.Entry<RetrievalMethod, Double> entry : this.normalized.entrySet()) {
                if (best == null || entry.getValue() > this.normalized.get(best)) {
                    best = entry.getKey();
                }
            }
            return best;
        }
    }
}
