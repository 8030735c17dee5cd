package com.smerag.retrieval;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smerag.runtime.TransientServiceException;

/**
 * Second retrieval stage. Without a usable scorer the candidates pass through in their first-stage
 * order, cut to the final size.
 */
public class Reranker {
    private static final Logger log = LoggerFactory.getLogger(Reranker.class);

    private final Optional<RelevanceScorer> scorer;
    private final int finalTopK;

    public Reranker(Optional<RelevanceScorer> scorer, int finalTopK) {
        if (finalTopK <= 0) {
            throw new IllegalArgumentException("finalTopK must be positive: " + finalTopK);
        }
        this.scorer = scorer;
        this.finalTopK = finalTopK;
    }

    public List<RetrievedPassage> rerank(String query, List<RetrievedPassage> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        if (scorer.isEmpty()) {
            log.warn("No reranker configured; returning first-stage order");
            return truncate(candidates);
        }
        float[] scores;
        try {
            scores = scorer.get().score(query, candidates.stream().map(RetrievedPassage::text).toList());
        } catch (IOException | TransientServiceException e) {
            log.warn("Reranker {} failed, returning first-stage order: {}", scorer.get().name(), e.getMessage());
            return truncate(candidates);
        }
        if (scores.length != candidates.size()) {
            log.warn("Reranker {} returned {} scores for {} passages, returning first-stage order",
                    scorer.get().name(), scores.length, candidates.size());
            return truncate(candidates);
        }

        List<RetrievedPassage> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            scored.add(candidates.get(i).withRerankScore(scores[i]));
        }
        // List.sort is stable, so equal scores keep first-stage order.
        scored.sort(Comparator.comparing(RetrievedPassage::rerankScore).reversed());
        return truncate(scored);
    }

    private List<RetrievedPassage> truncate(List<RetrievedPassage> passages) {
        return List.copyOf(passages.subList(0, Math.min(finalTopK, passages.size())));
    }
}
