package com.smerag.retrieval;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public class LexicalRelevanceScorer implements RelevanceScorer {

    @Override
    public String name() {
        return "lexical";
    }

    @Override
    public float[] score(String query, List<String> passages) {
        Set<String> queryTerms = terms(query);
        float[] scores = new float[passages.size()];
        for (int i = 0; i < passages.size(); i++) {
            scores[i] = coverage(queryTerms, passages.get(i));
        }
        return scores;
    }

    private float coverage(Set<String> queryTerms, String text) {
        if (queryTerms.isEmpty() || text == null || text.isBlank()) {
            return 0f;
        }
        Set<String> words = terms(text);
        long matches = queryTerms.stream().filter(words::contains).count();
        return (float) matches / queryTerms.size();
    }

    private static Set<String> terms(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(token -> !token.isBlank())
                .collect(Collectors.toSet());
    }
}
