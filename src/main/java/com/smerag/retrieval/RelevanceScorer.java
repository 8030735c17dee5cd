package com.smerag.retrieval;

import java.io.IOException;
import java.util.List;

public interface RelevanceScorer {
    String name();

    float[] score(String query, List<String> passages) throws IOException;
}
