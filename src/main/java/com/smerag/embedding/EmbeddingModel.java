package com.smerag.embedding;

import java.util.List;

public interface EmbeddingModel {
    String name();

    int dimension();

    List<float[]> embed(List<String> texts);
}
