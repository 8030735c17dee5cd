package com.smerag.vectorstore;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.smerag.sparse.SparseVector;

public interface VectorStore {
    String indexName();

    Optional<IndexDescription> describe();

    void create(int dimension, String metric);

    void upsert(List<VectorRecord> records, String namespace);

    /**
     * @return up to {@code topK} matches ranked by {@code dense·q + sparse·q}, best first
     */
    List<QueryMatch> query(float[] dense, SparseVector sparse, Map<String, Object> filter, int topK, String namespace);

    void delete(Map<String, Object> filter, String namespace);
}
