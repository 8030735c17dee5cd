package com.smerag.retrieval;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smerag.embedding.DenseEncoder;
import com.smerag.runtime.ConfigurationException;
import com.smerag.sparse.Bm25SparseEncoder;
import com.smerag.sparse.SparseVector;
import com.smerag.vectorstore.MetadataKeys;
import com.smerag.vectorstore.Namespaces;
import com.smerag.vectorstore.QueryMatch;
import com.smerag.vectorstore.VectorStore;

public class HybridRetriever {
    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

    private final DenseEncoder denseEncoder;
    private final Bm25SparseEncoder sparseEncoder;
    private final VectorStore store;
    private final Reranker reranker;
    private final int searchChunkSize;
    private final int preRerankTopK;
    private final float alpha;

    public HybridRetriever(
            DenseEncoder denseEncoder,
            Bm25SparseEncoder sparseEncoder,
            VectorStore store,
            Reranker reranker,
            int searchChunkSize,
            int preRerankTopK,
            double hybridAlpha) {
        if (hybridAlpha < 0.0 || hybridAlpha > 1.0) {
            throw new ConfigurationException("hybridAlpha must be within [0, 1]: " + hybridAlpha);
        }
        if (preRerankTopK <= 0) {
            throw new ConfigurationException("preRerankTopK must be positive: " + preRerankTopK);
        }
        this.denseEncoder = denseEncoder;
        this.sparseEncoder = sparseEncoder;
        this.store = store;
        this.reranker = reranker;
        this.searchChunkSize = searchChunkSize;
        this.preRerankTopK = preRerankTopK;
        this.alpha = (float) hybridAlpha;
    }

    public List<RetrievedPassage> searchAndRerank(String query, String modelName) {
        if (!denseEncoder.supports(modelName)) {
            throw new ConfigurationException("Unknown embedding model: " + modelName
                    + " (configured: " + denseEncoder.modelNames() + ")");
        }
        String namespace = Namespaces.forModel(modelName);

        float[] dense = scale(denseEncoder.encodeOne(modelName, query), alpha);
        SparseVector sparse = sparseEncoder.encodeQuery(query).scale(1.0f - alpha);

        List<QueryMatch> matches = store.query(dense, sparse,
                Map.of(MetadataKeys.CHUNK_SIZE, searchChunkSize), preRerankTopK, namespace);
        if (matches.isEmpty()) {
            log.warn("No matches for query in namespace {} at chunk size {}", namespace, searchChunkSize);
            return List.of();
        }
        log.debug("Stage 1 returned {} candidates from {}", matches.size(), namespace);

        List<RetrievedPassage> candidates = matches.stream()
                .map(match -> new RetrievedPassage(
                        match.id(),
                        match.text(),
                        match.string(MetadataKeys.SOURCE),
                        match.string(MetadataKeys.DOC_ID),
                        match.string(MetadataKeys.PARENT_CHUNK_ID),
                        match.score(),
                        null))
                .toList();
        return reranker.rerank(query, candidates);
    }

    private static float[] scale(float[] vector, float factor) {
        float[] scaled = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            scaled[i] = vector[i] * factor;
        }
        return scaled;
    }
}
