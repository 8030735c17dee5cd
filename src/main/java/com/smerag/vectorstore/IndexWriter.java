package com.smerag.vectorstore;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smerag.runtime.ConfigurationException;
import com.smerag.runtime.TransientServiceException;

public class IndexWriter {
    private static final Logger log = LoggerFactory.getLogger(IndexWriter.class);

    private final VectorStore store;
    private final int batchSize;
    private volatile IndexDescription index;

    public IndexWriter(VectorStore store, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.store = store;
        this.batchSize = batchSize;
    }

    public IndexDescription ensureIndex(int dimension) {
        Optional<IndexDescription> existing = store.describe();
        if (existing.isEmpty()) {
            log.info("Index {} not found. Creating it with dimension {}.", store.indexName(), dimension);
            store.create(dimension, IndexDescription.DOT_PRODUCT);
            index = new IndexDescription(store.indexName(), dimension, IndexDescription.DOT_PRODUCT);
            return index;
        }
        IndexDescription description = existing.get();
        if (description.dimension() != dimension) {
            throw new ConfigurationException("Index " + description.name() + " has dimension "
                    + description.dimension() + " but the embedding models produce " + dimension);
        }
        if (!IndexDescription.DOT_PRODUCT.equalsIgnoreCase(description.metric())) {
            throw new ConfigurationException("Index " + description.name() + " uses metric " + description.metric()
                    + "; hybrid search needs " + IndexDescription.DOT_PRODUCT);
        }
        index = description;
        return description;
    }

    public void ensureModelDimensions(Map<String, Integer> dimensionsByModel) {
        IndexDescription current = requireIndex();
        dimensionsByModel.forEach((modelName, dimension) -> {
            if (dimension != current.dimension()) {
                throw new ConfigurationException("Embedding model " + modelName + " has dimension " + dimension
                        + " but index " + current.name() + " expects " + current.dimension());
            }
        });
    }

    public int upsert(List<VectorRecord> records, String namespace) {
        IndexDescription current = requireIndex();
        for (VectorRecord record : records) {
            if (record.dense().length != current.dimension()) {
                throw new ConfigurationException("Vector " + record.id() + " has dimension " + record.dense().length
                        + " but index " + current.name() + " expects " + current.dimension());
            }
        }
        int written = 0;
        for (int start = 0; start < records.size(); start += batchSize) {
            List<VectorRecord> batch = records.subList(start, Math.min(records.size(), start + batchSize));
            store.upsert(batch, namespace);
            written += batch.size();
        }
        if (written > 0) {
            log.info("Upserted {} vectors into namespace {}", written, namespace);
        }
        return written;
    }

    /**
     * Removes every vector of the given documents from each namespace.
     *
     * @return document ids whose removal failed in at least one namespace
     */
    public Set<String> deleteDocuments(Collection<String> docIds, Collection<String> namespaces) {
        Set<String> failed = new LinkedHashSet<>();
        for (String docId : docIds) {
            for (String namespace : namespaces) {
                try {
                    store.delete(Map.of(MetadataKeys.DOC_ID, docId), namespace);
                    log.info("Deleted vectors for doc_id {} from namespace {}", docId, namespace);
                } catch (TransientServiceException e) {
                    log.warn("Failed to delete doc_id {} from namespace {}: {}", docId, namespace, e.getMessage());
                    failed.add(docId);
                }
            }
        }
        return failed;
    }

    private IndexDescription requireIndex() {
        IndexDescription current = index;
        if (current == null) {
            throw new IllegalStateException("ensureIndex must run before writing to " + store.indexName());
        }
        return current;
    }
}
