package com.smerag.vectorstore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smerag.sparse.SparseVector;

public class LocalJsonVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonVectorStore.class);

    private final Path path;
    private final String indexName;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private IndexDescription description;
    private final Map<String, Map<String, VectorRecord>> namespaces = new LinkedHashMap<>();

    public LocalJsonVectorStore(Path path, String indexName) throws IOException {
        this.path = path;
        this.indexName = indexName;
        load();
    }

    @Override
    public String indexName() {
        return indexName;
    }

    @Override
    public synchronized Optional<IndexDescription> describe() {
        return Optional.ofNullable(description);
    }

    @Override
    public synchronized void create(int dimension, String metric) {
        if (description != null) {
            throw new IllegalStateException("Index " + indexName + " already exists");
        }
        description = new IndexDescription(indexName, dimension, metric);
        log.info("Created local index {} (dimension={}, metric={}) at {}", indexName, dimension, metric, path);
        persist();
    }

    @Override
    public synchronized void upsert(List<VectorRecord> records, String namespace) {
        requireIndex();
        Map<String, VectorRecord> partition = namespaces.computeIfAbsent(namespace, unused -> new LinkedHashMap<>());
        for (VectorRecord record : records) {
            if (record.dense().length != description.dimension()) {
                throw new IllegalArgumentException("Vector " + record.id() + " has dimension " + record.dense().length
                        + ", index expects " + description.dimension());
            }
            partition.put(record.id(), record);
        }
        persist();
    }

    @Override
    public synchronized List<QueryMatch> query(float[] dense, SparseVector sparse, Map<String, Object> filter,
            int topK, String namespace) {
        requireIndex();
        Map<String, VectorRecord> partition = namespaces.getOrDefault(namespace, Map.of());
        List<QueryMatch> scored = new ArrayList<>();
        for (VectorRecord record : partition.values()) {
            if (!matches(record.metadata(), filter)) {
                continue;
            }
            float score = dot(dense, record.dense()) + sparse.dot(record.sparse());
            scored.add(new QueryMatch(record.id(), score, record.metadata()));
        }
        return scored.stream()
                .sorted(Comparator.comparing(QueryMatch::score).reversed())
                .limit(topK)
                .toList();
    }

    @Override
    public synchronized void delete(Map<String, Object> filter, String namespace) {
        Map<String, VectorRecord> partition = namespaces.get(namespace);
        if (partition == null || partition.isEmpty()) {
            return;
        }
        int before = partition.size();
        partition.values().removeIf(record -> matches(record.metadata(), filter));
        if (partition.size() != before) {
            persist();
        }
    }

    public synchronized int count(String namespace) {
        return namespaces.getOrDefault(namespace, Map.of()).size();
    }

    public synchronized Set<String> namespaces() {
        return Set.copyOf(namespaces.keySet());
    }

    public synchronized Optional<VectorRecord> fetch(String id, String namespace) {
        return Optional.ofNullable(namespaces.getOrDefault(namespace, Map.of()).get(id));
    }

    static boolean matches(Map<String, Object> metadata, Map<String, Object> filter) {
        for (Map.Entry<String, Object> condition : filter.entrySet()) {
            Object actual = metadata.get(condition.getKey());
            Object expected = condition.getValue();
            if (actual instanceof Number a && expected instanceof Number e) {
                if (a.doubleValue() != e.doubleValue()) {
                    return false;
                }
            } else if (!Objects.equals(actual, expected)) {
                return false;
            }
        }
        return true;
    }

    private static float dot(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        float sum = 0f;
        for (int i = 0; i < len; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private void requireIndex() {
        if (description == null) {
            throw new IllegalStateException("Index " + indexName + " does not exist. Run ingestion first.");
        }
    }

    private void load() throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return;
        }
        StoreFile stored = objectMapper.readValue(path.toFile(), StoreFile.class);
        description = stored.index();
        if (stored.namespaces() != null) {
            stored.namespaces().forEach((namespace, records) -> {
                Map<String, VectorRecord> partition = new LinkedHashMap<>();
                records.forEach(record -> partition.put(record.id(), record));
                namespaces.put(namespace, partition);
            });
        }
        log.debug("Loaded local vector store {} with {} namespaces", path, namespaces.size());
    }

    private void persist() {
        Map<String, List<VectorRecord>> snapshot = new LinkedHashMap<>();
        namespaces.forEach((namespace, partition) -> snapshot.put(namespace, List.copyOf(partition.values())));
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), new StoreFile(description, snapshot));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write local vector store " + path, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoreFile(IndexDescription index, Map<String, List<VectorRecord>> namespaces) {
    }
}
