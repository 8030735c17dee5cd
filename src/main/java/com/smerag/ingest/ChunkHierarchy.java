package com.smerag.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ChunkHierarchy {
    private final Map<Integer, List<DocumentChunk>> byLevel;

    public ChunkHierarchy(Map<Integer, List<DocumentChunk>> byLevel) {
        Map<Integer, List<DocumentChunk>> copy = new LinkedHashMap<>();
        byLevel.forEach((level, chunks) -> copy.put(level, List.copyOf(chunks)));
        this.byLevel = Collections.unmodifiableMap(copy);
    }

    public List<Integer> levels() {
        return List.copyOf(byLevel.keySet());
    }

    public List<DocumentChunk> at(int level) {
        return byLevel.getOrDefault(level, List.of());
    }

    public List<DocumentChunk> coarsest() {
        return byLevel.isEmpty() ? List.of() : byLevel.values().iterator().next();
    }

    public List<DocumentChunk> all() {
        List<DocumentChunk> all = new ArrayList<>();
        byLevel.values().forEach(all::addAll);
        return all;
    }

    public int size() {
        return byLevel.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
