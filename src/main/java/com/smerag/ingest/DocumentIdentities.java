package com.smerag.ingest;

import java.util.Map;
import java.util.TreeMap;

public class DocumentIdentities {
    private final Map<String, String> docIdByPath;

    public DocumentIdentities(Map<String, String> persisted) {
        this.docIdByPath = new TreeMap<>(persisted);
    }

    public String docIdFor(String absolutePath) {
        return docIdByPath.computeIfAbsent(absolutePath, StableIds::documentId);
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(docIdByPath);
    }
}
