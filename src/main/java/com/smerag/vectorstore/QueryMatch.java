package com.smerag.vectorstore;

import java.util.Map;

public record QueryMatch(String id, float score, Map<String, Object> metadata) {
    public QueryMatch {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String text() {
        return string(MetadataKeys.TEXT);
    }

    public String string(String key) {
        Object value = metadata.get(key);
        return value == null ? "" : value.toString();
    }
}
