package com.smerag.ingest;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Manifest {
    private final Map<String, String> files;
    private final Map<String, String> docIds;

    public Manifest() {
        this(Map.of(), Map.of());
    }

    @JsonCreator
    public Manifest(@JsonProperty("files") Map<String, String> files,
            @JsonProperty("doc_ids") Map<String, String> docIds) {
        this.files = files == null ? new TreeMap<>() : new TreeMap<>(files);
        this.docIds = docIds == null ? new TreeMap<>() : new TreeMap<>(docIds);
    }

    @JsonProperty("files")
    public Map<String, String> files() {
        return Collections.unmodifiableMap(files);
    }

    @JsonProperty("doc_ids")
    public Map<String, String> docIds() {
        return Collections.unmodifiableMap(docIds);
    }

    public String hashOf(String path) {
        return files.get(path);
    }

    public String docIdOf(String path) {
        return docIds.get(path);
    }

    public void record(String path, String hash, String docId) {
        files.put(path, hash);
        if (docId != null) {
            docIds.put(path, docId);
        }
    }

    public void forget(String path) {
        files.remove(path);
        docIds.remove(path);
    }

    public Manifest copy() {
        return new Manifest(files, docIds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Manifest other)) {
            return false;
        }
        return files.equals(other.files) && docIds.equals(other.docIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(files, docIds);
    }

    @Override
    public String toString() {
        return "Manifest{files=" + files.size() + ", docIds=" + docIds.size() + '}';
    }
}
