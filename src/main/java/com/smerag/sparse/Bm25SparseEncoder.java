package com.smerag.sparse;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smerag.runtime.MissingArtifactException;

public final class Bm25SparseEncoder {
    private static final Logger log = LoggerFactory.getLogger(Bm25SparseEncoder.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final double DEFAULT_K1 = 1.2;
    public static final double DEFAULT_B = 0.75;

    private final double k1;
    private final double b;
    private final int documentCount;
    private final double averageDocumentLength;
    private final Map<Integer, Integer> documentFrequencies;

    private Bm25SparseEncoder(double k1, double b, int documentCount, double averageDocumentLength,
            Map<Integer, Integer> documentFrequencies) {
        this.k1 = k1;
        this.b = b;
        this.documentCount = documentCount;
        this.averageDocumentLength = averageDocumentLength;
        this.documentFrequencies = Map.copyOf(documentFrequencies);
    }

    public static Bm25SparseEncoder fit(List<String> corpusTexts) {
        return fit(corpusTexts, DEFAULT_K1, DEFAULT_B);
    }

    public static Bm25SparseEncoder fit(List<String> corpusTexts, double k1, double b) {
        Map<Integer, Integer> frequencies = new HashMap<>();
        int documents = 0;
        long totalLength = 0;
        for (String text : corpusTexts) {
            if (text == null || text.isBlank()) {
                continue;
            }
            List<Integer> indices = Bm25Tokenizer.indices(text);
            documents++;
            totalLength += indices.size();
            for (Integer index : new HashSet<>(indices)) {
                frequencies.merge(index, 1, Integer::sum);
            }
        }
        if (documents == 0) {
            throw new IllegalArgumentException("No valid text content found to fit the BM25 encoder");
        }
        double average = (double) totalLength / documents;
        log.info("Fitted BM25 encoder on {} texts ({} distinct terms, avgdl={})",
                documents, frequencies.size(), String.format("%.1f", average));
        return new Bm25SparseEncoder(k1, b, documents, average, frequencies);
    }

    public List<SparseVector> encodeDocuments(List<String> texts) {
        List<SparseVector> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(encodeDocument(text));
        }
        return vectors;
    }

    public SparseVector encodeDocument(String text) {
        List<Integer> indices = Bm25Tokenizer.indices(text);
        if (indices.isEmpty()) {
            return SparseVector.empty();
        }
        Map<Integer, Integer> termFrequencies = new HashMap<>();
        indices.forEach(index -> termFrequencies.merge(index, 1, Integer::sum));
        double lengthNorm = k1 * (1.0 - b + b * (indices.size() / Math.max(averageDocumentLength, 1e-9)));
        SortedMap<Integer, Float> weights = new TreeMap<>();
        termFrequencies.forEach((index, tf) -> weights.put(index, (float) (tf / (tf + lengthNorm))));
        return SparseVector.of(weights);
    }

    public SparseVector encodeQuery(String text) {
        Set<Integer> unique = new LinkedHashSet<>(Bm25Tokenizer.indices(text));
        if (unique.isEmpty()) {
            return SparseVector.empty();
        }
        SortedMap<Integer, Float> weights = new TreeMap<>();
        double sum = 0.0;
        for (Integer index : unique) {
            double idf = Math.log((documentCount + 1.0) / (documentFrequencies.getOrDefault(index, 0) + 0.5));
            weights.put(index, (float) idf);
            sum += idf;
        }
        if (sum > 0.0) {
            double total = sum;
            weights.replaceAll((index, idf) -> (float) (idf / total));
        }
        return SparseVector.of(weights);
    }

    public int documentCount() {
        return documentCount;
    }

    public double averageDocumentLength() {
        return averageDocumentLength;
    }

    public int documentFrequency(String token) {
        return documentFrequencies.getOrDefault(Bm25Tokenizer.indexOf(token), 0);
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Bm25State state = new Bm25State(k1, b, documentCount, averageDocumentLength, new TreeMap<>(documentFrequencies));
        MAPPER.writeValue(path.toFile(), state);
        log.info("BM25 encoder saved to {}", path);
    }

    public static Bm25SparseEncoder load(Path path) throws IOException {
        if (!Files.exists(path)) {
            log.error("BM25 encoder file not found at {}. Run ingestion first.", path);
            throw new MissingArtifactException(path, "BM25 encoder not found at " + path);
        }
        log.info("Loading BM25 encoder from {}", path);
        Bm25State state = MAPPER.readValue(path.toFile(), Bm25State.class);
        return new Bm25SparseEncoder(state.k1(), state.b(), state.documentCount(), state.averageDocumentLength(),
                state.documentFrequencies() == null ? Map.of() : state.documentFrequencies());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Bm25State(double k1, double b, int documentCount, double averageDocumentLength,
            Map<Integer, Integer> documentFrequencies) {
    }
}
