package com.smerag.ingest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Character-bounded splitter that prefers the coarsest separator present in the text and only
 * falls back to finer ones for pieces that are still too long. Separators stay attached to the
 * start of the piece that follows them, so joining pieces reproduces the source text exactly.
 */
public class RecursiveTextSplitter {
    private static final Logger log = LoggerFactory.getLogger(RecursiveTextSplitter.class);

    public static final List<String> DEFAULT_SEPARATORS = List.of("\n\n", "\n", ". ", " ", "");

    private final int chunkSize;
    private final int chunkOverlap;
    private final List<String> separators;

    public RecursiveTextSplitter(int chunkSize, int chunkOverlap) {
        this(chunkSize, chunkOverlap, DEFAULT_SEPARATORS);
    }

    public RecursiveTextSplitter(int chunkSize, int chunkOverlap, List<String> separators) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap " + chunkOverlap + " must be in [0, " + chunkSize + ")");
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
        this.separators = List.copyOf(separators);
    }

    public List<Span> split(String text) {
        List<String> chunks = splitRecursive(text, separators);
        List<Span> spans = new ArrayList<>(chunks.size());
        int index = 0;
        int previousLength = 0;
        for (String chunk : chunks) {
            int searchFrom = Math.max(0, index + previousLength - chunkOverlap);
            int found = text.indexOf(chunk, searchFrom);
            if (found < 0) {
                found = text.indexOf(chunk);
            }
            index = found;
            previousLength = chunk.length();
            spans.add(new Span(found, chunk));
        }
        return spans;
    }

    private List<String> splitRecursive(String text, List<String> candidates) {
        String separator = candidates.get(candidates.size() - 1);
        List<String> finer = List.of();
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                finer = candidates.subList(i + 1, candidates.size());
                break;
            }
        }

        List<String> finalChunks = new ArrayList<>();
        List<String> fitting = new ArrayList<>();
        for (String piece : splitKeepingSeparator(text, separator)) {
            if (piece.length() < chunkSize) {
                fitting.add(piece);
                continue;
            }
            if (!fitting.isEmpty()) {
                finalChunks.addAll(merge(fitting));
                fitting.clear();
            }
            if (finer.isEmpty()) {
                finalChunks.add(piece);
            } else {
                finalChunks.addAll(splitRecursive(piece, finer));
            }
        }
        if (!fitting.isEmpty()) {
            finalChunks.addAll(merge(fitting));
        }
        return finalChunks;
    }

    private static List<String> splitKeepingSeparator(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            for (int i = 0; i < text.length(); i++) {
                pieces.add(String.valueOf(text.charAt(i)));
            }
            return pieces;
        }
        int cursor = 0;
        int match = text.indexOf(separator);
        while (match >= 0) {
            pieces.add(text.substring(cursor, match));
            cursor = match;
            match = text.indexOf(separator, match + separator.length());
        }
        pieces.add(text.substring(cursor));
        pieces.removeIf(String::isEmpty);
        return pieces;
    }

    private List<String> merge(List<String> pieces) {
        List<String> merged = new ArrayList<>();
        Deque<String> window = new ArrayDeque<>();
        int total = 0;
        for (String piece : pieces) {
            int length = piece.length();
            if (total + length > chunkSize) {
                if (total > chunkSize) {
                    log.debug("Created a chunk of size {}, which is longer than the specified {}", total, chunkSize);
                }
                if (!window.isEmpty()) {
                    addJoined(merged, window);
                    while (total > chunkOverlap || (total + length > chunkSize && total > 0)) {
                        total -= window.removeFirst().length();
                    }
                }
            }
            window.addLast(piece);
            total += length;
        }
        addJoined(merged, window);
        return merged;
    }

    private static void addJoined(List<String> merged, Deque<String> window) {
        String joined = String.join("", window).strip();
        if (!joined.isEmpty()) {
            merged.add(joined);
        }
    }

    public record Span(int start, String text) {
    }
}
