package com.smerag.ingest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HierarchicalChunker {
    private static final Logger log = LoggerFactory.getLogger(HierarchicalChunker.class);

    private final List<Integer> levelSizes;
    private final double overlapRatio;
    private final int maxOverlap;

    public HierarchicalChunker(List<Integer> levelSizes, double overlapRatio, int maxOverlap) {
        if (levelSizes == null || levelSizes.isEmpty()) {
            throw new IllegalArgumentException("At least one chunk size is required");
        }
        this.levelSizes = levelSizes.stream()
                .distinct()
                .sorted(Comparator.reverseOrder())
                .toList();
        this.overlapRatio = overlapRatio;
        this.maxOverlap = maxOverlap;
    }

    public int overlapFor(int levelSize) {
        return Math.min((int) (levelSize * overlapRatio), maxOverlap);
    }

    public ChunkHierarchy chunk(List<SourceDocument> documents) {
        Map<Integer, List<DocumentChunk>> results = new LinkedHashMap<>();

        int topSize = levelSizes.get(0);
        RecursiveTextSplitter topSplitter = new RecursiveTextSplitter(topSize, overlapFor(topSize));
        List<DocumentChunk> previous = new ArrayList<>();
        for (SourceDocument document : documents) {
            if (document.text() == null || document.text().isBlank()) {
                log.warn("Skipping empty document: {}", document.source());
                continue;
            }
            String seedParent = document.docSeq() == 0
                    ? document.docId()
                    : document.docId() + "#" + document.docSeq();
            List<RecursiveTextSplitter.Span> spans = topSplitter.split(document.text());
            for (int i = 0; i < spans.size(); i++) {
                RecursiveTextSplitter.Span span = spans.get(i);
                String chunkId = StableIds.chunkId(seedParent, topSize, i, span.start(), span.text().length());
                previous.add(new DocumentChunk(chunkId, span.text(),
                        ChunkMetadata.topLevel(document, chunkId, topSize, i, span.start())));
            }
        }
        log.info("Created {} parent chunks (size={})", previous.size(), topSize);
        results.put(topSize, previous);

        for (int level = 1; level < levelSizes.size(); level++) {
            int size = levelSizes.get(level);
            RecursiveTextSplitter splitter = new RecursiveTextSplitter(size, overlapFor(size));
            List<DocumentChunk> current = new ArrayList<>();
            for (DocumentChunk parent : previous) {
                if (parent.text().isBlank()) {
                    log.warn("Skipping empty parent chunk {}", parent.id());
                    continue;
                }
                List<RecursiveTextSplitter.Span> spans = splitter.split(parent.text());
                for (int i = 0; i < spans.size(); i++) {
                    RecursiveTextSplitter.Span span = spans.get(i);
                    String chunkId = StableIds.chunkId(parent.id(), size, i, span.start(), span.text().length());
                    current.add(new DocumentChunk(chunkId, span.text(),
                            parent.metadata().child(chunkId, size, i, span.start())));
                }
            }
            log.info("Created {} child chunks (size={})", current.size(), size);
            results.put(size, current);
            previous = current;
        }
        return new ChunkHierarchy(results);
    }
}
