package com.smerag.ingest;

import java.time.Instant;

public record ChunkMetadata(
        String subject,
        String source,
        String filePath,
        String docId,
        int docSeq,
        Instant timestamp,
        String chunkId,
        String parentChunkId,
        String parentDocId,
        int level,
        int chunkIndex,
        int startIndex) {

    public static ChunkMetadata topLevel(SourceDocument document, String chunkId, int level, int chunkIndex, int startIndex) {
        return new ChunkMetadata(
                document.subject(),
                document.source(),
                document.filePath(),
                document.docId(),
                document.docSeq(),
                document.timestamp(),
                chunkId,
                "",
                document.docId(),
                level,
                chunkIndex,
                startIndex);
    }

    public ChunkMetadata child(String childChunkId, int childLevel, int childIndex, int childStart) {
        return new ChunkMetadata(
                subject,
                source,
                filePath,
                docId,
                docSeq,
                timestamp,
                childChunkId,
                chunkId,
                parentDocId,
                childLevel,
                childIndex,
                childStart);
    }

    public boolean isTopLevel() {
        return parentChunkId.isEmpty();
    }
}
