package com.smerag.vectorstore;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import com.smerag.ingest.ChunkMetadata;
import com.smerag.ingest.DocumentChunk;
import com.smerag.sparse.SparseVector;

public record VectorRecord(String id, float[] dense, SparseVector sparse, Map<String, Object> metadata) {
    public VectorRecord {
        metadata = Map.copyOf(metadata);
    }

    public static VectorRecord forChunk(DocumentChunk chunk, float[] dense, SparseVector sparse) {
        ChunkMetadata meta = chunk.metadata();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MetadataKeys.TEXT, chunk.text());
        metadata.put(MetadataKeys.SOURCE, meta.source());
        metadata.put(MetadataKeys.DOC_ID, meta.docId());
        metadata.put(MetadataKeys.CHUNK_SIZE, meta.level());
        metadata.put(MetadataKeys.CHUNK_INDEX, meta.chunkIndex());
        metadata.put(MetadataKeys.PARENT_CHUNK_ID, meta.parentChunkId());
        metadata.put(MetadataKeys.PARENT_DOC_ID, meta.parentDocId());
        metadata.put(MetadataKeys.SUBJECT, meta.subject());
        metadata.put(MetadataKeys.FILE_PATH, meta.filePath());
        return new VectorRecord(chunk.id(), dense, sparse, metadata);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VectorRecord other
                && id.equals(other.id)
                && Arrays.equals(dense, other.dense)
                && sparse.equals(other.sparse)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "VectorRecord{id=" + id + ", dim=" + dense.length + ", sparse=" + sparse + '}';
    }
}
