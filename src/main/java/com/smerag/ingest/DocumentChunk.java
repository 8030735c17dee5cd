package com.smerag.ingest;

public record DocumentChunk(String id, String text, ChunkMetadata metadata) {
}
