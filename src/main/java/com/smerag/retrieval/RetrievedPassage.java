package com.smerag.retrieval;

public record RetrievedPassage(
        String chunkId,
        String text,
        String source,
        String docId,
        String parentChunkId,
        float hybridScore,
        Float rerankScore) {

    public RetrievedPassage withRerankScore(float score) {
        return new RetrievedPassage(chunkId, text, source, docId, parentChunkId, hybridScore, score);
    }
}
