package com.smerag.ingest;

import java.time.Instant;

public record SourceDocument(
        String docId,
        String subject,
        String source,
        String filePath,
        int docSeq,
        Instant timestamp,
        String text) {
}
