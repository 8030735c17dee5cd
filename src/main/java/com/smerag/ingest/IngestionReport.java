package com.smerag.ingest;

import java.util.List;

public record IngestionReport(
        int processedFiles,
        int unchangedFiles,
        int deletedFiles,
        int totalFiles,
        int vectorsUpserted,
        int emptySparseChunks,
        List<String> failedFiles) {

    public IngestionReport {
        failedFiles = List.copyOf(failedFiles);
    }

    static IngestionReport noChanges(int unchangedFiles) {
        return new IngestionReport(0, unchangedFiles, 0, unchangedFiles, 0, 0, List.of());
    }
}
