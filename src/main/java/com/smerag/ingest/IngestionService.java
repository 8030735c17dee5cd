package com.smerag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smerag.embedding.DenseEncoder;
import com.smerag.runtime.ConfigurationException;
import com.smerag.runtime.TransientServiceException;
import com.smerag.sparse.Bm25SparseEncoder;
import com.smerag.sparse.SparseVector;
import com.smerag.vectorstore.IndexDescription;
import com.smerag.vectorstore.IndexWriter;
import com.smerag.vectorstore.Namespaces;
import com.smerag.vectorstore.VectorRecord;

/**
 * One incremental ingestion run: detect what changed since the manifest was written, remove
 * stale vectors, refit BM25 over the whole current corpus, index new and modified files in every
 * model namespace, and record only the files that made it.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final DocumentLoaders loaders;
    private final HierarchicalChunker chunker;
    private final DenseEncoder denseEncoder;
    private final IndexWriter indexWriter;
    private final ManifestStore manifestStore;
    private final ChangeDetector changeDetector;
    private final String subject;
    private final Clock clock;

    public IngestionService(
            DocumentLoaders loaders,
            HierarchicalChunker chunker,
            DenseEncoder denseEncoder,
            IndexWriter indexWriter,
            String subject) {
        this(loaders, chunker, denseEncoder, indexWriter, new ManifestStore(), subject, Clock.systemUTC());
    }

    IngestionService(
            DocumentLoaders loaders,
            HierarchicalChunker chunker,
            DenseEncoder denseEncoder,
            IndexWriter indexWriter,
            ManifestStore manifestStore,
            String subject,
            Clock clock) {
        this.loaders = loaders;
        this.chunker = chunker;
        this.denseEncoder = denseEncoder;
        this.indexWriter = indexWriter;
        this.manifestStore = manifestStore;
        this.changeDetector = new ChangeDetector();
        this.subject = subject;
        this.clock = clock;
    }

    public IngestionReport ingest(Path docsRoot, Path manifestPath, Path sparseModelPath) throws IOException {
        if (!Files.isDirectory(docsRoot)) {
            throw new ConfigurationException("Docs folder not found: " + docsRoot.toAbsolutePath().normalize());
        }
        List<String> models = denseEncoder.modelNames();
        if (models.isEmpty()) {
            throw new ConfigurationException("No embedding models configured");
        }

        Manifest manifest = manifestStore.load(manifestPath);
        Map<String, String> current = new CorpusScanner(loaders::supports).scan(docsRoot);
        ChangeSet changes = changeDetector.detect(manifest, current);
        if (changes.isEmpty()) {
            log.info("No changes detected. Index is up to date.");
            return IngestionReport.noChanges(changes.unchanged().size());
        }

        Map<String, Integer> dimensions = new LinkedHashMap<>();
        for (String model : models) {
            dimensions.put(model, denseEncoder.dim(model));
        }
        IndexDescription index = indexWriter.ensureIndex(dimensions.get(models.get(0)));
        indexWriter.ensureModelDimensions(dimensions);
        log.info("Writing to index {} (dimension={})", index.name(), index.dimension());
        List<String> namespaces = models.stream().map(Namespaces::forModel).toList();

        Manifest updated = manifest.copy();
        DocumentIdentities identities = new DocumentIdentities(manifest.docIds());
        Set<String> failed = new LinkedHashSet<>();
        Set<String> cleared = new LinkedHashSet<>();

        int deleted = deletePhase(changes, manifest, namespaces, updated, failed, cleared);

        Instant timestamp = Instant.now(clock);
        Map<String, ChunkHierarchy> hierarchies = new LinkedHashMap<>();
        for (Map.Entry<String, String> file : current.entrySet()) {
            String path = file.getKey();
            boolean pending = changes.toProcess().contains(path);
            if (pending && failed.contains(path)) {
                continue;
            }
            if (!new SourceFile(path, file.getValue()).readable()) {
                log.warn("Skipping unreadable file {}", path);
                if (pending) {
                    failed.add(path);
                }
                continue;
            }
            try {
                List<SourceDocument> documents = loaders.load(Path.of(path), identities.docIdFor(path), subject, timestamp);
                hierarchies.put(path, chunker.chunk(documents));
            } catch (DocumentLoadException e) {
                log.error("Error loading {}: {}", path, e.getMessage());
                if (pending) {
                    failed.add(path);
                }
            }
        }

        Bm25SparseEncoder sparseEncoder = refit(hierarchies.values(), sparseModelPath);

        int processed = 0;
        int upserted = 0;
        int emptySparse = 0;
        for (String path : changes.toProcess()) {
            if (failed.contains(path)) {
                continue;
            }
            ChunkHierarchy hierarchy = hierarchies.get(path);
            try {
                if (!hierarchy.isEmpty()) {
                    FileResult result = indexFile(hierarchy, sparseEncoder, models);
                    upserted += result.upserted();
                    emptySparse += result.emptySparse();
                } else {
                    log.warn("No content extracted from {}", path);
                }
                updated.record(path, current.get(path), identities.docIdFor(path));
                processed++;
            } catch (TransientServiceException e) {
                log.error("Failed to index {}: {}", path, e.getMessage());
                failed.add(path);
            }
        }

        for (String path : failed) {
            if (cleared.contains(path)) {
                // Old vectors are gone; force a rebuild next run even if the bytes come back unchanged.
                log.warn("Invalidating manifest entry for {}: its vectors were removed but not rebuilt", path);
                updated.record(path, SourceFile.UNREADABLE_HASH, identities.docIdFor(path));
            }
        }

        manifestStore.save(manifestPath, updated);
        log.info("Ingestion complete: {} processed, {} unchanged, {} deleted, {} failed, {} vectors upserted",
                processed, changes.unchanged().size(), deleted, failed.size(), upserted);
        return new IngestionReport(processed, changes.unchanged().size(), deleted, current.size(), upserted,
                emptySparse, new ArrayList<>(failed));
    }

    private int deletePhase(ChangeSet changes, Manifest manifest, List<String> namespaces, Manifest updated,
            Set<String> failed, Set<String> cleared) {
        Map<String, String> docIdsByPath = new LinkedHashMap<>();
        for (String path : changes.toDelete()) {
            String docId = manifest.docIdOf(path);
            if (docId != null) {
                docIdsByPath.put(path, docId);
            }
        }
        Set<String> failedDocIds = indexWriter.deleteDocuments(docIdsByPath.values(), namespaces);

        int deleted = 0;
        for (String path : changes.toDelete()) {
            if (failedDocIds.contains(docIdsByPath.get(path))) {
                failed.add(path);
            } else if (changes.isModification(path)) {
                cleared.add(path);
            } else {
                updated.forget(path);
                deleted++;
            }
        }
        return deleted;
    }

    private Bm25SparseEncoder refit(Iterable<ChunkHierarchy> hierarchies, Path sparseModelPath) throws IOException {
        List<String> corpus = new ArrayList<>();
        for (ChunkHierarchy hierarchy : hierarchies) {
            hierarchy.coarsest().forEach(chunk -> corpus.add(chunk.text()));
        }
        if (corpus.stream().allMatch(String::isBlank)) {
            log.warn("Corpus has no content left; keeping the previous BM25 model");
            return null;
        }
        log.info("Fitting BM25 on {} coarse chunks", corpus.size());
        Bm25SparseEncoder encoder = Bm25SparseEncoder.fit(corpus);
        encoder.save(sparseModelPath);
        log.info("BM25 model saved to {}", sparseModelPath);
        return encoder;
    }

    private FileResult indexFile(ChunkHierarchy hierarchy, Bm25SparseEncoder sparseEncoder, List<String> models) {
        int upserted = 0;
        int emptySparse = 0;
        for (int level : hierarchy.levels()) {
            List<DocumentChunk> chunks = hierarchy.at(level);
            List<SparseVector> sparse = sparseEncoder.encodeDocuments(chunks.stream().map(DocumentChunk::text).toList());
            List<DocumentChunk> kept = new ArrayList<>();
            List<SparseVector> keptSparse = new ArrayList<>();
            for (int i = 0; i < chunks.size(); i++) {
                if (sparse.get(i).isEmpty()) {
                    log.warn("Skipping chunk {}: empty sparse vector", chunks.get(i).id());
                    emptySparse++;
                    continue;
                }
                kept.add(chunks.get(i));
                keptSparse.add(sparse.get(i));
            }
            if (kept.isEmpty()) {
                continue;
            }
            List<String> texts = kept.stream().map(DocumentChunk::text).toList();
            for (String model : models) {
                List<float[]> dense = denseEncoder.encode(model, texts);
                List<VectorRecord> records = new ArrayList<>(kept.size());
                for (int i = 0; i < kept.size(); i++) {
                    records.add(VectorRecord.forChunk(kept.get(i), dense.get(i), keptSparse.get(i)));
                }
                upserted += indexWriter.upsert(records, Namespaces.forModel(model));
            }
        }
        return new FileResult(upserted, emptySparse);
    }

    private record FileResult(int upserted, int emptySparse) {
    }
}
