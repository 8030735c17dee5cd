package com.smerag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.smerag.embedding.DenseEncoder;
import com.smerag.embedding.EmbeddingModel;
import com.smerag.embedding.HashingEmbeddingModel;
import com.smerag.runtime.ConfigurationException;
import com.smerag.runtime.TransientServiceException;
import com.smerag.sparse.Bm25SparseEncoder;
import com.smerag.sparse.SparseVector;
import com.smerag.vectorstore.IndexDescription;
import com.smerag.vectorstore.IndexWriter;
import com.smerag.vectorstore.LocalJsonVectorStore;
import com.smerag.vectorstore.MetadataKeys;
import com.smerag.vectorstore.QueryMatch;
import com.smerag.vectorstore.RecordingVectorStore;

class IngestionServiceTest {
    private static final List<String> MODELS = List.of("mini-a", "org/mini-b.v1");
    private static final List<String> NAMESPACES = List.of("mini-a", "org_mini-b_v1");

    @TempDir
    Path tempDir;

    private Path docs;
    private Path manifestPath;
    private Path sparsePath;
    private LocalJsonVectorStore local;
    private RecordingVectorStore store;

    @BeforeEach
    void setUp() throws Exception {
        docs = Files.createDirectories(tempDir.resolve("Docs"));
        manifestPath = tempDir.resolve("logs/ingestion_manifest.json");
        sparsePath = tempDir.resolve("bm25_encoder.json");
        local = new LocalJsonVectorStore(tempDir.resolve("store.json"), "sme-test");
        store = new RecordingVectorStore(local);
    }

    @Test
    void shouldIngestThenSkipUnchangedCorpus() throws Exception {
        Files.writeString(docs.resolve("bauxite.txt"), "Bauxite is the main ore of aluminum. It is refined into alumina before smelting.");
        Files.writeString(docs.resolve("geothermal.md"), "# Geothermal\nGeothermal plants turn underground heat and steam into electricity.");

        IngestionReport first = service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);

        assertEquals(2, first.processedFiles());
        assertTrue(first.vectorsUpserted() > 0);
        assertTrue(first.failedFiles().isEmpty());
        assertTrue(Files.exists(sparsePath));
        assertTrue(store.events.contains("create:16:dotproduct"));
        for (String namespace : NAMESPACES) {
            assertTrue(local.count(namespace) > 0, namespace);
        }
        Manifest manifest = new ManifestStore().load(manifestPath);
        assertEquals(2, manifest.files().size());
        assertEquals(2, manifest.docIds().size());

        String manifestBefore = Files.readString(manifestPath);
        store.events.clear();

        IngestionReport second = service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);

        assertEquals(0, second.processedFiles());
        assertEquals(2, second.unchangedFiles());
        assertEquals(0, second.vectorsUpserted());
        assertTrue(store.writes().isEmpty());
        assertEquals(manifestBefore, Files.readString(manifestPath));
    }

    @Test
    void shouldDeleteOldVectorsBeforeReindexingModifiedFile() throws Exception {
        Path file = docs.resolve("mining.txt");
        Files.writeString(file, "Strip mining removes soil and causes erosion.");
        service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);
        String docId = new ManifestStore().load(manifestPath).docIdOf(CorpusScanner.key(file));
        store.events.clear();

        Files.writeString(file, "Strip mining destroys habitat and increases pollution of rivers.");
        IngestionReport report = service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);

        assertEquals(1, report.processedFiles());
        List<String> writes = store.writes();
        assertEquals("delete:" + NAMESPACES.get(0) + ":" + docId, writes.get(0));
        assertEquals("delete:" + NAMESPACES.get(1) + ":" + docId, writes.get(1));
        assertTrue(writes.subList(2, writes.size()).stream().allMatch(event -> event.startsWith("upsert:")));

        Manifest manifest = new ManifestStore().load(manifestPath);
        assertEquals(docId, manifest.docIdOf(CorpusScanner.key(file)));
        List<QueryMatch> remaining = local.query(new float[16], SparseVector.empty(), Map.of(MetadataKeys.DOC_ID, docId), 100, NAMESPACES.get(0));
        assertFalse(remaining.isEmpty());
        assertTrue(remaining.stream().noneMatch(match -> match.text().contains("erosion")));
    }

    @Test
    void shouldRemoveDeletedFileFromIndexAndManifest() throws Exception {
        Path keep = docs.resolve("keep.txt");
        Path gone = docs.resolve("gone.txt");
        Files.writeString(keep, "Rare earth elements include scandium and yttrium.");
        Files.writeString(gone, "Hydraulic fracturing pumps water into shale at high pressure.");
        service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);
        String goneId = new ManifestStore().load(manifestPath).docIdOf(CorpusScanner.key(gone));

        Files.delete(gone);
        IngestionReport report = service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);

        assertEquals(1, report.deletedFiles());
        assertEquals(0, report.processedFiles());
        Manifest manifest = new ManifestStore().load(manifestPath);
        assertEquals(1, manifest.files().size());
        assertNull(manifest.docIdOf(CorpusScanner.key(gone)));
        for (String namespace : NAMESPACES) {
            assertTrue(local.query(new float[16], SparseVector.empty(), Map.of(MetadataKeys.DOC_ID, goneId), 100, namespace).isEmpty());
        }
        assertEquals(1, Bm25SparseEncoder.load(sparsePath).documentCount());
    }

    @Test
    void shouldKeepPreviousManifestEntryWhenDeleteFails() throws Exception {
        Path file = docs.resolve("oil.txt");
        Files.writeString(file, "Oil and gas come from shale formations.");
        service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);
        Manifest before = new ManifestStore().load(manifestPath);
        String key = CorpusScanner.key(file);

        Files.writeString(file, "Oil sands are mined and heated with steam.");
        store.failDeletesFor.add(before.docIdOf(key));
        IngestionReport report = service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);

        assertEquals(List.of(key), report.failedFiles());
        assertEquals(0, report.processedFiles());
        assertEquals(before.hashOf(key), new ManifestStore().load(manifestPath).hashOf(key));
    }

    @Test
    void shouldSkipFileWhoseEmbeddingFailsAndRecordTheRest() throws Exception {
        Path good = docs.resolve("good.txt");
        Path bad = docs.resolve("bad.txt");
        Files.writeString(good, "Geothermal energy uses heat from magma.");
        Files.writeString(bad, "This text makes the embedding service explode.");

        IngestionReport report = service(encoderFailingOn("explode")).ingest(docs, manifestPath, sparsePath);

        assertEquals(1, report.processedFiles());
        assertEquals(List.of(CorpusScanner.key(bad)), report.failedFiles());
        Manifest manifest = new ManifestStore().load(manifestPath);
        assertTrue(manifest.files().containsKey(CorpusScanner.key(good)));
        assertFalse(manifest.files().containsKey(CorpusScanner.key(bad)));

        IngestionReport retry = service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);
        assertEquals(1, retry.processedFiles());
        assertEquals(1, retry.unchangedFiles());
    }

    @Test
    void shouldNotIndexChunksWithEmptySparseVectors() throws Exception {
        Files.writeString(docs.resolve("filler.txt"), "the and of it is");
        Files.writeString(docs.resolve("magnets.txt"), "Neodymium magnets power electronics.");

        IngestionReport report = service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);

        assertEquals(2, report.processedFiles());
        assertTrue(report.emptySparseChunks() > 0);
        assertEquals(2, new ManifestStore().load(manifestPath).files().size());
        assertTrue(local.query(new float[16], SparseVector.empty(), Map.of(MetadataKeys.SOURCE, "filler.txt"), 100,
                NAMESPACES.get(0)).isEmpty());
    }

    @Test
    void shouldFailFastOnDimensionMismatch() throws Exception {
        Files.writeString(docs.resolve("a.txt"), "Aluminum smelting needs electricity.");
        local.create(32, IndexDescription.DOT_PRODUCT);

        assertThrows(ConfigurationException.class, () -> service(hashingEncoder()).ingest(docs, manifestPath, sparsePath));
        assertFalse(Files.exists(manifestPath));
    }

    @Test
    void shouldRejectMissingDocsFolder() {
        assertThrows(ConfigurationException.class,
                () -> service(hashingEncoder()).ingest(tempDir.resolve("missing"), manifestPath, sparsePath));
    }

    @Test
    void shouldKeepIdenticalFilesAsSeparateDocuments() throws Exception {
        Files.writeString(docs.resolve("one.txt"), "Same words appear here.");
        Files.writeString(docs.resolve("two.txt"), "Same words appear here.");

        service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);

        Manifest manifest = new ManifestStore().load(manifestPath);
        assertNotEquals(manifest.docIdOf(CorpusScanner.key(docs.resolve("one.txt"))),
                manifest.docIdOf(CorpusScanner.key(docs.resolve("two.txt"))));
        for (String namespace : NAMESPACES) {
            assertEquals(4, local.count(namespace), namespace);
        }
    }

    @Test
    void shouldRebuildFileThatWasTemporarilyUnreadable() throws Exception {
        Path unreadable = Path.of("/proc/self/mem");
        assumeTrue(Files.isRegularFile(unreadable) && CorpusScanner.fingerprint(unreadable).isEmpty(),
                "needs a regular file whose reads fail");
        Path file = docs.resolve("bauxite.txt");
        String original = "Bauxite is refined into alumina and smelted into aluminum.";
        Files.writeString(file, original);
        Files.writeString(docs.resolve("quartz.txt"), "Quartz is a silicate mineral.");
        service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);
        String docId = new ManifestStore().load(manifestPath).docIdOf(CorpusScanner.key(file));
        assertFalse(vectorsOf(docId).isEmpty());

        Files.delete(file);
        Files.createSymbolicLink(file, unreadable);
        IngestionReport broken = service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);
        assertEquals(List.of(CorpusScanner.key(file)), broken.failedFiles());

        Files.delete(file);
        Files.writeString(file, original);
        IngestionReport restored = service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);

        assertEquals(1, restored.processedFiles());
        assertTrue(restored.failedFiles().isEmpty());
        assertFalse(vectorsOf(docId).isEmpty());
        assertEquals(CorpusScanner.fingerprint(file), new ManifestStore().load(manifestPath).hashOf(CorpusScanner.key(file)));
    }

    @Test
    void shouldRebuildModifiedFileWhoseLoadFailedOnceItIsRestored() throws Exception {
        Path file = docs.resolve("fracking.txt");
        String original = "Hydraulic fracturing pumps water into shale at high pressure.";
        Files.writeString(file, original);
        DocumentLoaders loaders = new DocumentLoaders(List.of(new RefusingLoader("corrupt")));
        service(loaders, hashingEncoder()).ingest(docs, manifestPath, sparsePath);
        String key = CorpusScanner.key(file);
        String docId = new ManifestStore().load(manifestPath).docIdOf(key);

        Files.writeString(file, "corrupt export");
        IngestionReport failedRun = service(loaders, hashingEncoder()).ingest(docs, manifestPath, sparsePath);

        assertEquals(List.of(key), failedRun.failedFiles());
        assertTrue(vectorsOf(docId).isEmpty());
        assertEquals(SourceFile.UNREADABLE_HASH, new ManifestStore().load(manifestPath).hashOf(key));

        Files.writeString(file, original);
        IngestionReport restored = service(loaders, hashingEncoder()).ingest(docs, manifestPath, sparsePath);

        assertEquals(1, restored.processedFiles());
        assertFalse(vectorsOf(docId).isEmpty());
        assertEquals(docId, new ManifestStore().load(manifestPath).docIdOf(key));
    }

    @Test
    void shouldRebuildModifiedFileWhoseEmbeddingFailed() throws Exception {
        Path file = docs.resolve("rare-earths.txt");
        Files.writeString(file, "Rare earth elements include scandium.");
        service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);
        String key = CorpusScanner.key(file);

        Files.writeString(file, "Rare earth magnets explode the embedding budget.");
        IngestionReport failedRun = service(encoderFailingOn("explode")).ingest(docs, manifestPath, sparsePath);
        assertEquals(List.of(key), failedRun.failedFiles());

        Files.writeString(file, "Rare earth elements include scandium.");
        IngestionReport restored = service(hashingEncoder()).ingest(docs, manifestPath, sparsePath);

        assertEquals(1, restored.processedFiles());
        assertFalse(vectorsOf(new ManifestStore().load(manifestPath).docIdOf(key)).isEmpty());
    }

    private List<QueryMatch> vectorsOf(String docId) {
        return local.query(new float[16], SparseVector.empty(), Map.of(MetadataKeys.DOC_ID, docId), 100,
                NAMESPACES.get(0));
    }

    private IngestionService service(DocumentLoaders loaders, DenseEncoder encoder) {
        return new IngestionService(
                loaders,
                new HierarchicalChunker(List.of(200, 60), 0.1, 220),
                encoder,
                new IndexWriter(store, 100),
                "Mining");
    }

    private IngestionService service(DenseEncoder encoder) {
        return service(DocumentLoaders.defaults(), encoder);
    }

    private static DenseEncoder hashingEncoder() {
        return new DenseEncoder(MODELS, name -> new HashingEmbeddingModel(name, 16), 8);
    }

    private static DenseEncoder encoderFailingOn(String marker) {
        return new DenseEncoder(MODELS, name -> new EmbeddingModel() {
            private final HashingEmbeddingModel delegate = new HashingEmbeddingModel(name, 16);

            @Override
            public String name() {
                return name;
            }

            @Override
            public int dimension() {
                return 16;
            }

            @Override
            public List<float[]> embed(List<String> texts) {
                if (texts.stream().anyMatch(text -> text.contains(marker))) {
                    throw new TransientServiceException("embedding:" + name, "service unavailable");
                }
                return delegate.embed(texts);
            }
        }, 8);
    }

    private static class RefusingLoader implements DocumentLoader {
        private final TextDocumentLoader delegate = new TextDocumentLoader(List.of(".txt"));
        private final String marker;

        RefusingLoader(String marker) {
            this.marker = marker;
        }

        @Override
        public boolean supports(Path path) {
            return delegate.supports(path);
        }

        @Override
        public List<String> load(Path path) throws DocumentLoadException {
            List<String> texts = delegate.load(path);
            if (texts.stream().anyMatch(text -> text.contains(marker))) {
                throw new DocumentLoadException(path, "unparseable export", null);
            }
            return texts;
        }
    }
}
