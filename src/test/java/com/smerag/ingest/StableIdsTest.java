package com.smerag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

class StableIdsTest {

    @Test
    void shouldUseFirstSixteenHexCharactersOfSha1() {
        // SHA-1("abc") = a9993e364706816aba3e25717850c26c9cd0d89d
        assertEquals("doc-a9993e364706816a", StableIds.stableId("abc", StableIds.DOCUMENT_PREFIX));
    }

    @Test
    void shouldDeriveChunkIdFromParentLevelAndPosition() {
        String id = StableIds.chunkId("doc-1", 512, 3, 100, 40);

        assertTrue(id.matches("chunk-[0-9a-f]{16}"));
        assertEquals(StableIds.stableId("doc-1|512|3|100|40", StableIds.CHUNK_PREFIX), id);
        assertEquals(id, StableIds.chunkId("doc-1", 512, 3, 100, 40));
        assertNotEquals(id, StableIds.chunkId("doc-1", 512, 3, 101, 40));
        assertNotEquals(id, StableIds.chunkId("doc-2", 512, 3, 100, 40));
    }

    @Test
    void shouldKeepDocumentIdForPathAcrossRuns() {
        DocumentIdentities first = new DocumentIdentities(Map.of());
        String assigned = first.docIdFor("/docs/a.txt");

        DocumentIdentities second = new DocumentIdentities(first.snapshot());

        assertEquals(assigned, second.docIdFor("/docs/a.txt"));
        assertEquals(StableIds.documentId("/docs/a.txt"), assigned);
        assertEquals("doc-kept", new DocumentIdentities(Map.of("/docs/b.txt", "doc-kept")).docIdFor("/docs/b.txt"));
    }
}
