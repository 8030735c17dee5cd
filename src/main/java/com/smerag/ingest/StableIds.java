package com.smerag.ingest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class StableIds {
    public static final String DOCUMENT_PREFIX = "doc";
    public static final String CHUNK_PREFIX = "chunk";
    private static final int HEX_LENGTH = 16;

    private StableIds() {
    }

    public static String stableId(String seed, String prefix) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            String hex = HexFormat.of().formatHex(digest.digest(seed.getBytes(StandardCharsets.UTF_8)));
            return prefix + "-" + hex.substring(0, HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 unavailable", e);
        }
    }

    public static String documentId(String absolutePath) {
        return stableId(absolutePath, DOCUMENT_PREFIX);
    }

    public static String chunkId(String parentId, int levelSize, int indexInLevel, int startOffset, int contentLength) {
        String seed = parentId + "|" + levelSize + "|" + indexInLevel + "|" + startOffset + "|" + contentLength;
        return stableId(seed, CHUNK_PREFIX);
    }
}
