package com.smerag.ingest;

public record SourceFile(String path, String hash) {
    public static final String UNREADABLE_HASH = "";

    public boolean readable() {
        return !UNREADABLE_HASH.equals(hash);
    }
}
