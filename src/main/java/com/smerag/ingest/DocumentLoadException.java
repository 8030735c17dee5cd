package com.smerag.ingest;

import java.nio.file.Path;

public class DocumentLoadException extends Exception {
    private final Path path;

    public DocumentLoadException(Path path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
