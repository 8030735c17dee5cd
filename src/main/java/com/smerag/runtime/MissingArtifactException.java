package com.smerag.runtime;

import java.nio.file.Path;

public class MissingArtifactException extends RuntimeException {
    private final Path artifactPath;

    public MissingArtifactException(Path artifactPath, String message) {
        super(message);
        this.artifactPath = artifactPath;
    }

    public Path artifactPath() {
        return artifactPath;
    }
}
