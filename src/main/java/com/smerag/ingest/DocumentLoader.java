package com.smerag.ingest;

import java.nio.file.Path;
import java.util.List;

public interface DocumentLoader {
    boolean supports(Path path);

    List<String> load(Path path) throws DocumentLoadException;
}
