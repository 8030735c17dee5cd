package com.smerag.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;

public class TikaDocumentLoader implements DocumentLoader {
    private final Tika tika = new Tika();
    private final List<String> extensions;

    public TikaDocumentLoader(List<String> extensions) {
        this.extensions = extensions;
        this.tika.setMaxStringLength(-1);
    }

    @Override
    public boolean supports(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(fileName::endsWith);
    }

    @Override
    public List<String> load(Path path) throws DocumentLoadException {
        try {
            return List.of(tika.parseToString(path));
        } catch (IOException | TikaException e) {
            throw new DocumentLoadException(path, "text extraction failed", e);
        }
    }
}
