package com.smerag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ManifestStore {
    private static final Logger log = LoggerFactory.getLogger(ManifestStore.class);
    private final ObjectMapper mapper = new ObjectMapper();

    public Manifest load(Path path) throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return new Manifest();
        }
        try {
            return mapper.readValue(path.toFile(), Manifest.class);
        } catch (JacksonException e) {
            log.warn("Manifest file {} is corrupted ({}). Starting fresh.", path, e.getOriginalMessage());
            return new Manifest();
        }
    }

    public void save(Path path, Manifest manifest) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), manifest);
    }
}
