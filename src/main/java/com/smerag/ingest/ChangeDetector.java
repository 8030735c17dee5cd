package com.smerag.ingest;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ChangeDetector {
    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    public ChangeSet detect(Manifest manifest, Map<String, String> currentHashes) {
        Set<String> toDelete = new LinkedHashSet<>();
        Set<String> toProcess = new LinkedHashSet<>();
        Set<String> unchanged = new LinkedHashSet<>();

        for (Map.Entry<String, String> previous : manifest.files().entrySet()) {
            String path = previous.getKey();
            String currentHash = currentHashes.get(path);
            if (currentHash == null) {
                log.info("DELETION detected: {}", path);
                toDelete.add(path);
            } else if (!currentHash.equals(previous.getValue()) || SourceFile.UNREADABLE_HASH.equals(currentHash)) {
                log.info("MODIFICATION detected: {}", path);
                toDelete.add(path);
                toProcess.add(path);
            } else {
                unchanged.add(path);
            }
        }

        for (String path : currentHashes.keySet()) {
            if (manifest.hashOf(path) == null) {
                log.info("NEW file detected: {}", path);
                toProcess.add(path);
            }
        }

        log.info("Change detection complete: {} to delete, {} to process, {} unchanged",
                toDelete.size(), toProcess.size(), unchanged.size());
        return new ChangeSet(toDelete, toProcess, unchanged);
    }
}
