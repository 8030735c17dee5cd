package com.smerag.ingest;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of comparing the corpus with the manifest. Modified paths appear in both
 * {@code toDelete} and {@code toProcess}; {@code unchanged} is disjoint from both.
 */
public record ChangeSet(Set<String> toDelete, Set<String> toProcess, Set<String> unchanged) {
    public ChangeSet {
        toDelete = Collections.unmodifiableSet(new LinkedHashSet<>(toDelete));
        toProcess = Collections.unmodifiableSet(new LinkedHashSet<>(toProcess));
        unchanged = Collections.unmodifiableSet(new LinkedHashSet<>(unchanged));
    }

    public boolean isEmpty() {
        return toDelete.isEmpty() && toProcess.isEmpty();
    }

    public boolean isModification(String path) {
        return toDelete.contains(path) && toProcess.contains(path);
    }
}
