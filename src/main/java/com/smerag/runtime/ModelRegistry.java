package com.smerag.runtime;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ModelRegistry<M> {
    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final String kind;
    private final Set<String> knownNames;
    private final Function<String, M> loader;
    private final Map<String, M> loaded = new ConcurrentHashMap<>();
    private final ReentrantLock loadLock = new ReentrantLock();

    public ModelRegistry(String kind, Set<String> knownNames, Function<String, M> loader) {
        this.kind = kind;
        this.knownNames = Collections.unmodifiableSet(new LinkedHashSet<>(knownNames));
        this.loader = loader;
    }

    public M get(String name) {
        M model = loaded.get(name);
        if (model != null) {
            return model;
        }
        if (!knownNames.contains(name)) {
            throw new ConfigurationException("Unknown " + kind + " model '" + name + "'; configured: " + knownNames);
        }
        loadLock.lock();
        try {
            model = loaded.get(name);
            if (model == null) {
                log.info("Loading {} model: {}", kind, name);
                model = loader.apply(name);
                loaded.put(name, model);
            }
            return model;
        } finally {
            loadLock.unlock();
        }
    }

    public boolean isKnown(String name) {
        return knownNames.contains(name);
    }
}
