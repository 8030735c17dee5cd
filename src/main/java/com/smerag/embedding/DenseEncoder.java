package com.smerag.embedding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smerag.runtime.AppConfig;
import com.smerag.runtime.ConfigurationException;
import com.smerag.runtime.ModelRegistry;

import okhttp3.OkHttpClient;

public class DenseEncoder {
    private static final Logger log = LoggerFactory.getLogger(DenseEncoder.class);

    private final ModelRegistry<EmbeddingModel> registry;
    private final List<String> modelNames;
    private final int batchSize;

    public DenseEncoder(List<String> modelNames, Function<String, EmbeddingModel> loader, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.modelNames = List.copyOf(modelNames);
        this.registry = new ModelRegistry<>("embedding", new LinkedHashSet<>(modelNames), loader);
        this.batchSize = batchSize;
    }

    public static DenseEncoder fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        Map<String, AppConfig.EmbeddingModelConfig> byName = new LinkedHashMap<>();
        for (AppConfig.EmbeddingModelConfig model : config.getModels()) {
            if (model.getName() == null || model.getName().isBlank()) {
                throw new ConfigurationException("Every embedding model needs a name");
            }
            if (byName.put(model.getName(), model) != null) {
                throw new ConfigurationException("Embedding model configured twice: " + model.getName());
            }
        }
        return new DenseEncoder(List.copyOf(byName.keySet()),
                name -> EmbeddingModels.create(byName.get(name), httpClient),
                config.getBatchSize());
    }

    public List<String> modelNames() {
        return modelNames;
    }

    public boolean supports(String modelName) {
        return registry.isKnown(modelName);
    }

    public int dim(String modelName) {
        return registry.get(modelName).dimension();
    }

    public List<float[]> encode(String modelName, List<String> texts) {
        EmbeddingModel model = registry.get(modelName);
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            List<String> batch = texts.subList(start, Math.min(texts.size(), start + batchSize));
            List<float[]> embedded = model.embed(batch);
            for (float[] vector : embedded) {
                if (vector.length != model.dimension()) {
                    throw new ConfigurationException("Model " + modelName + " returned a vector of width "
                            + vector.length + " but declares " + model.dimension());
                }
            }
            vectors.addAll(embedded);
        }
        log.debug("Embedded {} texts with {}", texts.size(), modelName);
        return vectors;
    }

    public float[] encodeOne(String modelName, String text) {
        return encode(modelName, List.of(text)).get(0);
    }
}
