package com.smerag.embedding;

import java.util.Locale;

import com.smerag.runtime.AppConfig;
import com.smerag.runtime.ConfigurationException;

import okhttp3.OkHttpClient;

public final class EmbeddingModels {
    private EmbeddingModels() {
    }

    public static EmbeddingModel create(AppConfig.EmbeddingModelConfig config, OkHttpClient httpClient) {
        if (config.getDimension() <= 0) {
            throw new ConfigurationException("Embedding model " + config.getName() + " needs a positive dimension");
        }
        String provider = config.getProvider() == null ? "http" : config.getProvider().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "http" -> {
                if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
                    throw new ConfigurationException("Embedding model " + config.getName() + " has no endpoint");
                }
                yield new HttpEmbeddingModel(httpClient, config.getName(), config.getEndpoint(), config.getDimension());
            }
            case "hashing" -> new HashingEmbeddingModel(config.getName(), config.getDimension());
            default -> throw new ConfigurationException("Unknown embedding provider '" + config.getProvider()
                    + "' for model " + config.getName());
        };
    }
}
