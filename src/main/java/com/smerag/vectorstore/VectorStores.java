package com.smerag.vectorstore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;

import com.smerag.runtime.AppConfig;
import com.smerag.runtime.ConfigurationException;

import okhttp3.OkHttpClient;

public final class VectorStores {
    private VectorStores() {
    }

    public static VectorStore create(AppConfig.VectorStoreConfig config, OkHttpClient httpClient) throws IOException {
        return create(config, httpClient, System::getenv);
    }

    static VectorStore create(AppConfig.VectorStoreConfig config, OkHttpClient httpClient,
            Function<String, String> environment) throws IOException {
        String provider = config.getProvider() == null ? "local" : config.getProvider().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "local" -> new LocalJsonVectorStore(Path.of(config.getLocalPath()), config.getIndexName());
            case "pinecone" -> {
                String keyVariable = config.getPinecone().getApiKeyEnv();
                String apiKey = environment.apply(keyVariable);
                if (apiKey == null || apiKey.isBlank()) {
                    throw new ConfigurationException("Missing Pinecone API key: set " + keyVariable);
                }
                yield new PineconeVectorStore(httpClient, apiKey, config.getIndexName(), config.getPinecone());
            }
            default -> throw new ConfigurationException("Unknown vector store provider: " + config.getProvider());
        };
    }
}
