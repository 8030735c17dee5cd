package com.smerag.retrieval;

import java.util.Locale;
import java.util.Optional;

import com.smerag.runtime.AppConfig;
import com.smerag.runtime.ConfigurationException;

import okhttp3.OkHttpClient;

public final class RelevanceScorers {
    private RelevanceScorers() {
    }

    public static Optional<RelevanceScorer> create(AppConfig.RerankerConfig config, OkHttpClient httpClient) {
        String provider = config.getProvider() == null ? "none" : config.getProvider().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "none" -> Optional.empty();
            case "lexical" -> Optional.of(new LexicalRelevanceScorer());
            case "http" -> {
                if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
                    throw new ConfigurationException("Reranker provider http needs retrieval.reranker.endpoint");
                }
                yield Optional.of(new HttpRelevanceScorer(httpClient, config.getEndpoint(), config.getModel()));
            }
            default -> throw new ConfigurationException("Unknown reranker provider: " + config.getProvider());
        };
    }
}
