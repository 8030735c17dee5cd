package com.smerag.retrieval;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smerag.runtime.TransientServiceException;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class HttpRelevanceScorer implements RelevanceScorer {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;

    public HttpRelevanceScorer(OkHttpClient httpClient, String endpoint, String model) {
        this.httpClient = httpClient;
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.model = model;
    }

    @Override
    public String name() {
        return model;
    }

    @Override
    public float[] score(String query, List<String> passages) throws IOException {
        if (passages.isEmpty()) {
            return new float[0];
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        body.put("texts", passages);
        body.put("raw_scores", false);
        body.put("truncate", true);

        Request request = new Request.Builder()
                .url(endpoint + "/rerank")
                .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            String payload = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new TransientServiceException("reranker:" + model,
                        "rerank returned HTTP " + response.code() + ": " + payload);
            }
            JsonNode root = mapper.readTree(payload);
            if (!root.isArray()) {
                throw new IOException("Unexpected rerank payload: " + payload);
            }
            float[] scores = new float[passages.size()];
            boolean[] seen = new boolean[passages.size()];
            for (JsonNode item : root) {
                int index = item.path("index").asInt(-1);
                if (index < 0 || index >= scores.length) {
                    throw new IOException("Rerank result index out of range: " + index);
                }
                scores[index] = (float) item.path("score").asDouble();
                seen[index] = true;
            }
            for (int i = 0; i < seen.length; i++) {
                if (!seen[i]) {
                    throw new IOException("Rerank response is missing a score for passage " + i);
                }
            }
            return scores;
        }
    }
}
