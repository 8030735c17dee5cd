package com.smerag.embedding;

import java.io.IOException;
import java.util.ArrayList;
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

public class HttpEmbeddingModel implements EmbeddingModel {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String name;
    private final String endpoint;
    private final int dimension;

    public HttpEmbeddingModel(OkHttpClient httpClient, String name, String endpoint, int dimension) {
        this.httpClient = httpClient;
        this.name = name;
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.dimension = dimension;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("inputs", texts);
            body.put("normalize", true);
            body.put("truncate", true);
            Request request = new Request.Builder()
                    .url(endpoint + "/embed")
                    .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    throw new TransientServiceException("embedding:" + name, "HTTP " + response.code() + " from " + endpoint);
                }
                JsonNode root = mapper.readTree(response.body().string());
                if (!root.isArray() || root.size() != texts.size()) {
                    throw new TransientServiceException("embedding:" + name,
                            "expected " + texts.size() + " vectors, got " + (root.isArray() ? root.size() : root.getNodeType()));
                }
                List<float[]> vectors = new ArrayList<>(root.size());
                for (JsonNode vectorNode : root) {
                    float[] vector = new float[vectorNode.size()];
                    for (int i = 0; i < vectorNode.size(); i++) {
                        vector[i] = (float) vectorNode.get(i).asDouble();
                    }
                    vectors.add(vector);
                }
                return vectors;
            }
        } catch (IOException e) {
            throw new TransientServiceException("embedding:" + name, "request to " + endpoint + " failed", e);
        }
    }
}
