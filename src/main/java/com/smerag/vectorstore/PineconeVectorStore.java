package com.smerag.vectorstore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smerag.runtime.AppConfig;
import com.smerag.runtime.TransientServiceException;
import com.smerag.sparse.SparseVector;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class PineconeVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(PineconeVectorStore.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String SERVICE = "pinecone";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiKey;
    private final String indexName;
    private final AppConfig.PineconeConfig config;
    private volatile String host;

    public PineconeVectorStore(OkHttpClient httpClient, String apiKey, String indexName, AppConfig.PineconeConfig config) {
        this.httpClient = httpClient;
        this.apiKey = apiKey;
        this.indexName = indexName;
        this.config = config;
    }

    @Override
    public String indexName() {
        return indexName;
    }

    @Override
    public Optional<IndexDescription> describe() {
        Request request = authorized(new Request.Builder().url(controlPlane("/indexes/" + indexName)).get());
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            JsonNode root = readSuccessful(response, "describe index");
            rememberHost(root);
            return Optional.of(new IndexDescription(
                    root.path("name").asText(indexName),
                    root.path("dimension").asInt(),
                    root.path("metric").asText()));
        } catch (IOException e) {
            throw new TransientServiceException(SERVICE, "describe index " + indexName + " failed", e);
        }
    }

    @Override
    public void create(int dimension, String metric) {
        Map<String, Object> serverless = new LinkedHashMap<>();
        serverless.put("cloud", config.getCloud());
        serverless.put("region", config.getRegion());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", indexName);
        body.put("dimension", dimension);
        body.put("metric", metric);
        body.put("spec", Map.of("serverless", serverless));

        log.info("Creating Pinecone serverless index {} with dimension {}", indexName, dimension);
        try (Response response = httpClient.newCall(post(controlPlane("/indexes"), body)).execute()) {
            rememberHost(readSuccessful(response, "create index"));
        } catch (IOException e) {
            throw new TransientServiceException(SERVICE, "create index " + indexName + " failed", e);
        }
        awaitReady();
        log.info("Index {} created.", indexName);
    }

    @Override
    public void upsert(List<VectorRecord> records, String namespace) {
        if (records.isEmpty()) {
            return;
        }
        List<Map<String, Object>> vectors = new ArrayList<>(records.size());
        for (VectorRecord record : records) {
            Map<String, Object> vector = new LinkedHashMap<>();
            vector.put("id", record.id());
            vector.put("values", record.dense());
            if (!record.sparse().isEmpty()) {
                vector.put("sparseValues", sparseBody(record.sparse()));
            }
            vector.put("metadata", record.metadata());
            vectors.add(vector);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vectors", vectors);
        body.put("namespace", namespace);
        try (Response response = httpClient.newCall(post(dataPlane("/vectors/upsert"), body)).execute()) {
            readSuccessful(response, "upsert");
        } catch (IOException e) {
            throw new TransientServiceException(SERVICE, "upsert into " + namespace + " failed", e);
        }
    }

    @Override
    public List<QueryMatch> query(float[] dense, SparseVector sparse, Map<String, Object> filter, int topK, String namespace) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("namespace", namespace);
        body.put("topK", topK);
        body.put("vector", dense);
        if (!sparse.isEmpty()) {
            body.put("sparseVector", sparseBody(sparse));
        }
        if (!filter.isEmpty()) {
            body.put("filter", filterBody(filter));
        }
        body.put("includeMetadata", true);
        body.put("includeValues", false);

        try (Response response = httpClient.newCall(post(dataPlane("/query"), body)).execute()) {
            JsonNode root = readSuccessful(response, "query");
            List<QueryMatch> matches = new ArrayList<>();
            for (JsonNode match : root.path("matches")) {
                Map<String, Object> metadata = match.has("metadata")
                        ? mapper.convertValue(match.get("metadata"), new TypeReference<Map<String, Object>>() {
                        })
                        : Map.of();
                matches.add(new QueryMatch(match.path("id").asText(), (float) match.path("score").asDouble(), metadata));
            }
            return matches;
        } catch (IOException e) {
            throw new TransientServiceException(SERVICE, "query in " + namespace + " failed", e);
        }
    }

    @Override
    public void delete(Map<String, Object> filter, String namespace) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("filter", filterBody(filter));
        body.put("namespace", namespace);
        try (Response response = httpClient.newCall(post(dataPlane("/vectors/delete"), body)).execute()) {
            if (response.code() == 404) {
                log.debug("Namespace {} does not exist yet; nothing to delete", namespace);
                return;
            }
            readSuccessful(response, "delete");
        } catch (IOException e) {
            throw new TransientServiceException(SERVICE, "delete in " + namespace + " failed", e);
        }
    }

    private void awaitReady() {
        long deadline = System.currentTimeMillis() + config.getReadyTimeoutMs();
        while (true) {
            Request request = authorized(new Request.Builder().url(controlPlane("/indexes/" + indexName)).get());
            try (Response response = httpClient.newCall(request).execute()) {
                JsonNode root = readSuccessful(response, "describe index");
                rememberHost(root);
                if (root.path("status").path("ready").asBoolean(false)) {
                    return;
                }
            } catch (IOException e) {
                throw new TransientServiceException(SERVICE, "polling index " + indexName + " failed", e);
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new TransientServiceException(SERVICE, "index " + indexName + " not ready after "
                        + config.getReadyTimeoutMs() + " ms");
            }
            try {
                Thread.sleep(config.getReadyPollMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientServiceException(SERVICE, "interrupted while waiting for index " + indexName, e);
            }
        }
    }

    private Map<String, Object> sparseBody(SparseVector sparse) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("indices", sparse.indices());
        body.put("values", sparse.values());
        return body;
    }

    private Map<String, Object> filterBody(Map<String, Object> filter) {
        Map<String, Object> body = new LinkedHashMap<>();
        filter.forEach((key, value) -> body.put(key, Map.of("$eq", value)));
        return body;
    }

    private Request post(String url, Object body) throws IOException {
        return authorized(new Request.Builder()
                .url(url)
                .post(RequestBody.create(mapper.writeValueAsString(body), JSON)));
    }

    private Request authorized(Request.Builder builder) {
        return builder
                .header("Api-Key", apiKey)
                .header("X-Pinecone-API-Version", config.getApiVersion())
                .build();
    }

    private JsonNode readSuccessful(Response response, String operation) throws IOException {
        String payload = response.body() == null ? "" : response.body().string();
        if (!response.isSuccessful()) {
            throw new TransientServiceException(SERVICE, operation + " returned HTTP " + response.code() + ": " + payload);
        }
        return payload.isBlank() ? mapper.createObjectNode() : mapper.readTree(payload);
    }

    private void rememberHost(JsonNode indexNode) {
        String reported = indexNode.path("host").asText("");
        if (!reported.isBlank()) {
            host = reported.contains("://") ? reported : "https://" + reported;
        }
    }

    private String controlPlane(String path) {
        String base = config.getControlPlaneUrl();
        return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + path;
    }

    private String dataPlane(String path) {
        if (host == null) {
            describe().orElseThrow(() -> new IllegalStateException(
                    "Index " + indexName + " does not exist. Run ingestion first."));
        }
        return host + path;
    }
}
