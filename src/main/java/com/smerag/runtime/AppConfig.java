package com.smerag.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private IngestConfig ingest = new IngestConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private VectorStoreConfig vectorStore = new VectorStoreConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private HttpConfig http = new HttpConfig();

    public IngestConfig getIngest() {
        return ingest;
    }

    public void setIngest(IngestConfig ingest) {
        this.ingest = ingest == null ? new IngestConfig() : ingest;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public VectorStoreConfig getVectorStore() {
        return vectorStore;
    }

    public void setVectorStore(VectorStoreConfig vectorStore) {
        this.vectorStore = vectorStore == null ? new VectorStoreConfig() : vectorStore;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public HttpConfig getHttp() {
        return http;
    }

    public void setHttp(HttpConfig http) {
        this.http = http == null ? new HttpConfig() : http;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestConfig {
        private String docsPath = "./Docs";
        private String subject = "General";
        private List<Integer> chunkSizes = List.of(2048, 512);
        private double overlapRatio = 0.1;
        private int maxOverlap = 220;
        private int upsertBatchSize = 100;
        private String manifestPath = "logs/ingestion_manifest.json";
        private String sparseModelPath = "bm25_encoder.json";

        public String getDocsPath() {
            return docsPath;
        }

        public void setDocsPath(String docsPath) {
            this.docsPath = docsPath;
        }

        public String getSubject() {
            return subject;
        }

        public void setSubject(String subject) {
            this.subject = subject == null ? "General" : subject;
        }

        public List<Integer> getChunkSizes() {
            return chunkSizes;
        }

        public void setChunkSizes(List<Integer> chunkSizes) {
            this.chunkSizes = chunkSizes == null ? List.of(2048, 512) : chunkSizes;
        }

        public double getOverlapRatio() {
            return overlapRatio;
        }

        public void setOverlapRatio(double overlapRatio) {
            this.overlapRatio = overlapRatio;
        }

        public int getMaxOverlap() {
            return maxOverlap;
        }

        public void setMaxOverlap(int maxOverlap) {
            this.maxOverlap = maxOverlap;
        }

        public int getUpsertBatchSize() {
            return upsertBatchSize;
        }

        public void setUpsertBatchSize(int upsertBatchSize) {
            this.upsertBatchSize = upsertBatchSize;
        }

        public String getManifestPath() {
            return manifestPath;
        }

        public void setManifestPath(String manifestPath) {
            this.manifestPath = manifestPath;
        }

        public String getSparseModelPath() {
            return sparseModelPath;
        }

        public void setSparseModelPath(String sparseModelPath) {
            this.sparseModelPath = sparseModelPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private int batchSize = 32;
        private List<EmbeddingModelConfig> models = new ArrayList<>();

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public List<EmbeddingModelConfig> getModels() {
            return models;
        }

        public void setModels(List<EmbeddingModelConfig> models) {
            this.models = models == null ? new ArrayList<>() : models;
        }

        public List<String> modelNames() {
            return models.stream().map(EmbeddingModelConfig::getName).toList();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingModelConfig {
        private String name;
        private String provider = "http";
        private String endpoint;
        private int dimension;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VectorStoreConfig {
        private String provider = "local";
        private String indexName = "sme-agent-new";
        private String localPath = ".smerag/vector-store.json";
        private PineconeConfig pinecone = new PineconeConfig();

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getIndexName() {
            return indexName;
        }

        public void setIndexName(String indexName) {
            this.indexName = indexName;
        }

        public String getLocalPath() {
            return localPath;
        }

        public void setLocalPath(String localPath) {
            this.localPath = localPath;
        }

        public PineconeConfig getPinecone() {
            return pinecone;
        }

        public void setPinecone(PineconeConfig pinecone) {
            this.pinecone = pinecone == null ? new PineconeConfig() : pinecone;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PineconeConfig {
        private String apiKeyEnv = "PINECONE_API_KEY";
        private String controlPlaneUrl = "https://api.pinecone.io";
        private String apiVersion = "2024-07";
        private String cloud = "aws";
        private String region = "us-east-1";
        private long readyTimeoutMs = 120000;
        private long readyPollMs = 2000;

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public String getControlPlaneUrl() {
            return controlPlaneUrl;
        }

        public void setControlPlaneUrl(String controlPlaneUrl) {
            this.controlPlaneUrl = controlPlaneUrl;
        }

        public String getApiVersion() {
            return apiVersion;
        }

        public void setApiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
        }

        public String getCloud() {
            return cloud;
        }

        public void setCloud(String cloud) {
            this.cloud = cloud;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public long getReadyTimeoutMs() {
            return readyTimeoutMs;
        }

        public void setReadyTimeoutMs(long readyTimeoutMs) {
            this.readyTimeoutMs = readyTimeoutMs;
        }

        public long getReadyPollMs() {
            return readyPollMs;
        }

        public void setReadyPollMs(long readyPollMs) {
            this.readyPollMs = readyPollMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int searchChunkSize = 0;
        private int preRerankTopK = 50;
        private int finalTopK = 10;
        private double hybridAlpha = 0.5;
        private RerankerConfig reranker = new RerankerConfig();

        public int getSearchChunkSize() {
            return searchChunkSize;
        }

        public void setSearchChunkSize(int searchChunkSize) {
            this.searchChunkSize = searchChunkSize;
        }

        public int getPreRerankTopK() {
            return preRerankTopK;
        }

        public void setPreRerankTopK(int preRerankTopK) {
            this.preRerankTopK = preRerankTopK;
        }

        public int getFinalTopK() {
            return finalTopK;
        }

        public void setFinalTopK(int finalTopK) {
            this.finalTopK = finalTopK;
        }

        public double getHybridAlpha() {
            return hybridAlpha;
        }

        public void setHybridAlpha(double hybridAlpha) {
            this.hybridAlpha = hybridAlpha;
        }

        public RerankerConfig getReranker() {
            return reranker;
        }

        public void setReranker(RerankerConfig reranker) {
            this.reranker = reranker == null ? new RerankerConfig() : reranker;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RerankerConfig {
        private String provider = "lexical";
        private String endpoint;
        private String model = "BAAI/bge-reranker-base";

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HttpConfig {
        private int connectTimeoutMs = 10000;
        private int readTimeoutMs = 60000;

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }
    }
}
