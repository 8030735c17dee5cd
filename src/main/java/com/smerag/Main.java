package com.smerag;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.smerag.embedding.DenseEncoder;
import com.smerag.evaluation.EvaluationQuery;
import com.smerag.evaluation.EvaluationReport;
import com.smerag.evaluation.RetrievalEvaluator;
import com.smerag.ingest.DocumentLoaders;
import com.smerag.ingest.HierarchicalChunker;
import com.smerag.ingest.IngestionReport;
import com.smerag.ingest.IngestionService;
import com.smerag.retrieval.HybridRetriever;
import com.smerag.retrieval.RelevanceScorers;
import com.smerag.retrieval.Reranker;
import com.smerag.retrieval.RetrievedPassage;
import com.smerag.runtime.AppConfig;
import com.smerag.runtime.ConfigurationException;
import com.smerag.runtime.MissingArtifactException;
import com.smerag.runtime.TransientServiceException;
import com.smerag.sparse.Bm25SparseEncoder;
import com.smerag.vectorstore.IndexWriter;
import com.smerag.vectorstore.VectorStore;
import com.smerag.vectorstore.VectorStores;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "sme-rag",
        mixinStandardHelpOptions = true,
        version = "sme-rag 0.1.0",
        description = "Incremental document ingestion and hybrid retrieval for the SME assistant.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_CONFIGURATION_ERROR = 3;
    static final int EXIT_SERVICE_FAILURE = 4;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "ingest")
    Mode mode;

    @Option(names = "--docs-path", description = "Corpus folder; overrides ingest.docsPath")
    Path docsPath;

    @Option(names = "--query", description = "Query text used in retrieve mode")
    String query;

    @Option(names = "--model", description = "Embedding model to search with; defaults to the first configured model")
    String model;

    @Option(names = "--eval-queries", description = "JSON list of evaluation queries, created with a default suite when absent",
            defaultValue = "eval/queries.json")
    Path evalQueriesPath;

    @Option(names = "--report-path", description = "Where evaluate mode writes its JSON report", defaultValue = "logs/retrieval_eval.json")
    Path reportPath;

    @Option(names = "--k", description = "Cut-off for Hit@k and nDCG@k in evaluate mode", defaultValue = "10")
    int k;

    enum Mode {
        ingest,
        retrieve,
        evaluate
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting SME-RAG in {} mode", mode);
        log.info("Using config file: {}", configPath);

        try {
            return switch (mode) {
                case ingest -> runIngest(config);
                case retrieve -> runRetrieve(config);
                case evaluate -> runEvaluate(config);
            };
        } catch (ConfigurationException | MissingArtifactException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        } catch (TransientServiceException e) {
            log.error("Service {} failed: {}", e.service(), e.getMessage());
            return EXIT_SERVICE_FAILURE;
        }
    }

    int runIngest(AppConfig config) throws IOException {
        AppConfig.IngestConfig ingest = config.getIngest();
        Path corpus = docsPath != null ? docsPath : Path.of(ingest.getDocsPath());
        OkHttpClient httpClient = createHttpClient(config.getHttp());
        IngestionService service = createIngestionService(config, httpClient);
        IngestionReport report = service.ingest(corpus, Path.of(ingest.getManifestPath()), Path.of(ingest.getSparseModelPath()));
        log.info("Ingested corpus {}: processed={}, unchanged={}, deleted={}, failed={}, total={}, vectors={}, emptySparse={}",
                corpus,
                report.processedFiles(),
                report.unchangedFiles(),
                report.deletedFiles(),
                report.failedFiles().size(),
                report.totalFiles(),
                report.vectorsUpserted(),
                report.emptySparseChunks());
        return 0;
    }

    int runRetrieve(AppConfig config) throws IOException {
        if (query == null || query.isBlank()) {
            log.error("--query is required in retrieve mode");
            return EXIT_USAGE_ERROR;
        }
        OkHttpClient httpClient = createHttpClient(config.getHttp());
        DenseEncoder denseEncoder = createDenseEncoder(config, httpClient);
        HybridRetriever retriever = createRetriever(config, denseEncoder, httpClient);
        String modelName = model != null ? model : defaultModel(denseEncoder);

        List<RetrievedPassage> results = retriever.searchAndRerank(query, modelName);
        log.info("Retrieved {} passages with {}", results.size(), modelName);
        for (int i = 0; i < results.size(); i++) {
            RetrievedPassage passage = results.get(i);
            log.info("Result #{} hybrid={} rerank={} source={} chunk={} text={}",
                    i + 1,
                    String.format(Locale.ROOT, "%.4f", passage.hybridScore()),
                    passage.rerankScore() == null ? "n/a" : String.format(Locale.ROOT, "%.4f", passage.rerankScore()),
                    passage.source(),
                    passage.chunkId(),
                    preview(passage.text()));
        }
        return 0;
    }

    int runEvaluate(AppConfig config) throws IOException {
        OkHttpClient httpClient = createHttpClient(config.getHttp());
        DenseEncoder denseEncoder = createDenseEncoder(config, httpClient);
        HybridRetriever retriever = createRetriever(config, denseEncoder, httpClient);
        List<String> models = model != null ? List.of(model) : denseEncoder.modelNames();

        RetrievalEvaluator evaluator = new RetrievalEvaluator(retriever::searchAndRerank);
        List<EvaluationQuery> queries = evaluator.loadQueries(evalQueriesPath);
        EvaluationReport report = evaluator.evaluate(queries, models, k);
        evaluator.writeReport(reportPath, report);
        log.info("Evaluation report written to {} ({} failed queries)", reportPath, report.failedQueries());
        return 0;
    }

    AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            log.warn("Config file {} not found, using defaults", config);
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    OkHttpClient createHttpClient(AppConfig.HttpConfig http) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(http.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(http.getReadTimeoutMs()))
                .build();
    }

    DenseEncoder createDenseEncoder(AppConfig config, OkHttpClient httpClient) {
        return DenseEncoder.fromConfig(config.getEmbedding(), httpClient);
    }

    VectorStore createVectorStore(AppConfig config, OkHttpClient httpClient) throws IOException {
        return VectorStores.create(config.getVectorStore(), httpClient);
    }

    IngestionService createIngestionService(AppConfig config, OkHttpClient httpClient) throws IOException {
        AppConfig.IngestConfig ingest = config.getIngest();
        return new IngestionService(
                DocumentLoaders.defaults(),
                new HierarchicalChunker(ingest.getChunkSizes(), ingest.getOverlapRatio(), ingest.getMaxOverlap()),
                createDenseEncoder(config, httpClient),
                new IndexWriter(createVectorStore(config, httpClient), ingest.getUpsertBatchSize()),
                ingest.getSubject());
    }

    HybridRetriever createRetriever(AppConfig config, DenseEncoder denseEncoder, OkHttpClient httpClient) throws IOException {
        AppConfig.RetrievalConfig retrieval = config.getRetrieval();
        Bm25SparseEncoder sparseEncoder = Bm25SparseEncoder.load(Path.of(config.getIngest().getSparseModelPath()));
        Reranker reranker = new Reranker(RelevanceScorers.create(retrieval.getReranker(), httpClient), retrieval.getFinalTopK());
        return new HybridRetriever(
                denseEncoder,
                sparseEncoder,
                createVectorStore(config, httpClient),
                reranker,
                searchChunkSize(config),
                retrieval.getPreRerankTopK(),
                retrieval.getHybridAlpha());
    }

    static int searchChunkSize(AppConfig config) {
        int configured = config.getRetrieval().getSearchChunkSize();
        if (configured > 0) {
            return configured;
        }
        List<Integer> sizes = config.getIngest().getChunkSizes();
        if (sizes.isEmpty()) {
            throw new ConfigurationException("ingest.chunkSizes must not be empty");
        }
        return Collections.max(sizes);
    }

    private static String defaultModel(DenseEncoder denseEncoder) {
        if (denseEncoder.modelNames().isEmpty()) {
            throw new ConfigurationException("No embedding models configured");
        }
        return denseEncoder.modelNames().get(0);
    }

    private static String preview(String text) {
        String flat = text.strip().replaceAll("\\s+", " ");
        return flat.length() > 240 ? flat.substring(0, 240) + "..." : flat;
    }
}
