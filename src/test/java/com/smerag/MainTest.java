package com.smerag;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smerag.runtime.AppConfig;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private Path configPath;
    private Path docs;

    @BeforeEach
    void setUp() throws IOException {
        docs = Files.createDirectories(tempDir.resolve("Docs"));
        Files.writeString(docs.resolve("bauxite.txt"),
                "Bauxite is the main ore of aluminum. Refineries turn it into alumina.");
        Files.writeString(docs.resolve("geothermal.md"),
                "# Geothermal\nGeothermal energy uses heat from the earth to make steam for a turbine.");
        configPath = writeTestConfig(tempDir.resolve("test-config.yml"));
    }

    @Test
    void shouldIngestThenRetrieveThenEvaluate() throws IOException {
        assertEquals(0, run("--mode", "ingest", "--docs-path", docs.toString()));
        assertTrue(Files.exists(tempDir.resolve("state/bm25_encoder.json")));
        assertTrue(Files.exists(tempDir.resolve("state/manifest.json")));
        assertTrue(Files.exists(tempDir.resolve("store/vectors.json")));

        assertEquals(0, run("--mode", "retrieve", "--query", "What is bauxite used for?"));
        assertEquals(0, run("--mode", "retrieve", "--query", "geothermal steam", "--model", "org/mini-b"));

        Path queries = tempDir.resolve("eval/queries.json");
        Path report = tempDir.resolve("logs/retrieval_eval.json");
        assertEquals(0, run("--mode", "evaluate", "--eval-queries", queries.toString(), "--report-path", report.toString(),
                "--k", "5"));
        assertTrue(Files.exists(queries));
        JsonNode json = new ObjectMapper().readTree(report.toFile());
        assertEquals(5, json.path("k").asInt());
        assertEquals(2, json.path("summaries").size());
        assertEquals("mini-a", json.path("summaries").get(0).path("model").asText());
    }

    @Test
    void shouldRequireQueryInRetrieveMode() {
        assertEquals(Main.EXIT_USAGE_ERROR, run("--mode", "retrieve"));
    }

    @Test
    void shouldReportConfigurationErrors() {
        assertEquals(Main.EXIT_CONFIGURATION_ERROR, run("--mode", "retrieve", "--query", "bauxite"));
        assertEquals(Main.EXIT_CONFIGURATION_ERROR, run("--mode", "ingest", "--docs-path", tempDir.resolve("missing").toString()));

        assertEquals(0, run("--mode", "ingest", "--docs-path", docs.toString()));
        assertEquals(Main.EXIT_CONFIGURATION_ERROR, run("--mode", "retrieve", "--query", "bauxite", "--model", "unknown"));
    }

    @Test
    void shouldRejectUnknownMode() {
        assertEquals(Main.EXIT_USAGE_ERROR, new CommandLine(new Main()).execute("--mode", "benchmark"));
    }

    @Test
    void shouldPickLargestChunkSizeWhenSearchSizeUnset() {
        AppConfig config = new AppConfig();
        assertEquals(2048, Main.searchChunkSize(config));

        config.getRetrieval().setSearchChunkSize(512);
        assertEquals(512, Main.searchChunkSize(config));
    }

    private int run(String... args) {
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = configPath.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return new CommandLine(new Main()).execute(withConfig);
    }

    private Path writeTestConfig(Path path) throws IOException {
        String root = tempDir.toString().replace('\\', '/');
        Files.writeString(path, """
                ingest:
                  subject: Mining
                  chunkSizes: [200, 60]
                  manifestPath: %1$s/state/manifest.json
                  sparseModelPath: %1$s/state/bm25_encoder.json
                embedding:
                  batchSize: 4
                  models:
                    - name: mini-a
                      provider: hashing
                      dimension: 16
                    - name: org/mini-b
                      provider: hashing
                      dimension: 16
                vectorStore:
                  provider: local
                  indexName: sme-test
                  localPath: %1$s/store/vectors.json
                retrieval:
                  searchChunkSize: 0
                  preRerankTopK: 20
                  finalTopK: 3
                  hybridAlpha: 0.5
                  reranker:
                    provider: lexical
                """.formatted(root));
        return path;
    }
}
