package com.smerag.evaluation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smerag.retrieval.RetrievedPassage;
import com.smerag.runtime.ConfigurationException;
import com.smerag.runtime.TransientServiceException;

public class RetrievalEvaluator {
    private static final Logger log = LoggerFactory.getLogger(RetrievalEvaluator.class);

    private final PassageSearch search;
    private final ObjectMapper objectMapper;

    public RetrievalEvaluator(PassageSearch search) {
        this(search, new ObjectMapper());
    }

    RetrievalEvaluator(PassageSearch search, ObjectMapper objectMapper) {
        this.search = search;
        this.objectMapper = objectMapper;
    }

    public EvaluationReport evaluate(List<EvaluationQuery> queries, List<String> models, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        List<EvaluationReport.QueryResult> results = new ArrayList<>();
        List<EvaluationReport.ModelSummary> summaries = new ArrayList<>();
        int failed = 0;

        for (String model : models) {
            log.info("--- Evaluating: {} ---", model);
            List<EvaluationReport.QueryResult> modelResults = new ArrayList<>();
            for (EvaluationQuery query : queries) {
                List<RetrievedPassage> passages;
                try {
                    passages = search.search(query.query(), model);
                } catch (TransientServiceException e) {
                    log.error("Query '{}' failed for model {}: {}", query.query(), model, e.getMessage());
                    failed++;
                    continue;
                }
                List<Integer> grades = passages.stream()
                        .limit(k)
                        .map(passage -> RankingMetrics.grade(passage.text(), query.expectedKeywords()))
                        .toList();
                modelResults.add(new EvaluationReport.QueryResult(
                        model,
                        query.query(),
                        grades,
                        passages.stream().limit(k).map(RetrievedPassage::chunkId).toList(),
                        RankingMetrics.hitAtK(grades, k),
                        RankingMetrics.reciprocalRank(grades),
                        RankingMetrics.ndcgAtK(grades, k)));
            }
            results.addAll(modelResults);
            summaries.add(summarize(model, modelResults));
        }
        EvaluationReport report = new EvaluationReport(k, results, summaries, failed);
        summaries.forEach(summary -> log.info("{}: Hit@{}={} MRR={} nDCG@{}={}",
                summary.model(), k, format(summary.hitRate()), format(summary.meanReciprocalRank()),
                k, format(summary.meanNdcg())));
        return report;
    }

    public List<EvaluationQuery> loadQueries(Path path) throws IOException {
        if (!Files.exists(path)) {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), EvaluationQuery.defaultSuite());
        }
        EvaluationQuery[] loaded = objectMapper.readValue(path.toFile(), EvaluationQuery[].class);
        for (EvaluationQuery query : loaded) {
            if (query.query() == null || query.query().isBlank()) {
                throw new ConfigurationException("Evaluation query without text in " + path);
            }
        }
        return Arrays.asList(loaded);
    }

    public void writeReport(Path path, EvaluationReport report) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), report);
    }

    private EvaluationReport.ModelSummary summarize(String model, List<EvaluationReport.QueryResult> results) {
        if (results.isEmpty()) {
            return new EvaluationReport.ModelSummary(model, 0, 0.0, 0.0, 0.0);
        }
        double total = results.size();
        return new EvaluationReport.ModelSummary(
                model,
                results.size(),
                results.stream().mapToInt(EvaluationReport.QueryResult::hitAtK).sum() / total,
                results.stream().mapToDouble(EvaluationReport.QueryResult::reciprocalRank).sum() / total,
                results.stream().mapToDouble(EvaluationReport.QueryResult::ndcgAtK).sum() / total);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    @FunctionalInterface
    public interface PassageSearch {
        List<RetrievedPassage> search(String query, String model);
    }
}
