package com.smerag.evaluation;

import java.util.List;

public record EvaluationReport(
        int k,
        List<QueryResult> queries,
        List<ModelSummary> summaries,
        int failedQueries) {

    public record QueryResult(
            String model,
            String query,
            List<Integer> grades,
            List<String> chunkIds,
            int hitAtK,
            double reciprocalRank,
            double ndcgAtK) {
    }

    public record ModelSummary(
            String model,
            int evaluatedQueries,
            double hitRate,
            double meanReciprocalRank,
            double meanNdcg) {
    }
}
