package com.smerag.evaluation;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

class RankingMetricsTest {

    @Test
    void shouldGradeByKeywordCoverageIgnoringCase() {
        List<String> keywords = List.of("Aluminum", "alumina");

        assertEquals(2, RankingMetrics.grade("Bauxite is refined into ALUMINA and then aluminum.", keywords));
        assertEquals(1, RankingMetrics.grade("bauxite yields aluminum", keywords));
        assertEquals(0, RankingMetrics.grade("granite countertops", keywords));
        assertEquals(0, RankingMetrics.grade(null, keywords));
        assertEquals(0, RankingMetrics.grade("anything", List.of()));
    }

    @Test
    void shouldComputeHitAndReciprocalRank() {
        assertEquals(1, RankingMetrics.hitAtK(List.of(0, 0, 1), 3));
        assertEquals(0, RankingMetrics.hitAtK(List.of(0, 0, 1), 2));
        assertEquals(1.0 / 3, RankingMetrics.reciprocalRank(List.of(0, 0, 2)), 1e-9);
        assertEquals(0.0, RankingMetrics.reciprocalRank(List.of(0, 0)), 1e-9);
    }

    @Test
    void shouldNormaliseDcgByIdealOrderOfRetrievedGrades() {
        assertEquals(1.761859507, RankingMetrics.dcgAtK(List.of(0, 2, 1), 3), 1e-6);
        assertEquals(0.669671816, RankingMetrics.ndcgAtK(List.of(0, 2, 1), 3), 1e-6);
        assertEquals(0.239812467, RankingMetrics.ndcgAtK(List.of(0, 1, 2), 2), 1e-6);
        assertEquals(1.0, RankingMetrics.ndcgAtK(List.of(2, 2, 0), 3), 1e-9);
        assertEquals(0.0, RankingMetrics.ndcgAtK(List.of(0, 0), 2), 1e-9);
    }
}
