package com.smerag.evaluation;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

public final class RankingMetrics {
    private RankingMetrics() {
    }

    public static int grade(String text, List<String> keywords) {
        if (keywords.isEmpty()) {
            return 0;
        }
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        long matches = keywords.stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .filter(lower::contains)
                .count();
        if (matches == 0) {
            return 0;
        }
        return matches == keywords.size() ? 2 : 1;
    }

    public static int hitAtK(List<Integer> grades, int k) {
        return grades.stream().limit(k).anyMatch(grade -> grade > 0) ? 1 : 0;
    }

    public static double reciprocalRank(List<Integer> grades) {
        for (int i = 0; i < grades.size(); i++) {
            if (grades.get(i) > 0) {
                return 1.0 / (i + 1);
            }
        }
        return 0.0;
    }

    public static double dcgAtK(List<Integer> grades, int k) {
        double sum = 0.0;
        int limit = Math.min(k, grades.size());
        for (int i = 0; i < limit; i++) {
            sum += grades.get(i) / log2(i + 2);
        }
        return sum;
    }

    public static double ndcgAtK(List<Integer> grades, int k) {
        double ideal = dcgAtK(grades.stream().sorted(Comparator.reverseOrder()).toList(), k);
        return ideal > 0 ? dcgAtK(grades, k) / ideal : 0.0;
    }

    private static double log2(int value) {
        return Math.log(value) / Math.log(2);
    }
}
