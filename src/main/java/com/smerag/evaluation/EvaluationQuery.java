package com.smerag.evaluation;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationQuery(String query, @JsonAlias("expected_keywords") List<String> expectedKeywords) {
    public EvaluationQuery {
        expectedKeywords = expectedKeywords == null ? List.of() : List.copyOf(expectedKeywords);
    }

    public static List<EvaluationQuery> defaultSuite() {
        return List.of(
                new EvaluationQuery("What is bauxite used for?", List.of("aluminum", "alumina")),
                new EvaluationQuery("Environmental impact of strip mining",
                        List.of("habitat", "destruction", "erosion", "pollution", "soil")),
                new EvaluationQuery("What are rare earth elements?",
                        List.of("lanthanides", "scandium", "yttrium", "magnets", "electronics")),
                new EvaluationQuery("Process of hydraulic fracturing",
                        List.of("fracking", "shale", "gas", "oil", "water", "pressure")),
                new EvaluationQuery("What is geothermal energy?",
                        List.of("heat", "earth", "steam", "turbine", "magma")));
    }
}
