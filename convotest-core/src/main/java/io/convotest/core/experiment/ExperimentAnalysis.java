package io.convotest.core.experiment;

import java.util.List;

public record ExperimentAnalysis(
    String experimentId,
    ExperimentStatus status,
    VariantStats control,
    List<VariantStats> treatments,
    List<VariantComparison> comparisons,
    boolean minimumSamplesReached,
    String recommendedWinner,
    Recommendation recommendation,
    String recommendationReason
) {
    public ExperimentAnalysis {
        treatments = treatments == null ? List.of() : List.copyOf(treatments);
        comparisons = comparisons == null ? List.of() : List.copyOf(comparisons);
    }
}
