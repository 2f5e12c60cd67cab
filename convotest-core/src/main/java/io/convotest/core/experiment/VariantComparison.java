package io.convotest.core.experiment;

public record VariantComparison(
    String treatmentVariantId,
    double controlPassRate,
    double treatmentPassRate,
    double passRateDifference,
    double passRateLift,
    double zScore,
    double pValue,
    boolean significant
) {
}
