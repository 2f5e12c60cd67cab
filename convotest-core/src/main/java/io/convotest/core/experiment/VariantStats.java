package io.convotest.core.experiment;

public record VariantStats(
    String variantId,
    VariantRole role,
    int sampleSize,
    int passCount,
    double passRate,
    double avgGoalCompletionRate,
    double avgTurnCount,
    double avgDurationMs,
    double errorRate,
    double passRateLower,
    double passRateUpper
) {
}
