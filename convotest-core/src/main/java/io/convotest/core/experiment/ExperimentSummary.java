package io.convotest.core.experiment;

import java.time.Instant;

public record ExperimentSummary(
    String experimentId,
    String name,
    ExperimentStatus status,
    String hypothesis,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    int controlSamples,
    int treatmentSamples,
    int minSampleSize,
    Double controlPassRate,
    Double treatmentPassRate,
    Double passRateLift,
    Double pValue,
    Boolean significant,
    Recommendation recommendation,
    String winningVariantId,
    String conclusion
) {
}
